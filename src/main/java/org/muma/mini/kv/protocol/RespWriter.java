package org.muma.mini.kv.protocol;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * RESP 协议写入器
 * <p>
 * 确定性的一次性序列化，不做额外缓冲；每个值写完后 flush 底层流。
 * 与 {@link RespReader} 相互独立，可以分别用在同一连接的两个方向上。
 */
public class RespWriter {

    private static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] NULL_LENGTH = "-1".getBytes(StandardCharsets.US_ASCII);

    private final OutputStream out;

    public RespWriter(OutputStream out) {
        this.out = out;
    }

    public void write(RedisMessage msg) throws IOException {
        writeValue(msg);
        out.flush();
    }

    // 数组元素递归写入
    private void writeValue(RedisMessage msg) throws IOException {
        if (msg instanceof SimpleString s) {
            writeLine(RespReader.PLUS_BYTE, s.content().getBytes(StandardCharsets.UTF_8));
        } else if (msg instanceof ErrorMessage e) {
            writeLine(RespReader.MINUS_BYTE, e.content().getBytes(StandardCharsets.UTF_8));
        } else if (msg instanceof RedisInteger i) {
            writeLine(RespReader.COLON_BYTE, ascii(i.value()));
        } else if (msg instanceof BulkString b) {
            if (b.isNull()) {
                writeLine(RespReader.DOLLAR_BYTE, NULL_LENGTH);
            } else {
                writeLine(RespReader.DOLLAR_BYTE, ascii(b.content().length));
                out.write(b.content());
                out.write(CRLF);
            }
        } else if (msg instanceof RedisArray a) {
            if (a.isNull()) {
                writeLine(RespReader.ASTERISK_BYTE, NULL_LENGTH);
            } else {
                writeLine(RespReader.ASTERISK_BYTE, ascii(a.elements().length));
                for (RedisMessage element : a.elements()) {
                    writeValue(element);
                }
            }
        }
    }

    private void writeLine(byte type, byte[] body) throws IOException {
        out.write(type);
        out.write(body);
        out.write(CRLF);
    }

    private static byte[] ascii(long value) {
        return Long.toString(value).getBytes(StandardCharsets.US_ASCII);
    }
}
