package org.muma.mini.kv.protocol;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * RESP 协议读取器 (阻塞式)
 * <p>
 * 每次 {@link #read()} 从流中消费恰好一个完整的值。
 * 调用方负责缓冲 (socket 流请包一层 BufferedInputStream)。
 */
public class RespReader {

    // RESP 协议常量
    static final byte PLUS_BYTE = '+';
    static final byte MINUS_BYTE = '-';
    static final byte COLON_BYTE = ':';
    static final byte DOLLAR_BYTE = '$';
    static final byte ASTERISK_BYTE = '*';

    // 回车换行
    static final byte CR = '\r';
    static final byte LF = '\n';

    private final InputStream in;
    private final RespLimits limits;

    // 流中的数据已全部在内存里，available() 是精确值
    private final boolean fullyBuffered;

    public RespReader(InputStream in) {
        this(in, RespLimits.DEFAULT);
    }

    public RespReader(InputStream in, RespLimits limits) {
        this(in, limits, false);
    }

    /**
     * @param fullyBuffered 为 true 时，BulkString 剩余字节不足直接判定为半包，不做任何拷贝
     */
    RespReader(InputStream in, RespLimits limits, boolean fullyBuffered) {
        this.in = in;
        this.limits = limits;
        this.fullyBuffered = fullyBuffered;
    }

    /**
     * 读取下一个值。
     *
     * @return 解码出的值；如果在类型标识字节之前流就正常结束，返回 {@code null} (连接关闭)
     * @throws RespTruncatedException 值读到一半流结束
     * @throws RespProtocolException  帧格式非法或超出 {@link RespLimits}
     * @throws IOException            底层 I/O 错误
     */
    public RedisMessage read() throws IOException {
        int type = in.read();
        if (type == -1) {
            return null;
        }
        return readValue(type, 0);
    }

    // 数组元素: 此时流结束属于半包，不是正常关闭
    private RedisMessage readNext(int depth) throws IOException {
        int type = in.read();
        if (type == -1) {
            throw new RespTruncatedException("stream ended before array element");
        }
        return readValue(type, depth);
    }

    private RedisMessage readValue(int type, int depth) throws IOException {
        return switch (type) {
            case PLUS_BYTE -> new SimpleString(readLine());
            case MINUS_BYTE -> new ErrorMessage(readLine());
            case COLON_BYTE -> new RedisInteger(readLong("integer"));
            case DOLLAR_BYTE -> readBulkString();
            case ASTERISK_BYTE -> readArray(depth);
            default -> throw new RespProtocolException("unknown type tag '" + printable(type) + "'");
        };
    }

    // 解析 BulkString: $<length>\r\n<data>\r\n
    private BulkString readBulkString() throws IOException {
        long length = readLong("bulk length");
        if (length == -1) {
            return BulkString.NULL;
        }
        if (length < 0) {
            throw new RespProtocolException("invalid bulk length: " + length);
        }
        if (length > limits.maxBulkLength()) {
            throw new RespProtocolException("bulk length " + length + " exceeds limit " + limits.maxBulkLength());
        }

        // 半包时不拷贝 payload
        if (fullyBuffered && in.available() < length + 2) {
            throw new RespTruncatedException("bulk payload incomplete: expected " + length + " bytes");
        }

        // readNBytes 按块分配，不会因为声明的长度一次性申请大数组
        byte[] content = in.readNBytes((int) length);
        if (content.length < length) {
            throw new RespTruncatedException("bulk payload truncated: expected " + length + " bytes, got " + content.length);
        }

        readCRLF();
        return new BulkString(content);
    }

    // 解析 Array: *<count>\r\n<element1>...<elementN>
    private RedisArray readArray(int depth) throws IOException {
        long count = readLong("array length");
        if (count == -1) {
            return RedisArray.NULL;
        }
        if (count < 0) {
            throw new RespProtocolException("invalid array length: " + count);
        }
        if (count > limits.maxArrayLength()) {
            throw new RespProtocolException("array length " + count + " exceeds limit " + limits.maxArrayLength());
        }
        if (depth + 1 > limits.maxDepth()) {
            throw new RespProtocolException("array nesting exceeds limit " + limits.maxDepth());
        }

        RedisMessage[] elements = new RedisMessage[(int) count];
        for (int i = 0; i < elements.length; i++) {
            // 任一元素失败直接抛出，不返回部分结果
            elements[i] = readNext(depth + 1);
        }
        return new RedisArray(elements);
    }

    // 读取一行 (不含结尾的 \r\n)
    private String readLine() throws IOException {
        ByteArrayOutputStream line = new ByteArrayOutputStream(32);
        while (true) {
            int b = in.read();
            if (b == -1) {
                throw new RespTruncatedException("stream ended inside a line");
            }
            if (b == LF) {
                byte[] bytes = line.toByteArray();
                if (bytes.length == 0 || bytes[bytes.length - 1] != CR) {
                    throw new RespProtocolException("line not terminated by CRLF");
                }
                return new String(bytes, 0, bytes.length - 1, StandardCharsets.UTF_8);
            }
            if (line.size() >= limits.maxLineLength()) {
                throw new RespProtocolException("line exceeds limit " + limits.maxLineLength());
            }
            line.write(b);
        }
    }

    private long readLong(String what) throws IOException {
        String s = readLine();
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new RespProtocolException("invalid " + what + ": '" + s + "'", e);
        }
    }

    private void readCRLF() throws IOException {
        int b1 = in.read();
        int b2 = in.read();
        if (b1 == -1 || b2 == -1) {
            throw new RespTruncatedException("stream ended before bulk terminator");
        }
        if (b1 != CR || b2 != LF) {
            throw new RespProtocolException("expected CRLF after bulk payload");
        }
    }

    private static String printable(int b) {
        return b >= 0x20 && b < 0x7f ? String.valueOf((char) b) : String.format("0x%02x", b);
    }
}
