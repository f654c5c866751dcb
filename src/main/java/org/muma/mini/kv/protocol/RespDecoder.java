package org.muma.mini.kv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufInputStream;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;

import java.util.List;

/**
 * RESP 协议解码器 (Netty 适配)
 * <p>
 * 在累积缓冲区上直接运行 {@link RespReader}：遇到半包就回滚读指针等下一批数据，
 * 其余协议错误向上抛出，由 handler 关闭连接。
 */
public class RespDecoder extends ByteToMessageDecoder {

    private final RespLimits limits;

    public RespDecoder() {
        this(RespLimits.DEFAULT);
    }

    public RespDecoder(RespLimits limits) {
        this.limits = limits;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        if (!in.isReadable()) {
            return;
        }

        in.markReaderIndex();
        RedisMessage msg;
        try {
            msg = new RespReader(new ByteBufInputStream(in), limits, true).read();
        } catch (RespTruncatedException e) {
            // 半包: 数据不够，回滚等待
            in.resetReaderIndex();
            return;
        } catch (RespProtocolException e) {
            // 出错后无法重新同步，丢弃剩余字节
            in.skipBytes(in.readableBytes());
            throw e;
        }
        out.add(msg);
    }
}
