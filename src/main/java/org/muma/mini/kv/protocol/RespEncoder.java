package org.muma.mini.kv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufOutputStream;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

/**
 * RESP 协议编码器 (Netty 适配)，序列化逻辑全部委托给 {@link RespWriter}
 */
public class RespEncoder extends MessageToByteEncoder<RedisMessage> {

    @Override
    protected void encode(ChannelHandlerContext ctx, RedisMessage msg, ByteBuf out) throws Exception {
        new RespWriter(new ByteBufOutputStream(out)).write(msg);
    }
}
