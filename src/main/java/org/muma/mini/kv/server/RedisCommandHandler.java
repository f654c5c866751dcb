package org.muma.mini.kv.server;

import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import org.muma.mini.kv.command.CommandDispatcher;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.RespProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 每个连接一个实例
 * <p>
 * 读一个请求 -> 分发 -> 写回复，同一连接上的命令严格串行 (Channel 绑定在单个 EventLoop 上)。
 * 协议错误和写失败都会关闭连接，命令级错误只回复 ErrorMessage。
 */
public class RedisCommandHandler extends SimpleChannelInboundHandler<RedisMessage> {

    private static final Logger log = LoggerFactory.getLogger(RedisCommandHandler.class);

    // 记录连接的客户端数量
    private static final AtomicInteger connectedClients = new AtomicInteger();

    private final CommandDispatcher dispatcher;

    public RedisCommandHandler(CommandDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    public static int connectedClients() {
        return connectedClients.get();
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        int total = connectedClients.incrementAndGet();
        log.info("Client connected: {}, total clients: {}", ctx.channel().remoteAddress(), total);
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        int total = connectedClients.decrementAndGet();
        log.info("Client disconnected: {}, total clients: {}", ctx.channel().remoteAddress(), total);
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, RedisMessage msg) {
        RedisContext context = new RedisContext(ctx);
        RedisMessage response = dispatcher.dispatch(msg, context);

        ChannelFuture future = ctx.writeAndFlush(response);
        if (context.isCloseRequested()) {
            future.addListener(ChannelFutureListener.CLOSE);
        } else {
            // 对端已经断开时写失败，直接关闭
            future.addListener(ChannelFutureListener.CLOSE_ON_FAILURE);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof DecoderException && cause.getCause() instanceof RespProtocolException protocolError) {
            // 解码器无法重新同步，只能断开
            log.warn("Protocol error from {}: {}", ctx.channel().remoteAddress(), protocolError.getMessage());
        } else if (cause instanceof IOException) {
            log.debug("Connection error from {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
        } else {
            log.error("Unexpected error on connection {}", ctx.channel().remoteAddress(), cause);
        }
        ctx.close();
    }
}
