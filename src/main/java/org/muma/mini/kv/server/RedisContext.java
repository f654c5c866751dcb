package org.muma.mini.kv.server;

import io.netty.channel.ChannelHandlerContext;

/**
 * 命令执行上下文
 * 封装了与当前连接相关的环境信息
 */
public class RedisContext {

    // 脱离网络执行 (测试、嵌入式调用) 时为 null
    private final ChannelHandlerContext nettyCtx;

    private volatile boolean closeRequested;

    public RedisContext() {
        this(null);
    }

    public RedisContext(ChannelHandlerContext nettyCtx) {
        this.nettyCtx = nettyCtx;
    }

    public ChannelHandlerContext getNettyCtx() {
        return nettyCtx;
    }

    /**
     * 回复写出后关闭连接 (QUIT)
     */
    public void requestClose() {
        this.closeRequested = true;
    }

    public boolean isCloseRequested() {
        return closeRequested;
    }
}
