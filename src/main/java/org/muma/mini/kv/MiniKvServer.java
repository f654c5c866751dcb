package org.muma.mini.kv;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import org.muma.mini.kv.command.CommandDispatcher;
import org.muma.mini.kv.config.MiniKvConfig;
import org.muma.mini.kv.protocol.RespDecoder;
import org.muma.mini.kv.protocol.RespEncoder;
import org.muma.mini.kv.protocol.RespLimits;
import org.muma.mini.kv.server.RedisCommandHandler;
import org.muma.mini.kv.store.StorageEngine;
import org.muma.mini.kv.store.impl.MemoryStorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

public class MiniKvServer {

    private static final Logger log = LoggerFactory.getLogger(MiniKvServer.class);

    private final MiniKvConfig config;
    private final StorageEngine storage;
    private final CommandDispatcher dispatcher;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public MiniKvServer(MiniKvConfig config) {
        this(config, new MemoryStorageEngine());
    }

    public MiniKvServer(MiniKvConfig config, StorageEngine storage) {
        this.config = config;
        this.storage = storage;
        this.dispatcher = new CommandDispatcher(storage);
    }

    /**
     * 绑定端口并返回实际监听地址 (port=0 时由系统分配)
     */
    public synchronized InetSocketAddress start() throws InterruptedException {
        if (serverChannel != null) {
            throw new IllegalStateException("Server already started");
        }
        RespLimits limits = config.toRespLimits();

        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(config.getWorkerThreads());

        try {
            var bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    // Boss 线程上的连接日志
                    .handler(new LoggingHandler(LogLevel.DEBUG))
                    // 禁用 Nagle 算法，降低延迟
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childOption(ChannelOption.SO_KEEPALIVE, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ch.pipeline()
                                    .addLast(new RespDecoder(limits))
                                    .addLast(new RespEncoder())
                                    .addLast(new RedisCommandHandler(dispatcher));
                        }
                    });

            log.info("Starting Mini-KV server on {}:{}", config.getHost(), config.getPort());
            serverChannel = bootstrap.bind(config.getHost(), config.getPort()).sync().channel();
        } catch (Exception e) {
            // bind 失败 (端口占用等) 时释放线程组
            stop();
            throw e;
        }

        InetSocketAddress address = (InetSocketAddress) serverChannel.localAddress();
        log.info("Mini-KV started successfully, listening on {}", address);
        return address;
    }

    /**
     * 阻塞直到监听 Channel 关闭
     */
    public void awaitTermination() throws InterruptedException {
        Channel channel;
        synchronized (this) {
            channel = serverChannel;
        }
        if (channel != null) {
            channel.closeFuture().sync();
        }
    }

    public synchronized void stop() {
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
            serverChannel = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully().syncUninterruptibly();
            bossGroup = null;
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully().syncUninterruptibly();
            workerGroup = null;
        }
        log.info("Mini-KV server stopped.");
    }

    public StorageEngine getStorage() {
        return storage;
    }

    public static void main(String[] args) throws InterruptedException {
        // 1. 初始化配置并解析参数
        MiniKvConfig config = MiniKvConfig.getInstance();
        try {
            config.load(args);
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
            return;
        }

        MiniKvServer server = new MiniKvServer(config);
        // JVM 收到 SIGINT/SIGTERM 时优雅关闭
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down server...");
            server.stop();
        }, "minikv-shutdown"));

        try {
            server.start();
        } catch (Exception e) {
            log.error("Failed to start server", e);
            System.exit(1);
            return;
        }
        server.awaitTermination();
    }
}
