package org.muma.mini.resp;

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
import org.muma.mini.resp.command.CommandDispatcher;
import org.muma.mini.resp.config.MiniRespConfig;
import org.muma.mini.resp.protocol.RespDecoder;
import org.muma.mini.resp.protocol.RespEncoder;
import org.muma.mini.resp.protocol.RespFrameParser;
import org.muma.mini.resp.server.RedisCommandHandler;
import org.muma.mini.resp.store.StorageEngine;
import org.muma.mini.resp.store.impl.MemoryStorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

public class MiniRespServer {

    private static final Logger log = LoggerFactory.getLogger(MiniRespServer.class);

    private final MiniRespConfig config;
    private final StorageEngine storage;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public MiniRespServer(MiniRespConfig config, StorageEngine storage) {
        this.config = config;
        this.storage = storage;
    }

    /**
     * 绑定端口并开始接收连接，返回实际监听的地址 (port=0 时由系统分配)
     */
    public InetSocketAddress start() throws InterruptedException {
        // 所有连接共享同一个 Dispatcher 和 StorageEngine
        CommandDispatcher dispatcher = new CommandDispatcher(storage, config.getSlowLogThresholdMs());
        RespFrameParser parser = new RespFrameParser(config.getMaxBulkLength());

        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(config.getWorkerThreads());

        try {
            var bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    // 在 Boss 线程增加 Netty 自带的日志 Handler，可以看到 TCP 连接握手细节
                    .handler(new LoggingHandler(LogLevel.DEBUG))
                    // 开启 TCP_NODELAY (禁用 Nagle 算法)，降低延迟
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childOption(ChannelOption.SO_KEEPALIVE, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            // Decoder 有状态 (累积半包)，每个连接一个
                            ch.pipeline()
                                    .addLast(new RespDecoder(parser))
                                    .addLast(new RespEncoder())
                                    .addLast(new RedisCommandHandler(dispatcher));
                        }
                    });

            log.info("Starting Mini-RESP server on {}:{}", config.getBindHost(), config.getPort());
            serverChannel = bootstrap.bind(config.getBindHost(), config.getPort()).sync().channel();

            InetSocketAddress address = (InetSocketAddress) serverChannel.localAddress();
            log.info("Mini-RESP started successfully, listening on {}", address);
            return address;
        } catch (Exception e) {
            // bind 失败时 sync() 会直接抛出 BindException
            stop();
            throw e;
        }
    }

    public void awaitTermination() throws InterruptedException {
        if (serverChannel != null) {
            serverChannel.closeFuture().sync();
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
            log.info("Mini-RESP stopped, {} keys in store.", storage.size());
        }
    }

    public static void main(String[] args) {
        // 1. 初始化配置并解析参数
        MiniRespConfig config = MiniRespConfig.getInstance();
        config.load(args, System.getenv());

        // 2. 初始化存储 (进程内唯一)
        StorageEngine storage = new MemoryStorageEngine();

        MiniRespServer server = new MiniRespServer(config, storage);
        try {
            server.start();
            Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "mini-resp-shutdown"));
            server.awaitTermination();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted, shutting down");
        } catch (Exception e) {
            log.error("Failed to start server", e);
        } finally {
            server.stop();
        }
    }
}
