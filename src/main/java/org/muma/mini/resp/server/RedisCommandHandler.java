package org.muma.mini.resp.server;

import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import org.muma.mini.resp.command.CommandDispatcher;
import org.muma.mini.resp.protocol.ErrorMessage;
import org.muma.mini.resp.protocol.RedisMessage;
import org.muma.mini.resp.protocol.RespProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 每个连接一个实例，跑在该连接绑定的 EventLoop 线程上。
 * 收到一个请求就回复一个结果；协议错误和命令错误都不会断开连接。
 */
public class RedisCommandHandler extends SimpleChannelInboundHandler<RedisMessage> {

    private static final Logger log = LoggerFactory.getLogger(RedisCommandHandler.class);

    static final ErrorMessage PROTOCOL_ERROR = new ErrorMessage("ERR protocol error");

    // 记录连接的客户端数量
    private static final AtomicInteger connectedClients = new AtomicInteger();

    // 单例 Dispatcher，所有连接共享 (内部持有共享的 StorageEngine)
    private final CommandDispatcher dispatcher;

    // 写失败时只关闭当前连接
    private final ChannelFutureListener closeOnWriteFailure = this::onWriteComplete;

    public RedisCommandHandler(CommandDispatcher dispatcher) {
        this.dispatcher = dispatcher;
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
        if (log.isDebugEnabled()) {
            log.debug("Request from {}: {}", ctx.channel().remoteAddress(), msg);
        }
        RedisMessage response = dispatcher.dispatch(msg);
        ctx.writeAndFlush(response).addListener(closeOnWriteFailure);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof DecoderException && cause.getCause() instanceof RespProtocolException e) {
            log.warn("Protocol error from {}: {} ({})", ctx.channel().remoteAddress(), e.getKind(), e.getMessage());
            ctx.writeAndFlush(PROTOCOL_ERROR).addListener(closeOnWriteFailure);
            return;
        }

        if (cause instanceof IOException) {
            // 对端重置连接之类，属于正常断开
            log.debug("Connection error on {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
        } else {
            log.error("Unexpected error on {}, closing connection", ctx.channel().remoteAddress(), cause);
        }
        ctx.close();
    }

    private void onWriteComplete(ChannelFuture future) {
        if (!future.isSuccess()) {
            log.warn("Write to {} failed, closing connection", future.channel().remoteAddress(), future.cause());
            future.channel().close();
        }
    }
}
