package org.muma.mini.resp.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;

import java.util.List;

/**
 * RESP 协议解码器
 * <p>
 * ByteToMessageDecoder 负责累积半包，一次 read 里的多个请求 (pipeline) 会依次解出。
 * 协议错误时丢弃当前缓冲区并把异常交给后面的 Handler 处理，连接不关闭。
 */
public class RespDecoder extends ByteToMessageDecoder {

    private final RespFrameParser parser;

    public RespDecoder() {
        this(new RespFrameParser());
    }

    public RespDecoder(RespFrameParser parser) {
        this.parser = parser;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        int start = in.readerIndex();
        try {
            out.add(parser.parse(in));
        } catch (RespProtocolException e) {
            if (e.getKind() == ParseError.UNEXPECTED_END) {
                // 半包：回滚，等待下一次 read
                in.readerIndex(start);
                return;
            }
            // 无法再定位下一帧的起点，只能丢掉已收到的数据
            in.skipBytes(in.readableBytes());
            throw e;
        }
    }
}
