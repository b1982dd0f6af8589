package org.muma.mini.resp.utils;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import org.muma.mini.resp.protocol.BulkString;
import org.muma.mini.resp.protocol.RedisArray;
import org.muma.mini.resp.protocol.RedisMessage;
import org.muma.mini.resp.protocol.RespEncoder;

/**
 * RESP 编码工具类
 * 脱离 Netty Pipeline 使用，例如构造请求帧
 */
public final class RespCodecUtil {

    private RespCodecUtil() {
    }

    public static byte[] encode(RedisMessage msg) {
        ByteBuf buf = Unpooled.buffer(64);
        try {
            RespEncoder.write(buf, msg);
            return ByteBufUtil.getBytes(buf);
        } finally {
            buf.release();
        }
    }

    /**
     * 构造命令数组: command("SET", "k", "v") -> *3 $3 SET $1 k $1 v
     */
    public static RedisArray command(String... parts) {
        RedisMessage[] elements = new RedisMessage[parts.length];
        for (int i = 0; i < parts.length; i++) {
            elements[i] = new BulkString(parts[i]);
        }
        return new RedisArray(elements);
    }

    public static byte[] encodeCommand(String... parts) {
        return encode(command(parts));
    }
}
