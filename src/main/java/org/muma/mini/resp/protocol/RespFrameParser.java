package org.muma.mini.resp.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * RESP 帧解析器
 * <p>
 * 从 ByteBuf 的 readerIndex 开始读取一个完整的顶层值。
 * BulkString 按声明长度读取，payload 中出现 \r\n 也是合法的。
 * 数据不够时抛出 {@link ParseError#UNEXPECTED_END}，由调用方决定是否等待更多数据。
 */
public class RespFrameParser {

    // proto-max-bulk-len 默认 512MB，与 Redis 一致
    public static final long DEFAULT_MAX_BULK_LENGTH = 512L * 1024 * 1024;

    // payload 加上 CRLF 必须能放进一个 int
    public static final long MAX_BULK_LENGTH_LIMIT = Integer.MAX_VALUE - 2;

    // 头部行 (*N / $L / +xxx) 的最大长度，防止客户端一直不发 CRLF
    private static final int MAX_LINE_LENGTH = 64 * 1024;

    // RESP 协议常量
    private static final byte PLUS_BYTE = '+';
    private static final byte MINUS_BYTE = '-';
    private static final byte DOLLAR_BYTE = '$';
    private static final byte ASTERISK_BYTE = '*';

    // 回车换行
    private static final byte CR = '\r';
    private static final byte LF = '\n';

    private final long maxBulkLength;

    public RespFrameParser() {
        this(DEFAULT_MAX_BULK_LENGTH);
    }

    public RespFrameParser(long maxBulkLength) {
        if (maxBulkLength <= 0 || maxBulkLength > MAX_BULK_LENGTH_LIMIT) {
            throw new IllegalArgumentException("maxBulkLength out of range: " + maxBulkLength);
        }
        this.maxBulkLength = maxBulkLength;
    }

    /**
     * 解析一个顶层值，成功时 readerIndex 停在该值之后。
     * 失败时 readerIndex 的位置不确定，调用方需要自行回滚或丢弃。
     */
    public RedisMessage parse(ByteBuf in) {
        if (!in.isReadable()) {
            throw new RespProtocolException(ParseError.INVALID_FORMAT, "Empty input");
        }
        return readValue(in);
    }

    /**
     * 解析独立的缓冲区，只取第一个值，后面多余的字节忽略
     */
    public RedisMessage parse(byte[] data) {
        ByteBuf buf = Unpooled.wrappedBuffer(data);
        try {
            return parse(buf);
        } finally {
            buf.release();
        }
    }

    public RedisMessage parse(String data) {
        return parse(data.getBytes(StandardCharsets.UTF_8));
    }

    private RedisMessage readValue(ByteBuf in) {
        // 1. 读取类型标识字节
        byte typeByte = in.readByte();

        // 2. 根据类型分发处理
        return switch (typeByte) {
            case PLUS_BYTE -> new SimpleString(readLine(in));
            case MINUS_BYTE -> new ErrorMessage(readLine(in));
            case DOLLAR_BYTE -> decodeBulkString(in);
            case ASTERISK_BYTE -> decodeArray(in);
            default -> throw new RespProtocolException(ParseError.INVALID_FORMAT,
                    "Unknown RESP type byte: 0x" + Integer.toHexString(typeByte & 0xFF));
        };
    }

    // 解析 BulkString: $<length>\r\n<data>\r\n
    private BulkString decodeBulkString(ByteBuf in) {
        long length = readLength(in);
        if (length > maxBulkLength) {
            throw new RespProtocolException(ParseError.INVALID_LENGTH,
                    "Bulk length " + length + " exceeds limit " + maxBulkLength);
        }

        if (in.readableBytes() < length + 2) {
            throw new RespProtocolException(ParseError.UNEXPECTED_END, "Incomplete bulk string payload");
        }

        int len = (int) length;

        byte[] content = new byte[len];
        in.readBytes(content);

        // payload 后面必须紧跟 CRLF，否则说明实际长度与声明长度不一致
        byte b1 = in.readByte();
        byte b2 = in.readByte();
        if (b1 != CR || b2 != LF) {
            throw new RespProtocolException(ParseError.MALFORMED_INPUT,
                    "Bulk string payload does not match declared length " + len);
        }
        return new BulkString(content);
    }

    // 解析 Array: *<count>\r\n<element1>...<elementN>
    private RedisArray decodeArray(ByteBuf in) {
        long count = readLength(in);
        if (count > Integer.MAX_VALUE) {
            throw new RespProtocolException(ParseError.INVALID_LENGTH, "Array too large: " + count);
        }

        // 不按声明的数量预分配，避免恶意的超大 count
        List<RedisMessage> elements = new ArrayList<>((int) Math.min(count, 16));
        for (long i = 0; i < count; i++) {
            if (!in.isReadable()) {
                throw new RespProtocolException(ParseError.UNEXPECTED_END, "Incomplete array, missing element " + i);
            }
            // 元素只能是 BulkString，先看类型字节再解析，嵌套数组不会递归下去
            byte type = in.readByte();
            if (type != DOLLAR_BYTE) {
                throw new RespProtocolException(ParseError.INVALID_FORMAT,
                        "Array element " + i + " is not a bulk string");
            }
            elements.add(decodeBulkString(in));
        }
        return new RedisArray(elements.toArray(new RedisMessage[0]));
    }

    // 读取 *N / $L 后面的数字，必须是非负整数
    private long readLength(ByteBuf in) {
        String s = readLine(in);
        long value;
        try {
            value = Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new RespProtocolException(ParseError.INVALID_LENGTH, "Invalid length: '" + s + "'");
        }
        if (value < 0) {
            throw new RespProtocolException(ParseError.INVALID_LENGTH, "Negative length: " + value);
        }
        return value;
    }

    // 读取一行（到 \r\n 为止），readerIndex 移到 \r\n 之后
    private String readLine(ByteBuf in) {
        int start = in.readerIndex();
        // 只在前 MAX_LINE_LENGTH 个字节里找 CR，超长的行不论 CR 是否到达都拒绝
        int end = (int) Math.min(in.writerIndex(), (long) start + MAX_LINE_LENGTH + 1);
        int cr = in.indexOf(start, end, CR);
        if (cr < 0) {
            if (in.readableBytes() > MAX_LINE_LENGTH) {
                throw new RespProtocolException(ParseError.INVALID_LENGTH, "Protocol line too long");
            }
            throw new RespProtocolException(ParseError.UNEXPECTED_END, "Missing line terminator");
        }
        if (cr + 1 >= in.writerIndex()) {
            throw new RespProtocolException(ParseError.UNEXPECTED_END, "Missing LF after CR");
        }
        if (in.getByte(cr + 1) != LF) {
            throw new RespProtocolException(ParseError.INVALID_FORMAT, "Expected LF after CR");
        }

        String line = in.toString(start, cr - start, StandardCharsets.UTF_8);
        in.readerIndex(cr + 2);
        return line;
    }
}
