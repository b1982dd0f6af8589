package org.muma.mini.resp.protocol;

import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.DecoderException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class RespDecoderTest {

    private EmbeddedChannel channel;

    @BeforeEach
    void setUp() {
        channel = new EmbeddedChannel(new RespDecoder());
    }

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
    }

    private void write(String data) {
        channel.writeInbound(Unpooled.copiedBuffer(data, StandardCharsets.UTF_8));
    }

    private String firstArg(RedisMessage msg) {
        return ((BulkString) ((RedisArray) msg).elements()[0]).asString();
    }

    @Test
    void testFragmentedCommand() {
        write("*3\r\n$3\r\nSE");
        assertNull(channel.readInbound());

        write("T\r\n$3\r\nkey\r\n$3\r");
        assertNull(channel.readInbound());

        write("\nval\r\n");

        RedisArray array = channel.readInbound();
        assertNotNull(array);
        assertEquals(3, array.size());
        assertEquals("SET", firstArg(array));
        assertEquals("val", ((BulkString) array.elements()[2]).asString());
    }

    @Test
    void testPipelinedCommands() {
        write("*1\r\n$4\r\nPING\r\n*2\r\n$4\r\nECHO\r\n$2\r\nhi\r\n*1\r\n$4\r\nPI");

        assertEquals("PING", firstArg(channel.readInbound()));
        assertEquals("ECHO", firstArg(channel.readInbound()));
        assertNull(channel.readInbound());

        write("NG\r\n");
        assertEquals("PING", firstArg(channel.readInbound()));
    }

    @Test
    void testProtocolErrorIsRaisedAndBufferDiscarded() {
        DecoderException e = assertThrows(DecoderException.class, () -> write("$abc\r\nfoo\r\n"));
        RespProtocolException cause = assertInstanceOf(RespProtocolException.class, e.getCause());
        assertEquals(ParseError.INVALID_LENGTH, cause.getKind());

        // 之后的请求不受影响
        write("*1\r\n$4\r\nPING\r\n");
        assertEquals("PING", firstArg(channel.readInbound()));
    }

    @Test
    void testValidFrameBeforeErrorIsStillDelivered() {
        assertThrows(DecoderException.class, () -> write("*1\r\n$4\r\nPING\r\n!bad\r\n"));
        assertEquals("PING", firstArg(channel.readInbound()));
        assertNull(channel.readInbound());
    }
}
