package org.muma.mini.resp.server;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelOutboundHandlerAdapter;
import io.netty.channel.ChannelPromise;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.util.ReferenceCountUtil;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.mini.resp.command.CommandDispatcher;
import org.muma.mini.resp.protocol.RespDecoder;
import org.muma.mini.resp.protocol.RespEncoder;
import org.muma.mini.resp.store.StorageEngine;
import org.muma.mini.resp.store.impl.MemoryStorageEngine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 用 EmbeddedChannel 组装和线上一样的 Pipeline: Decoder -> Encoder -> Handler
 */
class RedisCommandHandlerTest {

    private StorageEngine storage;
    private EmbeddedChannel channel;

    @BeforeEach
    void setUp() {
        storage = new MemoryStorageEngine();
        channel = newChannel();
    }

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
    }

    private EmbeddedChannel newChannel() {
        CommandDispatcher dispatcher = new CommandDispatcher(storage);
        return new EmbeddedChannel(new RespDecoder(), new RespEncoder(), new RedisCommandHandler(dispatcher));
    }

    private void send(EmbeddedChannel ch, String data) {
        ch.writeInbound(Unpooled.copiedBuffer(data, StandardCharsets.UTF_8));
    }

    private String reply(EmbeddedChannel ch) {
        ByteBuf buf = ch.readOutbound();
        assertNotNull(buf, "expected a reply");
        try {
            return buf.toString(StandardCharsets.UTF_8);
        } finally {
            buf.release();
        }
    }

    @Test
    void testSetThenGet() {
        send(channel, "*3\r\n$3\r\nSET\r\n$3\r\nfoo\r\n$3\r\nbar\r\n");
        assertEquals("+OK\r\n", reply(channel));

        send(channel, "*2\r\n$3\r\nGET\r\n$3\r\nfoo\r\n");
        assertEquals("$3\r\nbar\r\n", reply(channel));
    }

    @Test
    void testNullAndEmptyReplies() {
        send(channel, "*2\r\n$3\r\nGET\r\n$7\r\nmissing\r\n");
        assertEquals("$-1\r\n", reply(channel));

        send(channel, "*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$0\r\n\r\n");
        assertEquals("+OK\r\n", reply(channel));
        send(channel, "*2\r\n$3\r\nGET\r\n$1\r\nk\r\n");
        assertEquals("$0\r\n\r\n", reply(channel));
    }

    @Test
    void testUnknownCommand() {
        send(channel, "*1\r\n$4\r\nFOOO\r\n");
        assertEquals("-ERR unknown command\r\n", reply(channel));
        assertTrue(channel.isOpen());
    }

    @Test
    void testProtocolErrorKeepsConnection() {
        send(channel, "$abc\r\nfoo\r\n");
        assertEquals("-ERR protocol error\r\n", reply(channel));
        assertTrue(channel.isOpen());

        send(channel, "*1\r\n$4\r\nping\r\n");
        assertEquals("+PONG\r\n", reply(channel));
    }

    @Test
    void testNonArrayRequest() {
        send(channel, "+PING\r\n");
        assertEquals("-ERR invalid command format\r\n", reply(channel));
    }

    @Test
    void testPipelinedAndSplitRequests() {
        send(channel, "*1\r\n$4\r\nPING\r\n*2\r\n$4\r\nECHO\r\n$2\r\nhi\r\n*2\r\n$3\r\nGE");
        assertEquals("+PONG\r\n", reply(channel));
        assertEquals("$2\r\nhi\r\n", reply(channel));
        assertNull(channel.readOutbound());

        send(channel, "T\r\n$1\r\nx\r\n");
        assertEquals("$-1\r\n", reply(channel));
    }

    @Test
    void testBinaryPayload() {
        send(channel, "*3\r\n$3\r\nSET\r\n$3\r\nbin\r\n$4\r\na\r\nb\r\n");
        assertEquals("+OK\r\n", reply(channel));

        send(channel, "*2\r\n$3\r\nGET\r\n$3\r\nbin\r\n");
        assertEquals("$4\r\na\r\nb\r\n", reply(channel));
    }

    @Test
    void testStoreSharedAcrossConnections() {
        EmbeddedChannel other = newChannel();
        try {
            send(channel, "*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$2\r\nv1\r\n");
            assertEquals("+OK\r\n", reply(channel));

            send(other, "*2\r\n$3\r\nGET\r\n$1\r\nk\r\n");
            assertEquals("$2\r\nv1\r\n", reply(other));
        } finally {
            other.finishAndReleaseAll();
        }
    }

    @Test
    void testDeeplyNestedRequestGetsProtocolError() {
        send(channel, "*1\r\n".repeat(200_000) + "$4\r\nPING\r\n");
        assertEquals("-ERR protocol error\r\n", reply(channel));
        assertTrue(channel.isOpen());

        send(channel, "*1\r\n$4\r\nPING\r\n");
        assertEquals("+PONG\r\n", reply(channel));
    }

    /**
     * 模拟 socket 写失败：所有写操作直接失败
     */
    private static class FailingWriteHandler extends ChannelOutboundHandlerAdapter {
        @Override
        public void write(ChannelHandlerContext ctx, Object msg, ChannelPromise promise) {
            ReferenceCountUtil.release(msg);
            promise.setFailure(new IOException("Broken pipe"));
        }
    }

    @Test
    void testWriteFailureClosesOnlyThatConnection() {
        CommandDispatcher dispatcher = new CommandDispatcher(storage);
        EmbeddedChannel broken = new EmbeddedChannel(new FailingWriteHandler(),
                new RespDecoder(), new RespEncoder(), new RedisCommandHandler(dispatcher));
        try {
            send(broken, "*1\r\n$4\r\nPING\r\n");
            broken.runPendingTasks();
            assertFalse(broken.isOpen());
            assertNull(broken.readOutbound());

            send(channel, "*1\r\n$4\r\nPING\r\n");
            assertEquals("+PONG\r\n", reply(channel));
        } finally {
            broken.finishAndReleaseAll();
        }
    }

    @Test
    void testIoErrorClosesOnlyThatConnection() {
        EmbeddedChannel other = newChannel();
        try {
            channel.pipeline().fireExceptionCaught(new IOException("Connection reset by peer"));
            assertFalse(channel.isOpen());

            send(other, "*1\r\n$4\r\nPING\r\n");
            assertEquals("+PONG\r\n", reply(other));
        } finally {
            other.finishAndReleaseAll();
        }
    }
}
