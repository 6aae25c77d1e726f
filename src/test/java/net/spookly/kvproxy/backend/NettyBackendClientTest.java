package net.spookly.kvproxy.backend;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.ByteToMessageDecoder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NettyBackendClientTest {
    private final Map<String, byte[]> store = new ConcurrentHashMap<>();
    private NioEventLoopGroup serverGroup;
    private NioEventLoopGroup clientGroup;
    private Channel serverChannel;
    private String address;

    @BeforeEach
    void startServer() {
        serverGroup = new NioEventLoopGroup(1);
        clientGroup = new NioEventLoopGroup(1);
        serverChannel = new ServerBootstrap()
                .group(serverGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel channel) {
                        channel.pipeline().addLast(new FakeMemcacheServer());
                    }
                })
                .bind("127.0.0.1", 0)
                .syncUninterruptibly()
                .channel();
        address = "127.0.0.1:" + ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    @AfterEach
    void stopServer() {
        serverChannel.close().syncUninterruptibly();
        serverGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS).syncUninterruptibly();
        clientGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS).syncUninterruptibly();
    }

    @Test
    void storesAndReadsValues() throws Exception {
        NettyBackendClient client = new NettyBackendClient(address, clientGroup, 1000);
        try {
            assertTrue(client.set("user:1", bytes("hello")).get(2, TimeUnit.SECONDS));

            Optional<byte[]> value = client.get("user:1").get(2, TimeUnit.SECONDS);

            assertArrayEquals(bytes("hello"), value.orElseThrow());
            assertFalse(client.get("user:2").get(2, TimeUnit.SECONDS).isPresent());
        } finally {
            client.close();
        }
    }

    @Test
    void pipelinedRepliesMatchRequestsInOrder() throws Exception {
        for (int i = 0; i < 20; i++) {
            store.put("k" + i, bytes("v" + i));
        }
        NettyBackendClient client = new NettyBackendClient(address, clientGroup, 1000);
        try {
            List<CompletableFuture<Optional<byte[]>>> replies = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                replies.add(client.get("k" + i));
            }
            for (int i = 0; i < 20; i++) {
                assertArrayEquals(bytes("v" + i), replies.get(i).get(2, TimeUnit.SECONDS).orElseThrow());
            }
        } finally {
            client.close();
        }
    }

    @Test
    void serverErrorFailsTheRequest() {
        NettyBackendClient client = new NettyBackendClient(address, clientGroup, 1000);
        try {
            ExecutionException exception = assertThrows(ExecutionException.class,
                    () -> client.set("reject", bytes("x")).get(2, TimeUnit.SECONDS));

            assertInstanceOf(BackendException.class, exception.getCause());
            assertTrue(exception.getCause().getMessage().contains("SERVER_ERROR"));
        } finally {
            client.close();
        }
    }

    @Test
    void droppedConnectionFailsPendingAndReconnects() throws Exception {
        NettyBackendClient client = new NettyBackendClient(address, clientGroup, 1000);
        try {
            ExecutionException exception = assertThrows(ExecutionException.class,
                    () -> client.get("hangup").get(2, TimeUnit.SECONDS));
            assertInstanceOf(BackendException.class, exception.getCause());

            store.put("after", bytes("ok"));
            assertArrayEquals(bytes("ok"), client.get("after").get(2, TimeUnit.SECONDS).orElseThrow());
        } finally {
            client.close();
        }
    }

    @Test
    void unreachableNodeFailsWithBackendException() {
        serverChannel.close().syncUninterruptibly();
        NettyBackendClient client = new NettyBackendClient(address, clientGroup, 500);
        try {
            ExecutionException exception = assertThrows(ExecutionException.class,
                    () -> client.get("k").get(2, TimeUnit.SECONDS));

            assertInstanceOf(BackendException.class, exception.getCause());
        } finally {
            client.close();
        }
    }

    @Test
    void closedClientRejectsRequests() {
        NettyBackendClient client = new NettyBackendClient(address, clientGroup, 1000);
        client.close();

        assertTrue(client.get("k").isCompletedExceptionally());
    }

    @Test
    void closedClientDoesNotReconnect() throws Exception {
        NettyBackendClient client = new NettyBackendClient(address, clientGroup, 1000);
        assertTrue(client.set("k", bytes("v")).get(2, TimeUnit.SECONDS));

        client.close();

        assertNull(client.connection());
        ExecutionException exception = assertThrows(ExecutionException.class,
                () -> client.get("k").get(2, TimeUnit.SECONDS));
        assertInstanceOf(BackendException.class, exception.getCause());
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Minimal memcached text protocol server. Key {@code reject} answers SERVER_ERROR and key
     * {@code hangup} closes the connection.
     */
    private final class FakeMemcacheServer extends ByteToMessageDecoder {
        @Override
        protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
            int lf = in.indexOf(in.readerIndex(), in.writerIndex(), (byte) '\n');
            if (lf < 0) {
                return;
            }
            String line = in.toString(in.readerIndex(), lf - 1 - in.readerIndex(), StandardCharsets.UTF_8);
            String[] parts = line.split(" ");
            if ("get".equals(parts[0])) {
                in.skipBytes(lf + 1 - in.readerIndex());
                handleGet(ctx, parts[1]);
                return;
            }
            int length = Integer.parseInt(parts[4]);
            if (in.readableBytes() < lf + 1 - in.readerIndex() + length + 2) {
                return;
            }
            in.skipBytes(lf + 1 - in.readerIndex());
            byte[] data = new byte[length];
            in.readBytes(data);
            in.skipBytes(2);
            if ("reject".equals(parts[1])) {
                reply(ctx, "SERVER_ERROR out of memory\r\n");
                return;
            }
            store.put(parts[1], data);
            reply(ctx, "STORED\r\n");
        }

        private void handleGet(ChannelHandlerContext ctx, String key) {
            if ("hangup".equals(key)) {
                ctx.close();
                return;
            }
            byte[] value = store.get(key);
            if (value == null) {
                reply(ctx, "END\r\n");
                return;
            }
            ByteBuf buffer = Unpooled.buffer();
            buffer.writeCharSequence("VALUE " + key + " 0 " + value.length + "\r\n", StandardCharsets.UTF_8);
            buffer.writeBytes(value);
            buffer.writeCharSequence("\r\nEND\r\n", StandardCharsets.UTF_8);
            ctx.writeAndFlush(buffer);
        }

        private void reply(ChannelHandlerContext ctx, String text) {
            ctx.writeAndFlush(Unpooled.copiedBuffer(text, StandardCharsets.UTF_8));
        }
    }
}
