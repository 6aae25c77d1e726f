package net.spookly.kvproxy.backend;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import net.spookly.kvproxy.util.NodeAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Memcached text protocol client for one storage node over a single pipelined TCP connection.
 * <p>
 * The connection is opened on first use and reopened on the next request after it drops.
 * Replies are matched to requests in FIFO order; all queue access happens on the channel's
 * event loop.
 */
public final class NettyBackendClient implements BackendClient {
    private static final Logger log = LoggerFactory.getLogger(NettyBackendClient.class);

    private final String address;
    private final Bootstrap bootstrap;
    private final Object connectLock = new Object();
    private ChannelFuture connection;
    private volatile boolean closed;

    public NettyBackendClient(String address, EventLoopGroup group, int connectTimeoutMs) {
        this.address = Objects.requireNonNull(address, "address");
        NodeAddress node = NodeAddress.parse(address);
        this.bootstrap = new Bootstrap()
                .group(Objects.requireNonNull(group, "group"))
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .remoteAddress(node.toSocketAddress())
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel channel) {
                        channel.pipeline()
                                .addLast(new MemcacheReplyDecoder())
                                .addLast(new MemcacheCommandEncoder())
                                .addLast(new ReplyHandler());
                    }
                });
    }

    @Override
    public String address() {
        return address;
    }

    @Override
    public CompletableFuture<Optional<byte[]>> get(String key) {
        return send(MemcacheCommand.get(key)).thenApply(reply -> {
            switch (reply.kind()) {
                case VALUE:
                    return Optional.of(reply.data());
                case MISS:
                    return Optional.empty();
                default:
                    throw new BackendException(address, "get failed: " + describe(reply));
            }
        });
    }

    @Override
    public CompletableFuture<Boolean> set(String key, byte[] value) {
        return send(MemcacheCommand.set(key, value)).thenApply(reply -> {
            switch (reply.kind()) {
                case STORED:
                    return Boolean.TRUE;
                case NOT_STORED:
                    return Boolean.FALSE;
                default:
                    throw new BackendException(address, "set failed: " + describe(reply));
            }
        });
    }

    CompletableFuture<MemcacheReply> send(MemcacheCommand command) {
        CompletableFuture<MemcacheReply> reply = new CompletableFuture<>();
        if (closed) {
            reply.completeExceptionally(new BackendException(address, "client closed"));
            return reply;
        }
        ChannelFuture connect = connection();
        if (connect == null) {
            reply.completeExceptionally(new BackendException(address, "client closed"));
            return reply;
        }
        connect.addListener(future -> {
            if (!future.isSuccess()) {
                reply.completeExceptionally(new BackendException(address, "connect failed", future.cause()));
                return;
            }
            write(connect.channel(), command, reply);
        });
        return reply;
    }

    private void write(Channel channel, MemcacheCommand command, CompletableFuture<MemcacheReply> reply) {
        ReplyHandler handler = channel.pipeline().get(ReplyHandler.class);
        if (handler == null || !channel.isActive()) {
            reply.completeExceptionally(new BackendException(address, "connection closed"));
            return;
        }
        handler.pending.add(reply);
        channel.writeAndFlush(command).addListener(written -> {
            if (!written.isSuccess()) {
                reply.completeExceptionally(new BackendException(address, "write failed", written.cause()));
                channel.close();
            }
        });
    }

    /**
     * Current connection, opened if needed, or {@code null} once the client is closed.
     */
    ChannelFuture connection() {
        synchronized (connectLock) {
            if (closed) {
                return null;
            }
            if (connection == null || (connection.isDone() && !isUsable(connection))) {
                connection = bootstrap.connect();
            }
            return connection;
        }
    }

    private static boolean isUsable(ChannelFuture future) {
        return future.isSuccess() && future.channel().isActive();
    }

    @Override
    public void close() {
        closed = true;
        ChannelFuture current;
        synchronized (connectLock) {
            current = connection;
            connection = null;
        }
        if (current != null) {
            current.addListener(future -> current.channel().close());
        }
    }

    private static String describe(MemcacheReply reply) {
        return reply.message() != null ? reply.message() : reply.kind().name();
    }

    private final class ReplyHandler extends SimpleChannelInboundHandler<MemcacheReply> {
        private final ArrayDeque<CompletableFuture<MemcacheReply>> pending = new ArrayDeque<>();

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, MemcacheReply reply) {
            CompletableFuture<MemcacheReply> next = pending.poll();
            if (next == null) {
                log.warn("Unsolicited reply from {}: {}", address, reply.kind());
                return;
            }
            next.complete(reply);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            failPending(new BackendException(address, "connection closed"));
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.debug("Closing connection to {} after error", address, cause);
            failPending(new BackendException(address, "protocol error", cause));
            ctx.close();
        }

        private void failPending(BackendException error) {
            CompletableFuture<MemcacheReply> next;
            while ((next = pending.poll()) != null) {
                next.completeExceptionally(error);
            }
        }
    }
}
