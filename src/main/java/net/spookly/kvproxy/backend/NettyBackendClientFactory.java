package net.spookly.kvproxy.backend;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;

/**
 * Builds {@link NettyBackendClient}s on a shared event loop group.
 * <p>
 * The group only provides I/O threads; every client still owns its own connection, so clients of
 * an active and a draining scheduler never share a channel.
 */
public final class NettyBackendClientFactory implements BackendClientFactory, AutoCloseable {
    private final EventLoopGroup group;
    private final int connectTimeoutMs;

    public NettyBackendClientFactory(int connectTimeoutMs) {
        this(new NioEventLoopGroup(0, threadFactory()), connectTimeoutMs);
    }

    public NettyBackendClientFactory(EventLoopGroup group, int connectTimeoutMs) {
        if (connectTimeoutMs <= 0) {
            throw new IllegalArgumentException("connect timeout must be greater than 0");
        }
        this.group = group;
        this.connectTimeoutMs = connectTimeoutMs;
    }

    @Override
    public BackendClient create(String address) {
        return new NettyBackendClient(address, group, connectTimeoutMs);
    }

    @Override
    public void close() {
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
    }

    private static ThreadFactory threadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "kvproxy-backend-io-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
