package net.spookly.kvproxy.backend;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Request/response access to one storage node.
 * <p>
 * Futures complete exceptionally on node-level failure (connection, protocol or server error).
 * Callers bound every future with their own timeout.
 */
public interface BackendClient extends AutoCloseable {
    String address();

    /**
     * Fetch a value; an empty optional is a miss, not a failure.
     */
    CompletableFuture<Optional<byte[]>> get(String key);

    /**
     * Store a value; {@code true} when the node acknowledged it.
     */
    CompletableFuture<Boolean> set(String key, byte[] value);

    /**
     * Release the connection. Pending requests fail.
     */
    @Override
    void close();
}
