package net.spookly.kvproxy.backend;

/**
 * Creates a client dedicated to one node address. Each scheduler owns the clients it creates.
 */
@FunctionalInterface
public interface BackendClientFactory {
    BackendClient create(String address);
}
