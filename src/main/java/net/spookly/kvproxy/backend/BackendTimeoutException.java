package net.spookly.kvproxy.backend;

/**
 * A node did not answer within the attempt timeout.
 */
public class BackendTimeoutException extends BackendException {
    private final long timeoutMs;

    public BackendTimeoutException(String address, long timeoutMs, Throwable cause) {
        super(address, "no reply within " + timeoutMs + " ms", cause);
        this.timeoutMs = timeoutMs;
    }

    public long timeoutMs() {
        return timeoutMs;
    }
}
