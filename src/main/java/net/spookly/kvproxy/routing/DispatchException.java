package net.spookly.kvproxy.routing;

/**
 * Operation-level failure surfaced to the caller of a dispatch.
 */
public class DispatchException extends RuntimeException {
    public DispatchException(String message) {
        super(message);
    }

    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
