package net.spookly.kvproxy.backend;

/**
 * Node-level failure talking to one storage node.
 */
public class BackendException extends RuntimeException {
    private final String address;

    public BackendException(String address, String message) {
        super(address + ": " + message);
        this.address = address;
    }

    public BackendException(String address, String message, Throwable cause) {
        super(address + ": " + message, cause);
        this.address = address;
    }

    public String address() {
        return address;
    }
}
