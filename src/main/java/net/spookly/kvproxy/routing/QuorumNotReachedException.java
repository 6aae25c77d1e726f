package net.spookly.kvproxy.routing;

import java.util.List;

/**
 * A write was acknowledged by some replicas but fewer than the write quorum requires.
 */
public class QuorumNotReachedException extends DispatchException {
    private final int acknowledged;
    private final int required;

    public QuorumNotReachedException(String key, int acknowledged, int required, List<Throwable> failures) {
        super("write of key '" + key + "' acknowledged by " + acknowledged + " of " + required + " required replicas");
        this.acknowledged = acknowledged;
        this.required = required;
        failures.forEach(this::addSuppressed);
    }

    public int acknowledged() {
        return acknowledged;
    }

    public int required() {
        return required;
    }
}
