package net.spookly.kvproxy.routing;

import java.util.List;

/**
 * Every replica of the key's partition failed. Each replica's failure is attached as suppressed.
 */
public class AllReplicasFailedException extends DispatchException {
    private final OperationKind kind;
    private final int attempts;

    public AllReplicasFailedException(OperationKind kind, String key, List<Throwable> failures) {
        super(kind.name().toLowerCase() + " of key '" + key + "' failed on all " + failures.size() + " replicas");
        this.kind = kind;
        this.attempts = failures.size();
        failures.forEach(this::addSuppressed);
    }

    public OperationKind kind() {
        return kind;
    }

    public int attempts() {
        return attempts;
    }
}
