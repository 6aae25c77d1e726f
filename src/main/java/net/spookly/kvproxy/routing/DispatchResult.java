package net.spookly.kvproxy.routing;

import java.util.List;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Successful outcome of one dispatched operation.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class DispatchResult {
    private final OperationKind kind;
    private final String key;
    /**
     * Nodes that answered: the serving replica of a read, the acknowledging replicas of a write.
     */
    private final List<String> nodes;
    @Getter(AccessLevel.NONE)
    private final byte[] value;
    private final int attempts;

    static DispatchResult read(String key, String node, byte[] value, int attempts) {
        return new DispatchResult(OperationKind.READ, key, List.of(node), value, attempts);
    }

    static DispatchResult write(String key, List<String> acknowledged, int attempts) {
        return new DispatchResult(OperationKind.WRITE, key, List.copyOf(acknowledged), null, attempts);
    }

    /**
     * Copy of the value read, or {@code null} for a miss and for writes.
     */
    public byte[] value() {
        return value == null ? null : value.clone();
    }

    public boolean found() {
        return value != null;
    }
}
