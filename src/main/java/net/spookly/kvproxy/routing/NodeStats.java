package net.spookly.kvproxy.routing;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Point-in-time health view of one node for statistics export.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class NodeStats {
    private final String address;
    /**
     * Decayed success weight.
     */
    private final double successCount;
    /**
     * Decayed failure weight.
     */
    private final double failureCount;
    private final double latencyMs;
    private final double score;
    private final boolean healthy;
    private final long totalSuccesses;
    private final long totalFailures;
}
