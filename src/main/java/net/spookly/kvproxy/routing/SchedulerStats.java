package net.spookly.kvproxy.routing;

import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Read-only statistics of one scheduler for the admin surface.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class SchedulerStats {
    private final long tableVersion;
    private final int nodeCount;
    private final int bucketCount;
    private final int replicaCount;
    private final SchedulerState state;
    private final Map<String, NodeStats> perNode;
}
