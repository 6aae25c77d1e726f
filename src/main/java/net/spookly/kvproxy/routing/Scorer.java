package net.spookly.kvproxy.routing;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tracks decayed per-node health from operation outcomes and ranks replicas by it.
 * <p>
 * Each node's state is an immutable {@link NodeHealth} swapped by compare-and-set, so readers
 * never observe a partially applied update and recording never blocks.
 */
public final class Scorer {
    static final double MAX_SCORE = 100D;

    private final Map<String, AtomicReference<NodeHealth>> states = new ConcurrentHashMap<>();
    private final ScorerSettings settings;
    private final Clock clock;

    public Scorer(ScorerSettings settings) {
        this(settings, Clock.systemUTC());
    }

    public Scorer(ScorerSettings settings, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Record the outcome of one attempt against {@code node}. Unknown nodes get a fresh entry.
     */
    public void recordOutcome(String node, boolean success, Duration latency) {
        if (node == null) {
            return;
        }
        double latencyMs = latency == null ? 0D : latency.toNanos() / 1_000_000D;
        recordOutcome(node, success, latencyMs, clock.millis());
    }

    void recordOutcome(String node, boolean success, double latencyMs, long atMillis) {
        state(node).updateAndGet(current -> current.record(success, latencyMs, atMillis, settings.halfLifeMs()));
    }

    /**
     * Make {@code nodes} visible in {@link #snapshot()} before their first outcome.
     */
    void track(Collection<String> nodes) {
        for (String node : nodes) {
            state(node);
        }
    }

    public double score(String node) {
        return scoreAt(node, clock.millis());
    }

    public boolean isHealthy(String node) {
        return score(node) >= settings.unhealthyThreshold();
    }

    /**
     * Order {@code nodes} best-first: higher score, then lower address.
     */
    public List<String> rank(List<String> nodes) {
        if (nodes.size() <= 1) {
            return List.copyOf(nodes);
        }
        long now = clock.millis();
        Map<String, Double> scores = new HashMap<>();
        for (String node : nodes) {
            scores.put(node, scoreAt(node, now));
        }
        List<String> ranked = new ArrayList<>(nodes);
        ranked.sort(Comparator.<String>comparingDouble(scores::get).reversed()
                .thenComparing(Comparator.naturalOrder()));
        return Collections.unmodifiableList(ranked);
    }

    /**
     * Health of every known node, keyed and sorted by address.
     */
    public Map<String, NodeStats> snapshot() {
        long now = clock.millis();
        Map<String, NodeStats> snapshot = new TreeMap<>();
        states.forEach((node, ref) -> {
            NodeHealth health = ref.get();
            double score = health.score(now, settings, MAX_SCORE);
            snapshot.put(node, new NodeStats(
                    node,
                    health.successCount(now, settings.halfLifeMs()),
                    health.failureCount(now, settings.halfLifeMs()),
                    health.latencyMs(),
                    score,
                    score >= settings.unhealthyThreshold(),
                    health.totalSuccesses(),
                    health.totalFailures()
            ));
        });
        return Collections.unmodifiableMap(snapshot);
    }

    private double scoreAt(String node, long nowMillis) {
        AtomicReference<NodeHealth> ref = states.get(node);
        NodeHealth health = ref == null ? NodeHealth.EMPTY : ref.get();
        return health.score(nowMillis, settings, MAX_SCORE);
    }

    private AtomicReference<NodeHealth> state(String node) {
        return states.computeIfAbsent(node, key -> new AtomicReference<>(NodeHealth.EMPTY));
    }
}
