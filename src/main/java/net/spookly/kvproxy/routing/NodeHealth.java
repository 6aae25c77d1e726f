package net.spookly.kvproxy.routing;

/**
 * Immutable, time-decayed outcome history for one node.
 * <p>
 * Weights are expressed as of {@link #asOfMillis}. An outcome newer than that moves the reference
 * point forward; an older one is decayed to the reference point before it is added. Either way the
 * result equals the sum of each outcome's decayed weight, so concurrent updates applied in any
 * order converge to the same state.
 */
final class NodeHealth {
    private static final long UNSET = Long.MIN_VALUE;
    static final NodeHealth EMPTY = new NodeHealth(0D, 0D, 0D, UNSET, 0L, 0L);

    private final double successWeight;
    private final double failureWeight;
    private final double latencyWeight;
    private final long asOfMillis;
    private final long totalSuccesses;
    private final long totalFailures;

    private NodeHealth(double successWeight, double failureWeight, double latencyWeight,
                       long asOfMillis, long totalSuccesses, long totalFailures) {
        this.successWeight = successWeight;
        this.failureWeight = failureWeight;
        this.latencyWeight = latencyWeight;
        this.asOfMillis = asOfMillis;
        this.totalSuccesses = totalSuccesses;
        this.totalFailures = totalFailures;
    }

    NodeHealth record(boolean success, double latencyMs, long atMillis, double halfLifeMs) {
        double latency = Double.isFinite(latencyMs) ? Math.max(0D, latencyMs) : 0D;
        long successes = totalSuccesses + (success ? 1 : 0);
        long failures = totalFailures + (success ? 0 : 1);
        if (asOfMillis == UNSET || atMillis >= asOfMillis) {
            double decay = asOfMillis == UNSET ? 0D : decay(atMillis - asOfMillis, halfLifeMs);
            return new NodeHealth(
                    successWeight * decay + (success ? 1D : 0D),
                    failureWeight * decay + (success ? 0D : 1D),
                    latencyWeight * decay + latency,
                    atMillis,
                    successes,
                    failures
            );
        }
        double weight = decay(asOfMillis - atMillis, halfLifeMs);
        return new NodeHealth(
                successWeight + (success ? weight : 0D),
                failureWeight + (success ? 0D : weight),
                latencyWeight + latency * weight,
                asOfMillis,
                successes,
                failures
        );
    }

    double successCount(long nowMillis, double halfLifeMs) {
        return successWeight * decayTo(nowMillis, halfLifeMs);
    }

    double failureCount(long nowMillis, double halfLifeMs) {
        return failureWeight * decayTo(nowMillis, halfLifeMs);
    }

    /**
     * Mean latency of the decayed outcomes; decay cancels out of the ratio.
     */
    double latencyMs() {
        double total = successWeight + failureWeight;
        return total > 0D ? latencyWeight / total : 0D;
    }

    /**
     * Score in [0, max] as of {@code nowMillis}: a success ratio with one phantom success, so an
     * idle node drifts back toward full score, multiplied by a latency penalty.
     */
    double score(long nowMillis, ScorerSettings settings, double max) {
        double decay = decayTo(nowMillis, settings.halfLifeMs());
        double successes = successWeight * decay;
        double failures = failureWeight * decay;
        double ratio = (successes + 1D) / (successes + failures + 1D);
        double reference = settings.latencyReferenceMs();
        double latencyFactor = reference / (reference + latencyMs());
        double score = max * ratio * latencyFactor;
        if (!Double.isFinite(score)) {
            return 0D;
        }
        return Math.min(max, Math.max(0D, score));
    }

    long totalSuccesses() {
        return totalSuccesses;
    }

    long totalFailures() {
        return totalFailures;
    }

    private double decayTo(long nowMillis, double halfLifeMs) {
        if (asOfMillis == UNSET || nowMillis <= asOfMillis) {
            return 1D;
        }
        return decay(nowMillis - asOfMillis, halfLifeMs);
    }

    private static double decay(long elapsedMillis, double halfLifeMs) {
        return Math.pow(0.5D, elapsedMillis / halfLifeMs);
    }
}
