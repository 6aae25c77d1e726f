package net.spookly.kvproxy.routing;

import net.spookly.kvproxy.config.ConfigDefaults;
import net.spookly.kvproxy.config.KvproxyConfig;

/**
 * Tuning for {@link Scorer}.
 *
 * @param halfLifeMs          time after which an outcome counts half as much
 * @param latencyReferenceMs  latency at which the latency factor halves a node's score
 * @param unhealthyThreshold  scores below this are reported unhealthy
 */
public record ScorerSettings(double halfLifeMs, double latencyReferenceMs, double unhealthyThreshold) {
    public ScorerSettings {
        if (halfLifeMs <= 0 || latencyReferenceMs <= 0) {
            throw new IllegalArgumentException("half-life and latency reference must be greater than 0");
        }
        if (unhealthyThreshold < 0 || unhealthyThreshold > Scorer.MAX_SCORE) {
            throw new IllegalArgumentException("unhealthy threshold must be between 0 and " + Scorer.MAX_SCORE);
        }
    }

    public static ScorerSettings defaults() {
        return new ScorerSettings(ConfigDefaults.HALF_LIFE_MS, ConfigDefaults.LATENCY_REFERENCE_MS,
                ConfigDefaults.UNHEALTHY_THRESHOLD);
    }

    public static ScorerSettings fromConfig(KvproxyConfig config) {
        KvproxyConfig.ScoringConfig scoring = config == null ? null : config.scoring;
        if (scoring == null) {
            return defaults();
        }
        return new ScorerSettings(
                scoring.halfLifeMs != null ? scoring.halfLifeMs : ConfigDefaults.HALF_LIFE_MS,
                scoring.latencyReferenceMs != null ? scoring.latencyReferenceMs : ConfigDefaults.LATENCY_REFERENCE_MS,
                scoring.unhealthyThreshold != null ? scoring.unhealthyThreshold : ConfigDefaults.UNHEALTHY_THRESHOLD
        );
    }
}
