package net.spookly.kvproxy.routing;

import net.spookly.kvproxy.config.ConfigDefaults;
import net.spookly.kvproxy.config.KvproxyConfig;

/**
 * Per-scheduler timeouts and replication policy.
 */
public record SchedulerSettings(int readTimeoutMs,
                                int writeTimeoutMs,
                                int drainTimeoutMs,
                                WriteQuorum writeQuorum,
                                int maxKeyLength) {
    public SchedulerSettings {
        if (readTimeoutMs <= 0 || writeTimeoutMs <= 0 || drainTimeoutMs <= 0) {
            throw new IllegalArgumentException("timeouts must be greater than 0");
        }
        if (maxKeyLength <= 0) {
            throw new IllegalArgumentException("max key length must be greater than 0");
        }
        writeQuorum = writeQuorum == null ? WriteQuorum.ALL : writeQuorum;
    }

    public static SchedulerSettings defaults() {
        return new SchedulerSettings(ConfigDefaults.READ_TIMEOUT_MS, ConfigDefaults.WRITE_TIMEOUT_MS,
                ConfigDefaults.DRAIN_TIMEOUT_MS, WriteQuorum.ALL, ConfigDefaults.MAX_KEY_LEN);
    }

    public static SchedulerSettings fromConfig(KvproxyConfig config) {
        KvproxyConfig.ProxyConfig proxy = config == null ? null : config.proxy;
        if (proxy == null) {
            return defaults();
        }
        return new SchedulerSettings(
                valueOr(proxy.readTimeoutMs, ConfigDefaults.READ_TIMEOUT_MS),
                valueOr(proxy.writeTimeoutMs, ConfigDefaults.WRITE_TIMEOUT_MS),
                valueOr(proxy.drainTimeoutMs, ConfigDefaults.DRAIN_TIMEOUT_MS),
                WriteQuorum.fromConfig(proxy.writeQuorum),
                valueOr(proxy.maxKeyLen, ConfigDefaults.MAX_KEY_LEN)
        );
    }

    private static int valueOr(Integer value, int fallback) {
        return value != null ? value : fallback;
    }
}
