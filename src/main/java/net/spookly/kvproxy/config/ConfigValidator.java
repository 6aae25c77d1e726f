package net.spookly.kvproxy.config;

import java.util.ArrayList;
import java.util.List;

import net.spookly.kvproxy.util.NodeAddress;

public final class ConfigValidator {
    private static final int MEMCACHE_MAX_KEY_LEN = 250;

    private ConfigValidator() {
    }

    /**
     * Validate configuration, throwing ConfigException on any violations.
     */
    public static void validate(KvproxyConfig config) {
        List<String> errors = new ArrayList<>();
        if (config == null) {
            errors.add("config is required");
            throwIfErrors(errors);
            return;
        }

        validateProxy(config, errors);
        validateRoute(config, errors);
        validateScoring(config, errors);
        validateAdmin(config, errors);
        validateObservability(config, errors);

        throwIfErrors(errors);
    }

    private static void validateProxy(KvproxyConfig config, List<String> errors) {
        KvproxyConfig.ProxyConfig proxy = config.proxy;
        if (proxy == null) {
            errors.add("proxy section is required");
            return;
        }
        requireNonBlank(errors, proxy.hostname, "proxy.hostname");
        requirePort(errors, proxy.port, "proxy.port");
        requirePositive(errors, proxy.n, "proxy.n");
        if (proxy.maxKeyLen != null && (proxy.maxKeyLen <= 0 || proxy.maxKeyLen > MEMCACHE_MAX_KEY_LEN)) {
            errors.add("proxy.maxKeyLen must be between 1 and " + MEMCACHE_MAX_KEY_LEN);
        }
        optionalPositive(errors, proxy.readTimeoutMs, "proxy.readTimeoutMs");
        optionalPositive(errors, proxy.writeTimeoutMs, "proxy.writeTimeoutMs");
        optionalPositive(errors, proxy.connectTimeoutMs, "proxy.connectTimeoutMs");
        optionalPositive(errors, proxy.drainTimeoutMs, "proxy.drainTimeoutMs");
        if (!isBlank(proxy.writeQuorum) && !isOneOf(proxy.writeQuorum, "all", "one")) {
            errors.add("proxy.writeQuorum must be one of: all, one");
        }
    }

    private static void validateRoute(KvproxyConfig config, List<String> errors) {
        KvproxyConfig.RouteConfig route = config.route;
        if (route == null) {
            errors.add("route section is required");
            return;
        }
        requireNonBlank(errors, route.file, "route.file");
        if (route.watchIntervalSeconds != null && route.watchIntervalSeconds < 0) {
            errors.add("route.watchIntervalSeconds must not be negative");
        }
        optionalPositive(errors, route.graceMs, "route.graceMs");
    }

    private static void validateScoring(KvproxyConfig config, List<String> errors) {
        KvproxyConfig.ScoringConfig scoring = config.scoring;
        if (scoring == null) {
            return;
        }
        optionalPositive(errors, scoring.halfLifeMs, "scoring.halfLifeMs");
        optionalPositive(errors, scoring.latencyReferenceMs, "scoring.latencyReferenceMs");
        if (scoring.unhealthyThreshold != null
                && (scoring.unhealthyThreshold < 0 || scoring.unhealthyThreshold > 100)) {
            errors.add("scoring.unhealthyThreshold must be between 0 and 100");
        }
    }

    private static void validateAdmin(KvproxyConfig config, List<String> errors) {
        KvproxyConfig.AdminConfig admin = config.admin;
        if (admin == null || !isTrue(admin.enabled)) {
            return;
        }
        if (isBlank(admin.listen)) {
            errors.add("admin.listen is required when admin.enabled is true");
            return;
        }
        try {
            NodeAddress.parse(admin.listen);
        } catch (IllegalArgumentException e) {
            errors.add("admin.listen is invalid: " + e.getMessage());
        }
    }

    private static void validateObservability(KvproxyConfig config, List<String> errors) {
        KvproxyConfig.ObservabilityConfig observability = config.observability;
        if (observability == null || observability.logging == null) {
            return;
        }
        String level = observability.logging.level;
        if (!isBlank(level) && !isOneOf(level, "trace", "debug", "info", "warn", "error")) {
            errors.add("observability.logging.level must be one of: trace, debug, info, warn, error");
        }
    }

    private static void requireNonBlank(List<String> errors, String value, String field) {
        if (isBlank(value)) {
            errors.add(field + " is required");
        }
    }

    private static void requirePort(List<String> errors, Integer value, String field) {
        if (value == null || value < 1 || value > 65535) {
            errors.add(field + " must be between 1 and 65535");
        }
    }

    private static void requirePositive(List<String> errors, Integer value, String field) {
        if (value == null || value <= 0) {
            errors.add(field + " must be greater than 0");
        }
    }

    private static void optionalPositive(List<String> errors, Integer value, String field) {
        if (value != null && value <= 0) {
            errors.add(field + " must be greater than 0");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static boolean isTrue(Boolean value) {
        return value != null && value;
    }

    private static boolean isOneOf(String value, String... options) {
        if (value == null) {
            return false;
        }
        for (String option : options) {
            if (value.equalsIgnoreCase(option)) {
                return true;
            }
        }
        return false;
    }

    private static void throwIfErrors(List<String> errors) {
        if (!errors.isEmpty()) {
            StringBuilder builder = new StringBuilder("Invalid config:\n");
            for (String error : errors) {
                builder.append("- ").append(error).append('\n');
            }
            throw new ConfigException(builder.toString());
        }
    }
}
