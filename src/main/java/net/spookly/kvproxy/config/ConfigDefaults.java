package net.spookly.kvproxy.config;

/**
 * Default configuration and route templates written when no config file exists.
 */
public final class ConfigDefaults {
    public static final int REPLICAS = 3;
    public static final int MAX_KEY_LEN = 250;
    public static final int READ_TIMEOUT_MS = 500;
    public static final int WRITE_TIMEOUT_MS = 1000;
    public static final int CONNECT_TIMEOUT_MS = 300;
    public static final int DRAIN_TIMEOUT_MS = 5000;
    public static final int GRACE_READ_TIMEOUTS = 5;
    public static final int HALF_LIFE_MS = 60_000;
    public static final int LATENCY_REFERENCE_MS = 50;
    public static final int UNHEALTHY_THRESHOLD = 40;

    private static final String DEFAULT_YAML_TEMPLATE = """
            # Generated default kvproxy config.
            # The route table lives in %s and is reloaded when its version increases.
            proxy:
              hostname: 127.0.0.1
              port: 7905
              n: 3
              maxKeyLen: 250
              readTimeoutMs: 500
              writeTimeoutMs: 1000
              connectTimeoutMs: 300
              drainTimeoutMs: 5000
              writeQuorum: all

            route:
              file: %s
              watchIntervalSeconds: 10

            scoring:
              halfLifeMs: 60000
              latencyReferenceMs: 50
              unhealthyThreshold: 40

            admin:
              enabled: true
              listen: 127.0.0.1:7908

            observability:
              logging:
                level: info
            """;

    private static final String DEFAULT_ROUTE_YAML = """
            # Generated default route table: one bucket served by three local nodes.
            version: 1
            numbucket: 1
            buckets:
              0: ["127.0.0.1:7980", "127.0.0.1:7981", "127.0.0.1:7982"]
            """;

    private ConfigDefaults() {
    }

    /**
     * Render the default configuration template.
     */
    public static String defaultYaml(String routeFile) {
        if (routeFile == null || routeFile.isBlank()) {
            throw new ConfigException("Route file path is required for the default config");
        }
        return DEFAULT_YAML_TEMPLATE.formatted(routeFile, routeFile);
    }

    public static String defaultRouteYaml() {
        return DEFAULT_ROUTE_YAML;
    }
}
