package net.spookly.kvproxy.config;

public class KvproxyConfig {
    public ProxyConfig proxy;
    public RouteConfig route;
    public ScoringConfig scoring;
    public AdminConfig admin;
    public ObservabilityConfig observability;

    public static class ProxyConfig {
        /**
         * Address the protocol front end advertises; the router itself does not bind it.
         */
        public String hostname;
        public Integer port;
        /**
         * Replication factor: every partition maps to exactly this many nodes.
         */
        public Integer n;
        public Integer maxKeyLen;
        public Integer readTimeoutMs;
        public Integer writeTimeoutMs;
        public Integer connectTimeoutMs;
        public Integer drainTimeoutMs;
        public String writeQuorum;
    }

    public static class RouteConfig {
        public String file;
        public Integer watchIntervalSeconds;
        /**
         * Delay before a superseded scheduler is closed. Defaults to five read timeouts.
         */
        public Integer graceMs;
    }

    public static class ScoringConfig {
        public Integer halfLifeMs;
        public Integer latencyReferenceMs;
        public Integer unhealthyThreshold;
    }

    public static class AdminConfig {
        public Boolean enabled;
        public String listen;
    }

    public static class ObservabilityConfig {
        public LoggingConfig logging;
    }

    public static class LoggingConfig {
        public String level;
    }
}
