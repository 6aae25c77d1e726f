package net.spookly.kvproxy.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ConfigValidatorTest {
    @Test
    void acceptsMinimalConfig() {
        assertDoesNotThrow(() -> ConfigValidator.validate(minimalConfig()));
    }

    @Test
    void reportsEveryViolationAtOnce() {
        KvproxyConfig config = minimalConfig();
        config.proxy.port = 0;
        config.proxy.n = 0;
        config.proxy.writeQuorum = "most";
        config.route.file = " ";

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigValidator.validate(config));

        String message = exception.getMessage();
        assertTrue(message.contains("proxy.port"));
        assertTrue(message.contains("proxy.n"));
        assertTrue(message.contains("proxy.writeQuorum"));
        assertTrue(message.contains("route.file"));
    }

    @Test
    void rejectsKeyLengthAboveProtocolLimit() {
        KvproxyConfig config = minimalConfig();
        config.proxy.maxKeyLen = 251;

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigValidator.validate(config));

        assertTrue(exception.getMessage().contains("proxy.maxKeyLen"));
    }

    @Test
    void requiresValidAdminListenWhenEnabled() {
        KvproxyConfig config = minimalConfig();
        config.admin = new KvproxyConfig.AdminConfig();
        config.admin.enabled = true;
        config.admin.listen = "localhost";

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigValidator.validate(config));

        assertTrue(exception.getMessage().contains("admin.listen"));
    }

    @Test
    void rejectsUnknownLogLevel() {
        KvproxyConfig config = minimalConfig();
        config.observability = new KvproxyConfig.ObservabilityConfig();
        config.observability.logging = new KvproxyConfig.LoggingConfig();
        config.observability.logging.level = "verbose";

        assertThrows(ConfigException.class, () -> ConfigValidator.validate(config));
    }

    private static KvproxyConfig minimalConfig() {
        KvproxyConfig config = new KvproxyConfig();
        config.proxy = new KvproxyConfig.ProxyConfig();
        config.proxy.hostname = "127.0.0.1";
        config.proxy.port = 7905;
        config.proxy.n = 3;
        config.route = new KvproxyConfig.RouteConfig();
        config.route.file = "route.yaml";
        return config;
    }
}
