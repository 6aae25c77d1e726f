package net.spookly.kvproxy.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class ConfigLoaderTest {
    @Test
    void createsDefaultConfigAndRouteWhenMissing() throws IOException {
        Path tempDir = Files.createTempDirectory("kvproxy-config");
        Path configPath = tempDir.resolve("kvproxy.yaml");

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigLoader.load(configPath));

        assertTrue(exception.getMessage().contains("generated default"));
        assertTrue(Files.exists(configPath));
        String content = Files.readString(configPath, StandardCharsets.UTF_8);
        assertTrue(content.contains("proxy:"));
        assertTrue(content.contains("file: route.yaml"));
        Path routePath = tempDir.resolve("route.yaml");
        assertTrue(Files.readString(routePath, StandardCharsets.UTF_8).contains("numbucket: 1"));
    }

    @Test
    void generatedDefaultLoadsWithOriginalDefaults() throws IOException {
        Path tempDir = Files.createTempDirectory("kvproxy-config");
        Path configPath = tempDir.resolve("kvproxy.yaml");
        assertThrows(ConfigException.class, () -> ConfigLoader.load(configPath));

        KvproxyConfig config = ConfigLoader.load(configPath);

        assertEquals("127.0.0.1", config.proxy.hostname);
        assertEquals(7905, config.proxy.port);
        assertEquals(3, config.proxy.n);
        assertEquals(250, config.proxy.maxKeyLen);
        assertEquals(tempDir.resolve("route.yaml").toString(), config.route.file);
        assertEquals("127.0.0.1:7908", config.admin.listen);
    }

    @Test
    void loadsTestResourceConfig() throws URISyntaxException {
        Path configPath = Paths.get(ConfigLoaderTest.class.getResource("/conf/kvproxy.yaml").toURI());

        KvproxyConfig config = ConfigLoader.load(configPath);

        assertEquals("127.0.0.1", config.proxy.hostname);
        assertEquals(7905, config.proxy.port);
        assertEquals(3, config.proxy.n);
        assertEquals(250, config.proxy.maxKeyLen);
        assertEquals("all", config.proxy.writeQuorum);
        assertEquals(configPath.getParent().resolve("route.yaml").toString(), config.route.file);
        assertEquals("warn", config.observability.logging.level);
    }

    @Test
    void rejectsUnknownProperties() throws IOException {
        Path tempDir = Files.createTempDirectory("kvproxy-config");
        Path configPath = tempDir.resolve("kvproxy.yaml");
        Files.writeString(configPath, ConfigDefaults.defaultYaml("route.yaml") + "\nunexpected: true\n",
                StandardCharsets.UTF_8);

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigLoader.load(configPath));

        assertTrue(exception.getMessage().contains("Failed to parse config"));
    }

    @Test
    void expandsEnvironmentValuesWithFallback() {
        Map<String, String> environment = Map.of("KVPROXY_PORT", "7910");
        Object raw = Map.of("proxy", Map.of(
                "port", "env:KVPROXY_PORT",
                "hostname", "env:KVPROXY_HOST|10.0.0.5",
                "tags", List.of("env:KVPROXY_PORT")
        ));

        @SuppressWarnings("unchecked")
        Map<String, Map<String, Object>> expanded =
                (Map<String, Map<String, Object>>) EnvExpander.expand(raw, null, environment::get);

        assertEquals("7910", expanded.get("proxy").get("port"));
        assertEquals("10.0.0.5", expanded.get("proxy").get("hostname"));
        assertEquals(List.of("7910"), expanded.get("proxy").get("tags"));
    }

    @Test
    void missingEnvironmentValueWithoutFallbackFails() {
        ConfigException exception = assertThrows(ConfigException.class,
                () -> EnvExpander.expand("env:KVPROXY_MISSING", null, name -> null));

        assertTrue(exception.getMessage().contains("KVPROXY_MISSING"));
    }

    @Test
    void expandsPathValuesRelativeToBaseDir() throws IOException {
        Path tempDir = Files.createTempDirectory("kvproxy-config");
        Files.writeString(tempDir.resolve("listen"), "127.0.0.1:7999\n", StandardCharsets.UTF_8);

        assertEquals("127.0.0.1:7999", EnvExpander.expand("path:listen", tempDir, name -> null));
    }
}
