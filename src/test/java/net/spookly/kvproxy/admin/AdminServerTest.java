package net.spookly.kvproxy.admin;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.spookly.kvproxy.backend.BackendClient;
import net.spookly.kvproxy.config.KvproxyConfig;
import net.spookly.kvproxy.route.FileRouteSource;
import net.spookly.kvproxy.route.RouteTableParser;
import net.spookly.kvproxy.routing.RouteCoordinator;
import net.spookly.kvproxy.routing.Scheduler;
import net.spookly.kvproxy.routing.SchedulerSettings;
import net.spookly.kvproxy.routing.ScorerSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AdminServerTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpClient http = HttpClient.newHttpClient();
    private Path routeFile;
    private RouteCoordinator coordinator;
    private AdminServer server;

    @BeforeEach
    void startServer() throws IOException {
        routeFile = Files.createTempDirectory("kvproxy-admin").resolve("route.yaml");
        Files.writeString(routeFile, route(1), StandardCharsets.UTF_8);
        coordinator = new RouteCoordinator(new RouteTableParser(3), Scheduler.factory(
                StubClient::new, SchedulerSettings.defaults(), ScorerSettings.defaults(), Clock.systemUTC()), 100);
        KvproxyConfig config = new KvproxyConfig();
        config.proxy = new KvproxyConfig.ProxyConfig();
        config.proxy.hostname = "127.0.0.1";
        config.proxy.port = 7905;
        server = new AdminServer(new InetSocketAddress("127.0.0.1", 0), coordinator,
                new FileRouteSource(routeFile), config);
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop();
        coordinator.close();
    }

    @Test
    void scoreIsNotFoundBeforeFirstLoad() throws Exception {
        HttpResponse<String> response = get("/stats/score");

        assertEquals(404, response.statusCode());
        assertFalse(MAPPER.readTree(response.body()).get("ok").asBoolean());
    }

    @Test
    void servesScoreAndRouteAfterReload() throws Exception {
        assertEquals(200, post("/stats/route/reload", "").statusCode());

        HttpResponse<String> score = get("/stats/score");
        HttpResponse<String> route = get("/stats/route");

        assertEquals(200, score.statusCode());
        JsonNode data = MAPPER.readTree(score.body()).get("data");
        assertEquals(1L, data.get("version").asLong());
        assertEquals(3, data.get("nodeCount").asInt());
        assertTrue(data.get("nodes").has("a:1"));
        assertEquals(100D, data.get("nodes").get("a:1").get("score").asDouble(), 1e-9);
        assertEquals(200, route.statusCode());
        assertTrue(route.body().contains("version: 1"));
        assertTrue(route.body().contains("a:1"));
    }

    @Test
    void servesEffectiveConfig() throws Exception {
        HttpResponse<String> response = get("/stats/config");

        assertEquals(200, response.statusCode());
        assertTrue(response.body().contains("hostname: 127.0.0.1"));
    }

    @Test
    void reloadFromBodyReportsEachOutcome() throws Exception {
        HttpResponse<String> applied = post("/stats/route/reload", route(4));
        HttpResponse<String> repeated = post("/stats/route/reload", route(4));
        HttpResponse<String> malformed = post("/stats/route/reload", "version: [");

        assertEquals(200, applied.statusCode());
        assertEquals("SUCCESS", MAPPER.readTree(applied.body()).get("data").get("status").asText());
        assertEquals(200, repeated.statusCode());
        assertEquals("ALREADY_CURRENT", MAPPER.readTree(repeated.body()).get("data").get("status").asText());
        assertEquals(400, malformed.statusCode());
        assertEquals("MALFORMED", MAPPER.readTree(malformed.body()).get("data").get("status").asText());
        assertEquals(4L, coordinator.lastAppliedVersion());
    }

    @Test
    void emptyReloadBodyReadsRouteSource() throws Exception {
        post("/stats/route/reload", "");
        Files.writeString(routeFile, route(9), StandardCharsets.UTF_8);

        HttpResponse<String> response = post("/stats/route/reload", "");

        assertEquals(200, response.statusCode());
        assertEquals(9L, coordinator.lastAppliedVersion());
    }

    @Test
    void rejectsWrongMethod() throws Exception {
        assertEquals(405, get("/stats/route/reload").statusCode());
        assertEquals(405, post("/stats/score", "").statusCode());
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri(path)).GET().build();
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri(path))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + server.address().getPort() + path);
    }

    private static String route(long version) {
        return "version: " + version + "\n"
                + "numbucket: 1\n"
                + "buckets:\n"
                + "  0: [\"a:1\", \"b:1\", \"c:1\"]\n";
    }

    private static final class StubClient implements BackendClient {
        private final String address;

        StubClient(String address) {
            this.address = address;
        }

        @Override
        public String address() {
            return address;
        }

        @Override
        public CompletableFuture<Optional<byte[]>> get(String key) {
            return CompletableFuture.completedFuture(Optional.empty());
        }

        @Override
        public CompletableFuture<Boolean> set(String key, byte[] value) {
            return CompletableFuture.completedFuture(true);
        }

        @Override
        public void close() {
        }
    }
}
