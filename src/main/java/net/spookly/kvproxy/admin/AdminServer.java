package net.spookly.kvproxy.admin;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import net.spookly.kvproxy.config.ConfigPrinter;
import net.spookly.kvproxy.config.KvproxyConfig;
import net.spookly.kvproxy.route.RouteSource;
import net.spookly.kvproxy.route.RouteTable;
import net.spookly.kvproxy.route.RouteTableParser;
import net.spookly.kvproxy.routing.NodeStats;
import net.spookly.kvproxy.routing.ReloadResult;
import net.spookly.kvproxy.routing.RouteCoordinator;
import net.spookly.kvproxy.routing.SchedulerStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * HTTP admin surface: scheduler statistics, the active route table, the effective config and a
 * manual reload trigger.
 */
public final class AdminServer {
    private static final Logger log = LoggerFactory.getLogger(AdminServer.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int MAX_REQUEST_BYTES = 1024 * 1024;

    private final RouteCoordinator coordinator;
    private final RouteSource routeSource;
    private final KvproxyConfig config;
    private final HttpServer server;
    private final ExecutorService executor;

    public AdminServer(InetSocketAddress listen,
                       RouteCoordinator coordinator,
                       RouteSource routeSource,
                       KvproxyConfig config) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.routeSource = Objects.requireNonNull(routeSource, "routeSource");
        this.config = Objects.requireNonNull(config, "config");
        try {
            this.server = HttpServer.create(Objects.requireNonNull(listen, "listen"), 0);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to bind admin listener on " + listen, e);
        }
        this.executor = Executors.newFixedThreadPool(2, runnable -> {
            Thread thread = new Thread(runnable, "kvproxy-admin");
            thread.setDaemon(true);
            return thread;
        });
        this.server.setExecutor(executor);
        this.server.createContext("/stats/score", new ScoreHandler());
        this.server.createContext("/stats/route/reload", new ReloadHandler());
        this.server.createContext("/stats/route", new RouteHandler());
        this.server.createContext("/stats/config", new ConfigHandler());
    }

    public void start() {
        server.start();
        log.info("Admin listening on {}:{}", server.getAddress().getHostString(), server.getAddress().getPort());
    }

    public void stop() {
        server.stop(0);
        executor.shutdownNow();
    }

    /**
     * Bound address; resolves an ephemeral port.
     */
    public InetSocketAddress address() {
        return server.getAddress();
    }

    private abstract class BaseHandler implements HttpHandler {
        private final String method;

        BaseHandler(String method) {
            this.method = method;
        }

        @Override
        public final void handle(HttpExchange exchange) throws IOException {
            try {
                if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
                    writeJson(exchange, 405, AdminResponse.error("method not allowed"));
                    return;
                }
                handleRequest(exchange, readBodyBytes(exchange));
            } catch (RequestTooLargeException e) {
                writeJson(exchange, 413, AdminResponse.error("request too large"));
            } catch (IllegalArgumentException e) {
                writeJson(exchange, 400, AdminResponse.error(e.getMessage()));
            } catch (Exception e) {
                log.warn("Admin request {} {} failed", exchange.getRequestMethod(), exchange.getRequestURI(), e);
                writeJson(exchange, 500, AdminResponse.error("internal error"));
            } finally {
                exchange.close();
            }
        }

        protected abstract void handleRequest(HttpExchange exchange, byte[] body) throws IOException;

        private byte[] readBodyBytes(HttpExchange exchange) throws IOException {
            try (InputStream input = exchange.getRequestBody()) {
                if (input == null) {
                    return new byte[0];
                }
                ByteArrayOutputStream output = new ByteArrayOutputStream();
                byte[] buffer = new byte[8192];
                int total = 0;
                int read;
                while ((read = input.read(buffer)) != -1) {
                    total += read;
                    if (total > MAX_REQUEST_BYTES) {
                        throw new RequestTooLargeException();
                    }
                    output.write(buffer, 0, read);
                }
                return output.toByteArray();
            }
        }
    }

    private final class ScoreHandler extends BaseHandler {
        ScoreHandler() {
            super("GET");
        }

        @Override
        protected void handleRequest(HttpExchange exchange, byte[] body) throws IOException {
            Optional<SchedulerStats> stats = coordinator.currentStats();
            if (stats.isEmpty()) {
                writeJson(exchange, 404, AdminResponse.error("no route table loaded"));
                return;
            }
            writeJson(exchange, 200, AdminResponse.ok("score", toMap(stats.get())));
        }
    }

    private final class RouteHandler extends BaseHandler {
        RouteHandler() {
            super("GET");
        }

        @Override
        protected void handleRequest(HttpExchange exchange, byte[] body) throws IOException {
            Optional<RouteTable> table = coordinator.currentRouteTable();
            if (table.isEmpty()) {
                writeJson(exchange, 404, AdminResponse.error("no route table loaded"));
                return;
            }
            writeYaml(exchange, RouteTableParser.toYaml(table.get()));
        }
    }

    private final class ConfigHandler extends BaseHandler {
        ConfigHandler() {
            super("GET");
        }

        @Override
        protected void handleRequest(HttpExchange exchange, byte[] body) throws IOException {
            writeYaml(exchange, ConfigPrinter.toYaml(config));
        }
    }

    private final class ReloadHandler extends BaseHandler {
        ReloadHandler() {
            super("POST");
        }

        @Override
        protected void handleRequest(HttpExchange exchange, byte[] body) throws IOException {
            ReloadResult result = body.length > 0
                    ? coordinator.reload(new String(body, StandardCharsets.UTF_8))
                    : coordinator.reload(routeSource);
            log.info("Admin reload: {}", result);
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("status", result.status().name());
            data.put("version", result.version());
            data.put("previousVersion", result.previousVersion());
            switch (result.status()) {
                case SUCCESS:
                case ALREADY_CURRENT:
                    writeJson(exchange, 200, AdminResponse.ok(result.message(), data));
                    break;
                case BUSY:
                    writeJson(exchange, 409, AdminResponse.error(result.message(), data));
                    break;
                case MALFORMED:
                    writeJson(exchange, 400, AdminResponse.error(result.message(), data));
                    break;
                default:
                    writeJson(exchange, 500, AdminResponse.error(result.message(), data));
                    break;
            }
        }
    }

    static Map<String, Object> toMap(SchedulerStats stats) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("version", stats.tableVersion());
        data.put("nodeCount", stats.nodeCount());
        data.put("bucketCount", stats.bucketCount());
        data.put("replicaCount", stats.replicaCount());
        data.put("state", stats.state().name());
        Map<String, Object> nodes = new LinkedHashMap<>();
        for (NodeStats node : stats.perNode().values()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("score", node.score());
            entry.put("healthy", node.healthy());
            entry.put("successCount", node.successCount());
            entry.put("failureCount", node.failureCount());
            entry.put("latencyMs", node.latencyMs());
            entry.put("totalSuccesses", node.totalSuccesses());
            entry.put("totalFailures", node.totalFailures());
            nodes.put(node.address(), entry);
        }
        data.put("nodes", nodes);
        return data;
    }

    private void writeJson(HttpExchange exchange, int status, AdminResponse response) throws IOException {
        write(exchange, status, "application/json", MAPPER.writeValueAsBytes(response));
    }

    private void writeYaml(HttpExchange exchange, String yaml) throws IOException {
        write(exchange, 200, "application/yaml; charset=utf-8", yaml.getBytes(StandardCharsets.UTF_8));
    }

    private void write(HttpExchange exchange, int status, String contentType, byte[] payload) throws IOException {
        exchange.getResponseHeaders().add("Content-Type", contentType);
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream output = exchange.getResponseBody()) {
            output.write(payload);
        }
    }

    private static final class RequestTooLargeException extends IOException {
    }
}
