package net.spookly.kvproxy;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;

import ch.qos.logback.classic.Level;
import net.spookly.kvproxy.admin.AdminServer;
import net.spookly.kvproxy.backend.NettyBackendClientFactory;
import net.spookly.kvproxy.config.ConfigDefaults;
import net.spookly.kvproxy.config.ConfigLoader;
import net.spookly.kvproxy.config.ConfigPrinter;
import net.spookly.kvproxy.config.KvproxyConfig;
import net.spookly.kvproxy.route.FileRouteSource;
import net.spookly.kvproxy.route.RouteSource;
import net.spookly.kvproxy.route.RouteTableParser;
import net.spookly.kvproxy.routing.ReloadResult;
import net.spookly.kvproxy.routing.RouteCoordinator;
import net.spookly.kvproxy.routing.RouteWatchService;
import net.spookly.kvproxy.routing.Scheduler;
import net.spookly.kvproxy.routing.SchedulerSettings;
import net.spookly.kvproxy.routing.ScorerSettings;
import net.spookly.kvproxy.util.NodeAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Standalone entry point for the kvproxy router process.
 */
public final class KvproxyMain {
    private static final Logger log = LoggerFactory.getLogger(KvproxyMain.class);
    private static final String DEFAULT_CONFIG = "config/kvproxy.yaml";

    private KvproxyMain() {
    }

    /**
     * Load config, apply the initial route table and run until shutdown.
     */
    public static void main(String[] args) {
        CliOptions options = parseArgs(args);
        KvproxyConfig config = ConfigLoader.load(options.configPath);
        applyLogLevel(config);
        if (options.printEffectiveConfig) {
            System.out.println(ConfigPrinter.toYaml(config));
            return;
        }
        if (options.dryRun) {
            System.out.println("Config OK (--dry-run).");
            return;
        }
        log.info("kvproxy config loaded: hostname={} port={} n={}",
                config.proxy.hostname, config.proxy.port, config.proxy.n);

        SchedulerSettings schedulerSettings = SchedulerSettings.fromConfig(config);
        NettyBackendClientFactory clientFactory = new NettyBackendClientFactory(connectTimeoutMs(config));
        RouteCoordinator coordinator = new RouteCoordinator(
                new RouteTableParser(config.proxy.n),
                Scheduler.factory(clientFactory, schedulerSettings, ScorerSettings.fromConfig(config), Clock.systemUTC()),
                graceMs(config, schedulerSettings)
        );
        RouteSource routeSource = new FileRouteSource(Paths.get(config.route.file));
        ReloadResult initial = coordinator.reload(routeSource);
        if (!initial.status().changed()) {
            log.warn("Initial route load from {} did not apply: {}", routeSource.describe(), initial);
        } else {
            log.info("Initial route load: {}", initial.message());
        }

        RouteWatchService watchService = new RouteWatchService(coordinator, routeSource, watchIntervalSeconds(config));
        watchService.start();

        AdminServer adminServer = null;
        if (config.admin != null && Boolean.TRUE.equals(config.admin.enabled)) {
            adminServer = new AdminServer(
                    NodeAddress.parse(config.admin.listen).toBindAddress(),
                    coordinator,
                    routeSource,
                    config
            );
            adminServer.start();
        }

        CountDownLatch latch = new CountDownLatch(1);
        AdminServer finalAdminServer = adminServer;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            watchService.stop();
            if (finalAdminServer != null) {
                finalAdminServer.stop();
            }
            coordinator.close();
            clientFactory.close();
            latch.countDown();
        }));

        try {
            latch.await();
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }

    private static void applyLogLevel(KvproxyConfig config) {
        if (config.observability == null || config.observability.logging == null
                || config.observability.logging.level == null) {
            return;
        }
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(Level.toLevel(config.observability.logging.level, Level.INFO));
        }
    }

    private static int connectTimeoutMs(KvproxyConfig config) {
        Integer value = config.proxy.connectTimeoutMs;
        return value != null ? value : ConfigDefaults.CONNECT_TIMEOUT_MS;
    }

    static long graceMs(KvproxyConfig config, SchedulerSettings settings) {
        if (config.route != null && config.route.graceMs != null) {
            return config.route.graceMs;
        }
        return (long) settings.readTimeoutMs() * ConfigDefaults.GRACE_READ_TIMEOUTS;
    }

    private static int watchIntervalSeconds(KvproxyConfig config) {
        Integer value = config.route.watchIntervalSeconds;
        return value != null ? value : 0;
    }

    static CliOptions parseArgs(String[] args) {
        Path configPath = Paths.get(DEFAULT_CONFIG);
        boolean dryRun = false;
        boolean printEffectiveConfig = false;
        if (args == null) {
            return new CliOptions(configPath, dryRun, printEffectiveConfig);
        }
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--config".equals(arg) || "-c".equals(arg)) {
                if (i + 1 < args.length) {
                    configPath = Paths.get(args[++i]);
                    continue;
                }
            }
            if ("--dry-run".equals(arg)) {
                dryRun = true;
                continue;
            }
            if ("--print-effective-config".equals(arg)) {
                printEffectiveConfig = true;
            }
        }
        return new CliOptions(configPath, dryRun, printEffectiveConfig);
    }

    record CliOptions(Path configPath, boolean dryRun, boolean printEffectiveConfig) {
    }
}
