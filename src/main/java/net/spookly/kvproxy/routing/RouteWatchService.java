package net.spookly.kvproxy.routing;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import net.spookly.kvproxy.route.RouteSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically re-reads the route source and hands it to the coordinator.
 */
public final class RouteWatchService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RouteWatchService.class);

    private final RouteCoordinator coordinator;
    private final RouteSource source;
    private final int intervalSeconds;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    // Guarded by this; stop() runs on the shutdown hook thread.
    private ScheduledFuture<?> scheduledTask;

    /**
     * @param intervalSeconds poll interval; 0 disables polling
     */
    public RouteWatchService(RouteCoordinator coordinator, RouteSource source, int intervalSeconds) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.source = Objects.requireNonNull(source, "source");
        if (intervalSeconds < 0) {
            throw new IllegalArgumentException("interval must not be negative");
        }
        this.intervalSeconds = intervalSeconds;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(threadFactory());
    }

    public synchronized void start() {
        if (stopped.get() || scheduledTask != null || intervalSeconds <= 0) {
            return;
        }
        scheduledTask = scheduler.scheduleWithFixedDelay(this::runOnce, intervalSeconds, intervalSeconds,
                TimeUnit.SECONDS);
        log.info("Watching {} every {}s", source.describe(), intervalSeconds);
    }

    public synchronized void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        if (scheduledTask != null) {
            scheduledTask.cancel(false);
            scheduledTask = null;
        }
        scheduler.shutdownNow();
    }

    @Override
    public void close() {
        stop();
    }

    synchronized boolean isScheduled() {
        return scheduledTask != null;
    }

    /**
     * One poll. Never throws, so the periodic task is never cancelled by a failure.
     */
    ReloadResult runOnce() {
        if (stopped.get()) {
            return null;
        }
        ReloadResult result;
        try {
            result = coordinator.reload(source);
        } catch (RuntimeException e) {
            log.error("Route reload from {} failed", source.describe(), e);
            return null;
        }
        switch (result.status()) {
            case SUCCESS:
                log.info("Route reload from {}: {}", source.describe(), result.message());
                break;
            case ALREADY_CURRENT:
                log.debug("Route reload from {}: {}", source.describe(), result.message());
                break;
            case BUSY:
                log.debug("Route reload from {} skipped: {}", source.describe(), result.message());
                break;
            default:
                log.warn("Route reload from {} rejected ({}): {}", source.describe(), result.status(),
                        result.message());
                break;
        }
        return result;
    }

    private static ThreadFactory threadFactory() {
        return runnable -> {
            Thread thread = new Thread(runnable, "kvproxy-route-watch");
            thread.setDaemon(true);
            return thread;
        };
    }
}
