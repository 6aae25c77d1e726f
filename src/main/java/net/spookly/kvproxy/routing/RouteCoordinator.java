package net.spookly.kvproxy.routing;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import net.spookly.kvproxy.route.MalformedRouteException;
import net.spookly.kvproxy.route.RouteSource;
import net.spookly.kvproxy.route.RouteTable;
import net.spookly.kvproxy.route.RouteTableParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the single active {@link Scheduler} and replaces it on reload.
 * <p>
 * A reload parses the candidate description, builds a new scheduler in isolation and publishes it
 * with one reference swap. The previous scheduler is marked draining and closed after the grace
 * period on a background thread, so the reload returns as soon as the swap is done. Only one reload
 * runs at a time; concurrent triggers are rejected with {@link ReloadStatus#BUSY}.
 */
public final class RouteCoordinator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RouteCoordinator.class);

    private final RouteTableParser parser;
    private final SchedulerFactory schedulerFactory;
    private final long graceMs;
    private final AtomicReference<Scheduler> active = new AtomicReference<>();
    private final AtomicBoolean reloading = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Set<Scheduler> retiring = ConcurrentHashMap.newKeySet();
    private final ScheduledExecutorService retirer;

    /**
     * @param graceMs delay between publishing a new scheduler and closing the one it replaced
     */
    public RouteCoordinator(RouteTableParser parser, SchedulerFactory schedulerFactory, long graceMs) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.schedulerFactory = Objects.requireNonNull(schedulerFactory, "schedulerFactory");
        if (graceMs < 0) {
            throw new IllegalArgumentException("grace period must not be negative");
        }
        this.graceMs = graceMs;
        this.retirer = Executors.newSingleThreadScheduledExecutor(threadFactory());
    }

    /**
     * Apply a route description.
     */
    public ReloadResult reload(String description) {
        if (!reloading.compareAndSet(false, true)) {
            return ReloadResult.busy(lastAppliedVersion());
        }
        try {
            return apply(description);
        } finally {
            reloading.set(false);
        }
    }

    /**
     * Read the description from {@code source} and apply it. The read happens inside the reload
     * guard, so a busy coordinator does not touch the source.
     */
    public ReloadResult reload(RouteSource source) {
        Objects.requireNonNull(source, "source");
        if (!reloading.compareAndSet(false, true)) {
            return ReloadResult.busy(lastAppliedVersion());
        }
        try {
            String description;
            try {
                description = source.read();
            } catch (IOException e) {
                return ReloadResult.failed(-1L, lastAppliedVersion(),
                        "failed to read " + source.describe() + ": " + e.getMessage());
            }
            return apply(description);
        } finally {
            reloading.set(false);
        }
    }

    private ReloadResult apply(String description) {
        long current = lastAppliedVersion();
        if (closed.get()) {
            return ReloadResult.failed(-1L, current, "coordinator is closed");
        }
        RouteTable candidate;
        try {
            candidate = parser.parse(description);
        } catch (MalformedRouteException e) {
            return ReloadResult.malformed(current, e.getMessage());
        }
        if (!candidate.isNewerThan(current)) {
            return ReloadResult.alreadyCurrent(candidate.version(), current);
        }
        Scheduler next;
        try {
            next = schedulerFactory.create(candidate);
        } catch (RuntimeException e) {
            log.warn("Failed to build scheduler for route version {}", candidate.version(), e);
            return ReloadResult.failed(candidate.version(), current,
                    "failed to build scheduler: " + e.getMessage());
        }
        Scheduler previous = active.getAndSet(next);
        if (previous != null) {
            retire(previous);
        }
        if (closed.get()) {
            // close() ran while the scheduler was being built and will not see it.
            if (active.compareAndSet(next, null)) {
                next.markDraining();
                closeRetired(next);
            }
            return ReloadResult.failed(candidate.version(), current, "coordinator closed during reload");
        }
        log.info("Published route version {} ({} buckets, {} nodes)",
                candidate.version(), candidate.bucketCount(), candidate.nodes().size());
        return ReloadResult.success(candidate.version(), current);
    }

    private void retire(Scheduler previous) {
        previous.markDraining();
        retiring.add(previous);
        try {
            retirer.schedule(() -> closeRetired(previous), graceMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            closeRetired(previous);
        }
    }

    private void closeRetired(Scheduler scheduler) {
        try {
            scheduler.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close retired scheduler for route version {}", scheduler.table().version(), e);
        } finally {
            retiring.remove(scheduler);
        }
    }

    /**
     * Dispatch through the active scheduler.
     *
     * @throws NoReplicasConfiguredException no route table has been loaded yet
     */
    public DispatchResult dispatch(OperationKind kind, String key, byte[] payload) {
        Scheduler scheduler = requireActive();
        try {
            return scheduler.dispatch(kind, key, payload);
        } catch (SchedulerClosedException e) {
            // Held a scheduler across its whole grace period; retry once on the current one.
            Scheduler current = requireActive();
            if (current == scheduler) {
                throw e;
            }
            return current.dispatch(kind, key, payload);
        }
    }

    private Scheduler requireActive() {
        Scheduler scheduler = active.get();
        if (scheduler == null) {
            throw new NoReplicasConfiguredException("no route table has been loaded");
        }
        return scheduler;
    }

    public Optional<Scheduler> activeScheduler() {
        return Optional.ofNullable(active.get());
    }

    /**
     * Version of the active route table, or -1 before the first successful reload.
     */
    public long lastAppliedVersion() {
        Scheduler scheduler = active.get();
        return scheduler == null ? -1L : scheduler.table().version();
    }

    public Optional<SchedulerStats> currentStats() {
        return activeScheduler().map(Scheduler::stats);
    }

    public Optional<RouteTable> currentRouteTable() {
        return activeScheduler().map(Scheduler::table);
    }

    boolean isReloading() {
        return reloading.get();
    }

    int retiringCount() {
        return retiring.size();
    }

    /**
     * Stop retiring, then close the active scheduler and every scheduler still draining.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        retirer.shutdownNow();
        Scheduler current = active.getAndSet(null);
        if (current != null) {
            current.markDraining();
            closeRetired(current);
        }
        for (Scheduler scheduler : Set.copyOf(retiring)) {
            closeRetired(scheduler);
        }
    }

    private static ThreadFactory threadFactory() {
        return runnable -> {
            Thread thread = new Thread(runnable, "kvproxy-route-retire");
            thread.setDaemon(true);
            return thread;
        };
    }
}
