package net.spookly.kvproxy.routing;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Predicate;

import net.spookly.kvproxy.backend.BackendClient;
import net.spookly.kvproxy.backend.BackendClientFactory;
import net.spookly.kvproxy.backend.BackendException;
import net.spookly.kvproxy.backend.BackendTimeoutException;
import net.spookly.kvproxy.route.RouteTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes operations against the replicas of one {@link RouteTable}.
 * <p>
 * Reads go to the best-ranked replica and fail over down the ranking; writes go to every replica
 * and succeed according to the {@link WriteQuorum}. Every attempt is bounded by the read or write
 * timeout and its outcome is fed to the {@link Scorer}. The route table is never changed by
 * failures, only the ranking is.
 * <p>
 * The scheduler owns one {@link BackendClient} per distinct node of its table and releases them on
 * {@link #close()} after in-flight work drains or the drain timeout elapses.
 */
public final class Scheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final RouteTable table;
    private final Scorer scorer;
    private final SchedulerSettings settings;
    private final Map<String, BackendClient> clients;
    private final AtomicReference<SchedulerState> state = new AtomicReference<>(SchedulerState.ACTIVE);
    private final Object drainMonitor = new Object();
    /**
     * Open dispatches plus backend attempts that have not settled. Guarded by drainMonitor.
     */
    private int inFlight;

    public Scheduler(RouteTable table, Scorer scorer, BackendClientFactory clientFactory, SchedulerSettings settings) {
        this.table = Objects.requireNonNull(table, "table");
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        this.settings = Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(clientFactory, "clientFactory");
        Map<String, BackendClient> created = new LinkedHashMap<>();
        try {
            for (String node : table.nodes()) {
                created.put(node, Objects.requireNonNull(clientFactory.create(node), "client for " + node));
            }
        } catch (RuntimeException e) {
            closeClients(created.values());
            throw e;
        }
        this.clients = Collections.unmodifiableMap(created);
        scorer.track(table.nodes());
    }

    /**
     * Factory that builds each scheduler with its own fresh {@link Scorer}.
     */
    public static SchedulerFactory factory(BackendClientFactory clientFactory,
                                           SchedulerSettings settings,
                                           ScorerSettings scorerSettings,
                                           Clock clock) {
        return table -> new Scheduler(table, new Scorer(scorerSettings, clock), clientFactory, settings);
    }

    public RouteTable table() {
        return table;
    }

    public SchedulerState state() {
        return state.get();
    }

    Scorer scorer() {
        return scorer;
    }

    /**
     * Execute one operation.
     *
     * @param payload value to store for {@link OperationKind#WRITE}; ignored for reads
     * @throws AllReplicasFailedException   every replica failed
     * @throws QuorumNotReachedException    a write was acknowledged by too few replicas
     * @throws NoReplicasConfiguredException the key's partition has no replicas
     * @throws SchedulerClosedException     the scheduler was already closed
     */
    public DispatchResult dispatch(OperationKind kind, String key, byte[] payload) {
        Objects.requireNonNull(kind, "kind");
        validateKey(key);
        enter();
        try {
            List<String> replicas = table.lookup(key);
            if (replicas.isEmpty()) {
                throw new NoReplicasConfiguredException("bucket " + table.bucketOf(key)
                        + " has no replicas in route version " + table.version());
            }
            switch (kind) {
                case READ:
                    return read(key, replicas);
                case WRITE:
                    return write(key, replicas, payload == null ? new byte[0] : payload);
                default:
                    throw new IllegalArgumentException("unsupported operation: " + kind);
            }
        } finally {
            exit();
        }
    }

    private DispatchResult read(String key, List<String> replicas) {
        List<String> ranked = scorer.rank(replicas);
        List<Throwable> failures = new ArrayList<>(ranked.size());
        for (String node : ranked) {
            CompletableFuture<Optional<byte[]>> attempt = attempt(
                    node, client -> client.get(key), value -> true, settings.readTimeoutMs());
            try {
                Optional<byte[]> value = await(attempt);
                if (!failures.isEmpty()) {
                    log.debug("Read of {} served by {} after {} failed attempts", key, node, failures.size());
                }
                return DispatchResult.read(key, node, value.orElse(null), failures.size() + 1);
            } catch (ExecutionException e) {
                failures.add(failureOf(node, e.getCause(), settings.readTimeoutMs()));
            }
        }
        throw new AllReplicasFailedException(OperationKind.READ, key, failures);
    }

    private DispatchResult write(String key, List<String> replicas, byte[] payload) {
        int total = replicas.size();
        int required = settings.writeQuorum().required(total);
        Queue<String> acknowledged = new ConcurrentLinkedQueue<>();
        Queue<Throwable> failures = new ConcurrentLinkedQueue<>();
        AtomicInteger settled = new AtomicInteger();
        CompletableFuture<Void> decided = new CompletableFuture<>();
        for (String node : replicas) {
            attempt(node, client -> client.set(key, payload), Boolean.TRUE::equals, settings.writeTimeoutMs())
                    .whenComplete((stored, error) -> {
                        if (error == null && Boolean.TRUE.equals(stored)) {
                            acknowledged.add(node);
                        } else {
                            failures.add(error != null
                                    ? failureOf(node, error, settings.writeTimeoutMs())
                                    : new BackendException(node, "not stored"));
                        }
                        if (acknowledged.size() >= required || settled.incrementAndGet() == total) {
                            decided.complete(null);
                        }
                    });
        }
        try {
            await(decided);
        } catch (ExecutionException e) {
            throw new DispatchException("write of key '" + key + "' failed", e.getCause());
        }
        List<String> acked = List.copyOf(acknowledged);
        if (acked.size() >= required) {
            return DispatchResult.write(key, acked, total);
        }
        if (acked.isEmpty()) {
            throw new AllReplicasFailedException(OperationKind.WRITE, key, List.copyOf(failures));
        }
        throw new QuorumNotReachedException(key, acked.size(), required, List.copyOf(failures));
    }

    /**
     * Issue one bounded attempt and record its outcome. The returned stage completes only after
     * the outcome is recorded.
     */
    private <T> CompletableFuture<T> attempt(String node,
                                             Function<BackendClient, CompletableFuture<T>> call,
                                             Predicate<T> acknowledged,
                                             int timeoutMs) {
        BackendClient client = clients.get(node);
        long started = System.nanoTime();
        CompletableFuture<T> response;
        if (client == null) {
            response = CompletableFuture.failedFuture(new BackendException(node, "no client for node"));
        } else {
            try {
                response = call.apply(client);
            } catch (RuntimeException e) {
                response = CompletableFuture.failedFuture(e);
            }
        }
        attemptStarted();
        return response
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .whenComplete((value, error) -> {
                    boolean success = error == null && acknowledged.test(value);
                    scorer.recordOutcome(node, success, Duration.ofNanos(System.nanoTime() - started));
                    exit();
                });
    }

    /**
     * Every awaited future is bounded by an attempt timeout, so this never waits indefinitely.
     */
    private static <T> T await(CompletableFuture<T> future) throws ExecutionException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DispatchException("interrupted while waiting for a replica", e);
        }
    }

    private static Throwable failureOf(String node, Throwable error, int timeoutMs) {
        Throwable cause = unwrap(error);
        if (cause instanceof TimeoutException) {
            return new BackendTimeoutException(node, timeoutMs, cause);
        }
        return cause;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private void validateKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("key is required");
        }
        if (key.getBytes(StandardCharsets.UTF_8).length > settings.maxKeyLength()) {
            throw new IllegalArgumentException("key exceeds " + settings.maxKeyLength() + " bytes");
        }
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (c <= ' ' || c == 0x7f) {
                throw new IllegalArgumentException("key must not contain whitespace or control characters");
            }
        }
    }

    public SchedulerStats stats() {
        return new SchedulerStats(
                table.version(),
                table.nodes().size(),
                table.bucketCount(),
                table.replicaCount(),
                state.get(),
                scorer.snapshot()
        );
    }

    /**
     * Stop being the published scheduler. Requests that already hold it are still served.
     */
    void markDraining() {
        state.compareAndSet(SchedulerState.ACTIVE, SchedulerState.DRAINING);
    }

    int inFlight() {
        synchronized (drainMonitor) {
            return inFlight;
        }
    }

    private void enter() {
        synchronized (drainMonitor) {
            if (state.get() == SchedulerState.CLOSED) {
                throw new SchedulerClosedException(table.version());
            }
            inFlight++;
        }
    }

    private void attemptStarted() {
        synchronized (drainMonitor) {
            inFlight++;
        }
    }

    private void exit() {
        synchronized (drainMonitor) {
            inFlight--;
            if (inFlight == 0) {
                drainMonitor.notifyAll();
            }
        }
    }

    /**
     * Reject new dispatch, wait up to the drain timeout for in-flight work, then release every
     * backend connection. Repeated calls return immediately.
     */
    @Override
    public void close() {
        if (state.getAndSet(SchedulerState.CLOSED) == SchedulerState.CLOSED) {
            return;
        }
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(settings.drainTimeoutMs());
        int remaining;
        synchronized (drainMonitor) {
            while (inFlight > 0) {
                long waitNanos = deadline - System.nanoTime();
                if (waitNanos <= 0) {
                    break;
                }
                try {
                    TimeUnit.NANOSECONDS.timedWait(drainMonitor, waitNanos);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
            remaining = inFlight;
        }
        if (remaining > 0) {
            log.warn("Route version {} still had {} operations in flight after the {} ms drain timeout; "
                    + "force closing backend connections", table.version(), remaining, settings.drainTimeoutMs());
        }
        closeClients(clients.values());
        log.info("Closed scheduler for route version {}", table.version());
    }

    private static void closeClients(Iterable<BackendClient> toClose) {
        for (BackendClient client : toClose) {
            try {
                client.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close backend client {}: {}", client.address(), e.getMessage());
            }
        }
    }
}
