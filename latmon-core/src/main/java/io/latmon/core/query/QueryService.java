package io.latmon.core.query;

import io.latmon.core.aggregate.SnapshotSource;
import io.latmon.core.model.ComponentClass;
import io.latmon.core.model.LatencyEvent;
import io.latmon.core.model.PerformanceSnapshot;
import io.latmon.core.model.ResourceUsage;
import io.latmon.core.model.SystemStatus;
import io.latmon.core.sink.PersistenceSink;
import io.latmon.core.store.EventStore;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only facade over the aggregator, the event store and host metrics. Every read runs with a
 * deadline; a slow or failing dependency surfaces as a {@link QueryException} and never as an empty
 * result. {@link #status()} instead degrades to a partial view naming what was unavailable.
 */
public final class QueryService implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(QueryService.class);
    public static final int MAX_EVENTS = 1000;

    private static final int STORE_READ_THREADS = 2;

    private final SnapshotSource snapshots;
    private final PersistenceSink sink;
    private final EventStore store;
    private final PipelineView pipeline;
    private final ResourceProbe resources;
    private final Duration timeout;
    private final ExecutorService storeReads;
    private final ExecutorService snapshotReads;

    public QueryService(
        SnapshotSource snapshots,
        PersistenceSink sink,
        PipelineView pipeline,
        ResourceProbe resources,
        Duration timeout
    ) {
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.store = sink.store();
        this.pipeline = pipeline == null ? PipelineView.none() : pipeline;
        this.resources = resources == null ? ResourceUsage::unknown : resources;
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
        this.timeout = timeout;
        // a hung store holds at most STORE_READ_THREADS threads and cannot starve snapshot reads
        AtomicInteger threads = new AtomicInteger();
        this.storeReads = Executors.newFixedThreadPool(STORE_READ_THREADS, runnable -> {
            Thread thread = new Thread(runnable, "latmon-query-" + threads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        this.snapshotReads = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "latmon-query-snapshots");
            thread.setDaemon(true);
            return thread;
        });
    }

    public List<LatencyEvent> recentEvents(int limit) throws QueryException {
        int safe = clampLimit(limit);
        return readStore(() -> sink.recent(safe));
    }

    public List<LatencyEvent> events(Instant since, Instant until, ComponentClass componentClass, int limit)
        throws QueryException {
        int safe = clampLimit(limit);
        return readStore(() -> store.range(since, until, componentClass, safe));
    }

    public List<PerformanceSnapshot> metrics() throws QueryException {
        return readSnapshots(snapshots::snapshot);
    }

    public PerformanceSnapshot metrics(ComponentClass componentClass) throws QueryException {
        return readSnapshots(() -> snapshots.snapshot(componentClass));
    }

    public ResourceUsage resources() {
        try {
            return resources.sample();
        } catch (RuntimeException e) {
            LOG.debug("Resource probe failed: {}", e.getMessage());
            return ResourceUsage.unknown();
        }
    }

    public SystemStatus status() {
        List<String> degraded = new ArrayList<>();

        List<PerformanceSnapshot> performance = List.of();
        try {
            performance = metrics().stream().filter(snapshot -> snapshot.eventCount() > 0).toList();
        } catch (QueryException e) {
            degraded.add("aggregator");
        }

        long totalEvents = 0;
        Instant lastEventTime = null;
        try {
            totalEvents = readStore(store::count);
            Optional<Instant> last = readStore(store::lastEventTime);
            lastEventTime = last.orElse(null);
        } catch (QueryException e) {
            degraded.add("store");
        }

        String summary = degraded.isEmpty() ? "operational" : "degraded: " + String.join(", ", degraded);
        return new SystemStatus(
            summary,
            totalEvents,
            pipeline.droppedEvents(),
            pipeline.activeSamplers(),
            performance,
            lastEventTime,
            resources(),
            degraded
        );
    }

    @Override
    public void close() {
        storeReads.shutdownNow();
        snapshotReads.shutdownNow();
    }

    private <T> T readStore(Callable<T> read) throws QueryException {
        Future<T> future = storeReads.submit(read);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.warn("Store read exceeded {} ms", timeout.toMillis());
            throw new QueryException(QueryException.Reason.STORE_TIMEOUT, "store read timed out", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            LOG.warn("Store read failed: {}", cause.getMessage());
            String message = cause instanceof IOException ? cause.getMessage() : "store read failed";
            throw new QueryException(QueryException.Reason.STORE_UNAVAILABLE, message, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new QueryException(QueryException.Reason.STORE_UNAVAILABLE, "interrupted", e);
        }
    }

    private <T> T readSnapshots(Callable<T> read) throws QueryException {
        Future<T> future = snapshotReads.submit(read);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new QueryException(QueryException.Reason.AGGREGATOR_UNAVAILABLE, "snapshot timed out", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            LOG.warn("Aggregator snapshot failed: {}", cause.getMessage());
            throw new QueryException(QueryException.Reason.AGGREGATOR_UNAVAILABLE, "snapshot failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new QueryException(QueryException.Reason.AGGREGATOR_UNAVAILABLE, "interrupted", e);
        }
    }

    private static int clampLimit(int limit) {
        return Math.max(0, Math.min(MAX_EVENTS, limit));
    }
}
