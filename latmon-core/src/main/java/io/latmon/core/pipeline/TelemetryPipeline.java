package io.latmon.core.pipeline;

import io.latmon.core.aggregate.Aggregator;
import io.latmon.core.aggregate.AggregatorFeed;
import io.latmon.core.bus.BoundedEventBus;
import io.latmon.core.bus.EventBus;
import io.latmon.core.model.ComponentClass;
import io.latmon.core.query.PipelineView;
import io.latmon.core.sampler.ProcessTable;
import io.latmon.core.sampler.Sampler;
import io.latmon.core.sampler.SamplerState;
import io.latmon.core.sampler.SamplerStats;
import io.latmon.core.sink.PersistenceSink;
import io.latmon.core.sink.SinkStats;
import io.latmon.core.store.EventStore;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires samplers, the bus, the persistence sink and the aggregator feed, and owns their threads.
 * Every sampler gets its own {@link ProcessTable} so that CPU deltas are tracked per cadence.
 */
public final class TelemetryPipeline implements PipelineView, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(TelemetryPipeline.class);
    private static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(10);

    private final BoundedEventBus bus;
    private final PersistenceSink sink;
    private final AggregatorFeed feed;
    private final List<Sampler> samplers;
    private final CancellationToken token = new CancellationToken();

    private ExecutorService samplerExecutor;
    private ExecutorService consumerExecutor;
    private final List<Future<?>> samplerFutures = new ArrayList<>();
    private final List<Future<?>> consumerFutures = new ArrayList<>();
    private boolean started;
    private boolean stopped;

    public TelemetryPipeline(
        PipelineSettings settings,
        EventStore store,
        Aggregator aggregator,
        Supplier<? extends ProcessTable> processTables,
        Clock clock
    ) {
        Objects.requireNonNull(settings, "settings must not be null");
        Objects.requireNonNull(store, "store must not be null");
        Objects.requireNonNull(aggregator, "aggregator must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
        this.bus = new BoundedEventBus(settings.busCapacity());
        this.sink = new PersistenceSink(
            store,
            bus.subscribe("persistence"),
            settings.retryPolicy(),
            settings.batchSize(),
            token
        );
        this.feed = new AggregatorFeed(aggregator, bus.subscribe("aggregator"), token);

        List<Sampler> created = new ArrayList<>();
        for (Map.Entry<ComponentClass, Duration> entry : settings.samplerIntervals().entrySet()) {
            Objects.requireNonNull(processTables, "processTables must not be null when samplers are configured");
            created.add(new Sampler(
                entry.getKey(),
                entry.getValue(),
                processTables.get(),
                settings.rules(),
                bus,
                clock,
                token
            ));
        }
        created.sort((left, right) -> left.componentClass().compareTo(right.componentClass()));
        this.samplers = List.copyOf(created);
    }

    public synchronized void start() {
        if (started) {
            throw new IllegalStateException("Pipeline already started");
        }
        started = true;
        consumerExecutor = Executors.newFixedThreadPool(2, named("latmon-consumer"));
        consumerFutures.add(consumerExecutor.submit(sink));
        consumerFutures.add(consumerExecutor.submit(feed));
        if (!samplers.isEmpty()) {
            samplerExecutor = Executors.newFixedThreadPool(samplers.size(), named("latmon-sampler"));
            for (Sampler sampler : samplers) {
                samplerFutures.add(samplerExecutor.submit(sampler));
            }
        }
        LOG.info("Telemetry pipeline started with {} sampler(s), bus capacity {}", samplers.size(), bus.capacity());
    }

    public void stop(ShutdownMode mode) {
        stop(mode, DEFAULT_DRAIN_TIMEOUT);
    }

    /**
     * Graceful stop ends the samplers, closes the bus and waits up to {@code drainTimeout} for
     * already-buffered events to reach the store and the aggregator; if the drain does not finish
     * in time the stop escalates to forced. Forced stop discards whatever is still buffered.
     */
    public synchronized void stop(ShutdownMode mode, Duration drainTimeout) {
        if (stopped) {
            return;
        }
        stopped = true;
        LOG.info("Stopping telemetry pipeline ({})", mode);
        token.cancel(mode);
        if (mode == ShutdownMode.FORCED) {
            bus.close();
            shutdownNow();
            logFinalStats();
            return;
        }

        long deadline = System.nanoTime() + drainTimeout.toNanos();
        boolean drained = awaitAll(samplerFutures, deadline);
        bus.close();
        drained = awaitAll(consumerFutures, deadline) && drained;
        if (!drained) {
            LOG.warn("Graceful drain did not finish within {} ms, forcing stop", drainTimeout.toMillis());
            token.cancel(ShutdownMode.FORCED);
            shutdownNow();
        } else {
            shutdown();
        }
        logFinalStats();
    }

    @Override
    public void close() {
        stop(ShutdownMode.GRACEFUL);
    }

    public EventBus bus() {
        return bus;
    }

    public PersistenceSink sink() {
        return sink;
    }

    public CancellationToken token() {
        return token;
    }

    @Override
    public List<String> activeSamplers() {
        if (!started) {
            return List.of();
        }
        return samplers.stream()
            .filter(sampler -> sampler.state() != SamplerState.TERMINATED)
            .map(Sampler::name)
            .toList();
    }

    @Override
    public long droppedEvents() {
        return bus.droppedCount();
    }

    public List<SamplerStats> samplerStats() {
        return samplers.stream().map(Sampler::stats).toList();
    }

    public SinkStats sinkStats() {
        return sink.stats();
    }

    private boolean awaitAll(List<Future<?>> futures, long deadlineNanos) {
        boolean completed = true;
        for (Future<?> future : futures) {
            long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
            try {
                future.get(remaining, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                completed = false;
            } catch (ExecutionException e) {
                LOG.warn("Pipeline task failed: {}", e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return completed;
    }

    private void shutdown() {
        if (samplerExecutor != null) {
            samplerExecutor.shutdown();
        }
        if (consumerExecutor != null) {
            consumerExecutor.shutdown();
        }
    }

    private void shutdownNow() {
        if (samplerExecutor != null) {
            samplerExecutor.shutdownNow();
        }
        if (consumerExecutor != null) {
            consumerExecutor.shutdownNow();
        }
    }

    private void logFinalStats() {
        SinkStats stats = sink.stats();
        LOG.info(
            "Telemetry pipeline stopped: {} persisted, {} dropped by bus, {} dropped by sink",
            stats.persisted(),
            bus.droppedCount(),
            stats.dropped()
        );
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
