package io.latmon.core.sink;

import io.latmon.core.bus.EventSubscription;
import io.latmon.core.model.LatencyEvent;
import io.latmon.core.pipeline.CancellationToken;
import io.latmon.core.store.EventStore;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single writer between the bus and the durable store. Events are written in batches; an event
 * that still fails after the retry policy is exhausted is dropped and logged so that ingestion
 * never stalls on storage trouble.
 */
public final class PersistenceSink implements Runnable {
    private static final Logger LOG = LoggerFactory.getLogger(PersistenceSink.class);
    private static final Duration POLL_INTERVAL = Duration.ofMillis(20);

    private final EventStore store;
    private final EventSubscription subscription;
    private final RetryPolicy retryPolicy;
    private final int batchSize;
    private final CancellationToken token;

    private final AtomicLong persisted = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong retries = new AtomicLong();
    private final AtomicLong failedBatches = new AtomicLong();

    public PersistenceSink(
        EventStore store,
        EventSubscription subscription,
        RetryPolicy retryPolicy,
        int batchSize,
        CancellationToken token
    ) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.subscription = Objects.requireNonNull(subscription, "subscription must not be null");
        this.retryPolicy = retryPolicy == null ? RetryPolicy.defaults() : retryPolicy;
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        this.batchSize = batchSize;
        this.token = Objects.requireNonNull(token, "token must not be null");
    }

    /**
     * Consumes until the bus is closed and drained, or until a forced stop.
     */
    @Override
    public void run() {
        LOG.info("Persistence sink started (batch size {})", batchSize);
        List<LatencyEvent> batch = new ArrayList<>(batchSize);
        try {
            while (!token.isForced() && !subscription.isExhausted()) {
                Optional<LatencyEvent> first = subscription.poll(POLL_INTERVAL);
                if (first.isEmpty()) {
                    continue;
                }
                batch.add(first.get());
                subscription.drainTo(batch, batchSize - 1);
                storeBatch(batch);
                batch.clear();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            int discarded = batch.size() + subscription.size();
            if (discarded > 0) {
                dropped.addAndGet(discarded);
                LOG.warn("Persistence sink stopped with {} unpersisted event(s) discarded", discarded);
            }
            LOG.info("Persistence sink stopped: {} persisted, {} dropped", persisted.get(), dropped.get());
        }
    }

    /**
     * Stores a single event with bounded retry. Never throws; a failed event is dropped.
     *
     * @return the persisted event, or empty if it was dropped
     */
    public Optional<LatencyEvent> store(LatencyEvent event) throws InterruptedException {
        List<LatencyEvent> stored = storeBatch(List.of(event));
        return stored.isEmpty() ? Optional.empty() : Optional.of(stored.get(0));
    }

    List<LatencyEvent> storeBatch(List<LatencyEvent> batch) throws InterruptedException {
        IOException lastFailure = null;
        for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
            if (attempt > 1) {
                retries.incrementAndGet();
                Duration backoff = retryPolicy.backoffBefore(attempt - 1);
                LOG.debug("Retrying batch of {} event(s) in {} ms (attempt {}/{})",
                    batch.size(), backoff.toMillis(), attempt, retryPolicy.maxAttempts());
                if (token.awaitForced(backoff)) {
                    break;
                }
            }
            try {
                List<LatencyEvent> stored = store.appendAll(batch);
                persisted.addAndGet(stored.size());
                return stored;
            } catch (IOException | RuntimeException e) {
                lastFailure = e instanceof IOException io ? io : new IOException(e);
            }
        }
        failedBatches.incrementAndGet();
        if (batch.size() == 1 || token.isForced()) {
            drop(batch.size(), lastFailure);
            return List.of();
        }
        return storeIndividually(batch);
    }

    /**
     * Splits a batch that exhausted its retries so that only the events that fail on their own are
     * dropped. Each event already had the full retry budget as part of the batch and gets one more
     * attempt here.
     */
    private List<LatencyEvent> storeIndividually(List<LatencyEvent> batch) {
        LOG.debug("Writing failed batch of {} event(s) one at a time", batch.size());
        List<LatencyEvent> stored = new ArrayList<>(batch.size());
        int failed = 0;
        IOException lastFailure = null;
        for (int i = 0; i < batch.size(); i++) {
            if (token.isForced()) {
                failed += batch.size() - i;
                break;
            }
            try {
                stored.addAll(store.appendAll(List.of(batch.get(i))));
            } catch (IOException | RuntimeException e) {
                failed++;
                lastFailure = e instanceof IOException io ? io : new IOException(e);
            }
        }
        persisted.addAndGet(stored.size());
        if (failed > 0) {
            drop(failed, lastFailure);
        }
        return stored;
    }

    private void drop(int count, IOException lastFailure) {
        dropped.addAndGet(count);
        LOG.warn(
            "Dropped {} event(s) after {} failed attempt(s): {}",
            count,
            retryPolicy.maxAttempts(),
            lastFailure == null ? "stopped" : lastFailure.getMessage()
        );
    }

    public List<LatencyEvent> recent(int limit) throws IOException {
        return store.recent(limit);
    }

    public int purge(Instant olderThan) throws IOException {
        return store.purgeOlderThan(olderThan);
    }

    public EventStore store() {
        return store;
    }

    public SinkStats stats() {
        return new SinkStats(persisted.get(), dropped.get(), retries.get(), failedBatches.get(), subscription.size());
    }
}
