package io.latmon.core.retention;

import io.latmon.core.sink.PersistenceSink;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically deletes events older than the retention horizon. A failed run is logged and
 * simply tried again at the next scheduled run.
 */
public final class RetentionCompactor implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(RetentionCompactor.class);

    private final PersistenceSink sink;
    private final Duration retention;
    private final Clock clock;
    private final AtomicLong purgedTotal = new AtomicLong();
    private final AtomicLong failedRuns = new AtomicLong();
    private final AtomicReference<Instant> lastRun = new AtomicReference<>();
    private ScheduledExecutorService scheduler;

    public RetentionCompactor(PersistenceSink sink, int retentionDays, Clock clock) {
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        if (retentionDays <= 0) {
            throw new IllegalArgumentException("retentionDays must be > 0");
        }
        this.retention = Duration.ofDays(retentionDays);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public synchronized void start(Duration initialDelay, Duration period) {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "latmon-retention");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(
            this::runSafely,
            initialDelay.toMillis(),
            period.toMillis(),
            TimeUnit.MILLISECONDS
        );
        LOG.info("Retention compactor scheduled every {} keeping {} day(s)", period, retention.toDays());
    }

    /**
     * Purges everything strictly older than {@code now - retention}.
     *
     * @return number of events removed
     */
    public int runOnce() throws IOException {
        Instant cutoff = clock.instant().minus(retention);
        int removed = sink.purge(cutoff);
        purgedTotal.addAndGet(removed);
        lastRun.set(clock.instant());
        LOG.info("Retention compaction removed {} event(s) older than {}", removed, cutoff);
        return removed;
    }

    public long purgedTotal() {
        return purgedTotal.get();
    }

    public long failedRuns() {
        return failedRuns.get();
    }

    public Instant lastRun() {
        return lastRun.get();
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }

    void runSafely() {
        try {
            runOnce();
        } catch (IOException | RuntimeException e) {
            failedRuns.incrementAndGet();
            LOG.warn("Retention compaction failed, retrying at next run: {}", e.getMessage());
        }
    }
}
