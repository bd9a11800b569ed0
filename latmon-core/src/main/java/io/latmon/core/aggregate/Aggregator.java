package io.latmon.core.aggregate;

import io.latmon.core.model.ComponentClass;
import io.latmon.core.model.LatencyEvent;
import io.latmon.core.model.PerformanceSnapshot;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Online per-class latency statistics over a rolling window. Each class has its own rolling
 * window behind its own read-write lock: updates to one class never wait on another, and any
 * number of snapshot readers may run alongside each other.
 */
public final class Aggregator implements SnapshotSource {
    private final Clock clock;
    private final Instant startedAt;
    private final AggregatorSettings settings;
    private final Map<ComponentClass, ClassWindow> windows = new EnumMap<>(ComponentClass.class);
    private final AtomicLong ingested = new AtomicLong();

    public Aggregator(AggregatorSettings settings, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.startedAt = clock.instant();
        for (ComponentClass componentClass : ComponentClass.values()) {
            windows.put(componentClass, new ClassWindow(
                new RollingWindow(settings.layout(), settings.horizon(), settings.slot())
            ));
        }
    }

    /**
     * Folds one event into its class's window.
     *
     * @return {@code false} if the event was older than the window and ignored
     */
    public boolean record(LatencyEvent event) {
        ClassWindow window = windows.get(event.componentClass());
        Instant now = clock.instant();
        boolean recorded;
        window.lock.writeLock().lock();
        try {
            recorded = window.rolling.record(event.timestamp(), event.durationMicros(), now);
        } finally {
            window.lock.writeLock().unlock();
        }
        ingested.incrementAndGet();
        return recorded;
    }

    @Override
    public PerformanceSnapshot snapshot(ComponentClass componentClass) {
        ClassWindow window = windows.get(componentClass);
        Instant now = clock.instant();
        LogHistogram merged;
        Instant lastRecorded;
        window.lock.readLock().lock();
        try {
            merged = window.rolling.merged(now);
            lastRecorded = window.rolling.lastRecorded();
        } finally {
            window.lock.readLock().unlock();
        }
        if (merged.count() == 0) {
            return PerformanceSnapshot.empty(componentClass, lastRecorded == null ? now : lastRecorded);
        }
        return new PerformanceSnapshot(
            componentClass,
            merged.count(),
            millis(merged.averageMicros()),
            millis(merged.minMicros()),
            millis(merged.maxMicros()),
            millis(merged.percentileMicros(50)),
            millis(merged.percentileMicros(95)),
            millis(merged.percentileMicros(99)),
            rate(merged.count(), now),
            lastRecorded
        );
    }

    @Override
    public List<PerformanceSnapshot> snapshot() {
        List<PerformanceSnapshot> snapshots = new ArrayList<>(windows.size());
        for (ComponentClass componentClass : ComponentClass.values()) {
            snapshots.add(snapshot(componentClass));
        }
        return List.copyOf(snapshots);
    }

    public long ingested() {
        return ingested.get();
    }

    public long lateEvents() {
        long total = 0;
        for (ClassWindow window : windows.values()) {
            window.lock.readLock().lock();
            try {
                total += window.rolling.late();
            } finally {
                window.lock.readLock().unlock();
            }
        }
        return total;
    }

    /**
     * Total histogram buckets held across all classes and slots. Fixed at construction.
     */
    public long trackedBuckets() {
        long perWindow = (long) settings.layout().bucketCount() * windows.get(ComponentClass.SYSTEM).rolling.slotCount();
        return perWindow * windows.size();
    }

    public Duration horizon() {
        return settings.horizon();
    }

    private double rate(long count, Instant now) {
        Duration observed = Duration.between(startedAt, now);
        Duration span = observed.compareTo(settings.horizon()) < 0 ? observed : settings.horizon();
        double seconds = Math.max(1.0, span.toMillis() / 1000.0);
        return round2(count / seconds);
    }

    private static double millis(double micros) {
        return Math.round(micros) / 1000.0;
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private static final class ClassWindow {
        private final RollingWindow rolling;
        private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

        private ClassWindow(RollingWindow rolling) {
            this.rolling = rolling;
        }
    }
}
