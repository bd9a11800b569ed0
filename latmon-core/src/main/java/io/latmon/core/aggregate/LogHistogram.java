package io.latmon.core.aggregate;

import java.util.Arrays;

/**
 * Fixed-size duration histogram over a {@link BucketLayout}. Not thread-safe; callers guard it.
 */
public final class LogHistogram {
    private final BucketLayout layout;
    private final long[] counts;
    private long count;
    private long sumMicros;
    private long minMicros = Long.MAX_VALUE;
    private long maxMicros = Long.MIN_VALUE;

    public LogHistogram(BucketLayout layout) {
        this.layout = layout;
        this.counts = new long[layout.bucketCount()];
    }

    public void record(long micros) {
        long value = Math.max(0L, micros);
        counts[layout.indexOf(value)]++;
        count++;
        sumMicros += value;
        minMicros = Math.min(minMicros, value);
        maxMicros = Math.max(maxMicros, value);
    }

    public void mergeFrom(LogHistogram other) {
        if (other.count == 0) {
            return;
        }
        for (int i = 0; i < counts.length; i++) {
            counts[i] += other.counts[i];
        }
        count += other.count;
        sumMicros += other.sumMicros;
        minMicros = Math.min(minMicros, other.minMicros);
        maxMicros = Math.max(maxMicros, other.maxMicros);
    }

    public void reset() {
        Arrays.fill(counts, 0L);
        count = 0;
        sumMicros = 0;
        minMicros = Long.MAX_VALUE;
        maxMicros = Long.MIN_VALUE;
    }

    public long count() {
        return count;
    }

    public long minMicros() {
        return count == 0 ? 0L : minMicros;
    }

    public long maxMicros() {
        return count == 0 ? 0L : maxMicros;
    }

    public double averageMicros() {
        return count == 0 ? 0.0 : (double) sumMicros / count;
    }

    public int bucketCount() {
        return counts.length;
    }

    /**
     * Estimates the value at {@code percentile} (0-100] by linear interpolation inside the bucket
     * holding the target rank, clamped to the observed min and max.
     */
    public double percentileMicros(double percentile) {
        if (count == 0) {
            return 0.0;
        }
        double safe = Math.max(0.0, Math.min(100.0, percentile));
        long rank = Math.max(1L, (long) Math.ceil(safe / 100.0 * count));
        long cumulative = 0;
        for (int i = 0; i < counts.length; i++) {
            if (counts[i] == 0) {
                continue;
            }
            if (cumulative + counts[i] >= rank) {
                double lower = Math.max(layout.lowerBound(i), minMicros);
                double upper = Math.min(layout.upperBound(i), maxMicros);
                double fraction = (double) (rank - cumulative) / counts[i];
                double estimate = lower + fraction * Math.max(0.0, upper - lower);
                return Math.max(minMicros, Math.min(maxMicros, estimate));
            }
            cumulative += counts[i];
        }
        return maxMicros;
    }
}
