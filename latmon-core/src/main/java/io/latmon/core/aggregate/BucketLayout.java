package io.latmon.core.aggregate;

import java.util.ArrayList;
import java.util.List;

/**
 * Logarithmically spaced bucket bounds in microseconds. Bucket 0 holds {@code [0, first)},
 * bucket {@code i} holds {@code [bound(i-1), bound(i))}, and the last bucket is the overflow
 * for everything at or above the ceiling.
 */
public final class BucketLayout {
    private final long[] upperBounds;
    private final double logGrowth;
    private final long first;

    public BucketLayout(long firstBoundMicros, double growth, long ceilingMicros) {
        if (firstBoundMicros <= 0) {
            throw new IllegalArgumentException("firstBoundMicros must be > 0");
        }
        if (growth <= 1.0) {
            throw new IllegalArgumentException("growth must be > 1");
        }
        if (ceilingMicros <= firstBoundMicros) {
            throw new IllegalArgumentException("ceilingMicros must be > firstBoundMicros");
        }
        List<Long> bounds = new ArrayList<>();
        double bound = firstBoundMicros;
        long previous = 0;
        while (previous < ceilingMicros) {
            long next = Math.min(ceilingMicros, Math.max(previous + 1, Math.round(bound)));
            bounds.add(next);
            previous = next;
            bound *= growth;
        }
        this.upperBounds = bounds.stream().mapToLong(Long::longValue).toArray();
        this.logGrowth = Math.log(growth);
        this.first = firstBoundMicros;
    }

    public static BucketLayout doublingFromMillisecond() {
        return new BucketLayout(1_000L, 2.0, 60_000_000L);
    }

    public int bucketCount() {
        return upperBounds.length + 1;
    }

    public int overflowIndex() {
        return upperBounds.length;
    }

    public int indexOf(long micros) {
        if (micros < first) {
            return 0;
        }
        if (micros >= upperBounds[upperBounds.length - 1]) {
            return overflowIndex();
        }
        int index = (int) Math.floor(Math.log((double) micros / first) / logGrowth) + 1;
        index = Math.max(1, Math.min(upperBounds.length - 1, index));
        while (index > 0 && micros < upperBounds[index - 1]) {
            index--;
        }
        while (micros >= upperBounds[index]) {
            index++;
        }
        return index;
    }

    public long lowerBound(int index) {
        return index == 0 ? 0L : upperBounds[index - 1];
    }

    /**
     * Exclusive upper bound; {@link Long#MAX_VALUE} for the overflow bucket.
     */
    public long upperBound(int index) {
        return index >= upperBounds.length ? Long.MAX_VALUE : upperBounds[index];
    }
}
