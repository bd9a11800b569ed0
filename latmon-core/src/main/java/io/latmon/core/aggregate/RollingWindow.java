package io.latmon.core.aggregate;

import java.time.Duration;
import java.time.Instant;

/**
 * Ring of per-slot histograms covering a fixed horizon. A slot is reset lazily when a newer slot
 * index lands on its ring position, and slots older than the horizon are skipped when merging, so
 * neither writes nor reads depend on how many events have been recorded. Not thread-safe.
 */
final class RollingWindow {
    private final BucketLayout layout;
    private final long slotMillis;
    private final long[] slotIndexes;
    private final LogHistogram[] slots;
    private long late;
    private Instant lastRecorded;

    RollingWindow(BucketLayout layout, Duration horizon, Duration slot) {
        if (slot.isZero() || slot.isNegative() || horizon.compareTo(slot) < 0) {
            throw new IllegalArgumentException("horizon must cover at least one positive slot");
        }
        if (horizon.toMillis() % slot.toMillis() != 0) {
            throw new IllegalArgumentException("horizon must be a multiple of the slot duration");
        }
        this.layout = layout;
        this.slotMillis = slot.toMillis();
        int slotCount = (int) (horizon.toMillis() / slotMillis);
        this.slotIndexes = new long[slotCount];
        this.slots = new LogHistogram[slotCount];
        for (int i = 0; i < slotCount; i++) {
            slotIndexes[i] = Long.MIN_VALUE;
            slots[i] = new LogHistogram(layout);
        }
    }

    /**
     * @return {@code false} if the timestamp already fell outside the window
     */
    boolean record(Instant timestamp, long micros, Instant now) {
        long current = slotIndex(now);
        long target = Math.min(slotIndex(timestamp), current);
        if (target <= current - slots.length) {
            late++;
            return false;
        }
        int position = (int) Math.floorMod(target, (long) slots.length);
        if (slotIndexes[position] != target) {
            if (slotIndexes[position] > target) {
                late++;
                return false;
            }
            slotIndexes[position] = target;
            slots[position].reset();
        }
        slots[position].record(micros);
        if (lastRecorded == null || timestamp.isAfter(lastRecorded)) {
            lastRecorded = timestamp;
        }
        return true;
    }

    LogHistogram merged(Instant now) {
        long current = slotIndex(now);
        LogHistogram merged = new LogHistogram(layout);
        for (int i = 0; i < slots.length; i++) {
            long index = slotIndexes[i];
            if (index > current - slots.length && index <= current) {
                merged.mergeFrom(slots[i]);
            }
        }
        return merged;
    }

    Instant lastRecorded() {
        return lastRecorded;
    }

    long late() {
        return late;
    }

    int slotCount() {
        return slots.length;
    }

    Duration horizon() {
        return Duration.ofMillis(slotMillis * slots.length);
    }

    private long slotIndex(Instant instant) {
        return Math.floorDiv(instant.toEpochMilli(), slotMillis);
    }
}
