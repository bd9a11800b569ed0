package io.latmon.core.model;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One observed latency occurrence. The {@code id} stays {@code null} until the event
 * has been durably written; {@link #withId(long)} returns the persisted copy.
 */
public record LatencyEvent(
    Long id,
    Instant timestamp,
    ComponentClass componentClass,
    SourceKind sourceKind,
    long durationMicros,
    String description,
    Map<String, Object> metadata
) {
    public LatencyEvent {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(componentClass, "componentClass must not be null");
        Objects.requireNonNull(sourceKind, "sourceKind must not be null");
        if (durationMicros < 0) {
            throw new IllegalArgumentException("durationMicros must be >= 0");
        }
        timestamp = timestamp.truncatedTo(ChronoUnit.MICROS);
        description = description == null ? "" : description;
        metadata = metadata == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static LatencyEvent of(
        Instant timestamp,
        ComponentClass componentClass,
        SourceKind sourceKind,
        Duration duration,
        String description
    ) {
        return new LatencyEvent(null, timestamp, componentClass, sourceKind, toMicros(duration), description, null);
    }

    public LatencyEvent withMetadata(Map<String, Object> values) {
        return new LatencyEvent(id, timestamp, componentClass, sourceKind, durationMicros, description, values);
    }

    public LatencyEvent withId(long assignedId) {
        if (id != null) {
            throw new IllegalStateException("event already persisted with id " + id);
        }
        return new LatencyEvent(assignedId, timestamp, componentClass, sourceKind, durationMicros, description, metadata);
    }

    public boolean persisted() {
        return id != null;
    }

    public double durationMillis() {
        return durationMicros / 1000.0;
    }

    private static long toMicros(Duration duration) {
        if (duration == null || duration.isNegative()) {
            return 0L;
        }
        return duration.getSeconds() * 1_000_000L + duration.getNano() / 1_000L;
    }
}
