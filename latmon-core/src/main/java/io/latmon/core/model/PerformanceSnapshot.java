package io.latmon.core.model;

import java.time.Instant;

public record PerformanceSnapshot(
    ComponentClass componentClass,
    long eventCount,
    double avgDurationMs,
    double minDurationMs,
    double maxDurationMs,
    double p50DurationMs,
    double p95DurationMs,
    double p99DurationMs,
    double eventsPerSecond,
    Instant lastUpdated
) {
    public static PerformanceSnapshot empty(ComponentClass componentClass, Instant at) {
        return new PerformanceSnapshot(componentClass, 0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, at);
    }
}
