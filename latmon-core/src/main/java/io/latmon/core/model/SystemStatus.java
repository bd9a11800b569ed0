package io.latmon.core.model;

import java.time.Instant;
import java.util.List;

public record SystemStatus(
    String summary,
    long totalEvents,
    long droppedEvents,
    List<String> activeSamplers,
    List<PerformanceSnapshot> performance,
    Instant lastEventTime,
    ResourceUsage resources,
    List<String> degraded
) {
    public SystemStatus {
        summary = summary == null ? "" : summary;
        activeSamplers = activeSamplers == null ? List.of() : List.copyOf(activeSamplers);
        performance = performance == null ? List.of() : List.copyOf(performance);
        resources = resources == null ? ResourceUsage.unknown() : resources;
        degraded = degraded == null ? List.of() : List.copyOf(degraded);
    }

    public boolean partial() {
        return !degraded.isEmpty();
    }
}
