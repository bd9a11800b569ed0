package io.latmon.core.api;

import io.latmon.core.model.LatencyEvent;
import io.latmon.core.model.PerformanceSnapshot;
import io.latmon.core.model.ResourceUsage;
import io.latmon.core.model.SystemStatus;
import io.latmon.core.store.Timestamps;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the snake_case JSON bodies the dashboard reads. Timestamps use the stored
 * fixed-width form so clients can sort them lexically.
 */
final class TelemetryPayloadMapper {

    Map<String, Object> event(LatencyEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", event.id());
        payload.put("timestamp", Timestamps.format(event.timestamp()));
        payload.put("component_class", event.componentClass().wireName());
        payload.put("source_kind", event.sourceKind().wireName());
        payload.put("duration_microseconds", event.durationMicros());
        payload.put("duration_ms", event.durationMillis());
        payload.put("description", event.description());
        payload.put("metadata", event.metadata() == null || event.metadata().isEmpty() ? null : event.metadata());
        return payload;
    }

    List<Map<String, Object>> events(List<LatencyEvent> events) {
        return events.stream().map(this::event).toList();
    }

    Map<String, Object> snapshot(PerformanceSnapshot snapshot) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("component_class", snapshot.componentClass().wireName());
        payload.put("event_count", snapshot.eventCount());
        payload.put("avg_duration_ms", snapshot.avgDurationMs());
        payload.put("min_duration_ms", snapshot.minDurationMs());
        payload.put("max_duration_ms", snapshot.maxDurationMs());
        payload.put("p50_duration_ms", snapshot.p50DurationMs());
        payload.put("p95_duration_ms", snapshot.p95DurationMs());
        payload.put("p99_duration_ms", snapshot.p99DurationMs());
        payload.put("events_per_second", snapshot.eventsPerSecond());
        payload.put("last_updated", snapshot.lastUpdated() == null ? null : Timestamps.format(snapshot.lastUpdated()));
        return payload;
    }

    List<Map<String, Object>> snapshots(List<PerformanceSnapshot> snapshots) {
        return snapshots.stream().map(this::snapshot).toList();
    }

    Map<String, Object> resources(ResourceUsage usage) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("uptime_seconds", usage.uptimeSeconds());
        payload.put("process_memory_mb", usage.processMemoryMb());
        payload.put("process_cpu_percent", usage.processCpuPercent());
        payload.put("total_memory_mb", usage.totalMemoryMb());
        payload.put("free_memory_mb", usage.freeMemoryMb());
        payload.put("cpu_count", usage.cpuCount());
        payload.put("load_average", usage.loadAverage());
        payload.put("process_count", usage.processCount());
        return payload;
    }

    Map<String, Object> status(SystemStatus status) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("summary", status.summary());
        payload.put("total_events", status.totalEvents());
        payload.put("dropped_events", status.droppedEvents());
        payload.put("active_samplers", status.activeSamplers());
        payload.put("performance", snapshots(status.performance()));
        payload.put("last_event_time", status.lastEventTime() == null ? null : Timestamps.format(status.lastEventTime()));
        payload.put("resources", resources(status.resources()));
        payload.put("partial", status.partial());
        payload.put("degraded", status.degraded());
        return payload;
    }
}
