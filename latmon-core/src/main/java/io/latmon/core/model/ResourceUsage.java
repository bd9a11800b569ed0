package io.latmon.core.model;

public record ResourceUsage(
    long uptimeSeconds,
    long processMemoryMb,
    double processCpuPercent,
    long totalMemoryMb,
    long freeMemoryMb,
    int cpuCount,
    double loadAverage,
    long processCount
) {
    public static ResourceUsage unknown() {
        return new ResourceUsage(0, 0, 0.0, 0, 0, 0, -1.0, 0);
    }
}
