package io.latmon.core.sampler;

public record ProcessInfo(
    long pid,
    String name,
    String commandLine,
    double cpuPercent,
    long memoryBytes
) {
    public ProcessInfo {
        name = name == null ? "" : name;
        commandLine = commandLine == null ? "" : commandLine;
        cpuPercent = Math.max(0.0, cpuPercent);
        memoryBytes = Math.max(0L, memoryBytes);
    }
}
