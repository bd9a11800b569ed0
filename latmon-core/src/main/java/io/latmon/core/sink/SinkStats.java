package io.latmon.core.sink;

public record SinkStats(
    long persisted,
    long dropped,
    long retries,
    long failedBatches,
    int buffered
) {
}
