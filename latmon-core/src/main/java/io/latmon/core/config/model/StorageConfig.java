package io.latmon.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageConfig(
    String databasePath,
    int retentionDays,
    int compactionIntervalHours,
    int batchSize,
    RetryConfig retry
) {
    public StorageConfig {
        retry = retry == null ? RetryConfig.defaults() : retry;
    }

    public static StorageConfig defaults() {
        return new StorageConfig("~/.latmon/metrics.db", 30, 24, 64, RetryConfig.defaults());
    }
}
