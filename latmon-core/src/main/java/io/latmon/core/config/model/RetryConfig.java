package io.latmon.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RetryConfig(int maxAttempts, long initialBackoffMs, long maxBackoffMs) {

    public static RetryConfig defaults() {
        return new RetryConfig(3, 50, 1_000);
    }
}
