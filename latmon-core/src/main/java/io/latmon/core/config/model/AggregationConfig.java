package io.latmon.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AggregationConfig(
    int windowMinutes,
    int slotSeconds,
    long firstBucketMicros,
    double bucketGrowth,
    long ceilingMicros
) {

    public static AggregationConfig defaults() {
        return new AggregationConfig(60, 60, 1_000L, 2.0, 60_000_000L);
    }
}
