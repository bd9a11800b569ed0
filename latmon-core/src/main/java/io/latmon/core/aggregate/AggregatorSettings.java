package io.latmon.core.aggregate;

import java.time.Duration;

public record AggregatorSettings(BucketLayout layout, Duration horizon, Duration slot) {

    public static AggregatorSettings defaults() {
        return new AggregatorSettings(BucketLayout.doublingFromMillisecond(), Duration.ofHours(1), Duration.ofMinutes(1));
    }
}
