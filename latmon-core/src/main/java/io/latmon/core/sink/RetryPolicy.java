package io.latmon.core.sink;

import java.time.Duration;

public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        initialBackoff = initialBackoff == null || initialBackoff.isNegative() ? Duration.ZERO : initialBackoff;
        maxBackoff = maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0 ? initialBackoff : maxBackoff;
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofMillis(50), Duration.ofSeconds(1));
    }

    /**
     * Delay before retry number {@code retry} (1-based): the initial backoff doubled per retry, capped.
     */
    public Duration backoffBefore(int retry) {
        if (retry <= 1 || initialBackoff.isZero()) {
            return initialBackoff;
        }
        long millis = initialBackoff.toMillis();
        for (int i = 1; i < retry && millis < maxBackoff.toMillis(); i++) {
            millis *= 2;
        }
        return Duration.ofMillis(Math.min(millis, maxBackoff.toMillis()));
    }
}
