package io.latmon.core.sampler;

import io.latmon.core.bus.EventBus;
import io.latmon.core.model.ComponentClass;
import io.latmon.core.model.LatencyEvent;
import io.latmon.core.model.SourceKind;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Times an arbitrary operation and publishes the elapsed time as an event. The event is
 * published whether the operation returns or throws; the outcome is tagged in metadata.
 */
public final class LatencyRecorder {
    private static final Logger LOG = LoggerFactory.getLogger(LatencyRecorder.class);

    private final EventBus bus;
    private final Clock clock;

    public LatencyRecorder(EventBus bus, Clock clock) {
        this.bus = Objects.requireNonNull(bus, "bus must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public <T> T measure(
        ComponentClass componentClass,
        SourceKind sourceKind,
        String description,
        Callable<T> operation
    ) throws Exception {
        Instant startedAt = clock.instant();
        long started = System.nanoTime();
        String outcome = "error";
        try {
            T result = operation.call();
            outcome = "ok";
            return result;
        } finally {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
            LatencyEvent event = LatencyEvent.of(startedAt, componentClass, sourceKind, elapsed, description)
                .withMetadata(Map.of("outcome", outcome));
            if (!bus.publish(event)) {
                LOG.debug("Measurement for {} was not accepted by the bus", componentClass.wireName());
            }
        }
    }
}
