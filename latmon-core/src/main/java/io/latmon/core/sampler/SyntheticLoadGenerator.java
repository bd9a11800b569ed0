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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Emits deterministic {@link SourceKind#SYNTHETIC_TEST} events so the pipeline can be exercised
 * without real editor or model processes running.
 */
public final class SyntheticLoadGenerator {
    private static final Logger LOG = LoggerFactory.getLogger(SyntheticLoadGenerator.class);

    private final EventBus bus;
    private final Clock clock;

    public SyntheticLoadGenerator(EventBus bus, Clock clock) {
        this.bus = Objects.requireNonNull(bus, "bus must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @return number of events the bus accepted
     */
    public int emit(ComponentClass componentClass, int iterations) {
        Profile profile = Profile.of(componentClass);
        return emit(componentClass, iterations, i -> Duration.ofMillis(profile.baseMs() + (i % profile.spreadMs())));
    }

    public int emit(ComponentClass componentClass, int iterations, DurationFunction durations) {
        if (iterations <= 0) {
            return 0;
        }
        int accepted = 0;
        Instant last = Instant.MIN;
        for (int i = 0; i < iterations; i++) {
            Instant now = clock.instant();
            last = now.isBefore(last) ? last : now;
            LatencyEvent event = LatencyEvent.of(
                last,
                componentClass,
                SourceKind.SYNTHETIC_TEST,
                durations.durationFor(i),
                "Synthetic " + componentClass.displayName() + " command #" + (i + 1)
            ).withMetadata(Map.of("iteration", i + 1));
            if (bus.publish(event)) {
                accepted++;
            }
        }
        LOG.info("Emitted {}/{} synthetic {} event(s)", accepted, iterations, componentClass.wireName());
        return accepted;
    }

    @FunctionalInterface
    public interface DurationFunction {
        Duration durationFor(int iteration);
    }

    private record Profile(long baseMs, long spreadMs) {
        static Profile of(ComponentClass componentClass) {
            return switch (componentClass) {
                case AI_MODEL_LOCAL, AI_MODEL_REMOTE -> new Profile(100, 200);
                case TERMINAL -> new Profile(20, 80);
                default -> new Profile(10, 50);
            };
        }
    }
}
