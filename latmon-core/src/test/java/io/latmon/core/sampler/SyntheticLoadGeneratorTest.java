package io.latmon.core.sampler;

import static org.assertj.core.api.Assertions.assertThat;

import io.latmon.core.bus.BoundedEventBus;
import io.latmon.core.bus.EventSubscription;
import io.latmon.core.model.ComponentClass;
import io.latmon.core.model.LatencyEvent;
import io.latmon.core.model.SourceKind;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class SyntheticLoadGeneratorTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    @Test
    void shouldEmitDeterministicDurationsPerProfile() {
        BoundedEventBus bus = new BoundedEventBus(100);
        EventSubscription subscription = bus.subscribe("persistence");

        int accepted = new SyntheticLoadGenerator(bus, CLOCK).emit(ComponentClass.AI_MODEL_LOCAL, 3);

        List<LatencyEvent> events = new ArrayList<>();
        subscription.drainTo(events, 10);
        assertThat(accepted).isEqualTo(3);
        assertThat(events).extracting(LatencyEvent::durationMicros).containsExactly(100_000L, 101_000L, 102_000L);
        assertThat(events).extracting(LatencyEvent::sourceKind).containsOnly(SourceKind.SYNTHETIC_TEST);
        assertThat(events.get(2).metadata()).containsEntry("iteration", 3);
    }

    @Test
    void shouldReportOnlyAcceptedEvents() {
        BoundedEventBus bus = new BoundedEventBus(2);
        bus.subscribe("persistence");

        int accepted = new SyntheticLoadGenerator(bus, CLOCK).emit(ComponentClass.TERMINAL, 5);

        assertThat(accepted).isEqualTo(2);
        assertThat(bus.droppedCount()).isEqualTo(3);
        assertThat(new SyntheticLoadGenerator(bus, CLOCK).emit(ComponentClass.TERMINAL, 0)).isZero();
    }
}
