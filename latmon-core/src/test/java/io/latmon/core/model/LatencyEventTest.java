package io.latmon.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class LatencyEventTest {

    @Test
    void shouldAssignIdOnlyOnce() {
        LatencyEvent event = LatencyEvent.of(Instant.EPOCH, ComponentClass.EDITOR, SourceKind.PROCESS_SCAN,
            Duration.ofMillis(2), "x");

        LatencyEvent persisted = event.withId(7);

        assertThat(event.persisted()).isFalse();
        assertThat(persisted.persisted()).isTrue();
        assertThatThrownBy(() -> persisted.withId(8)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldRejectNegativeDurations() {
        assertThatThrownBy(() -> new LatencyEvent(null, Instant.EPOCH, ComponentClass.EDITOR, SourceKind.PROCESS_SCAN,
            -1, "", null)).isInstanceOf(IllegalArgumentException.class);
        assertThat(LatencyEvent.of(Instant.EPOCH, ComponentClass.EDITOR, SourceKind.PROCESS_SCAN,
            Duration.ofMillis(-5), "").durationMicros()).isZero();
    }

    @Test
    void shouldParseWireNamesLeniently() {
        assertThat(ComponentClass.fromWireName("AI_MODEL_LOCAL")).isEqualTo(ComponentClass.AI_MODEL_LOCAL);
        assertThat(SourceKind.fromWireName(" synthetic-test ")).isEqualTo(SourceKind.SYNTHETIC_TEST);
        assertThatThrownBy(() -> ComponentClass.fromWireName("kernel")).isInstanceOf(IllegalArgumentException.class);
    }
}
