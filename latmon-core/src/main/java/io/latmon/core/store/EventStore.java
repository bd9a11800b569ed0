package io.latmon.core.store;

import io.latmon.core.model.ComponentClass;
import io.latmon.core.model.LatencyEvent;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface EventStore {
    /**
     * Writes all events atomically and returns them with their assigned ids, in input order.
     */
    List<LatencyEvent> appendAll(List<LatencyEvent> events) throws IOException;

    default LatencyEvent append(LatencyEvent event) throws IOException {
        return appendAll(List.of(event)).get(0);
    }

    /** Up to {@code limit} events, newest first. */
    List<LatencyEvent> recent(int limit) throws IOException;

    /**
     * Events with {@code from <= timestamp < to}, newest first. A {@code null} bound or class is
     * unconstrained.
     */
    List<LatencyEvent> range(Instant from, Instant to, ComponentClass componentClass, int limit) throws IOException;

    /** Deletes events with {@code timestamp < cutoff}; an event exactly at the cutoff is kept. */
    int purgeOlderThan(Instant cutoff) throws IOException;

    long count() throws IOException;

    Optional<Instant> lastEventTime() throws IOException;
}
