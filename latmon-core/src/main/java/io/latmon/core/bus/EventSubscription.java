package io.latmon.core.bus;

import io.latmon.core.model.LatencyEvent;
import java.time.Duration;
import java.util.Collection;
import java.util.Optional;

public interface EventSubscription {
    String name();

    Optional<LatencyEvent> poll();

    Optional<LatencyEvent> poll(Duration timeout) throws InterruptedException;

    int drainTo(Collection<? super LatencyEvent> target, int maxElements);

    int size();

    long droppedCount();

    /**
     * True once the owning bus is closed and every buffered event has been taken.
     */
    boolean isExhausted();
}
