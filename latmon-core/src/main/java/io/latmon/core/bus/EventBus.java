package io.latmon.core.bus;

import io.latmon.core.model.LatencyEvent;

public interface EventBus extends AutoCloseable {
    /**
     * Offers an event to every subscriber without blocking.
     *
     * @return {@code false} when the bus is closed or at least one subscriber queue was full
     */
    boolean publish(LatencyEvent event);

    EventSubscription subscribe(String name);

    long droppedCount();

    int capacity();

    boolean isClosed();

    @Override
    void close();
}
