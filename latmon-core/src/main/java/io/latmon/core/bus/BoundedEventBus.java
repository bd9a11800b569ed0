package io.latmon.core.bus;

import io.latmon.core.model.LatencyEvent;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fan-out bus with one bounded FIFO queue per subscriber. A full queue rejects the
 * newest event; producers never wait for space.
 */
public final class BoundedEventBus implements EventBus {
    private final int capacity;
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public BoundedEventBus(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
    }

    @Override
    public boolean publish(LatencyEvent event) {
        if (event == null || closed.get() || subscriptions.isEmpty()) {
            return false;
        }
        boolean accepted = true;
        for (Subscription subscription : subscriptions) {
            if (!subscription.offer(event)) {
                accepted = false;
            }
        }
        if (!accepted) {
            dropped.incrementAndGet();
        }
        return accepted;
    }

    @Override
    public EventSubscription subscribe(String name) {
        if (closed.get()) {
            throw new IllegalStateException("bus is closed");
        }
        Subscription subscription = new Subscription(name, capacity);
        subscriptions.add(subscription);
        return subscription;
    }

    @Override
    public long droppedCount() {
        return dropped.get();
    }

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        closed.set(true);
    }

    private final class Subscription implements EventSubscription {
        private final String name;
        private final ArrayBlockingQueue<LatencyEvent> queue;
        private final AtomicLong droppedHere = new AtomicLong();

        private Subscription(String name, int capacity) {
            this.name = name == null || name.isBlank() ? "subscriber-" + subscriptions.size() : name;
            this.queue = new ArrayBlockingQueue<>(capacity);
        }

        private boolean offer(LatencyEvent event) {
            if (queue.offer(event)) {
                return true;
            }
            droppedHere.incrementAndGet();
            return false;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public Optional<LatencyEvent> poll() {
            return Optional.ofNullable(queue.poll());
        }

        @Override
        public Optional<LatencyEvent> poll(Duration timeout) throws InterruptedException {
            return Optional.ofNullable(queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS));
        }

        @Override
        public int drainTo(Collection<? super LatencyEvent> target, int maxElements) {
            return queue.drainTo(target, maxElements);
        }

        @Override
        public int size() {
            return queue.size();
        }

        @Override
        public long droppedCount() {
            return droppedHere.get();
        }

        @Override
        public boolean isExhausted() {
            return closed.get() && queue.isEmpty();
        }
    }
}
