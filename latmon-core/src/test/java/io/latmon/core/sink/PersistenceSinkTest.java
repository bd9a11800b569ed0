package io.latmon.core.sink;

import static org.assertj.core.api.Assertions.assertThat;

import io.latmon.core.InMemoryEventStore;
import io.latmon.core.bus.BoundedEventBus;
import io.latmon.core.bus.EventSubscription;
import io.latmon.core.model.ComponentClass;
import io.latmon.core.model.LatencyEvent;
import io.latmon.core.model.SourceKind;
import io.latmon.core.pipeline.CancellationToken;
import io.latmon.core.pipeline.ShutdownMode;
import io.latmon.core.store.EventStore;
import io.latmon.core.store.SqliteEventStore;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PersistenceSinkTest {
    private static final RetryPolicy FAST_RETRY = new RetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(4));

    @TempDir
    Path tempDir;

    @Test
    void shouldPersistAfterTransientFailures() throws Exception {
        InMemoryEventStore store = new InMemoryEventStore();
        store.failNextWrites(2);
        PersistenceSink sink = sink(store, new BoundedEventBus(8).subscribe("persistence"), new CancellationToken());

        Optional<LatencyEvent> stored = sink.store(event(1));

        assertThat(stored).isPresent();
        assertThat(stored.get().persisted()).isTrue();
        assertThat(sink.stats().retries()).isEqualTo(2);
        assertThat(sink.stats().dropped()).isZero();
    }

    @Test
    void shouldDropAfterRetriesAreExhausted() throws Exception {
        InMemoryEventStore store = new InMemoryEventStore();
        store.setWritesDown(true);
        PersistenceSink sink = sink(store, new BoundedEventBus(8).subscribe("persistence"), new CancellationToken());

        Optional<LatencyEvent> stored = sink.store(event(1));

        assertThat(stored).isEmpty();
        assertThat(store.writeAttempts()).isEqualTo(3);
        assertThat(sink.stats().dropped()).isEqualTo(1);
        assertThat(sink.stats().failedBatches()).isEqualTo(1);
    }

    @Test
    void shouldKeepConsumingThroughAStorageOutage() throws Exception {
        InMemoryEventStore store = new InMemoryEventStore();
        BoundedEventBus bus = new BoundedEventBus(100);
        CancellationToken token = new CancellationToken();
        PersistenceSink sink = sink(store, bus.subscribe("persistence"), token);
        Thread consumer = new Thread(sink, "test-sink");
        store.setWritesDown(true);
        consumer.start();

        int acceptedDuringOutage = 0;
        for (int i = 0; i < 50; i++) {
            if (bus.publish(event(i))) {
                acceptedDuringOutage++;
            }
            Thread.sleep(2);
        }
        Thread.sleep(100);
        store.setWritesDown(false);
        for (int i = 0; i < 10; i++) {
            assertThat(bus.publish(event(100 + i))).isTrue();
        }
        bus.close();
        token.cancel(ShutdownMode.GRACEFUL);
        consumer.join(5_000);

        SinkStats stats = sink.stats();
        assertThat(consumer.isAlive()).isFalse();
        assertThat(acceptedDuringOutage).isEqualTo(50);
        assertThat(stats.dropped()).isPositive();
        assertThat(stats.persisted()).isGreaterThanOrEqualTo(10);
        assertThat(stats.persisted() + stats.dropped()).isEqualTo(60);
        assertThat(store.count()).isEqualTo(stats.persisted());
    }

    @Test
    void shouldDrainBufferedEventsOnGracefulStop() throws Exception {
        InMemoryEventStore store = new InMemoryEventStore();
        BoundedEventBus bus = new BoundedEventBus(16);
        CancellationToken token = new CancellationToken();
        PersistenceSink sink = sink(store, bus.subscribe("persistence"), token);
        for (int i = 0; i < 5; i++) {
            bus.publish(event(i));
        }
        token.cancel(ShutdownMode.GRACEFUL);
        bus.close();

        sink.run();

        assertThat(store.count()).isEqualTo(5);
        assertThat(sink.stats().persisted()).isEqualTo(5);
        assertThat(sink.stats().buffered()).isZero();
    }

    @Test
    void shouldDiscardBufferedEventsOnForcedStop() throws Exception {
        InMemoryEventStore store = new InMemoryEventStore();
        BoundedEventBus bus = new BoundedEventBus(16);
        CancellationToken token = new CancellationToken();
        EventSubscription subscription = bus.subscribe("persistence");
        PersistenceSink sink = sink(store, subscription, token);
        for (int i = 0; i < 5; i++) {
            bus.publish(event(i));
        }
        token.cancel(ShutdownMode.FORCED);

        sink.run();

        assertThat(store.count()).isZero();
        assertThat(sink.stats().dropped()).isEqualTo(5);
    }

    @Test
    void shouldDropOnlyTheEventThatCannotBeStored() throws Exception {
        SqliteEventStore store = new SqliteEventStore(tempDir.resolve("metrics.db"));
        BoundedEventBus bus = new BoundedEventBus(32);
        PersistenceSink sink = sink(store, bus.subscribe("persistence"), new CancellationToken());
        for (int i = 0; i < 9; i++) {
            bus.publish(event(i).withMetadata(Map.of("seen_at", Instant.parse("2026-03-01T10:00:00Z"))));
        }
        bus.publish(event(9).withMetadata(Map.of("handle", new Object())));
        bus.close();

        sink.run();

        assertThat(store.count()).isEqualTo(9);
        assertThat(sink.stats().persisted()).isEqualTo(9);
        assertThat(sink.stats().dropped()).isEqualTo(1);
        assertThat(store.recent(10)).extracting(LatencyEvent::description).doesNotContain("event 9");
    }

    @Test
    void shouldSplitAFailedBatchAndKeepTheHealthyEvents() throws Exception {
        InMemoryEventStore store = new InMemoryEventStore();
        store.rejectWhen(event -> event.description().equals("event 2"));
        PersistenceSink sink = sink(store, new BoundedEventBus(8).subscribe("persistence"), new CancellationToken());

        List<LatencyEvent> stored = sink.storeBatch(List.of(event(1), event(2), event(3)));

        assertThat(stored).extracting(LatencyEvent::description).containsExactly("event 1", "event 3");
        assertThat(stored).allMatch(LatencyEvent::persisted);
        assertThat(store.writeAttempts()).isEqualTo(3 + 3);
        assertThat(sink.stats().dropped()).isEqualTo(1);
        assertThat(sink.stats().failedBatches()).isEqualTo(1);
    }

    @Test
    void shouldDeleteThroughPurgeAndReadBackThroughRecent() throws Exception {
        InMemoryEventStore store = new InMemoryEventStore();
        PersistenceSink sink = sink(store, new BoundedEventBus(8).subscribe("persistence"), new CancellationToken());
        sink.storeBatch(List.of(event(0), event(1), event(2)));

        int purged = sink.purge(Instant.parse("2026-03-01T10:00:00.002Z"));

        assertThat(purged).isEqualTo(2);
        assertThat(sink.recent(10)).extracting(LatencyEvent::description).containsExactly("event 2");
    }

    @Test
    void shouldDoubleBackoffUpToTheCap() {
        RetryPolicy policy = new RetryPolicy(5, Duration.ofMillis(50), Duration.ofMillis(150));

        assertThat(policy.backoffBefore(1)).isEqualTo(Duration.ofMillis(50));
        assertThat(policy.backoffBefore(2)).isEqualTo(Duration.ofMillis(100));
        assertThat(policy.backoffBefore(3)).isEqualTo(Duration.ofMillis(150));
        assertThat(policy.backoffBefore(4)).isEqualTo(Duration.ofMillis(150));
    }

    private static PersistenceSink sink(EventStore store, EventSubscription subscription, CancellationToken token) {
        return new PersistenceSink(store, subscription, FAST_RETRY, 8, token);
    }

    private static LatencyEvent event(int i) {
        return LatencyEvent.of(
            Instant.parse("2026-03-01T10:00:00Z").plusMillis(i),
            ComponentClass.EDITOR,
            SourceKind.PROCESS_SCAN,
            Duration.ofMillis(3),
            "event " + i
        );
    }
}
