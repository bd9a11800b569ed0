package io.latmon.core.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import io.latmon.core.InMemoryEventStore;
import io.latmon.core.aggregate.Aggregator;
import io.latmon.core.aggregate.AggregatorSettings;
import io.latmon.core.model.ComponentClass;
import io.latmon.core.model.LatencyEvent;
import io.latmon.core.model.SourceKind;
import io.latmon.core.sampler.ClassificationRules;
import io.latmon.core.sampler.ProcessInfo;
import io.latmon.core.sampler.SamplerState;
import io.latmon.core.sampler.SamplerStats;
import io.latmon.core.sink.RetryPolicy;
import io.latmon.core.store.SqliteEventStore;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TelemetryPipelineTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldDeliverSamplerEventsToStoreAndAggregator() throws Exception {
        SqliteEventStore store = new SqliteEventStore(tempDir.resolve("metrics.db"));
        Aggregator aggregator = new Aggregator(AggregatorSettings.defaults(), Clock.systemUTC());
        PipelineSettings settings = new PipelineSettings(
            1_000,
            16,
            RetryPolicy.defaults(),
            Map.of(ComponentClass.EDITOR, Duration.ofMillis(50)),
            ClassificationRules.defaults()
        );
        TelemetryPipeline pipeline = new TelemetryPipeline(
            settings,
            store,
            aggregator,
            () -> () -> List.of(new ProcessInfo(4242L, "code", "/usr/bin/code", 2.0, 8_192L)),
            Clock.systemUTC()
        );
        assertThat(pipeline.activeSamplers()).isEmpty();

        pipeline.start();
        Thread.sleep(500);
        awaitTrue(() -> recentCount(store) >= 8, Duration.ofSeconds(3));

        assertThat(store.recent(10)).hasSizeGreaterThanOrEqualTo(8)
            .allSatisfy(event -> assertThat(event.componentClass()).isEqualTo(ComponentClass.EDITOR));
        assertThat(pipeline.activeSamplers()).containsExactly("editor-sampler");

        pipeline.stop(ShutdownMode.GRACEFUL);

        assertThat(pipeline.activeSamplers()).isEmpty();
        assertThat(pipeline.samplerStats()).extracting(SamplerStats::state).containsExactly(SamplerState.TERMINATED);
        assertThat(pipeline.sinkStats().persisted()).isEqualTo(store.count());
        assertThat(aggregator.snapshot(ComponentClass.EDITOR).eventCount()).isEqualTo(store.count());
        assertThat(pipeline.droppedEvents()).isZero();
    }

    @Test
    void shouldDrainEverythingAlreadyBufferedOnGracefulStop() {
        InMemoryEventStore store = new InMemoryEventStore();
        Aggregator aggregator = new Aggregator(AggregatorSettings.defaults(), Clock.systemUTC());
        TelemetryPipeline pipeline = new TelemetryPipeline(settings(RetryPolicy.defaults()), store, aggregator, null, Clock.systemUTC());
        pipeline.start();

        for (int i = 0; i < 200; i++) {
            assertThat(pipeline.bus().publish(event(i))).isTrue();
        }
        pipeline.stop(ShutdownMode.GRACEFUL);

        assertThat(pipeline.sinkStats().persisted()).isEqualTo(200);
        assertThat(pipeline.sinkStats().dropped()).isZero();
        assertThat(aggregator.snapshot(ComponentClass.TERMINAL).eventCount()).isEqualTo(200);
        assertThat(pipeline.bus().publish(event(999))).isFalse();
    }

    @Test
    void shouldDiscardBufferedEventsOnForcedStop() throws Exception {
        InMemoryEventStore store = new InMemoryEventStore();
        store.setWritesDown(true);
        Aggregator aggregator = new Aggregator(AggregatorSettings.defaults(), Clock.systemUTC());
        RetryPolicy slowRetry = new RetryPolicy(3, Duration.ofSeconds(5), Duration.ofSeconds(5));
        TelemetryPipeline pipeline = new TelemetryPipeline(settings(slowRetry), store, aggregator, null, Clock.systemUTC());
        pipeline.start();
        for (int i = 0; i < 100; i++) {
            pipeline.bus().publish(event(i));
        }
        Thread.sleep(100);

        long started = System.nanoTime();
        pipeline.stop(ShutdownMode.FORCED);
        awaitTrue(() -> pipeline.sinkStats().dropped() == 100, Duration.ofSeconds(3));

        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(4));
        assertThat(pipeline.token().isForced()).isTrue();
        assertThat(pipeline.sinkStats().persisted()).isZero();
        assertThat(pipeline.sinkStats().dropped()).isEqualTo(100);
        assertThat(store.count()).isZero();
    }

    @Test
    void shouldPersistAndSummariseSyntheticRun() throws Exception {
        SqliteEventStore store = new SqliteEventStore(tempDir.resolve("synthetic.db"));
        SyntheticRun run = new SyntheticRun(
            settings(RetryPolicy.defaults()),
            AggregatorSettings.defaults(),
            store,
            Clock.systemUTC()
        );

        SyntheticRun.Result result = run.run(List.of(), 20);

        assertThat(result.accepted()).isEqualTo(60);
        assertThat(result.sink().persisted()).isEqualTo(60);
        assertThat(store.count()).isEqualTo(60);
        assertThat(result.snapshots()).hasSize(3).allSatisfy(snapshot -> {
            assertThat(snapshot.eventCount()).isEqualTo(20);
            assertThat(snapshot.p50DurationMs()).isPositive();
        });
        assertThat(store.recent(1).get(0).sourceKind()).isEqualTo(SourceKind.SYNTHETIC_TEST);
    }

    private static PipelineSettings settings(RetryPolicy retry) {
        return new PipelineSettings(1_000, 16, retry, Map.of(), ClassificationRules.defaults());
    }

    private static LatencyEvent event(int i) {
        return LatencyEvent.of(Instant.now(), ComponentClass.TERMINAL, SourceKind.COMMAND_EXECUTION, Duration.ofMillis(5 + i % 10), "cmd " + i);
    }

    private static int recentCount(SqliteEventStore store) {
        try {
            return store.recent(10).size();
        } catch (IOException e) {
            return 0;
        }
    }

    private static void awaitTrue(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
    }
}
