package io.latmon.core.pipeline;

import io.latmon.core.aggregate.Aggregator;
import io.latmon.core.aggregate.AggregatorSettings;
import io.latmon.core.model.ComponentClass;
import io.latmon.core.model.PerformanceSnapshot;
import io.latmon.core.sampler.SyntheticLoadGenerator;
import io.latmon.core.sink.SinkStats;
import io.latmon.core.store.EventStore;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Pushes synthetic events through a sampler-less pipeline into a real store, then drains it
 * gracefully. Used to smoke-test an installation without any monitored processes running.
 */
public final class SyntheticRun {
    public static final List<ComponentClass> DEFAULT_CLASSES =
        List.of(ComponentClass.EDITOR, ComponentClass.AI_MODEL_LOCAL, ComponentClass.TERMINAL);

    private final PipelineSettings settings;
    private final AggregatorSettings aggregatorSettings;
    private final EventStore store;
    private final Clock clock;

    public SyntheticRun(PipelineSettings settings, AggregatorSettings aggregatorSettings, EventStore store, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null").withoutSamplers();
        this.aggregatorSettings = Objects.requireNonNull(aggregatorSettings, "aggregatorSettings must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public Result run(List<ComponentClass> classes, int iterations) {
        if (iterations < 1) {
            throw new IllegalArgumentException("iterations must be >= 1");
        }
        List<ComponentClass> targets = classes == null || classes.isEmpty() ? DEFAULT_CLASSES : classes;
        Aggregator aggregator = new Aggregator(aggregatorSettings, clock);
        TelemetryPipeline pipeline = new TelemetryPipeline(settings, store, aggregator, null, clock);
        pipeline.start();
        int accepted = 0;
        try {
            SyntheticLoadGenerator generator = new SyntheticLoadGenerator(pipeline.bus(), clock);
            for (ComponentClass componentClass : targets) {
                accepted += generator.emit(componentClass, iterations);
            }
        } finally {
            pipeline.stop(ShutdownMode.GRACEFUL);
        }

        List<PerformanceSnapshot> snapshots = new ArrayList<>();
        for (ComponentClass componentClass : targets) {
            snapshots.add(aggregator.snapshot(componentClass));
        }
        return new Result(accepted, pipeline.droppedEvents(), pipeline.sinkStats(), snapshots);
    }

    public record Result(
        int accepted,
        long droppedByBus,
        SinkStats sink,
        List<PerformanceSnapshot> snapshots
    ) {
    }
}
