package io.latmon.cli;

import io.latmon.core.config.ConfigPaths;
import io.latmon.core.config.ConfigService;
import io.latmon.core.config.model.LatmonConfig;
import io.latmon.core.model.ComponentClass;
import io.latmon.core.model.PerformanceSnapshot;
import io.latmon.core.pipeline.PipelineSettings;
import io.latmon.core.pipeline.SyntheticRun;
import io.latmon.core.store.SqliteEventStore;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "simulate", description = "Push synthetic latency events through the pipeline")
public final class SimulateCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "0..1", description = "Component class (default: editor, ai-model-local, terminal)")
    String component;

    @Option(names = {"-i", "--iterations"}, description = "Events per component class", defaultValue = "10")
    int iterations;

    @Option(names = {"--config"}, description = "Config file override")
    Path config;

    public SimulateCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        if (iterations < 1) {
            System.err.println("Simulate command failed: iterations must be >= 1");
            return 2;
        }
        List<ComponentClass> classes;
        try {
            classes = component == null ? SyntheticRun.DEFAULT_CLASSES : List.of(ComponentClass.fromWireName(component));
        } catch (IllegalArgumentException e) {
            System.err.println("Simulate command failed: " + e.getMessage());
            return 2;
        }
        try {
            LatmonConfig loaded = context.configService().load(context.resolveConfig(config));
            SyntheticRun run = new SyntheticRun(
                PipelineSettings.from(loaded),
                ConfigService.aggregatorSettings(loaded),
                new SqliteEventStore(ConfigPaths.resolve(loaded.storage().databasePath())),
                context.clock()
            );
            SyntheticRun.Result result = run.run(classes, iterations);
            System.out.println("Accepted events: " + result.accepted());
            System.out.println("Persisted events: " + result.sink().persisted());
            System.out.println("Dropped events: " + (result.droppedByBus() + result.sink().dropped()));
            for (PerformanceSnapshot snapshot : result.snapshots()) {
                System.out.printf(
                    "%-16s count=%d avg=%.2fms p50=%.2fms p95=%.2fms p99=%.2fms%n",
                    snapshot.componentClass().wireName(),
                    snapshot.eventCount(),
                    snapshot.avgDurationMs(),
                    snapshot.p50DurationMs(),
                    snapshot.p95DurationMs(),
                    snapshot.p99DurationMs()
                );
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Simulate command failed: " + e.getMessage());
            return 1;
        }
    }
}
