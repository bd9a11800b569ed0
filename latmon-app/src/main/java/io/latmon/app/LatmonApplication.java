package io.latmon.app;

import io.latmon.cli.CliContext;
import io.latmon.cli.LatmonCliCommand;
import io.latmon.cli.RunCommand;
import io.latmon.cli.SimulateCommand;
import io.latmon.cli.StatusCommand;
import io.latmon.core.aggregate.Aggregator;
import io.latmon.core.api.TelemetryServer;
import io.latmon.core.config.ConfigPaths;
import io.latmon.core.config.ConfigService;
import io.latmon.core.config.model.LatmonConfig;
import io.latmon.core.pipeline.PipelineSettings;
import io.latmon.core.pipeline.ShutdownMode;
import io.latmon.core.pipeline.TelemetryPipeline;
import io.latmon.core.query.JvmResourceProbe;
import io.latmon.core.query.QueryService;
import io.latmon.core.retention.RetentionCompactor;
import io.latmon.core.sampler.JdkProcessTable;
import io.latmon.core.store.EventStore;
import io.latmon.core.store.SqliteEventStore;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class LatmonApplication {
    private static final Logger LOG = LoggerFactory.getLogger(LatmonApplication.class);
    private static final Duration COMPACTION_INITIAL_DELAY = Duration.ofMinutes(1);
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(15);

    private LatmonApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Clock clock = Clock.systemUTC();
        CliContext context = new CliContext(
            configService,
            ConfigPaths.defaultConfigPath(),
            (port, configOverride) -> runPipeline(configService, configOverride, port, clock),
            clock
        );

        CommandLine commandLine = new CommandLine(new LatmonCliCommand());
        commandLine.addSubcommand("run", new RunCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("simulate", new SimulateCommand(context));
        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Everything that can fail at startup (config, storage path, port) is checked before the
     * samplers start. Blocks until the JVM is asked to shut down, then drains gracefully.
     */
    private static int runPipeline(ConfigService configService, Path configPath, Integer portOverride, Clock clock)
        throws Exception {
        LatmonConfig config = configService.load(configPath);
        int port = portOverride == null ? config.server().port() : portOverride;
        EventStore store = new SqliteEventStore(ConfigPaths.resolve(config.storage().databasePath()));
        Aggregator aggregator = new Aggregator(ConfigService.aggregatorSettings(config), clock);
        TelemetryPipeline pipeline = new TelemetryPipeline(
            PipelineSettings.from(config),
            store,
            aggregator,
            JdkProcessTable::new,
            clock
        );

        CountDownLatch shutdown = new CountDownLatch(1);
        CountDownLatch drained = new CountDownLatch(1);
        try (QueryService queries = new QueryService(
                aggregator,
                pipeline.sink(),
                pipeline,
                new JvmResourceProbe(),
                Duration.ofMillis(config.server().queryTimeoutMs())
            );
             TelemetryServer server = new TelemetryServer(config.server().host(), port, queries);
             RetentionCompactor compactor = new RetentionCompactor(pipeline.sink(), config.storage().retentionDays(), clock)) {
            server.start();
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                shutdown.countDown();
                awaitQuietly(drained, SHUTDOWN_GRACE);
            }, "latmon-shutdown"));

            pipeline.start();
            compactor.start(COMPACTION_INITIAL_DELAY, Duration.ofHours(config.storage().compactionIntervalHours()));
            System.out.println("Latency monitor started; query API on http://127.0.0.1:" + server.port());
            System.out.println("Endpoints: GET /health, /status, /events?limit=N, /metrics, /metrics/{class}, /resources");
            shutdown.await();
            LOG.info("Shutdown requested");
        } finally {
            pipeline.stop(ShutdownMode.GRACEFUL);
            drained.countDown();
        }
        return 0;
    }

    private static void awaitQuietly(CountDownLatch latch, Duration timeout) {
        try {
            if (!latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Pipeline did not drain within {} s", timeout.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
