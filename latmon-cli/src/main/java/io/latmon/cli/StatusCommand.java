package io.latmon.cli;

import io.latmon.core.config.ConfigPaths;
import io.latmon.core.config.model.LatmonConfig;
import io.latmon.core.model.LatencyEvent;
import io.latmon.core.store.EventStore;
import io.latmon.core.store.SqliteEventStore;
import io.latmon.core.store.Timestamps;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "status", description = "Show configuration and stored event status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--config"}, description = "Config file override")
    Path config;

    @Option(names = {"-v", "--verbose"}, description = "Also list the most recent events")
    boolean verbose;

    @Option(names = {"--limit"}, description = "Events listed with --verbose", defaultValue = "10")
    int limit;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            Path configPath = context.resolveConfig(config);
            LatmonConfig loaded = context.configService().load(configPath);
            Path databasePath = ConfigPaths.resolve(loaded.storage().databasePath());
            System.out.println("Config path: " + configPath);
            System.out.println("Config exists: " + Files.exists(configPath));
            System.out.println("Database: " + databasePath);
            System.out.println("Retention: " + loaded.storage().retentionDays() + " day(s)");
            System.out.println("Enabled samplers: " + String.join(", ", loaded.sampling().enabledClasses()));
            System.out.println("Query API: " + loaded.server().host() + ":" + loaded.server().port());

            EventStore store = new SqliteEventStore(databasePath);
            long total = store.count();
            Optional<Instant> last = store.lastEventTime();
            System.out.println("Stored events: " + total);
            System.out.println("Last event: " + last.map(Timestamps::format).orElse("none"));
            if (verbose) {
                for (LatencyEvent event : store.recent(Math.max(1, limit))) {
                    System.out.printf(
                        "  #%d %s %-16s %10.3f ms  %s%n",
                        event.id(),
                        Timestamps.format(event.timestamp()),
                        event.componentClass().wireName(),
                        event.durationMillis(),
                        event.description()
                    );
                }
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
