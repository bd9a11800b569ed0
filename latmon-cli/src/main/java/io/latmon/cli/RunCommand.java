package io.latmon.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "run", description = "Start samplers, storage and the query API")
public final class RunCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--port"}, description = "Query API port (overrides config)")
    Integer port;

    @Option(names = {"--config"}, description = "Config file override")
    Path config;

    public RunCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        if (port != null && (port < 0 || port > 65_535)) {
            System.err.println("Run command failed: port must be between 0 and 65535");
            return 2;
        }
        try {
            return context.pipelineRunner().run(port, context.resolveConfig(config));
        } catch (Exception e) {
            System.err.println("Run command failed: " + e.getMessage());
            return 1;
        }
    }
}
