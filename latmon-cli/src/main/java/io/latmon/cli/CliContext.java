package io.latmon.cli;

import io.latmon.core.config.ConfigService;
import java.nio.file.Path;
import java.time.Clock;

public record CliContext(
    ConfigService configService,
    Path configPath,
    PipelineRunner pipelineRunner,
    Clock clock
) {
    public CliContext(ConfigService configService, Path configPath) {
        this(configService, configPath, (port, configOverride) -> {
            throw new UnsupportedOperationException("pipeline runner is not configured");
        }, Clock.systemUTC());
    }

    public Path resolveConfig(Path override) {
        return override == null ? configPath : override;
    }
}
