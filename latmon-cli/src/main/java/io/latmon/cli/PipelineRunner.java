package io.latmon.cli;

import java.nio.file.Path;

@FunctionalInterface
public interface PipelineRunner {
    /**
     * Runs samplers, storage and the query server until the process is asked to stop.
     *
     * @param portOverride server port, or {@code null} for the configured one
     */
    int run(Integer portOverride, Path configOverride) throws Exception;
}
