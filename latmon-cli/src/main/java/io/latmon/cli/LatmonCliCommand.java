package io.latmon.cli;

import picocli.CommandLine.Command;

@Command(name = "latmon", mixinStandardHelpOptions = true, description = "Latency telemetry for editor, model and terminal processes")
public final class LatmonCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
