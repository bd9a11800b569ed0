package io.latmon.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.latmon.core.config.ConfigService;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class CommandIntegrationTest {

    @TempDir
    Path tempDir;

    private Path configPath;

    @BeforeEach
    void setUp() throws Exception {
        configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "storage": { "databasePath": "%s" }
            }
            """.formatted(tempDir.resolve("metrics.db").toString().replace("\\", "\\\\")), StandardCharsets.UTF_8);
    }

    @Test
    void shouldSimulateAndPrintPercentiles() {
        CliContext context = new CliContext(new ConfigService(), configPath);

        CommandResult result = execute(new SimulateCommand(context), "editor", "--iterations", "5");

        assertThat(result.exitCode()).isEqualTo(0);
        assertThat(result.out())
            .contains("Accepted events: 5")
            .contains("Persisted events: 5")
            .contains("editor")
            .contains("p95=");
    }

    @Test
    void shouldRejectUnknownComponentInSimulate() {
        CliContext context = new CliContext(new ConfigService(), configPath);

        CommandResult result = execute(new SimulateCommand(context), "kernel");

        assertThat(result.exitCode()).isEqualTo(2);
    }

    @Test
    void shouldReportStoredEventsInStatus() {
        CliContext context = new CliContext(new ConfigService(), configPath);
        execute(new SimulateCommand(context), "terminal", "-i", "3");

        CommandResult result = execute(new StatusCommand(context), "--verbose");

        assertThat(result.exitCode()).isEqualTo(0);
        assertThat(result.out())
            .contains("Config exists: true")
            .contains("Stored events: 3")
            .contains("Synthetic Terminal command #3");
    }

    @Test
    void shouldFailStatusOnInvalidConfig() throws Exception {
        Files.writeString(configPath, "{ \"bus\": { \"capacity\": 0 } }");
        CliContext context = new CliContext(new ConfigService(), configPath);

        CommandResult result = execute(new StatusCommand(context));

        assertThat(result.exitCode()).isEqualTo(1);
    }

    @Test
    void shouldDelegateRunToPipelineRunnerWithOverrides() {
        AtomicReference<Integer> port = new AtomicReference<>();
        AtomicReference<Path> config = new AtomicReference<>();
        CliContext context = new CliContext(new ConfigService(), configPath, (portOverride, configOverride) -> {
            port.set(portOverride);
            config.set(configOverride);
            return 0;
        }, Clock.systemUTC());

        CommandResult result = execute(new RunCommand(context), "--port", "4545");

        assertThat(result.exitCode()).isEqualTo(0);
        assertThat(port.get()).isEqualTo(4545);
        assertThat(config.get()).isEqualTo(configPath);
        assertThat(execute(new RunCommand(context), "--port", "70000").exitCode()).isEqualTo(2);
    }

    private static CommandResult execute(Callable<Integer> command, String... args) {
        PrintStream originalOut = System.out;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            int code = new CommandLine(command).execute(args);
            return new CommandResult(code, out.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(originalOut);
        }
    }

    private record CommandResult(int exitCode, String out) {
    }
}
