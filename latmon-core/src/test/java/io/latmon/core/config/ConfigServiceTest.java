package io.latmon.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.latmon.core.aggregate.AggregatorSettings;
import io.latmon.core.config.model.LatmonConfig;
import io.latmon.core.model.ComponentClass;
import io.latmon.core.pipeline.PipelineSettings;
import io.latmon.core.sampler.ClassificationRule;
import io.latmon.core.sink.RetryPolicy;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadDefaultsWhenConfigMissing() throws Exception {
        ConfigService service = new ConfigService();

        LatmonConfig config = service.load(tempDir.resolve("config.json"));

        assertThat(config.sampling().defaultIntervalMs()).isEqualTo(100);
        assertThat(config.bus().capacity()).isEqualTo(10_000);
        assertThat(config.storage().retentionDays()).isEqualTo(30);
        assertThat(config.server().port()).isEqualTo(3030);
        assertThat(config.rules()).isEmpty();
    }

    @Test
    void shouldMergeFileValuesOverDefaults() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "sampling": { "defaultIntervalMs": 250 },
              "storage": { "retry": { "maxAttempts": 5 } },
              "server": { "port": 4040 }
            }
            """);

        LatmonConfig config = service.load(configPath);

        assertThat(config.sampling().defaultIntervalMs()).isEqualTo(250);
        assertThat(config.sampling().intervalFor("ai-model-local")).isEqualTo(200);
        assertThat(config.sampling().intervalFor("terminal")).isEqualTo(250);
        assertThat(config.storage().retry().maxAttempts()).isEqualTo(5);
        assertThat(config.storage().retry().initialBackoffMs()).isEqualTo(50);
        assertThat(config.server().port()).isEqualTo(4040);
        assertThat(config.server().host()).isEqualTo("0.0.0.0");
    }

    @Test
    void shouldReportEveryViolationAtOnce() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "sampling": { "defaultIntervalMs": 0, "enabledClasses": ["editor", "kernel"] },
              "bus": { "capacity": 0 },
              "storage": { "retentionDays": -1 },
              "aggregation": { "windowMinutes": 60, "slotSeconds": 7 },
              "server": { "port": 70000 }
            }
            """);

        assertThatThrownBy(() -> service.load(configPath))
            .isInstanceOfSatisfying(ConfigValidationException.class, error -> assertThat(error.violations()).contains(
                "sampling.defaultIntervalMs must be > 0",
                "sampling.enabledClasses has unknown component class: kernel",
                "bus.capacity must be >= 1",
                "storage.retentionDays must be >= 1",
                "aggregation.windowMinutes must be a whole multiple of slotSeconds",
                "server.port must be between 0 and 65535"
            ));
    }

    @Test
    void shouldReplaceBuiltInRulesWithCustomRules() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "rules": [
                { "name": "jetbrains", "componentClass": "editor", "nameContains": ["idea"] }
              ]
            }
            """);

        List<ClassificationRule> rules = ConfigService.classificationRules(service.load(configPath));

        assertThat(rules).singleElement().satisfies(rule -> {
            assertThat(rule.name()).isEqualTo("jetbrains");
            assertThat(rule.target()).isEqualTo(ComponentClass.EDITOR);
        });
    }

    @Test
    void shouldRejectRuleWithBrokenPattern() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            { "rules": [ { "componentClass": "terminal", "namePattern": "([" } ] }
            """);

        assertThatThrownBy(() -> service.load(configPath))
            .isInstanceOfSatisfying(ConfigValidationException.class, error -> assertThat(error.violations())
                .contains("rules[0].namePattern is not a valid regular expression"));
    }

    @Test
    void shouldDeriveRuntimeSettingsFromConfig() {
        LatmonConfig config = LatmonConfig.defaults();

        RetryPolicy retry = ConfigService.retryPolicy(config);
        AggregatorSettings aggregation = ConfigService.aggregatorSettings(config);
        PipelineSettings pipeline = PipelineSettings.from(config);

        assertThat(retry).isEqualTo(RetryPolicy.defaults());
        assertThat(aggregation.horizon()).isEqualTo(Duration.ofHours(1));
        assertThat(aggregation.layout().bucketCount()).isEqualTo(18);
        assertThat(pipeline.samplerIntervals())
            .containsEntry(ComponentClass.EDITOR, Duration.ofMillis(100))
            .containsEntry(ComponentClass.AI_MODEL_REMOTE, Duration.ofMillis(200))
            .doesNotContainKey(ComponentClass.NETWORK);
        assertThat(pipeline.rules()).isNotEmpty();
        assertThat(pipeline.withoutSamplers().samplerIntervals()).isEmpty();
    }

    @Test
    void shouldSaveLoadableJson() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("nested/config.json");

        service.save(configPath, LatmonConfig.defaults());

        assertThat(Files.readString(configPath)).contains("\"defaultIntervalMs\"");
        assertThat(service.load(configPath)).isEqualTo(LatmonConfig.defaults());
    }

    @Test
    void shouldExpandHomeInDatabasePath() {
        Path resolved = ConfigPaths.resolve("~/.latmon/metrics.db");

        assertThat(resolved).isEqualTo(Path.of(System.getProperty("user.home"), ".latmon", "metrics.db"));
        assertThat(ConfigPaths.resolve("/var/lib/latmon.db")).isEqualTo(Path.of("/var/lib/latmon.db"));
    }
}
