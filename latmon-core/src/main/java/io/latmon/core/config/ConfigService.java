package io.latmon.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.latmon.core.aggregate.AggregatorSettings;
import io.latmon.core.aggregate.BucketLayout;
import io.latmon.core.config.model.AggregationConfig;
import io.latmon.core.config.model.LatmonConfig;
import io.latmon.core.config.model.RetryConfig;
import io.latmon.core.config.model.RuleConfig;
import io.latmon.core.model.ComponentClass;
import io.latmon.core.model.SourceKind;
import io.latmon.core.sampler.ClassificationRule;
import io.latmon.core.sampler.ClassificationRules;
import io.latmon.core.sink.RetryPolicy;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public final class ConfigService {
    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Loads the file at {@code configPath} layered over the defaults, then validates it.
     * A missing file yields the defaults.
     */
    public LatmonConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return LatmonConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(LatmonConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        LatmonConfig config = mapper.treeToValue(merged, LatmonConfig.class);
        validate(config);
        return config;
    }

    public void save(Path configPath, LatmonConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        if (configPath.getParent() != null) {
            Files.createDirectories(configPath.getParent());
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public String toPrettyJson(LatmonConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    public void validate(LatmonConfig config) {
        List<String> violations = new ArrayList<>();

        if (config.sampling().defaultIntervalMs() <= 0) {
            violations.add("sampling.defaultIntervalMs must be > 0");
        }
        for (Map.Entry<String, Long> entry : config.sampling().intervalsMs().entrySet()) {
            if (!isComponentClass(entry.getKey())) {
                violations.add("sampling.intervalsMs has unknown component class: " + entry.getKey());
            }
            if (entry.getValue() == null || entry.getValue() <= 0) {
                violations.add("sampling.intervalsMs." + entry.getKey() + " must be > 0");
            }
        }
        for (String enabled : config.sampling().enabledClasses()) {
            if (!isComponentClass(enabled)) {
                violations.add("sampling.enabledClasses has unknown component class: " + enabled);
            }
        }

        if (config.bus().capacity() < 1) {
            violations.add("bus.capacity must be >= 1");
        }

        if (config.storage().databasePath() == null || config.storage().databasePath().isBlank()) {
            violations.add("storage.databasePath must not be blank");
        }
        if (config.storage().retentionDays() < 1) {
            violations.add("storage.retentionDays must be >= 1");
        }
        if (config.storage().compactionIntervalHours() < 1) {
            violations.add("storage.compactionIntervalHours must be >= 1");
        }
        if (config.storage().batchSize() < 1) {
            violations.add("storage.batchSize must be >= 1");
        }
        RetryConfig retry = config.storage().retry();
        if (retry.maxAttempts() < 1) {
            violations.add("storage.retry.maxAttempts must be >= 1");
        }
        if (retry.initialBackoffMs() < 0 || retry.maxBackoffMs() < retry.initialBackoffMs()) {
            violations.add("storage.retry backoff must satisfy 0 <= initialBackoffMs <= maxBackoffMs");
        }

        AggregationConfig aggregation = config.aggregation();
        if (aggregation.windowMinutes() < 1) {
            violations.add("aggregation.windowMinutes must be >= 1");
        }
        if (aggregation.slotSeconds() < 1) {
            violations.add("aggregation.slotSeconds must be >= 1");
        } else if (aggregation.windowMinutes() >= 1 && (aggregation.windowMinutes() * 60L) % aggregation.slotSeconds() != 0) {
            violations.add("aggregation.windowMinutes must be a whole multiple of slotSeconds");
        }
        if (aggregation.firstBucketMicros() < 1) {
            violations.add("aggregation.firstBucketMicros must be >= 1");
        }
        if (aggregation.bucketGrowth() <= 1.0) {
            violations.add("aggregation.bucketGrowth must be > 1");
        }
        if (aggregation.ceilingMicros() <= aggregation.firstBucketMicros()) {
            violations.add("aggregation.ceilingMicros must be greater than firstBucketMicros");
        }

        if (config.server().port() < 0 || config.server().port() > 65_535) {
            violations.add("server.port must be between 0 and 65535");
        }
        if (config.server().host() == null || config.server().host().isBlank()) {
            violations.add("server.host must not be blank");
        }
        if (config.server().queryTimeoutMs() <= 0) {
            violations.add("server.queryTimeoutMs must be > 0");
        }

        for (int i = 0; i < config.rules().size(); i++) {
            validateRule(config.rules().get(i), "rules[" + i + "]", violations);
        }

        if (!violations.isEmpty()) {
            throw new ConfigValidationException(violations);
        }
    }

    public static RetryPolicy retryPolicy(LatmonConfig config) {
        RetryConfig retry = config.storage().retry();
        return new RetryPolicy(
            retry.maxAttempts(),
            Duration.ofMillis(retry.initialBackoffMs()),
            Duration.ofMillis(retry.maxBackoffMs())
        );
    }

    public static AggregatorSettings aggregatorSettings(LatmonConfig config) {
        AggregationConfig aggregation = config.aggregation();
        return new AggregatorSettings(
            new BucketLayout(aggregation.firstBucketMicros(), aggregation.bucketGrowth(), aggregation.ceilingMicros()),
            Duration.ofMinutes(aggregation.windowMinutes()),
            Duration.ofSeconds(aggregation.slotSeconds())
        );
    }

    /**
     * Rules from the config file, or the built-in table when the file declares none.
     */
    public static List<ClassificationRule> classificationRules(LatmonConfig config) {
        if (config.rules().isEmpty()) {
            return ClassificationRules.defaults();
        }
        return config.rules().stream().map(ConfigService::toRule).toList();
    }

    public static Set<ComponentClass> enabledClasses(LatmonConfig config) {
        Set<ComponentClass> enabled = EnumSet.noneOf(ComponentClass.class);
        for (String raw : config.sampling().enabledClasses()) {
            enabled.add(ComponentClass.fromWireName(raw));
        }
        return enabled;
    }

    public static Duration samplingInterval(LatmonConfig config, ComponentClass componentClass) {
        return Duration.ofMillis(config.sampling().intervalFor(componentClass.wireName()));
    }

    private static ClassificationRule toRule(RuleConfig rule) {
        return new ClassificationRule(
            rule.name(),
            ComponentClass.fromWireName(rule.componentClass()),
            rule.sourceKind() == null ? SourceKind.PROCESS_SCAN : SourceKind.fromWireName(rule.sourceKind()),
            rule.nameEquals(),
            rule.nameContains(),
            rule.commandContains(),
            rule.namePattern(),
            rule.minCpuPercent()
        );
    }

    private static void validateRule(RuleConfig rule, String path, List<String> violations) {
        if (!isComponentClass(rule.componentClass())) {
            violations.add(path + ".componentClass is not a known component class: " + rule.componentClass());
        }
        if (rule.sourceKind() != null) {
            try {
                SourceKind.fromWireName(rule.sourceKind());
            } catch (IllegalArgumentException e) {
                violations.add(path + ".sourceKind is not a known source kind: " + rule.sourceKind());
            }
        }
        boolean hasMatcher = notEmpty(rule.nameEquals()) || notEmpty(rule.nameContains())
            || notEmpty(rule.commandContains()) || (rule.namePattern() != null && !rule.namePattern().isBlank());
        if (!hasMatcher) {
            violations.add(path + " must declare at least one matcher");
        }
        if (rule.namePattern() != null && !rule.namePattern().isBlank()) {
            try {
                Pattern.compile(rule.namePattern());
            } catch (PatternSyntaxException e) {
                violations.add(path + ".namePattern is not a valid regular expression");
            }
        }
        if (rule.minCpuPercent() < 0) {
            violations.add(path + ".minCpuPercent must be >= 0");
        }
    }

    private static boolean notEmpty(List<String> values) {
        return values != null && !values.isEmpty();
    }

    private static boolean isComponentClass(String raw) {
        try {
            ComponentClass.fromWireName(raw);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}
