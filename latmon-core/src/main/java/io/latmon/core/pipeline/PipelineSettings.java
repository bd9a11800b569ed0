package io.latmon.core.pipeline;

import io.latmon.core.config.ConfigService;
import io.latmon.core.config.model.LatmonConfig;
import io.latmon.core.model.ComponentClass;
import io.latmon.core.sampler.ClassificationRule;
import io.latmon.core.sink.RetryPolicy;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runtime shape of a pipeline: one sampler per entry in {@code samplerIntervals}.
 */
public record PipelineSettings(
    int busCapacity,
    int batchSize,
    RetryPolicy retryPolicy,
    Map<ComponentClass, Duration> samplerIntervals,
    List<ClassificationRule> rules
) {
    public PipelineSettings {
        if (busCapacity < 1) {
            throw new IllegalArgumentException("busCapacity must be >= 1");
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1");
        }
        retryPolicy = retryPolicy == null ? RetryPolicy.defaults() : retryPolicy;
        samplerIntervals = samplerIntervals == null ? Map.of() : Map.copyOf(samplerIntervals);
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public static PipelineSettings from(LatmonConfig config) {
        Map<ComponentClass, Duration> intervals = new EnumMap<>(ComponentClass.class);
        for (ComponentClass componentClass : ConfigService.enabledClasses(config)) {
            intervals.put(componentClass, ConfigService.samplingInterval(config, componentClass));
        }
        return new PipelineSettings(
            config.bus().capacity(),
            config.storage().batchSize(),
            ConfigService.retryPolicy(config),
            intervals,
            ConfigService.classificationRules(config)
        );
    }

    /**
     * Same settings without samplers, for runs fed only by synthetic or recorded events.
     */
    public PipelineSettings withoutSamplers() {
        return new PipelineSettings(busCapacity, batchSize, retryPolicy, Map.of(), rules);
    }
}
