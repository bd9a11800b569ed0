package io.latmon.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SamplingConfig(
    long defaultIntervalMs,
    Map<String, Long> intervalsMs,
    List<String> enabledClasses
) {
    public SamplingConfig {
        intervalsMs = intervalsMs == null ? Map.of() : Map.copyOf(intervalsMs);
        enabledClasses = enabledClasses == null ? List.of() : List.copyOf(enabledClasses);
    }

    public static SamplingConfig defaults() {
        return new SamplingConfig(
            100,
            Map.of("ai-model-local", 200L, "ai-model-remote", 200L),
            List.of("editor", "extension-host", "ai-model-local", "ai-model-remote", "terminal")
        );
    }

    public long intervalFor(String componentClass) {
        Long override = intervalsMs.get(componentClass);
        return override == null ? defaultIntervalMs : override;
    }
}
