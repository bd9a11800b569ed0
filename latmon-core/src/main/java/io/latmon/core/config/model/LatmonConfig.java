package io.latmon.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LatmonConfig(
    SamplingConfig sampling,
    BusConfig bus,
    StorageConfig storage,
    AggregationConfig aggregation,
    ServerConfig server,
    List<RuleConfig> rules
) {
    public LatmonConfig {
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public static LatmonConfig defaults() {
        return new LatmonConfig(
            SamplingConfig.defaults(),
            BusConfig.defaults(),
            StorageConfig.defaults(),
            AggregationConfig.defaults(),
            ServerConfig.defaults(),
            List.of()
        );
    }
}
