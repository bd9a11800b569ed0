package io.latmon.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BusConfig(int capacity) {

    public static BusConfig defaults() {
        return new BusConfig(10_000);
    }
}
