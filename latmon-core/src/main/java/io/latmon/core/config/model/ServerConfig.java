package io.latmon.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ServerConfig(String host, int port, long queryTimeoutMs) {

    public static ServerConfig defaults() {
        return new ServerConfig("0.0.0.0", 3030, 2_000);
    }
}
