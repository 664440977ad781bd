package io.schedula.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ServerConfig(String host, int port) {
    public static ServerConfig defaults() {
        return new ServerConfig("0.0.0.0", 3012);
    }
}
