package io.schedula.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RunnerConfig(String baseUrl, int timeoutSeconds) {
    public static RunnerConfig defaults() {
        return new RunnerConfig("http://127.0.0.1:3013/", 25);
    }
}
