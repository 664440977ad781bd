package io.schedula.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SchedulaConfig(
    ServerConfig server,
    StorageConfig storage,
    RunnerConfig runner,
    SchedulerConfig scheduler,
    Map<String, String> apiKeys
) {
    public SchedulaConfig {
        apiKeys = apiKeys == null ? Map.of() : Map.copyOf(apiKeys);
    }

    public static SchedulaConfig defaults() {
        return new SchedulaConfig(
            ServerConfig.defaults(),
            StorageConfig.defaults(),
            RunnerConfig.defaults(),
            SchedulerConfig.defaults(),
            Map.of()
        );
    }
}
