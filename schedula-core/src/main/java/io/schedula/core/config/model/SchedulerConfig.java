package io.schedula.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SchedulerConfig(
    String timezone,
    long historyExpirySeconds,
    int requestTimeoutSeconds,
    int maintenanceIntervalMinutes
) {
    public static SchedulerConfig defaults() {
        return new SchedulerConfig("", 86_400, 30, 60);
    }
}
