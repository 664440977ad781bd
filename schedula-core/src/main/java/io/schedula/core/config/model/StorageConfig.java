package io.schedula.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * {@code backend} is {@code file} (one JSON file per list) or {@code sqlite}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageConfig(String backend, String dataDir) {
    public static StorageConfig defaults() {
        return new StorageConfig("file", "~/.schedula/data");
    }
}
