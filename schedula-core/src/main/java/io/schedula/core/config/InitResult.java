package io.schedula.core.config;

import java.nio.file.Path;

public record InitResult(Path configPath, Path dataDir, boolean createdConfig, boolean overwrittenConfig) {
}
