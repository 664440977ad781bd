package io.schedula.cli;

import io.schedula.core.config.ConfigService;
import io.schedula.core.event.EventRegistry;
import java.nio.file.Path;

public record CliContext(
    EventRegistry registry,
    ConfigService configService,
    Path configPath,
    ServerRunner serverRunner
) {
    public CliContext(EventRegistry registry, ConfigService configService, Path configPath) {
        this(registry, configService, configPath, (host, port) -> {
            throw new UnsupportedOperationException("server runner is not configured");
        });
    }
}
