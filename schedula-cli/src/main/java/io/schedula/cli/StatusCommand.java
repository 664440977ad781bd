package io.schedula.cli;

import io.schedula.core.config.ConfigPaths;
import io.schedula.core.config.model.SchedulaConfig;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration and schedule status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            SchedulaConfig config = context.configService().load(context.configPath());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Data directory: " + ConfigPaths.resolveDataDir(config.storage().dataDir()));
            System.out.println("Storage backend: " + config.storage().backend());
            System.out.println("Listen address: " + config.server().host() + ":" + config.server().port());
            System.out.println("Runner URL: " + config.runner().baseUrl());
            System.out.println("API keys configured: " + config.apiKeys().size());
            System.out.println("Events: " + context.registry().list(0, 1).length());
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
