package io.schedula.cli;

import picocli.CommandLine.Command;

@Command(name = "schedula", mixinStandardHelpOptions = true, description = "Schedula event coordinator")
public final class SchedulaCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
