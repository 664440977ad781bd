package io.schedula.cli;

import io.schedula.core.event.Event;
import io.schedula.core.store.ListPage;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "events", description = "List scheduled events, newest first")
public final class EventsCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--offset", description = "Rows to skip", defaultValue = "0")
    int offset;

    @Option(names = "--limit", description = "Maximum rows to print", defaultValue = "50")
    int limit;

    public EventsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ListPage<Event> page = context.registry().list(offset, limit);
            if (page.items().isEmpty()) {
                System.out.println("No events.");
                return 0;
            }
            for (Event event : page.items()) {
                System.out.printf(
                    "%-20s %-8s %-12s %-16s %s%n",
                    event.id(),
                    event.enabledFlag() ? "enabled" : "disabled",
                    event.category(),
                    event.target(),
                    event.title()
                );
            }
            System.out.println("Showing " + page.items().size() + " of " + page.length());
            return 0;
        } catch (Exception e) {
            System.err.println("Events command failed: " + e.getMessage());
            return 1;
        }
    }
}
