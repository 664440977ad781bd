package io.schedula.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.schedula.core.config.ConfigService;
import io.schedula.core.cursor.CursorState;
import io.schedula.core.cursor.SchedulerState;
import io.schedula.core.event.EventDefaults;
import io.schedula.core.event.EventRegistry;
import io.schedula.core.identity.UserPrincipal;
import io.schedula.core.job.JobAbortCoordinator;
import io.schedula.core.request.RequestContext;
import io.schedula.core.scheduler.CatchUpRetickTrigger;
import io.schedula.core.scheduler.SchedulerControl;
import io.schedula.core.store.FileListStore;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class CliCommandsTest {

    @TempDir
    Path tempDir;

    private EventRegistry registry;
    private Path configPath;

    @BeforeEach
    void setUp() throws Exception {
        Clock clock = Clock.systemUTC();
        SchedulerControl idle = new SchedulerControl() {
            @Override
            public void forceReevaluateNow() {
            }

            @Override
            public SchedulerStatus status() {
                return new SchedulerStatus(false, false);
            }
        };
        registry = new EventRegistry(
            new FileListStore(tempDir.resolve("lists")),
            new CursorState(SchedulerState.restore(null), null, null, clock),
            Map::of,
            new JobAbortCoordinator(Map::of, (jobId, reason) -> {
            }),
            new CatchUpRetickTrigger(idle, clock),
            prefix -> prefix + "1",
            new EventDefaults("UTC", 0),
            clock,
            null,
            null
        );
        configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            { "storage": { "dataDir": "%s" }, "apiKeys": { "k-1": "Deploy bot" } }
            """.formatted(tempDir.resolve("data").toString().replace("\\", "\\\\")), StandardCharsets.UTF_8);
    }

    @Test
    void shouldListEventsNewestFirst() throws Exception {
        RequestContext context = RequestContext.unbounded(new UserPrincipal("ops"), Clock.systemUTC());
        registry.create(context, event("backup", "Nightly backup", 1));
        registry.create(context, event("report", "Weekly report", 0));

        String out = capture(() -> new CommandLine(new EventsCommand(cliContext())).execute("--limit", "10"));

        assertThat(out).contains("backup").contains("Weekly report").contains("disabled").contains("Showing 2 of 2");
        assertThat(out.indexOf("report")).isLessThan(out.indexOf("backup"));
    }

    @Test
    void shouldReportEmptySchedule() throws Exception {
        String out = capture(() -> new CommandLine(new EventsCommand(cliContext())).execute());

        assertThat(out).contains("No events.");
    }

    @Test
    void shouldPrintStatusFromConfig() throws Exception {
        String out = capture(() -> new CommandLine(new StatusCommand(cliContext())).execute());

        assertThat(out)
            .contains("Config exists: true")
            .contains("Storage backend: file")
            .contains("API keys configured: 1")
            .contains("Events: 0");
    }

    @Test
    void shouldInitDataDirectory() throws Exception {
        String out = capture(() -> new CommandLine(new InitCommand(cliContext())).execute());

        assertThat(out).contains("Refreshed config with new defaults");
        assertThat(Files.isDirectory(tempDir.resolve("data"))).isTrue();
    }

    @Test
    void shouldPassOverridesToServerRunner() {
        AtomicReference<String> seen = new AtomicReference<>();
        CliContext context = new CliContext(registry, new ConfigService(), configPath, (host, port) -> {
            seen.set(host + ":" + port);
            return 0;
        });

        int code = new CommandLine(new ServeCommand(context)).execute("--port", "4100");

        assertThat(code).isZero();
        assertThat(seen.get()).isEqualTo("null:4100");
    }

    private CliContext cliContext() {
        return new CliContext(registry, new ConfigService(), configPath);
    }

    private static Map<String, Object> event(String id, String title, int enabled) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("id", id);
        fields.put("title", title);
        fields.put("enabled", enabled);
        fields.put("category", "general");
        fields.put("target", "maingrp");
        fields.put("plugin", "shellplug");
        return fields;
    }

    private static String capture(Runnable command) {
        PrintStream originalOut = System.out;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            command.run();
        } finally {
            System.setOut(originalOut);
        }
        return out.toString(StandardCharsets.UTF_8);
    }
}
