package io.schedula.core.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.schedula.core.bus.InMemoryMessageBus;
import io.schedula.core.cursor.CursorState;
import io.schedula.core.cursor.SchedulerState;
import io.schedula.core.event.EventDefaults;
import io.schedula.core.event.EventRegistry;
import io.schedula.core.identity.StaticPrincipalResolver;
import io.schedula.core.job.Job;
import io.schedula.core.job.JobAbortCoordinator;
import io.schedula.core.job.JobHistoryService;
import io.schedula.core.job.JobLaunchMultiplexer;
import io.schedula.core.observability.ActivityService;
import io.schedula.core.observability.FileActivityStore;
import io.schedula.core.scheduler.CatchUpRetickTrigger;
import io.schedula.core.scheduler.SchedulerControl;
import io.schedula.core.store.FileListStore;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GatewayServerTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newHttpClient();
    private final Map<String, Job> activeJobs = new LinkedHashMap<>();
    private InMemoryMessageBus bus;
    private GatewayServer server;

    @BeforeEach
    void setUp() {
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
        FileListStore store = new FileListStore(tempDir.resolve("lists"));
        ActivityService activity = new ActivityService(new FileActivityStore(tempDir.resolve("activity.json")), clock);
        bus = new InMemoryMessageBus();
        EventRegistry registry = new EventRegistry(
            store,
            new CursorState(SchedulerState.restore(null), null, null, clock),
            () -> activeJobs,
            new JobAbortCoordinator(() -> activeJobs, (jobId, reason) -> {
            }),
            new CatchUpRetickTrigger(idle, clock),
            prefix -> prefix + "auto",
            new EventDefaults("UTC", 0),
            clock,
            activity,
            bus
        );
        JobLaunchMultiplexer multiplexer = new JobLaunchMultiplexer(
            registry,
            spec -> List.of(new Job("j1", spec.eventId(), false, spec.source()), new Job("j2", spec.eventId(), false, spec.source())),
            activity
        );
        server = new GatewayServer(
            0,
            "127.0.0.1",
            registry,
            multiplexer,
            new JobHistoryService(store),
            new StaticPrincipalResolver(Map.of("k-1", "Deploy bot")),
            activity,
            bus,
            clock,
            Duration.ofSeconds(10)
        );
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void shouldReportHealth() throws Exception {
        HttpResponse<String> response = send(HttpRequest.newBuilder(uri("/healthz")).GET().build());

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).contains("ok");
    }

    @Test
    void shouldRejectCallsWithoutCredentials() throws Exception {
        HttpResponse<String> response = send(HttpRequest.newBuilder(uri("/api/app/get_schedule")).GET().build());

        assertThat(response.statusCode()).isEqualTo(401);
        assertThat(mapper.readTree(response.body()).path("code").asText()).isEqualTo("session");
    }

    @Test
    void shouldCreateFetchAndListEvents() throws Exception {
        JsonNode created = body(post("/api/app/create_event", """
            { "id": "Nightly Backup", "title": "Nightly backup", "enabled": 1,
              "category": "general", "target": "maingrp", "plugin": "shellplug" }
            """), 200);
        assertThat(created.path("code").asInt(-1)).isZero();
        assertThat(created.path("id").asText()).isEqualTo("nightlybackup");

        JsonNode fetched = body(get("/api/app/get_event?id=nightlybackup"), 200);
        assertThat(fetched.path("event").path("title").asText()).isEqualTo("Nightly backup");
        assertThat(fetched.path("event").path("api_key").asText()).isEqualTo("k-1");

        JsonNode schedule = body(get("/api/app/get_schedule?offset=0&limit=10"), 200);
        assertThat(schedule.path("rows")).hasSize(1);
        assertThat(schedule.path("list").path("length").asInt()).isEqualTo(1);
    }

    @Test
    void shouldMapCoordinatorErrorsToStatusCodes() throws Exception {
        JsonNode missing = body(post("/api/app/update_event", "{ \"id\": \"ghost\", \"title\": \"x\" }"), 404);
        assertThat(missing.path("code").asText()).isEqualTo("event");
        assertThat(missing.path("description").asText()).isEqualTo("Failed to locate event: ghost");

        JsonNode invalid = body(post("/api/app/create_event", "{ \"title\": \"x\" }"), 400);
        assertThat(invalid.path("code").asText()).isEqualTo("validation");

        createEvent("busy");
        activeJobs.put("j9", new Job("j9", "busy", false, "Scheduler"));
        JsonNode conflict = body(post("/api/app/delete_event", "{ \"id\": \"busy\" }"), 409);
        assertThat(conflict.path("code").asText()).isEqualTo("conflict");

        HttpResponse<String> wrongMethod = get("/api/app/delete_event?id=busy");
        assertThat(wrongMethod.statusCode()).isEqualTo(405);
    }

    @Test
    void shouldRunEventAndReturnAllJobIds() throws Exception {
        createEvent("deploy");

        JsonNode run = body(post("/api/app/run_event", "{ \"id\": \"deploy\", \"timeout\": 60 }"), 200);

        assertThat(run.path("ids")).extracting(JsonNode::asText).containsExactly("j1", "j2");
        JsonNode activity = body(get("/api/app/get_activity?limit=5"), 200);
        assertThat(activity.path("rows").toString()).contains("job_run");
    }

    @Test
    void shouldRecordCompletionsAndServeHistory() throws Exception {
        createEvent("report");
        body(post("/api/app/job_complete", "{ \"id\": \"j1\", \"event\": \"report\", \"code\": 0, \"elapsed\": 12 }"), 200);

        JsonNode eventHistory = body(get("/api/app/get_event_history?id=report"), 200);
        JsonNode history = body(get("/api/app/get_history"), 200);

        assertThat(eventHistory.path("rows").get(0).path("id").asText()).isEqualTo("j1");
        assertThat(history.path("list").path("length").asInt()).isEqualTo(1);
    }

    @Test
    void shouldPushScheduleUpdatesToWebSocketClients() throws Exception {
        CompletableFuture<String> firstFrame = new CompletableFuture<>();
        WebSocket ws = client.newWebSocketBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .buildAsync(URI.create("ws://127.0.0.1:" + server.port() + "/ws"), new WebSocket.Listener() {
                @Override
                public void onOpen(WebSocket webSocket) {
                    webSocket.request(1);
                }

                @Override
                public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
                    firstFrame.complete(data.toString());
                    return null;
                }
            })
            .join();

        createEvent("pushed");

        JsonNode frame = mapper.readTree(firstFrame.get(5, TimeUnit.SECONDS));
        assertThat(frame.path("type").asText()).isEqualTo("schedule");
        ws.sendClose(WebSocket.NORMAL_CLOSURE, "done").join();
    }

    private void createEvent(String id) throws Exception {
        body(post("/api/app/create_event", """
            { "id": "%s", "title": "Event %s", "enabled": 1,
              "category": "general", "target": "maingrp", "plugin": "shellplug" }
            """.formatted(id, id)), 200);
    }

    private HttpResponse<String> get(String path) throws Exception {
        return send(HttpRequest.newBuilder(uri(path)).header("X-API-Key", "k-1").GET().build());
    }

    private HttpResponse<String> post(String path, String json) throws Exception {
        return send(HttpRequest.newBuilder(uri(path))
            .header("X-API-Key", "k-1")
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(json))
            .build());
    }

    private JsonNode body(HttpResponse<String> response, int expectedStatus) throws Exception {
        assertThat(response.statusCode()).as(response.body()).isEqualTo(expectedStatus);
        return mapper.readTree(response.body());
    }

    private HttpResponse<String> send(HttpRequest request) throws Exception {
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + server.port() + path);
    }
}
