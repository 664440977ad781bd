package io.schedula.core.runner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.schedula.core.error.LaunchException;
import io.schedula.core.job.Job;
import io.schedula.core.job.JobSpec;
import io.schedula.core.scheduler.SchedulerControl;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JobRunnerClientTest {

    private MockWebServer server;
    private JobRunnerClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = new JobRunnerClient(new OkHttpClient(), new ObjectMapper(), server.url("/").toString());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldLaunchAndReturnEveryJob() throws Exception {
        server.enqueue(json(200, """
            {
              "code": 0,
              "jobs": [
                { "id": "j1", "event": "e1", "detached": false, "source": "Manual (ops)", "hostname": "web01" },
                { "id": "j2", "event": "e1", "detached": false, "source": "Manual (ops)", "hostname": "web02" }
              ]
            }
            """));

        List<Job> jobs = client.launch(new JobSpec(Map.of("id", "e1", "title", "Deploy", "source", "Manual (ops)")));

        assertThat(jobs).extracting(Job::id).containsExactly("j1", "j2");
        assertThat(jobs.get(1).hostname()).isEqualTo("web02");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/api/job/launch");
        assertThat(request.getBody().readUtf8()).contains("\"title\":\"Deploy\"");
    }

    @Test
    void shouldSurfaceRunnerRefusalVerbatim() {
        server.enqueue(json(200, """
            { "code": "job", "description": "Maximum of 1 job already running for event: Deploy" }
            """));
        server.enqueue(json(500, """
            { "description": "No servers found for target: webgrp" }
            """));

        JobSpec spec = new JobSpec(Map.of("id", "e1"));
        assertThatThrownBy(() -> client.launch(spec))
            .isInstanceOf(LaunchException.class)
            .hasMessage("Maximum of 1 job already running for event: Deploy");
        assertThatThrownBy(() -> client.launch(spec))
            .isInstanceOf(LaunchException.class)
            .hasMessage("No servers found for target: webgrp");
    }

    @Test
    void shouldReadActiveJobsKeyedById() throws Exception {
        server.enqueue(json(200, """
            {
              "code": 0,
              "jobs": {
                "j1": { "id": "j1", "event": "e1", "detached": true, "source": "Scheduler", "event_title": "Deploy" }
              }
            }
            """));

        Map<String, Job> active = client.activeJobs();

        assertThat(active).containsOnlyKeys("j1");
        assertThat(active.get("j1").detached()).isTrue();
        assertThat(active.get("j1").eventTitle()).isEqualTo("Deploy");
    }

    @Test
    void shouldFailActiveJobListingOnServerError() {
        server.enqueue(new MockResponse().setResponseCode(502));

        assertThatThrownBy(() -> client.activeJobs()).isInstanceOf(IOException.class);
    }

    @Test
    void shouldTreatUnreadableSchedulerStatusAsBusy() {
        server.enqueue(json(200, """
            { "grace_pending": false, "ticking": true }
            """));
        server.enqueue(new MockResponse().setResponseCode(500));

        assertThat(client.status()).isEqualTo(new SchedulerControl.SchedulerStatus(false, true));
        assertThat(client.status()).isEqualTo(SchedulerControl.SchedulerStatus.busy());
    }

    @Test
    void shouldSendAbortAndRetickWithoutWaiting() throws Exception {
        server.enqueue(json(200, "{ \"code\": 0 }"));
        server.enqueue(json(200, "{ \"code\": 0 }"));

        client.requestAbort("j1", "Event 'Deploy' has been disabled.");
        RecordedRequest abort = server.takeRequest(5, TimeUnit.SECONDS);
        client.forceReevaluateNow();
        RecordedRequest retick = server.takeRequest(5, TimeUnit.SECONDS);

        assertThat(abort).isNotNull();
        assertThat(abort.getPath()).isEqualTo("/api/job/abort");
        assertThat(abort.getBody().readUtf8()).contains("\"id\":\"j1\"").contains("has been disabled.");
        assertThat(retick).isNotNull();
        assertThat(retick.getPath()).isEqualTo("/api/scheduler/retick");
    }

    private static MockResponse json(int status, String body) {
        return new MockResponse()
            .setResponseCode(status)
            .setHeader("Content-Type", "application/json")
            .setBody(body);
    }
}
