package io.schedula.core.runner;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.schedula.core.error.LaunchException;
import io.schedula.core.job.AbortChannel;
import io.schedula.core.job.ActiveJobSource;
import io.schedula.core.job.Job;
import io.schedula.core.job.JobLauncher;
import io.schedula.core.job.JobSpec;
import io.schedula.core.scheduler.SchedulerControl;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP adapter for the job runner service, which owns job processes and the minute-tick scheduler.
 * Launches and status reads are synchronous; aborts and re-ticks are enqueued and never awaited.
 */
public final class JobRunnerClient implements JobLauncher, AbortChannel, ActiveJobSource, SchedulerControl {
    private static final Logger LOG = LoggerFactory.getLogger(JobRunnerClient.class);
    private static final MediaType JSON = MediaType.get("application/json");
    private static final TypeReference<Map<String, Job>> JOB_MAP = new TypeReference<>() {
    };

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final HttpUrl baseUrl;

    public JobRunnerClient(OkHttpClient client, ObjectMapper mapper, String baseUrl) {
        this.client = client;
        this.mapper = mapper;
        HttpUrl parsed = HttpUrl.parse(baseUrl);
        if (parsed == null) {
            throw new IllegalArgumentException("invalid runner base URL: " + baseUrl);
        }
        this.baseUrl = parsed;
    }

    @Override
    public List<Job> launch(JobSpec spec) {
        JsonNode payload;
        try {
            payload = post("api/job/launch", spec.fields());
        } catch (IOException e) {
            throw new LaunchException("Failed to launch event: " + e.getMessage(), e);
        }
        if (!isSuccess(payload)) {
            throw new LaunchException(payload.path("description").asText("launch refused"));
        }
        List<Job> jobs = new ArrayList<>();
        for (JsonNode node : payload.path("jobs")) {
            jobs.add(mapper.convertValue(node, Job.class));
        }
        return jobs;
    }

    @Override
    public Map<String, Job> activeJobs() throws IOException {
        JsonNode payload = get("api/job/active");
        if (!isSuccess(payload)) {
            throw new IOException("Runner refused active job listing: " + payload.path("description").asText(""));
        }
        JsonNode jobs = payload.path("jobs");
        if (jobs.isMissingNode() || jobs.isNull()) {
            return Map.of();
        }
        return mapper.convertValue(jobs, JOB_MAP);
    }

    @Override
    public void requestAbort(String jobId, String reason) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", jobId);
        body.put("reason", reason);
        enqueue("api/job/abort", body, "abort of job " + jobId);
    }

    @Override
    public void forceReevaluateNow() {
        enqueue("api/scheduler/retick", Map.of(), "scheduler re-tick");
    }

    @Override
    public SchedulerStatus status() {
        try {
            JsonNode payload = get("api/scheduler/status");
            return new SchedulerStatus(
                payload.path("grace_pending").asBoolean(false),
                payload.path("ticking").asBoolean(false)
            );
        } catch (IOException e) {
            LOG.warn("Could not read scheduler status, treating scheduler as busy: {}", e.getMessage());
            return SchedulerStatus.busy();
        }
    }

    private JsonNode get(String path) throws IOException {
        Request request = new Request.Builder().url(url(path)).get().build();
        try (Response response = client.newCall(request).execute()) {
            return parse(response);
        }
    }

    private JsonNode post(String path, Map<String, Object> body) throws IOException {
        Request request = new Request.Builder()
            .url(url(path))
            .post(RequestBody.create(mapper.writeValueAsString(body), JSON))
            .build();
        try (Response response = client.newCall(request).execute()) {
            return parse(response);
        }
    }

    private void enqueue(String path, Map<String, Object> body, String description) {
        Request request;
        try {
            request = new Request.Builder()
                .url(url(path))
                .post(RequestBody.create(mapper.writeValueAsString(body), JSON))
                .build();
        } catch (IOException e) {
            LOG.warn("Could not encode {}: {}", description, e.getMessage());
            return;
        }
        client.newCall(request).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                LOG.warn("Runner request for {} failed: {}", description, e.getMessage());
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (response) {
                    if (!response.isSuccessful()) {
                        LOG.warn("Runner rejected {} with HTTP {}", description, response.code());
                    }
                }
            }
        });
    }

    private JsonNode parse(Response response) throws IOException {
        String raw = response.body() == null ? "" : response.body().string();
        JsonNode payload = raw.isBlank() ? mapper.createObjectNode() : mapper.readTree(raw);
        if (!response.isSuccessful()) {
            if (!payload.has("description")) {
                throw new IOException("HTTP " + response.code() + " from runner");
            }
            if (payload instanceof ObjectNode object && !object.has("code")) {
                object.put("code", "http_" + response.code());
            }
        }
        return payload;
    }

    private boolean isSuccess(JsonNode payload) {
        JsonNode code = payload.path("code");
        return code.isMissingNode() || (code.isNumber() && code.asInt() == 0) || "0".equals(code.asText());
    }

    private HttpUrl url(String path) {
        return baseUrl.newBuilder().addPathSegments(path).build();
    }
}
