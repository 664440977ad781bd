package io.schedula.core.job;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.schedula.core.error.LaunchException;
import io.schedula.core.event.Event;
import io.schedula.core.event.EventRegistry;
import io.schedula.core.identity.Principal;
import io.schedula.core.observability.ActivityService;
import io.schedula.core.request.RequestContext;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a manual run request into launched jobs. The launcher decides how many jobs one request
 * expands into; every resulting id is returned.
 */
public final class JobLaunchMultiplexer {
    private static final Logger LOG = LoggerFactory.getLogger(JobLaunchMultiplexer.class);
    private static final TypeReference<LinkedHashMap<String, Object>> FIELDS = new TypeReference<>() {
    };

    private final EventRegistry registry;
    private final JobLauncher launcher;
    private final ActivityService activityService;
    private final ObjectMapper mapper = new ObjectMapper();

    public JobLaunchMultiplexer(EventRegistry registry, JobLauncher launcher, ActivityService activityService) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.launcher = Objects.requireNonNull(launcher, "launcher must not be null");
        this.activityService = activityService;
    }

    public List<String> run(RequestContext context, String eventId, Map<String, Object> overrides) throws IOException {
        context.ensureActive("event lookup");
        Event event = registry.get(eventId);

        JobSpec spec = buildSpec(event, overrides, context.principal());
        LOG.debug("Running event manually: {}", spec.title());

        context.ensureActive("launch");
        List<Job> launched;
        try {
            launched = launcher.launch(spec);
        } catch (LaunchException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new LaunchException(e.getMessage() == null ? "launch failed" : e.getMessage(), e);
        }

        List<String> ids = new ArrayList<>();
        for (Job job : launched) {
            ids.add(job.id());
            recordRun(job, event, context.principal());
        }
        return ids;
    }

    JobSpec buildSpec(Event event, Map<String, Object> overrides, Principal principal) {
        // serializing yields an independent copy, nested maps included
        Map<String, Object> fields = mapper.convertValue(event, FIELDS);
        if (overrides != null) {
            for (Map.Entry<String, Object> entry : overrides.entrySet()) {
                if ("id".equals(entry.getKey())) {
                    continue;
                }
                fields.put(entry.getKey(), entry.getValue());
            }
        }
        fields.remove("api_key");
        fields.remove("username");
        fields.put("source", principal.sourceLabel());
        fields.put(principal.ownerField(), principal.ownerValue());
        return new JobSpec(fields);
    }

    private void recordRun(Job job, Event event, Principal principal) {
        if (activityService == null) {
            return;
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("job_id", job.id());
        attributes.put("event", event.id());
        attributes.put("title", event.title());
        attributes.put("source", principal.sourceLabel());
        try {
            activityService.record("job_run", attributes);
        } catch (Exception e) {
            LOG.debug("Failed to record job_run for {}: {}", job.id(), e.getMessage());
        }
    }
}
