package io.schedula.core.event;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.schedula.core.bus.ClientUpdate;
import io.schedula.core.bus.MessageBus;
import io.schedula.core.cursor.CursorState;
import io.schedula.core.error.ConflictException;
import io.schedula.core.error.EventNotFoundException;
import io.schedula.core.error.ValidationException;
import io.schedula.core.identity.Principal;
import io.schedula.core.job.ActiveJobSource;
import io.schedula.core.job.Job;
import io.schedula.core.job.JobAbortCoordinator;
import io.schedula.core.job.JobHistoryService;
import io.schedula.core.observability.ActivityService;
import io.schedula.core.request.RequestContext;
import io.schedula.core.scheduler.CatchUpRetickTrigger;
import io.schedula.core.store.ListPage;
import io.schedula.core.store.ListStore;
import io.schedula.core.store.StoreKeyNotFoundException;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CRUD over the schedule list. Every mutation is a single store call; the cursor, abort and
 * re-tick side effects run afterwards and cannot fail the request.
 */
public final class EventRegistry {
    public static final String SCHEDULE_KEY = "global/schedule";

    private static final Logger LOG = LoggerFactory.getLogger(EventRegistry.class);
    private static final List<String> REQUIRED = List.of("title", "enabled", "category", "target", "plugin");
    private static final TypeReference<LinkedHashMap<String, Object>> FIELDS = new TypeReference<>() {
    };

    private final ListStore store;
    private final CursorState cursors;
    private final ActiveJobSource activeJobs;
    private final JobAbortCoordinator abortCoordinator;
    private final CatchUpRetickTrigger retickTrigger;
    private final IdGenerator idGenerator;
    private final EventDefaults defaults;
    private final Clock clock;
    private final ActivityService activityService;
    private final MessageBus messageBus;
    private final ObjectMapper mapper;
    private final Object createLock = new Object();

    public EventRegistry(
        ListStore store,
        CursorState cursors,
        ActiveJobSource activeJobs,
        JobAbortCoordinator abortCoordinator,
        CatchUpRetickTrigger retickTrigger,
        IdGenerator idGenerator,
        EventDefaults defaults,
        Clock clock,
        ActivityService activityService,
        MessageBus messageBus
    ) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.cursors = Objects.requireNonNull(cursors, "cursors must not be null");
        this.activeJobs = Objects.requireNonNull(activeJobs, "activeJobs must not be null");
        this.abortCoordinator = Objects.requireNonNull(abortCoordinator, "abortCoordinator must not be null");
        this.retickTrigger = Objects.requireNonNull(retickTrigger, "retickTrigger must not be null");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator must not be null");
        this.defaults = Objects.requireNonNull(defaults, "defaults must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.activityService = activityService;
        this.messageBus = messageBus;
        this.mapper = new ObjectMapper();
        this.mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public ListPage<Event> list(int offset, int limit) throws IOException {
        ListPage<Map<String, Object>> page;
        try {
            page = store.listGet(SCHEDULE_KEY, Math.max(0, offset), limit <= 0 ? 50 : limit);
        } catch (StoreKeyNotFoundException e) {
            return ListPage.empty();
        }
        List<Event> events = new ArrayList<>();
        for (Map<String, Object> item : page.items()) {
            events.add(toEvent(item));
        }
        return new ListPage<>(events, page.length());
    }

    public Event get(String id) throws IOException {
        requireId(id);
        try {
            return toEvent(store.listFind(SCHEDULE_KEY, Map.of("id", id)));
        } catch (StoreKeyNotFoundException e) {
            throw new EventNotFoundException(id);
        }
    }

    public Event create(RequestContext context, Map<String, Object> fields) throws IOException {
        Map<String, Object> raw = fields == null ? Map.of() : fields;
        Map<String, Object> record = new LinkedHashMap<>();

        String id = EventFields.normalizeId(raw.get("id"));
        if (id.isEmpty()) {
            id = idGenerator.newId("e");
        }
        record.put("id", id);
        Object enabled = raw.get("enabled");
        if (enabled != null && !EventFields.BINARY.matcher(String.valueOf(enabled).trim()).matches()) {
            throw new ValidationException("enabled", "Missing or malformed parameter: enabled");
        }
        record.putAll(EventFields.normalizeWritable(raw, Set.of()));
        for (String field : REQUIRED) {
            if (!record.containsKey(field)) {
                throw new ValidationException(field, "Missing or malformed parameter: " + field);
            }
        }

        long now = nowSeconds();
        record.put("created", now);
        record.put("modified", now);
        record.putIfAbsent("max_children", 0);
        record.putIfAbsent("timeout", 0);
        Object timezone = record.get("timezone");
        if (timezone == null || String.valueOf(timezone).isBlank()) {
            record.put("timezone", defaults.timezone());
        }
        record.putIfAbsent("params", new LinkedHashMap<>());
        Principal principal = context.principal();
        record.put(principal.ownerField(), principal.ownerValue());

        Event event = toEvent(record);
        LOG.debug("Creating new event: {}", event.title());

        context.ensureActive("event create");
        synchronized (createLock) {
            if (exists(id)) {
                throw new ConflictException("Failed to create event: id already in use: " + id);
            }
            store.listUnshift(SCHEDULE_KEY, toMap(event));
        }

        LOG.debug("Successfully created event: {}", event.title());
        recordActivity("event_create", event, principal);
        publish(ClientUpdate.schedule());
        cursors.onCreate(id);
        return event;
    }

    /**
     * Applies a patch and returns the merged record. {@code reset_cursor} and {@code abort_jobs}
     * are consumed here and never stored.
     */
    public Event update(RequestContext context, String id, Map<String, Object> rawPatch) throws IOException {
        requireId(id);
        EventPatch patch = EventPatch.parse(rawPatch);

        context.ensureActive("event lookup");
        Event existing = get(id);

        Map<String, Object> updates = new LinkedHashMap<>(patch.fields());
        updates.put("modified", nowSeconds());
        LOG.debug("Updating event: {} {}", existing.title(), updates.keySet());

        context.ensureActive("event update");
        try {
            store.listFindUpdate(SCHEDULE_KEY, Map.of("id", id), updates);
        } catch (StoreKeyNotFoundException e) {
            throw new EventNotFoundException(id);
        }

        Map<String, Object> merged = toMap(existing);
        merged.putAll(updates);
        Event event = toEvent(merged);

        if (patch.resetCursor() != null) {
            cursors.reset(id, patch.resetCursor());
        }

        LOG.debug("Successfully updated event: {} ({})", event.id(), event.title());
        recordActivity("event_update", event, context.principal());
        publish(ClientUpdate.schedule());

        abortCoordinator.maybeAbort(event, patch.abortJobs());
        retickTrigger.maybeRetick(event, patch);
        return event;
    }

    /**
     * Deletes an event that has no attached running jobs. Detached jobs do not block deletion.
     */
    public Event delete(RequestContext context, String id) throws IOException {
        requireId(id);

        context.ensureActive("active job check");
        for (Job job : activeJobs.activeJobs().values()) {
            if (job.belongsTo(id) && !job.detached()) {
                throw new ConflictException("Failed to delete event: Still has running jobs");
            }
        }

        LOG.debug("Deleting event: {}", id);
        context.ensureActive("event delete");
        Event event;
        try {
            event = toEvent(store.listFindDelete(SCHEDULE_KEY, Map.of("id", id)));
        } catch (StoreKeyNotFoundException e) {
            throw new EventNotFoundException(id);
        }

        LOG.debug("Successfully deleted event: {}", event.title());
        recordActivity("event_delete", event, context.principal());
        publish(ClientUpdate.schedule());

        try {
            store.expire(JobHistoryService.eventLogKey(id), nowSeconds() + defaults.historyExpirySeconds());
        } catch (IOException e) {
            LOG.warn("Failed to schedule history expiry for event {}: {}", id, e.getMessage());
        }
        cursors.remove(id);
        return event;
    }

    private boolean exists(String id) throws IOException {
        try {
            store.listFind(SCHEDULE_KEY, Map.of("id", id));
            return true;
        } catch (StoreKeyNotFoundException e) {
            return false;
        }
    }

    private void requireId(String id) {
        if (id == null || !EventFields.ID.matcher(id).matches()) {
            throw new ValidationException("id", "Missing or malformed parameter: id");
        }
    }

    private Event toEvent(Map<String, Object> item) {
        return mapper.convertValue(item, Event.class);
    }

    private Map<String, Object> toMap(Event event) {
        return mapper.convertValue(event, FIELDS);
    }

    private long nowSeconds() {
        return clock.instant().getEpochSecond();
    }

    private void recordActivity(String type, Event event, Principal principal) {
        if (activityService == null) {
            return;
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("event", event.id());
        attributes.put("title", event.title());
        attributes.put("source", principal.sourceLabel());
        try {
            activityService.record(type, attributes);
        } catch (Exception e) {
            LOG.debug("Failed to record {} for event {}: {}", type, event.id(), e.getMessage());
        }
    }

    private void publish(ClientUpdate update) {
        if (messageBus != null) {
            messageBus.publish(update);
        }
    }
}
