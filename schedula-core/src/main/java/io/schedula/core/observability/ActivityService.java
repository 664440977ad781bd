package io.schedula.core.observability;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Transaction log of coordinator mutations ({@code event_create}, {@code event_update},
 * {@code event_delete}, {@code job_run}), capped at the most recent entries.
 */
public final class ActivityService {
    private static final int MAX_EVENTS = 20_000;

    private final ActivityStore store;
    private final Clock clock;

    public ActivityService(ActivityStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public synchronized ActivityEvent record(String type, Map<String, Object> attributes) throws IOException {
        List<ActivityEvent> all = new ArrayList<>(store.load());
        ActivityEvent event = new ActivityEvent(
            UUID.randomUUID().toString(),
            clock.instant(),
            type,
            attributes
        );
        all.add(event);
        if (all.size() > MAX_EVENTS) {
            all = new ArrayList<>(all.subList(all.size() - MAX_EVENTS, all.size()));
        }
        store.save(all);
        return event;
    }

    public synchronized List<ActivityEvent> recent(int limit) throws IOException {
        int safe = Math.max(1, limit);
        return store.load().stream()
            .sorted(Comparator.comparing(ActivityEvent::timestamp).reversed())
            .limit(safe)
            .toList();
    }

    public synchronized List<ActivityEvent> recentOfType(String type, int limit) throws IOException {
        int safe = Math.max(1, limit);
        return store.load().stream()
            .filter(event -> type.equalsIgnoreCase(event.type()))
            .sorted(Comparator.comparing(ActivityEvent::timestamp).reversed())
            .limit(safe)
            .toList();
    }
}
