package io.schedula.core.job;

import io.schedula.core.store.ListPage;
import io.schedula.core.store.ListStore;
import io.schedula.core.store.StoreKeyNotFoundException;
import java.io.IOException;
import java.util.Map;
import java.util.Objects;

/**
 * Completed-job rows, kept newest first both per event ({@code logs/events/<id>}) and
 * across all events ({@code logs/completed}).
 */
public final class JobHistoryService {
    public static final String COMPLETED_KEY = "logs/completed";
    public static final String EVENT_LOG_PREFIX = "logs/events/";

    private final ListStore store;

    public JobHistoryService(ListStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    public static String eventLogKey(String eventId) {
        return EVENT_LOG_PREFIX + eventId;
    }

    public ListPage<Map<String, Object>> eventHistory(String eventId, int offset, int limit) throws IOException {
        return page(eventLogKey(eventId), offset, limit <= 0 ? 100 : limit);
    }

    public ListPage<Map<String, Object>> history(int offset, int limit) throws IOException {
        return page(COMPLETED_KEY, offset, limit <= 0 ? 50 : limit);
    }

    /**
     * Appends a finished job reported by the runner. Rows without an {@code event} only go to the global list.
     */
    public void recordCompletion(Map<String, Object> row) throws IOException {
        Object eventId = row.get("event");
        if (eventId != null && !String.valueOf(eventId).isBlank()) {
            store.listUnshift(eventLogKey(String.valueOf(eventId)), row);
        }
        store.listUnshift(COMPLETED_KEY, row);
    }

    private ListPage<Map<String, Object>> page(String key, int offset, int limit) throws IOException {
        try {
            return store.listGet(key, Math.max(0, offset), limit);
        } catch (StoreKeyNotFoundException e) {
            return ListPage.empty();
        }
    }
}
