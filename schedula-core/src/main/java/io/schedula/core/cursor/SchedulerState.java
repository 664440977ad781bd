package io.schedula.core.cursor;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide scheduler bookkeeping, created once at startup and handed to the components that
 * own its mutations: {@code cursors} holds the last minute the scheduler considered per event and
 * {@code robins} the round-robin position used when an event rotates across target servers.
 */
public final class SchedulerState {
    private final Map<String, Long> cursors = new ConcurrentHashMap<>();
    private final Map<String, Integer> robins = new ConcurrentHashMap<>();

    public static SchedulerState restore(Snapshot snapshot) {
        SchedulerState state = new SchedulerState();
        if (snapshot != null) {
            state.cursors.putAll(snapshot.cursors());
            state.robins.putAll(snapshot.robins());
        }
        return state;
    }

    OptionalLong cursor(String eventId) {
        Long value = cursors.get(eventId);
        return value == null ? OptionalLong.empty() : OptionalLong.of(value);
    }

    void putCursor(String eventId, long minute) {
        cursors.put(eventId, minute);
    }

    void removeCursor(String eventId) {
        cursors.remove(eventId);
    }

    public OptionalInt robin(String eventId) {
        Integer value = robins.get(eventId);
        return value == null ? OptionalInt.empty() : OptionalInt.of(value);
    }

    void removeRobin(String eventId) {
        robins.remove(eventId);
    }

    public Snapshot snapshot() {
        return new Snapshot(Map.copyOf(cursors), Map.copyOf(robins));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Snapshot(Map<String, Long> cursors, Map<String, Integer> robins) {
        public Snapshot {
            cursors = cursors == null ? Map.of() : Map.copyOf(cursors);
            robins = robins == null ? Map.of() : Map.copyOf(robins);
        }
    }
}
