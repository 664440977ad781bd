package io.schedula.core.bus;

import java.util.Map;

/**
 * A change notification for connected clients: {@code schedule} when the event list changed,
 * {@code state} when scheduler cursors changed.
 */
public record ClientUpdate(String type, Map<String, Object> data) {
    public ClientUpdate {
        type = type == null ? "" : type.trim();
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    public static ClientUpdate schedule() {
        return new ClientUpdate("schedule", Map.of());
    }

    public static ClientUpdate state(Map<String, Object> state) {
        return new ClientUpdate("state", state);
    }
}
