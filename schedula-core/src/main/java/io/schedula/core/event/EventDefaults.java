package io.schedula.core.event;

import java.time.ZoneId;

/**
 * Values applied by the registry: the timezone given to events created without one, and how long
 * a deleted event's history log is kept before the maintenance sweep removes it.
 */
public record EventDefaults(String timezone, long historyExpirySeconds) {
    public static final long DEFAULT_HISTORY_EXPIRY_SECONDS = 86_400;

    public EventDefaults {
        timezone = timezone == null || timezone.isBlank() ? ZoneId.systemDefault().getId() : timezone.trim();
        historyExpirySeconds = historyExpirySeconds <= 0 ? DEFAULT_HISTORY_EXPIRY_SECONDS : historyExpirySeconds;
    }
}
