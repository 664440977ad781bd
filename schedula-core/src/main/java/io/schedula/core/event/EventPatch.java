package io.schedula.core.event;

import io.schedula.core.error.ValidationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A parsed update request: the whitelisted field overwrites plus the two directives,
 * which are routed to the coordinator and never persisted.
 */
public record EventPatch(Map<String, Object> fields, Long resetCursor, boolean abortJobs) {
    private static final Set<String> DIRECTIVES = Set.of(EventFields.RESET_CURSOR, EventFields.ABORT_JOBS);

    public EventPatch {
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static EventPatch parse(Map<String, Object> raw) {
        Map<String, Object> source = raw == null ? Map.of() : raw;
        Map<String, Object> fields = EventFields.normalizeWritable(source, DIRECTIVES);
        return new EventPatch(
            fields,
            parseResetCursor(source.get(EventFields.RESET_CURSOR)),
            isTruthy(source.get(EventFields.ABORT_JOBS))
        );
    }

    /**
     * True when this patch explicitly sets {@code enabled} to 1.
     */
    public boolean enables() {
        Object enabled = fields.get("enabled");
        return enabled instanceof Integer value && value == 1;
    }

    private static Long parseResetCursor(Object value) {
        if (value == null || String.valueOf(value).isBlank()) {
            return null;
        }
        long parsed;
        try {
            parsed = value instanceof Number number ? number.longValue() : Long.parseLong(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new ValidationException(EventFields.RESET_CURSOR, "Invalid value for reset_cursor: not an epoch timestamp");
        }
        // zero means "no reset", as with an absent key
        return parsed == 0 ? null : parsed;
    }

    private static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0;
        }
        String text = String.valueOf(value).trim();
        return !text.isEmpty() && !"0".equals(text) && !"false".equalsIgnoreCase(text);
    }
}
