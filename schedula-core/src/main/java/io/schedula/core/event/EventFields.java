package io.schedula.core.event;

import io.schedula.core.error.ValidationException;
import java.math.BigDecimal;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Field formats and the whitelist of client-writable event fields.
 */
public final class EventFields {
    public static final Pattern ID = Pattern.compile("^\\w+$");
    public static final Pattern TITLE = Pattern.compile("\\S");
    public static final Pattern TOKEN = Pattern.compile("^\\w+$");
    public static final Pattern TARGET = Pattern.compile("^[\\w\\-.]+$");
    public static final Pattern BINARY = Pattern.compile("^(1|0)$");

    public static final String RESET_CURSOR = "reset_cursor";
    public static final String ABORT_JOBS = "abort_jobs";

    /** Assigned by the registry; ignored when a client sends them. */
    public static final Set<String> SERVER_MANAGED = Set.of("created", "modified", "api_key", "username");

    private static final BigDecimal MAX_COUNT = BigDecimal.valueOf(Integer.MAX_VALUE);
    private static final Set<String> FLAGS = Set.of("enabled", "catch_up", "multiplex", "detached", "queue");
    private static final Set<String> COUNTS = Set.of(
        "max_children", "timeout", "stagger", "retries", "retry_delay", "queue_max"
    );
    private static final Set<String> TEXTS = Set.of(
        "timezone", "chain", "chain_error", "notify_success", "notify_fail", "web_hook", "notes", "algo"
    );
    private static final Set<String> MAPS = Set.of("params", "timing");
    private static final Set<String> WRITABLE;

    static {
        Set<String> writable = new HashSet<>();
        writable.addAll(Set.of("title", "category", "target", "plugin"));
        writable.addAll(FLAGS);
        writable.addAll(COUNTS);
        writable.addAll(TEXTS);
        writable.addAll(MAPS);
        WRITABLE = Set.copyOf(writable);
    }

    private EventFields() {
    }

    public static boolean isWritable(String field) {
        return WRITABLE.contains(field);
    }

    /**
     * Normalizes the writable fields of a client payload. Unknown keys are rejected;
     * {@code id}, server-managed fields and the given {@code skip} keys are left out of the result.
     */
    public static Map<String, Object> normalizeWritable(Map<String, Object> raw, Set<String> skip) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : raw.entrySet()) {
            String field = entry.getKey();
            if ("id".equals(field) || SERVER_MANAGED.contains(field) || skip.contains(field)) {
                continue;
            }
            if (!isWritable(field)) {
                throw new ValidationException(field, "Unknown event field: " + field);
            }
            normalized.put(field, normalize(field, entry.getValue()));
        }
        return normalized;
    }

    public static Object normalize(String field, Object value) {
        return switch (field) {
            case "title" -> requireMatch(field, value, TITLE);
            case "category", "plugin" -> requireMatch(field, value, TOKEN);
            case "target" -> requireMatch(field, value, TARGET);
            default -> {
                if (FLAGS.contains(field)) {
                    yield flag(field, value);
                }
                if (COUNTS.contains(field)) {
                    yield count(field, value);
                }
                if (TEXTS.contains(field)) {
                    yield value == null ? "" : String.valueOf(value);
                }
                if (MAPS.contains(field)) {
                    yield map(field, value);
                }
                throw new ValidationException(field, "Unknown event field: " + field);
            }
        };
    }

    /**
     * Lowercases and strips non-word characters; returns an empty string when nothing is left.
     */
    public static String normalizeId(Object raw) {
        if (raw == null) {
            return "";
        }
        return String.valueOf(raw).toLowerCase(Locale.ROOT).replaceAll("\\W+", "");
    }

    public static int flag(String field, Object value) {
        if (value instanceof Boolean bool) {
            return bool ? 1 : 0;
        }
        String text = value == null ? "" : String.valueOf(value).trim();
        if ("1".equals(text) || "true".equalsIgnoreCase(text)) {
            return 1;
        }
        if ("0".equals(text) || "false".equalsIgnoreCase(text)) {
            return 0;
        }
        throw new ValidationException(field, "Invalid value for " + field + ": must be 0 or 1");
    }

    private static String requireMatch(String field, Object value, Pattern pattern) {
        String text = value == null ? "" : String.valueOf(value);
        if (!pattern.matcher(text).find()) {
            throw new ValidationException(field, "Missing or malformed parameter: " + field);
        }
        return text;
    }

    private static int count(String field, Object value) {
        String text = value == null ? "" : String.valueOf(value).trim();
        if (text.isEmpty()) {
            return 0;
        }
        BigDecimal parsed;
        try {
            parsed = new BigDecimal(text);
        } catch (NumberFormatException e) {
            throw new ValidationException(field, "Invalid value for " + field + ": not an integer");
        }
        if (parsed.signum() != 0 && parsed.stripTrailingZeros().scale() > 0) {
            throw new ValidationException(field, "Invalid value for " + field + ": not an integer");
        }
        if (parsed.signum() < 0) {
            throw new ValidationException(field, "Invalid value for " + field + ": must not be negative");
        }
        if (parsed.compareTo(MAX_COUNT) > 0) {
            throw new ValidationException(field, "Invalid value for " + field + ": out of range");
        }
        return parsed.intValue();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> map(String field, Object value) {
        if (value == null) {
            return Map.of();
        }
        if (value instanceof Map<?, ?> map) {
            return new LinkedHashMap<>((Map<String, Object>) map);
        }
        throw new ValidationException(field, "Invalid value for " + field + ": must be an object");
    }
}
