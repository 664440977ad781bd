package io.schedula.core.job;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flat description of a job to launch: an event copy with run overrides applied on top.
 */
public record JobSpec(Map<String, Object> fields) {
    public JobSpec {
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public String eventId() {
        return text("id");
    }

    public String title() {
        return text("title");
    }

    public String source() {
        return text("source");
    }

    public Object get(String field) {
        return fields.get(field);
    }

    private String text(String field) {
        Object value = fields.get(field);
        return value == null ? "" : String.valueOf(value);
    }
}
