package io.schedula.core.job;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A job owned by the external runner. The coordinator only reads these.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Job(
    String id,
    String event,
    boolean detached,
    String source,
    String hostname,
    @JsonProperty("event_title") String eventTitle
) {
    public Job(String id, String event, boolean detached, String source) {
        this(id, event, detached, source, null, null);
    }

    public boolean belongsTo(String eventId) {
        return eventId != null && eventId.equals(event);
    }
}
