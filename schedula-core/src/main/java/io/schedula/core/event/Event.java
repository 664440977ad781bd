package io.schedula.core.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * A scheduled-event definition as persisted in the schedule list. Flags are stored as {@code 0}/{@code 1}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Event(
    String id,
    String title,
    int enabled,
    String category,
    String target,
    String plugin,
    @JsonProperty("max_children") int maxChildren,
    int timeout,
    String timezone,
    Map<String, Object> params,
    long created,
    long modified,
    @JsonProperty("catch_up") Integer catchUp,
    Map<String, Object> timing,
    Integer multiplex,
    Integer stagger,
    Integer retries,
    @JsonProperty("retry_delay") Integer retryDelay,
    Integer detached,
    Integer queue,
    @JsonProperty("queue_max") Integer queueMax,
    String chain,
    @JsonProperty("chain_error") String chainError,
    @JsonProperty("notify_success") String notifySuccess,
    @JsonProperty("notify_fail") String notifyFail,
    @JsonProperty("web_hook") String webHook,
    String notes,
    String algo,
    @JsonProperty("api_key") String apiKey,
    String username
) {
    public Event {
        params = params == null ? Map.of() : params;
    }

    public boolean enabledFlag() {
        return enabled == 1;
    }

    public boolean catchUpFlag() {
        return catchUp != null && catchUp == 1;
    }
}
