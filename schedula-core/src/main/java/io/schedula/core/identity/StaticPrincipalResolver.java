package io.schedula.core.identity;

import java.util.Map;
import java.util.Optional;

/**
 * Resolves API keys against a fixed key-to-title table and trusts any non-blank user name
 * forwarded by the fronting session layer.
 */
public final class StaticPrincipalResolver implements PrincipalResolver {
    private final Map<String, String> apiKeys;

    public StaticPrincipalResolver(Map<String, String> apiKeys) {
        this.apiKeys = apiKeys == null ? Map.of() : Map.copyOf(apiKeys);
    }

    @Override
    public Optional<Principal> resolve(String apiKey, String username) {
        if (apiKey != null && !apiKey.isBlank()) {
            String key = apiKey.trim();
            String title = apiKeys.get(key);
            if (title == null) {
                return Optional.empty();
            }
            return Optional.of(new ApiKeyPrincipal(key, title));
        }
        if (username != null && !username.isBlank()) {
            return Optional.of(new UserPrincipal(username));
        }
        return Optional.empty();
    }
}
