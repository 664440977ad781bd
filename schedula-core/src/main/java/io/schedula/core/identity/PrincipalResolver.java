package io.schedula.core.identity;

import java.util.Optional;

/**
 * Resolves the caller from request credentials. An API key takes precedence over a user name.
 */
public interface PrincipalResolver {
    Optional<Principal> resolve(String apiKey, String username);
}
