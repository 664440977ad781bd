package io.schedula.core.identity;

/**
 * The caller of a coordinator operation, resolved once per request by the identity layer.
 * Exactly one of the two implementations is present: {@link ApiKeyPrincipal} or {@link UserPrincipal}.
 */
public interface Principal {

    /**
     * Human-readable description used as the {@code source} of manually launched jobs.
     */
    String sourceLabel();

    /**
     * Owner field written onto records created by this principal ({@code api_key} or {@code username}).
     */
    String ownerField();

    String ownerValue();
}
