package io.schedula.core.identity;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class StaticPrincipalResolverTest {

    private final StaticPrincipalResolver resolver = new StaticPrincipalResolver(Map.of("k-1", "Deploy bot"));

    @Test
    void shouldPreferApiKeyOverUsername() {
        Principal principal = resolver.resolve("k-1", "admin").orElseThrow();

        assertThat(principal).isEqualTo(new ApiKeyPrincipal("k-1", "Deploy bot"));
        assertThat(principal.sourceLabel()).isEqualTo("API Key (Deploy bot)");
        assertThat(principal.ownerField()).isEqualTo("api_key");
    }

    @Test
    void shouldResolveForwardedUsername() {
        Principal principal = resolver.resolve("", "admin").orElseThrow();

        assertThat(principal.sourceLabel()).isEqualTo("Manual (admin)");
        assertThat(principal.ownerField()).isEqualTo("username");
        assertThat(principal.ownerValue()).isEqualTo("admin");
    }

    @Test
    void shouldRejectUnknownKeyAndMissingCredentials() {
        assertThat(resolver.resolve("k-unknown", "admin")).isEmpty();
        assertThat(resolver.resolve(null, " ")).isEmpty();
    }
}
