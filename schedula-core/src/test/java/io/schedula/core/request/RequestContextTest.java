package io.schedula.core.request;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.schedula.core.error.RequestExpiredException;
import io.schedula.core.identity.UserPrincipal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class RequestContextTest {

    @Test
    void shouldFailOnceDeadlinePasses() {
        MutableClock clock = new MutableClock(Instant.parse("2026-03-02T10:00:00Z"));
        RequestContext context = RequestContext.of(new UserPrincipal("ops"), clock, Duration.ofSeconds(30));

        assertThatCode(() -> context.ensureActive("lookup")).doesNotThrowAnyException();
        clock.now = clock.now.plusSeconds(31);
        assertThatThrownBy(() -> context.ensureActive("update"))
            .isInstanceOf(RequestExpiredException.class)
            .hasMessageContaining("update");
    }

    @Test
    void shouldFailOnceCancelled() {
        RequestContext context = RequestContext.unbounded(new UserPrincipal("ops"), Clock.systemUTC());

        context.cancel();

        assertThatThrownBy(() -> context.ensureActive("launch")).isInstanceOf(RequestExpiredException.class);
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
