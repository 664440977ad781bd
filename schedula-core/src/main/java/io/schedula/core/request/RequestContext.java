package io.schedula.core.request;

import io.schedula.core.error.RequestExpiredException;
import io.schedula.core.identity.Principal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Request-scoped state carried through a coordinator operation: the resolved caller,
 * the deadline for primary store calls, and a cancellation flag.
 */
public final class RequestContext {
    private final Principal principal;
    private final Instant deadline;
    private final Clock clock;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public RequestContext(Principal principal, Instant deadline, Clock clock) {
        this.principal = Objects.requireNonNull(principal, "principal must not be null");
        this.deadline = deadline == null ? Instant.MAX : deadline;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public static RequestContext of(Principal principal, Clock clock, Duration timeout) {
        Instant deadline = timeout == null || timeout.isZero() || timeout.isNegative()
            ? Instant.MAX
            : clock.instant().plus(timeout);
        return new RequestContext(principal, deadline, clock);
    }

    public static RequestContext unbounded(Principal principal, Clock clock) {
        return new RequestContext(principal, Instant.MAX, clock);
    }

    public Principal principal() {
        return principal;
    }

    public void cancel() {
        cancelled.set(true);
    }

    /**
     * Called before each primary external call. Once a request is cancelled or past its
     * deadline, no further primary mutation is started.
     */
    public void ensureActive(String step) {
        if (cancelled.get()) {
            throw new RequestExpiredException("Request cancelled before " + step);
        }
        if (clock.instant().isAfter(deadline)) {
            throw new RequestExpiredException("Request deadline exceeded before " + step);
        }
    }
}
