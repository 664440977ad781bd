package io.schedula.core.cursor;

import io.schedula.core.bus.ClientUpdate;
import io.schedula.core.bus.MessageBus;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the per-event scheduler cursor: the epoch second of the last minute the scheduler
 * considered for the event. Values are always truncated to a minute boundary.
 */
public final class CursorState {
    private static final Logger LOG = LoggerFactory.getLogger(CursorState.class);
    private static final long TICK_SECONDS = 60;

    private final SchedulerState state;
    private final SchedulerStateStore store;
    private final MessageBus bus;
    private final Clock clock;

    public CursorState(SchedulerState state, SchedulerStateStore store, MessageBus bus, Clock clock) {
        this.state = Objects.requireNonNull(state, "state must not be null");
        this.store = store;
        this.bus = bus;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * A new event starts at the current minute so it is not retroactively due.
     */
    public synchronized long onCreate(String eventId) {
        long minute = truncate(clock.instant().getEpochSecond());
        state.putCursor(eventId, minute);
        changed();
        return minute;
    }

    /**
     * Backs the cursor up one tick before {@code requestedEpochSeconds} so the next scheduler
     * pass evaluates the requested minute as due.
     */
    public synchronized long reset(String eventId, long requestedEpochSeconds) {
        long minute = truncate(requestedEpochSeconds - TICK_SECONDS);
        LOG.debug("Resetting cursor of event {} to {}", eventId, Instant.ofEpochSecond(minute));
        state.putCursor(eventId, minute);
        changed();
        return minute;
    }

    public synchronized void remove(String eventId) {
        state.removeCursor(eventId);
        state.removeRobin(eventId);
        changed();
    }

    public OptionalLong get(String eventId) {
        return state.cursor(eventId);
    }

    static long truncate(long epochSeconds) {
        return Math.floorDiv(epochSeconds, TICK_SECONDS) * TICK_SECONDS;
    }

    /**
     * Runs under the instance lock so snapshots reach the store in mutation order.
     */
    private void changed() {
        SchedulerState.Snapshot snapshot = state.snapshot();
        if (store != null) {
            try {
                store.save(snapshot);
            } catch (IOException e) {
                LOG.warn("Failed to persist scheduler state: {}", e.getMessage());
            }
        }
        if (bus != null) {
            bus.publish(ClientUpdate.state(Map.of("cursors", snapshot.cursors())));
        }
    }
}
