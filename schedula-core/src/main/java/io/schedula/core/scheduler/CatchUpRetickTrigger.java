package io.schedula.core.scheduler;

import io.schedula.core.event.Event;
import io.schedula.core.event.EventPatch;
import java.time.Clock;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-enabling a catch-up event mid-minute re-ticks the scheduler so backfill starts without
 * waiting for the next minute boundary.
 */
public final class CatchUpRetickTrigger {
    private static final Logger LOG = LoggerFactory.getLogger(CatchUpRetickTrigger.class);

    private final SchedulerControl scheduler;
    private final Clock clock;

    public CatchUpRetickTrigger(SchedulerControl scheduler, Clock clock) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @return true when a re-evaluation was requested
     */
    public boolean maybeRetick(Event event, EventPatch patch) {
        if (!patch.enables() || !event.catchUpFlag()) {
            return false;
        }
        // second 59 races the scheduler's own minute boundary
        if (Math.floorMod(clock.instant().getEpochSecond(), 60) == 59) {
            return false;
        }
        SchedulerControl.SchedulerStatus status = scheduler.status();
        if (status.gracePending() || status.ticking()) {
            return false;
        }
        LOG.debug("Catch-up event {} re-enabled, forcing scheduler re-tick", event.id());
        try {
            scheduler.forceReevaluateNow();
            return true;
        } catch (RuntimeException e) {
            LOG.warn("Scheduler re-tick for event {} failed: {}", event.id(), e.getMessage());
            return false;
        }
    }
}
