package io.schedula.core.scheduler;

/**
 * Control surface of the external minute-tick scheduler.
 */
public interface SchedulerControl {

    /**
     * Asks the scheduler to evaluate the current minute again, out of band. Not awaited.
     */
    void forceReevaluateNow();

    SchedulerStatus status();

    record SchedulerStatus(boolean gracePending, boolean ticking) {
        public static SchedulerStatus busy() {
            return new SchedulerStatus(true, true);
        }
    }
}
