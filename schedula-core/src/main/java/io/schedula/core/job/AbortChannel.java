package io.schedula.core.job;

/**
 * Asks the runner to abort a job. Delivery is asynchronous and unconfirmed.
 */
@FunctionalInterface
public interface AbortChannel {
    void requestAbort(String jobId, String reason);
}
