package io.schedula.core.job;

import io.schedula.core.event.Event;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Aborts the attached jobs of an event that an update has just disabled.
 */
public final class JobAbortCoordinator {
    private static final Logger LOG = LoggerFactory.getLogger(JobAbortCoordinator.class);

    private final ActiveJobSource activeJobs;
    private final AbortChannel abortChannel;

    public JobAbortCoordinator(ActiveJobSource activeJobs, AbortChannel abortChannel) {
        this.activeJobs = Objects.requireNonNull(activeJobs, "activeJobs must not be null");
        this.abortChannel = Objects.requireNonNull(abortChannel, "abortChannel must not be null");
    }

    /**
     * Requests an abort for every active, non-detached job of {@code event} when the event is
     * disabled and the update carried the abort directive. Never throws.
     *
     * @return ids of the jobs an abort was requested for
     */
    public List<String> maybeAbort(Event event, boolean abortDirective) {
        if (!abortDirective || event.enabledFlag()) {
            return List.of();
        }

        List<Job> snapshot;
        try {
            snapshot = new ArrayList<>(activeJobs.activeJobs().values());
        } catch (IOException e) {
            LOG.warn("Could not list active jobs to abort for event {}: {}", event.id(), e.getMessage());
            return List.of();
        }

        String reason = "Event '" + event.title() + "' has been disabled.";
        List<String> requested = new ArrayList<>();
        for (Job job : snapshot) {
            if (!job.belongsTo(event.id()) || job.detached()) {
                continue;
            }
            LOG.info("Job {} is being aborted: {}", job.id(), reason);
            try {
                abortChannel.requestAbort(job.id(), reason);
                requested.add(job.id());
            } catch (RuntimeException e) {
                LOG.warn("Abort request for job {} failed: {}", job.id(), e.getMessage());
            }
        }
        return requested;
    }
}
