package io.schedula.core.job;

import io.schedula.core.error.LaunchException;
import java.util.List;

@FunctionalInterface
public interface JobLauncher {

    /**
     * Launches one job spec. A multiplexed event may expand into several jobs.
     *
     * @throws LaunchException when the runner refuses the launch
     */
    List<Job> launch(JobSpec spec);
}
