package io.schedula.core.job;

import java.io.IOException;
import java.util.Map;

/**
 * Point-in-time snapshot of the jobs currently running, keyed by job id.
 */
@FunctionalInterface
public interface ActiveJobSource {
    Map<String, Job> activeJobs() throws IOException;
}
