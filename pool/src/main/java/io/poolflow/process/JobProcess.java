package io.poolflow.process;

import io.poolflow.job.JobResult;

import java.util.Optional;

/**
 * Handle on a launched job. The scheduler only polls it; it never waits on it.
 */
public interface JobProcess {
    /**
     * Non-blocking liveness check. Empty while the job is still running; the exit result once it has
     * ended. May be called again after exit and keeps returning the same result.
     */
    Optional<JobResult> poll();
}
