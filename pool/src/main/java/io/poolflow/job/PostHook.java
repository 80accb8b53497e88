package io.poolflow.job;

/**
 * Runs on the scheduler thread once the job has ended and its budget has been released.
 */
@FunctionalInterface
public interface PostHook {
    void afterExit(JobView job, JobResult result) throws Exception;
}
