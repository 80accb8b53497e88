package io.poolflow.job;

/**
 * Runs on the scheduler thread right after admission and before launch. Throwing fails the job
 * without launching it.
 */
@FunctionalInterface
public interface PreHook {
    void beforeLaunch(JobView job) throws Exception;
}
