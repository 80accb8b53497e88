package io.poolflow.process;

import io.poolflow.job.JobView;

/**
 * Starts jobs out of line with the scheduler loop.
 */
public interface ProcessLauncher extends AutoCloseable {
    /** Start the job's command. Must return promptly; the job runs independently afterwards. */
    JobProcess launch(JobView job) throws LaunchException;

    /** Whether launched commands are held to their cost by the operating system. */
    default boolean limitsEnforced() { return false; }

    /** Release launcher resources. Jobs already running are left alone. */
    @Override
    default void close() {}
}
