package io.poolflow.job;

/**
 * What a job runs. The scheduler never looks inside; only a
 * {@link io.poolflow.process.ProcessLauncher} interprets it.
 */
public interface JobCommand {
    /** Short human-readable description for status tables. */
    String label();
}
