package io.poolflow.job;

public enum JobState {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    /** Cost above the pool capacity; never admissible. */
    REJECTED;

    public boolean terminal() {
        return this == COMPLETED || this == FAILED || this == REJECTED;
    }
}
