package io.poolflow.runtime;

public enum PoolState {
    IDLE,
    ACTIVE,
    /** Dynamic pool after end(): no submissions, queued and running jobs still finish. */
    DRAINING,
    TERMINATED
}
