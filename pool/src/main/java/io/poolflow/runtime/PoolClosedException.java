package io.poolflow.runtime;

/** Submission to a pool that no longer accepts jobs. */
public class PoolClosedException extends JobRejectedException {
    public PoolClosedException(String message) { super(message); }
}
