package io.poolflow.runtime;

/**
 * A submission the pool refused. Nothing was queued.
 */
public abstract class JobRejectedException extends Exception {
    protected JobRejectedException(String message) { super(message); }
}
