package io.poolflow.runtime;

public enum PoolMode {
    /** Job list fixed at construction; terminates once every job has finished. */
    STATIC,
    /** Accepts submissions until {@link Pool#end()}. */
    DYNAMIC
}
