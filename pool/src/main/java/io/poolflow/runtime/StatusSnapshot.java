package io.poolflow.runtime;

import io.poolflow.job.JobId;

import java.time.Instant;
import java.util.List;

/**
 * Immutable view of a pool taken between ticks.
 *
 * @param capacity {@link #UNBOUNDED} when the pool runs without admission control
 * @param enforced whether the budget is actually enforced (false in degraded mode)
 */
public record StatusSnapshot(
        int pendingCount,
        List<RunningJob> runningJobs,
        long allocated,
        long capacity,
        PoolMode mode,
        boolean closed,
        PoolState state,
        boolean enforced,
        long completedCount,
        long failedCount,
        long rejectedCount,
        Instant takenAt
) {
    public static final long UNBOUNDED = Long.MAX_VALUE;

    public StatusSnapshot {
        runningJobs = List.copyOf(runningJobs);
    }

    public int runningCount() { return runningJobs.size(); }

    public boolean capacityUnbounded() { return capacity == UNBOUNDED; }

    public long available() { return capacityUnbounded() ? UNBOUNDED : capacity - allocated; }

    /** @param startedAt may be null only for snapshots built by hand */
    public record RunningJob(JobId id, long cost, String label, Instant startedAt) {}
}
