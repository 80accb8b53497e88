package io.poolflow.runtime;

import io.poolflow.job.JobId;

public class CostExceedsCapacityException extends JobRejectedException {
    private final JobId jobId;
    private final long cost;
    private final long capacity;

    public CostExceedsCapacityException(JobId jobId, long cost, long capacity) {
        super("job " + jobId + " costs " + cost + " bytes, more than the pool capacity of " + capacity + " bytes");
        this.jobId = jobId;
        this.cost = cost;
        this.capacity = capacity;
    }

    /** Id under which the rejected job is recorded in the pool history. */
    public JobId jobId() { return jobId; }
    public long cost() { return cost; }
    public long capacity() { return capacity; }
}
