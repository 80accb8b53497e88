package io.poolflow.job;

/**
 * Pool-scoped job identifier, assigned in submission order starting at 1.
 */
public record JobId(long value) implements Comparable<JobId> {
    public JobId {
        if (value <= 0) throw new IllegalArgumentException("job id must be positive: " + value);
    }

    @Override
    public int compareTo(JobId o) { return Long.compare(value, o.value); }

    @Override
    public String toString() { return Long.toString(value); }
}
