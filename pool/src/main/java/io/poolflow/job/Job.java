package io.poolflow.job;

import io.poolflow.process.JobProcess;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A unit of work with a fixed memory cost. State changes are made by the owning pool on its
 * scheduler thread; other threads only read.
 */
public final class Job implements JobView {
    private final JobId id;
    private final long cost;
    private final JobCommand command;
    private final PreHook preHook;
    private final PostHook postHook;
    private final Instant submittedAt;

    private volatile JobState state = JobState.PENDING;
    private volatile Instant startedAt;
    private volatile Instant endedAt;
    private volatile JobResult result;
    private JobProcess process; // only while RUNNING

    public Job(JobId id, long cost, JobCommand command, PreHook preHook, PostHook postHook, Instant submittedAt) {
        if (cost < 0) throw new IllegalArgumentException("cost must be >= 0: " + cost);
        this.id = Objects.requireNonNull(id, "id");
        this.cost = cost;
        this.command = Objects.requireNonNull(command, "command");
        this.preHook = preHook;
        this.postHook = postHook;
        this.submittedAt = Objects.requireNonNull(submittedAt, "submittedAt");
    }

    @Override public JobId id() { return id; }
    @Override public long cost() { return cost; }
    @Override public JobCommand command() { return command; }
    @Override public JobState state() { return state; }
    @Override public Instant submittedAt() { return submittedAt; }
    @Override public Optional<Instant> startedAt() { return Optional.ofNullable(startedAt); }
    @Override public Optional<Instant> endedAt() { return Optional.ofNullable(endedAt); }
    @Override public Optional<JobResult> result() { return Optional.ofNullable(result); }

    public Optional<PreHook> preHook() { return Optional.ofNullable(preHook); }
    public Optional<PostHook> postHook() { return Optional.ofNullable(postHook); }
    public Optional<JobProcess> process() { return Optional.ofNullable(process); }

    public void markRejected(Instant at) {
        require(JobState.PENDING);
        this.endedAt = at;
        this.state = JobState.REJECTED;
    }

    public void markRunning(JobProcess process, Instant at) {
        require(JobState.PENDING);
        this.process = Objects.requireNonNull(process, "process");
        this.startedAt = at;
        this.state = JobState.RUNNING;
    }

    /**
     * Moves a RUNNING job (or a PENDING one whose launch failed) to its terminal state. Returns the
     * new state.
     */
    public JobState finish(JobResult result, Instant at) {
        if (state != JobState.RUNNING && state != JobState.PENDING) {
            throw new IllegalStateException("job " + id + " already " + state);
        }
        this.result = Objects.requireNonNull(result, "result");
        this.endedAt = at;
        this.process = null;
        this.state = result.success() ? JobState.COMPLETED : JobState.FAILED;
        return state;
    }

    private void require(JobState expected) {
        if (state != expected) throw new IllegalStateException("job " + id + " is " + state + ", expected " + expected);
    }

    @Override
    public String toString() {
        return "Job{" +
                "id=" + id +
                ", cost=" + cost +
                ", state=" + state +
                ", command=" + command.label() +
                '}';
    }
}
