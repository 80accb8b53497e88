package io.poolflow.job;

import java.time.Instant;
import java.util.Optional;

/** Read-only view of a job handed to hooks and reporters. */
public interface JobView {
    JobId id();
    long cost();
    JobCommand command();
    JobState state();
    Instant submittedAt();
    Optional<Instant> startedAt();
    Optional<Instant> endedAt();
    Optional<JobResult> result();
}
