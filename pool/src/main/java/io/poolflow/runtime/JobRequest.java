package io.poolflow.runtime;

import io.poolflow.job.JobCommand;
import io.poolflow.job.PostHook;
import io.poolflow.job.PreHook;

import java.util.Objects;

/** A job to be created by a pool; used for the fixed job list of static pools. */
record JobRequest(long cost, JobCommand command, PreHook preHook, PostHook postHook) {
    JobRequest {
        if (cost < 0) throw new IllegalArgumentException("cost must be >= 0: " + cost);
        Objects.requireNonNull(command, "command");
    }
}
