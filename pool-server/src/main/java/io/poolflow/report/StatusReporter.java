package io.poolflow.report;

import io.poolflow.runtime.StatusSnapshot;

@FunctionalInterface
public interface StatusReporter {
    void report(StatusSnapshot snapshot);
}
