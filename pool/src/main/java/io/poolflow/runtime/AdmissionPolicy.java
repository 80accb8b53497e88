package io.poolflow.runtime;

import io.poolflow.job.Job;

import java.util.Iterator;

/**
 * The scan rule of an admission pass. Reservation, launch and bookkeeping stay in the pool; a
 * policy only decides which pending jobs are offered and when the scan stops.
 */
public interface AdmissionPolicy {
    /**
     * Walk the pending queue in order, offering jobs to {@code admitter}. Jobs the admitter takes
     * must be removed through the iterator. Returns the number taken.
     */
    int scan(Iterator<Job> pending, Admitter admitter);

    @FunctionalInterface
    interface Admitter {
        /** True when the job left the pending queue (launched, or failed while launching). */
        boolean offer(Job job);
    }
}
