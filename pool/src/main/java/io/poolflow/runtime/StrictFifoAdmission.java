package io.poolflow.runtime;

import io.poolflow.job.Job;

import java.util.Iterator;

/**
 * Strict FIFO: the scan stops at the first job that does not fit, so jobs start in submission
 * order at the price of head-of-line blocking.
 */
public class StrictFifoAdmission implements AdmissionPolicy {
    @Override
    public int scan(Iterator<Job> pending, Admitter admitter) {
        int taken = 0;
        while (pending.hasNext()) {
            Job job = pending.next();
            if (!admitter.offer(job)) break;
            pending.remove();
            taken++;
        }
        return taken;
    }

    @Override
    public String toString() { return "strict-fifo"; }
}
