package io.poolflow.runtime;

import io.poolflow.job.Job;

import java.util.Iterator;

/**
 * Work-conserving first fit: every pending job is offered in queue order, and a job that does not
 * fit does not stop cheaper jobs behind it.
 */
public class FirstFitAdmission implements AdmissionPolicy {
    @Override
    public int scan(Iterator<Job> pending, Admitter admitter) {
        int taken = 0;
        while (pending.hasNext()) {
            Job job = pending.next();
            if (admitter.offer(job)) {
                pending.remove();
                taken++;
            }
        }
        return taken;
    }

    @Override
    public String toString() { return "first-fit"; }
}
