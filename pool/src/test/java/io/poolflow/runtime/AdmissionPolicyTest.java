package io.poolflow.runtime;

import io.poolflow.job.InProcessTask;
import io.poolflow.job.Job;
import io.poolflow.job.JobId;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AdmissionPolicyTest {
    private static ArrayDeque<Job> queue(long... costs) {
        ArrayDeque<Job> q = new ArrayDeque<>();
        for (int i = 0; i < costs.length; i++) {
            q.add(new Job(new JobId(i + 1), costs[i], InProcessTask.of("j" + (i + 1), () -> {}), null, null, Instant.EPOCH));
        }
        return q;
    }

    private static AdmissionPolicy.Admitter budget(long[] remaining, List<Long> taken) {
        return job -> {
            if (job.cost() > remaining[0]) return false;
            remaining[0] -= job.cost();
            taken.add(job.id().value());
            return true;
        };
    }

    @Test
    void first_fit_skips_past_jobs_that_do_not_fit() {
        ArrayDeque<Job> q = queue(800, 500, 200);
        List<Long> taken = new ArrayList<>();
        int n = new FirstFitAdmission().scan(q.iterator(), budget(new long[]{1000}, taken));
        assertEquals(2, n);
        assertEquals(List.of(1L, 3L), taken);
        assertEquals(1, q.size());
        assertEquals(2, q.peek().id().value());
    }

    @Test
    void strict_fifo_stops_at_first_miss() {
        ArrayDeque<Job> q = queue(800, 500, 200);
        List<Long> taken = new ArrayList<>();
        int n = new StrictFifoAdmission().scan(q.iterator(), budget(new long[]{1000}, taken));
        assertEquals(1, n);
        assertEquals(List.of(1L), taken);
        assertEquals(2, q.size());
    }

    @Test
    void empty_queue_takes_nothing() {
        List<Long> taken = new ArrayList<>();
        assertEquals(0, new FirstFitAdmission().scan(queue().iterator(), budget(new long[]{10}, taken)));
        assertTrue(taken.isEmpty());
    }
}
