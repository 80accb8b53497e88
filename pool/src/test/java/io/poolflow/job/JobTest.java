package io.poolflow.job;

import io.poolflow.process.JobProcess;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class JobTest {
    private static final JobProcess ALIVE = Optional::empty;

    private static Job job() {
        return new Job(new JobId(7), 100, ExternalCommand.of("sleep", "1"), null, null, Instant.EPOCH);
    }

    @Test
    void runs_then_completes() {
        Job j = job();
        assertEquals(JobState.PENDING, j.state());
        j.markRunning(ALIVE, Instant.ofEpochSecond(10));
        assertEquals(JobState.RUNNING, j.state());
        assertTrue(j.process().isPresent());
        assertEquals(JobState.COMPLETED, j.finish(JobResult.exited(0), Instant.ofEpochSecond(20)));
        assertTrue(j.process().isEmpty());
        assertTrue(j.state().terminal());
        assertEquals(Instant.ofEpochSecond(20), j.endedAt().orElseThrow());
    }

    @Test
    void non_zero_exit_is_failure() {
        Job j = job();
        j.markRunning(ALIVE, Instant.EPOCH);
        assertEquals(JobState.FAILED, j.finish(JobResult.exited(137), Instant.EPOCH));
        assertEquals("exit 137", j.result().orElseThrow().describe());
    }

    @Test
    void terminal_jobs_cannot_move() {
        Job j = job();
        j.markRejected(Instant.EPOCH);
        assertThrows(IllegalStateException.class, () -> j.markRunning(ALIVE, Instant.EPOCH));
        assertThrows(IllegalStateException.class, () -> j.finish(JobResult.exited(0), Instant.EPOCH));
    }

    @Test
    void pending_job_can_fail_to_launch() {
        Job j = job();
        assertEquals(JobState.FAILED, j.finish(JobResult.launchFailed(new java.io.IOException("nope")), Instant.EPOCH));
        assertTrue(j.startedAt().isEmpty());
    }

    @Test
    void label_and_id_text() {
        assertEquals("sleep 1", job().command().label());
        assertEquals("7", new JobId(7).toString());
        assertThrows(IllegalArgumentException.class, () -> new JobId(0));
        assertThrows(IllegalArgumentException.class, () -> ExternalCommand.of());
    }
}
