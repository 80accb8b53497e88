package io.poolflow.report;

import io.poolflow.job.JobId;
import io.poolflow.runtime.PoolMode;
import io.poolflow.runtime.PoolState;
import io.poolflow.runtime.StatusSnapshot;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ConsoleStatusReporterTest {
    private static StatusSnapshot snapshot(long capacity, boolean enforced) {
        return new StatusSnapshot(3,
                List.of(new StatusSnapshot.RunningJob(new JobId(4), 2L << 30, "simulate --fine", Instant.ofEpochSecond(100))),
                2L << 30, capacity, PoolMode.DYNAMIC, false, PoolState.ACTIVE, enforced, 5, 1, 2, Instant.ofEpochSecond(200));
    }

    @Test
    void prints_counts_running_jobs_and_memory() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        new ConsoleStatusReporter(Instant.EPOCH, new PrintStream(buf, true, StandardCharsets.UTF_8)).report(snapshot(8L << 30, true));
        String out = buf.toString(StandardCharsets.UTF_8);
        assertTrue(out.contains("Jobs running: 1"));
        assertTrue(out.contains("Jobs in queue: 3"));
        assertTrue(out.contains("Jobs done: 6 (failed 1, rejected 2)"));
        assertTrue(out.contains("simulate --fine"));
        assertTrue(out.contains("Total memory: 8G"));
        assertTrue(out.contains("Available memory: 6G"));
        assertFalse(out.contains("not enforced"));
    }

    @Test
    void degraded_mode_is_visible() {
        String out = new ConsoleStatusReporter(Instant.EPOCH, System.out).render(snapshot(StatusSnapshot.UNBOUNDED, false));
        assertTrue(out.contains("Total memory: unbounded"));
        assertTrue(out.contains("(not enforced)"));
    }

    @Test
    void output_file_holds_only_the_latest_report() throws Exception {
        Path file = Files.createTempFile("status", ".txt");
        ConsoleStatusReporter r = new ConsoleStatusReporter(Instant.EPOCH, System.out, file);
        r.report(snapshot(8L << 30, true));
        r.reportEnd(snapshot(8L << 30, true));
        String out = Files.readString(file);
        assertEquals(1, out.split("Pool started", -1).length - 1);
        assertTrue(out.contains("End of pool"));
    }
}
