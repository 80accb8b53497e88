package io.poolflow.report;

import io.poolflow.config.ByteSizes;
import io.poolflow.runtime.Pool;
import io.poolflow.runtime.StatusSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Prints a status block: pool start, job counts, the running jobs and the memory budget. With an
 * output file the file is rewritten on every report, so it always holds the latest block only.
 */
public class ConsoleStatusReporter implements StatusReporter {
    private static final Logger log = LoggerFactory.getLogger(ConsoleStatusReporter.class);
    static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("dd/MM/yy-HH:mm:ss").withZone(ZoneId.systemDefault());

    private final Instant poolStartedAt;
    private final PrintStream console;
    private final Path output;

    public ConsoleStatusReporter(Instant poolStartedAt, PrintStream console) {
        this(poolStartedAt, console, null);
    }

    /** @param output file receiving the reports instead of {@code console}; may be null */
    public ConsoleStatusReporter(Instant poolStartedAt, PrintStream console, Path output) {
        this.poolStartedAt = poolStartedAt;
        this.console = console;
        this.output = output;
    }

    @Override
    public void report(StatusSnapshot s) {
        write(render(s));
    }

    /** Final block plus the end-of-pool line. */
    public void reportEnd(StatusSnapshot s) {
        write(render(s) + "End of pool - " + TIME.format(s.takenAt()) + System.lineSeparator());
    }

    String render(StatusSnapshot s) {
        StringBuilder sb = new StringBuilder();
        String nl = System.lineSeparator();
        sb.append("Pool started - ").append(TIME.format(poolStartedAt)).append(nl);
        sb.append("Pool status - ").append(TIME.format(s.takenAt()))
                .append(" (").append(s.mode()).append(", ").append(s.state()).append(s.closed() ? ", closed" : "").append(')').append(nl);
        sb.append("Jobs running: ").append(s.runningCount()).append(nl);
        sb.append("Jobs in queue: ").append(s.pendingCount()).append(nl);
        sb.append("Jobs done: ").append(s.completedCount() + s.failedCount())
                .append(" (failed ").append(s.failedCount()).append(", rejected ").append(s.rejectedCount()).append(')').append(nl);
        sb.append(String.format("%-8s %-10s %-20s %s%n", "Id", "Cost", "Start Date", "Command"));
        for (StatusSnapshot.RunningJob r : s.runningJobs()) {
            sb.append(String.format("%-8s %-10s %-20s %s%n", r.id(), ByteSizes.format(r.cost()),
                    r.startedAt() == null ? "-" : TIME.format(r.startedAt()), r.label()));
        }
        sb.append("Total memory: ").append(ByteSizes.format(s.capacity()))
                .append("\tAvailable memory: ").append(ByteSizes.format(s.available()));
        if (!s.enforced()) sb.append("\t(not enforced)");
        sb.append(nl);
        return sb.toString();
    }

    private void write(String block) {
        if (output == null) {
            console.print(block);
            console.flush();
            return;
        }
        try (OutputStream os = Files.newOutputStream(output)) {
            os.write(block.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Cannot write status to {}: {}", output, e.getMessage());
        }
    }

    /**
     * Report every {@code refresh} on a daemon thread until the pool terminates, then report once
     * more with the end line.
     */
    public Thread emitEvery(Pool pool, Duration refresh) {
        Thread t = new Thread(() -> {
            try {
                while (!pool.isTerminated()) {
                    report(pool.snapshot());
                    pool.awaitTermination(refresh);
                }
                reportEnd(pool.snapshot());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }, "poolflow-status");
        t.setDaemon(true);
        t.start();
        return t;
    }
}
