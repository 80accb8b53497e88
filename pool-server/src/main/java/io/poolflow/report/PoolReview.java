package io.poolflow.report;

import io.poolflow.config.ByteSizes;
import io.poolflow.job.JobView;
import io.poolflow.runtime.Pool;

import java.io.PrintStream;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Post-run summary with one row per job the pool has seen.
 */
public final class PoolReview {
    private static final String ROW = "%-6s %-10s %-10s %-20s %-20s %-8s %s%n";

    private PoolReview() {}

    public static void print(Pool pool, PrintStream out) {
        print(pool.jobs(), pool.createdAt(), pool.terminatedAt(), out);
    }

    public static void print(List<JobView> jobs, Instant started, Optional<Instant> ended, PrintStream out) {
        out.println("Pool review");
        out.println("Started - " + ConsoleStatusReporter.TIME.format(started));
        out.println("Ended - " + ended.map(ConsoleStatusReporter.TIME::format).orElse("-"));
        out.printf(ROW, "Id", "Status", "Cost", "Start Date", "End Date", "Hours", "Command");
        for (JobView j : jobs) {
            out.printf(ROW, j.id(), j.state(), ByteSizes.format(j.cost()),
                    j.startedAt().map(ConsoleStatusReporter.TIME::format).orElse("-"),
                    j.endedAt().map(ConsoleStatusReporter.TIME::format).orElse("-"),
                    runningHours(j).map(h -> String.format(Locale.ROOT, "%.2f", h)).orElse("-"),
                    j.command().label());
        }
        out.flush();
    }

    static Optional<Double> runningHours(JobView job) {
        if (job.startedAt().isEmpty() || job.endedAt().isEmpty()) return Optional.empty();
        Duration d = Duration.between(job.startedAt().get(), job.endedAt().get());
        return Optional.of(d.toMillis() / 3_600_000.0);
    }
}
