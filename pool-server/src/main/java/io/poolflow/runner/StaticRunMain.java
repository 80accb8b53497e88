package io.poolflow.runner;

import com.codahale.metrics.MetricRegistry;
import io.poolflow.budget.Accountants;
import io.poolflow.config.ByteSizes;
import io.poolflow.config.PoolConfig;
import io.poolflow.job.ExternalCommand;
import io.poolflow.job.JobState;
import io.poolflow.job.JobView;
import io.poolflow.process.DefaultProcessLauncher;
import io.poolflow.process.MemoryLimit;
import io.poolflow.report.ConsoleStatusReporter;
import io.poolflow.report.PoolReview;
import io.poolflow.runtime.Pool;
import io.poolflow.runtime.PoolBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.Callable;

/**
 * Runs a fixed list of commands under a memory budget and exits once all of them have ended.
 */
@CommandLine.Command(name = "poolflow-run", mixinStandardHelpOptions = true, description = "Run a job file as a static pool")
public final class StaticRunMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(StaticRunMain.class);

    @CommandLine.Parameters(index = "0", description = "Job file: one '<cost> <command...>' per line")
    Path jobFile;

    @CommandLine.Option(names = {"-c", "--capacity"}, description = "Memory budget, e.g. 16G; default from poolflow.capacity or free memory")
    String capacity;

    @CommandLine.Option(names = {"-m", "--memlimit"}, description = "Per-job memory limit: none|soft|hard")
    String memoryLimit;

    @CommandLine.Option(names = {"-w", "--workdir"}, description = "Working directory of the jobs")
    Path workDir;

    @CommandLine.Option(names = {"-l", "--log-dir"}, description = "Write each job's output to <log-dir>/job-<n>.log")
    Path logDir;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Status report file; default stdout")
    Path output;

    PrintStream out = System.out;

    public static void main(String[] args) {
        int code = new CommandLine(new StaticRunMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() throws Exception {
        PoolConfig cfg = PoolConfig.fromEnv();
        OptionalLong cap = capacity != null ? OptionalLong.of(ByteSizes.parse(capacity)) : cfg.capacityBytes();
        MemoryLimit limit = memoryLimit != null ? MemoryLimit.parse(memoryLimit) : cfg.memoryLimit();
        Path report = output != null ? output : cfg.output().orElse(null);

        List<JobFile.Entry> entries = JobFile.read(jobFile);
        PoolBuilder builder = PoolBuilder.staticPool()
                .accountant(Accountants.detect(cap))
                .launcher(new DefaultProcessLauncher(limit))
                .tickInterval(cfg.tickInterval())
                .metrics(new MetricRegistry());
        for (JobFile.Entry e : entries) {
            ExternalCommand cmd = new ExternalCommand(e.argv(), workDir,
                    logDir == null ? null : logDir.resolve("job-" + e.line() + ".log"));
            builder.job(e.cost(), cmd);
        }

        try (Pool pool = builder.build()) {
            ConsoleStatusReporter reporter = new ConsoleStatusReporter(pool.createdAt(), out, report);
            pool.start();
            Thread status = reporter.emitEvery(pool, cfg.refreshInterval());
            while (!pool.awaitTermination(Duration.ofSeconds(1))) {
                if (!pool.isLoopRunning() && !pool.isTerminated()) break;
            }
            status.join(Duration.ofSeconds(5).toMillis());
            PoolReview.print(pool, out);
            if (pool.fault().isPresent()) {
                log.error("Pool stopped on a fault", pool.fault().get());
                return 1;
            }
            boolean allCompleted = pool.jobs().stream().map(JobView::state).allMatch(s -> s == JobState.COMPLETED);
            return allCompleted ? 0 : 1;
        }
    }
}
