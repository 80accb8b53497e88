package io.poolflow.runtime;

import com.codahale.metrics.MetricRegistry;
import io.poolflow.budget.Accountants;
import io.poolflow.budget.MemoryBudget;
import io.poolflow.budget.ResourceAccountant;
import io.poolflow.job.JobCommand;
import io.poolflow.job.PostHook;
import io.poolflow.job.PreHook;
import io.poolflow.metrics.Metrics;
import io.poolflow.process.DefaultProcessLauncher;
import io.poolflow.process.MemoryLimit;
import io.poolflow.process.ProcessLauncher;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

public class PoolBuilder {
    private final PoolMode mode;
    private final List<JobRequest> jobs = new ArrayList<>();
    private ResourceAccountant accountant;
    private ProcessLauncher launcher;
    private AdmissionPolicy admission = new FirstFitAdmission();
    private Duration tickInterval = Duration.ofSeconds(1);
    private Clock clock = Clock.systemUTC();
    private MetricRegistry metricRegistry = new MetricRegistry();

    private PoolBuilder(PoolMode mode) { this.mode = mode; }

    /** A pool whose jobs are all given here; it terminates once they have all finished. */
    public static PoolBuilder staticPool() { return new PoolBuilder(PoolMode.STATIC); }

    /** A pool that accepts {@link Pool#submit} until {@link Pool#end()} is called. */
    public static PoolBuilder dynamicPool() { return new PoolBuilder(PoolMode.DYNAMIC); }

    public PoolBuilder capacity(long bytes) { this.accountant = new MemoryBudget(bytes); return this; }
    public PoolBuilder accountant(ResourceAccountant a) { this.accountant = a; return this; }
    public PoolBuilder launcher(ProcessLauncher l) { this.launcher = l; return this; }
    public PoolBuilder admission(AdmissionPolicy p) { this.admission = p; return this; }
    public PoolBuilder tickInterval(Duration d) { this.tickInterval = d; return this; }
    public PoolBuilder clock(Clock c) { this.clock = c; return this; }
    public PoolBuilder metrics(MetricRegistry r) { this.metricRegistry = r; return this; }

    public PoolBuilder job(long cost, JobCommand command) { return job(cost, command, null, null); }

    public PoolBuilder job(long cost, JobCommand command, PreHook preHook, PostHook postHook) {
        jobs.add(new JobRequest(cost, command, preHook, postHook));
        return this;
    }

    public Pool build() {
        if (mode == PoolMode.DYNAMIC && !jobs.isEmpty()) {
            throw new IllegalStateException("jobs of a dynamic pool are submitted after build()");
        }
        if (tickInterval.isNegative()) throw new IllegalArgumentException("tickInterval must be >= 0");
        ResourceAccountant acc = accountant != null ? accountant : Accountants.detect(OptionalLong.empty());
        ProcessLauncher pl = launcher != null ? launcher : new DefaultProcessLauncher(MemoryLimit.NONE);
        Objects.requireNonNull(admission, "admission");
        Objects.requireNonNull(clock, "clock");
        return new Pool(mode, acc, pl, admission, tickInterval, clock, new Metrics(metricRegistry), List.copyOf(jobs));
    }
}
