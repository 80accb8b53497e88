package io.poolflow.runtime;

import com.codahale.metrics.Histogram;
import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.poolflow.budget.AccountingUnderflowException;
import io.poolflow.budget.ResourceAccountant;
import io.poolflow.job.Job;
import io.poolflow.job.JobCommand;
import io.poolflow.job.JobId;
import io.poolflow.job.JobResult;
import io.poolflow.job.JobState;
import io.poolflow.job.JobView;
import io.poolflow.job.PostHook;
import io.poolflow.job.PreHook;
import io.poolflow.metrics.Metrics;
import io.poolflow.process.JobProcess;
import io.poolflow.process.ProcessLauncher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Admission-controlled job pool. Each {@link #tick()} first polls running jobs and releases the
 * budget of those that ended, then admits pending jobs that fit the remaining budget.
 * <p>
 * One thread drives ticks, either the loop started by {@link #start()} or a caller invoking
 * {@link #tick()} directly. {@link #submit} and {@link #end()} may be called from any thread; they
 * only touch the intake queue, which the next tick drains into the pending queue.
 */
public class Pool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Pool.class);

    private final PoolMode mode;
    private final ResourceAccountant accountant;
    private final ProcessLauncher launcher;
    private final AdmissionPolicy admission;
    private final Duration tickInterval;
    private final Clock clock;
    private final Instant createdAt;

    private final Object schedLock = new Object();
    private final Object intakeLock = new Object();

    // guarded by intakeLock
    private final ArrayDeque<Job> intake = new ArrayDeque<>();
    private final List<Job> history = new ArrayList<>();
    private long nextId = 1;
    private boolean closed;
    private long rejectedCount;

    // guarded by schedLock
    private final ArrayDeque<Job> pending = new ArrayDeque<>();
    private final List<Job> running = new ArrayList<>();
    private long completedCount;
    private long failedCount;

    private final AtomicReference<PoolState> state = new AtomicReference<>(PoolState.IDLE);
    private final CountDownLatch terminated = new CountDownLatch(1);
    private volatile Throwable fault;
    private volatile Instant terminatedAt;
    private volatile int pendingDepth;
    private volatile int runningDepth;
    private volatile Thread loopThread;
    private volatile boolean stopRequested;

    private final Timer tickTimer;
    private final Meter submittedMeter;
    private final Meter admittedMeter;
    private final Meter completedMeter;
    private final Meter failedMeter;
    private final Meter rejectedMeter;
    private final Histogram runtimeMillis;

    Pool(PoolMode mode,
         ResourceAccountant accountant,
         ProcessLauncher launcher,
         AdmissionPolicy admission,
         Duration tickInterval,
         Clock clock,
         Metrics metrics,
         List<JobRequest> initialJobs) {
        this.mode = Objects.requireNonNull(mode);
        this.accountant = Objects.requireNonNull(accountant);
        this.launcher = Objects.requireNonNull(launcher);
        this.admission = Objects.requireNonNull(admission);
        this.tickInterval = Objects.requireNonNull(tickInterval);
        this.clock = Objects.requireNonNull(clock);
        this.createdAt = clock.instant();
        this.tickTimer = metrics.timer("pool.tick.time");
        this.submittedMeter = metrics.meter("pool.jobs.submitted");
        this.admittedMeter = metrics.meter("pool.jobs.admitted");
        this.completedMeter = metrics.meter("pool.jobs.completed");
        this.failedMeter = metrics.meter("pool.jobs.failed");
        this.rejectedMeter = metrics.meter("pool.jobs.rejected");
        this.runtimeMillis = metrics.histogram("pool.job.runtime.ms");
        metrics.gauge("pool.memory.allocated", accountant::allocated);
        metrics.gauge("pool.memory.available", accountant::available);
        metrics.gauge("pool.queue.pending", () -> pendingDepth);
        metrics.gauge("pool.queue.running", () -> runningDepth);

        if (mode == PoolMode.DYNAMIC && !initialJobs.isEmpty()) {
            throw new IllegalArgumentException("a dynamic pool takes its jobs through submit()");
        }
        synchronized (intakeLock) {
            for (JobRequest r : initialJobs) {
                try {
                    enqueue(r.cost(), r.command(), r.preHook(), r.postHook());
                } catch (CostExceedsCapacityException e) {
                    log.warn("Static pool job not scheduled: {}", e.getMessage());
                }
            }
            pendingDepth = intake.size();
        }
        log.info("Created {} pool: capacity={} enforced={} admission={} jobs={}",
                mode, accountant.bounded() ? accountant.capacity() : "unbounded", accountant.bounded(), admission, initialJobs.size());
    }

    public JobId submit(long cost, JobCommand command) throws JobRejectedException {
        return submit(cost, command, null, null);
    }

    /**
     * Queue a job on a dynamic pool.
     *
     * @throws CostExceedsCapacityException the job could never fit; it is recorded as REJECTED
     * @throws PoolClosedException the pool is static or {@link #end()} has been called
     */
    public JobId submit(long cost, JobCommand command, PreHook preHook, PostHook postHook) throws JobRejectedException {
        if (cost < 0) throw new IllegalArgumentException("cost must be >= 0: " + cost);
        Objects.requireNonNull(command, "command");
        synchronized (intakeLock) {
            if (mode == PoolMode.STATIC) throw new PoolClosedException("static pool accepts no jobs after construction");
            if (closed) throw new PoolClosedException("pool has been ended; job not queued");
            if (state.get() == PoolState.TERMINATED) throw new IllegalStateException("pool is terminated");
            JobId id = enqueue(cost, command, preHook, postHook);
            pendingDepth++;
            return id;
        }
    }

    // caller holds intakeLock
    private JobId enqueue(long cost, JobCommand command, PreHook preHook, PostHook postHook) throws CostExceedsCapacityException {
        Instant now = clock.instant();
        Job job = new Job(new JobId(nextId++), cost, command, preHook, postHook, now);
        history.add(job);
        submittedMeter.mark();
        if (cost > accountant.capacity()) {
            job.markRejected(now);
            rejectedCount++;
            rejectedMeter.mark();
            throw new CostExceedsCapacityException(job.id(), cost, accountant.capacity());
        }
        intake.add(job);
        log.debug("Job {} queued: cost={} command={}", job.id(), cost, command.label());
        return job.id();
    }

    /**
     * Stop accepting submissions. Queued and running jobs still finish, after which the pool
     * terminates. Idempotent.
     */
    public void end() {
        if (mode != PoolMode.DYNAMIC) throw new IllegalStateException("end() is only valid on dynamic pools");
        synchronized (intakeLock) {
            if (closed) return;
            if (state.get() == PoolState.TERMINATED) throw new IllegalStateException("pool is terminated");
            closed = true;
        }
        state.updateAndGet(s -> s == PoolState.IDLE || s == PoolState.ACTIVE ? PoolState.DRAINING : s);
        log.info("Pool ended; draining remaining jobs");
    }

    /**
     * One scheduling pass: monitor, then admit. Returns the state after the pass.
     *
     * @throws AccountingUnderflowException the books no longer balance; the pool is terminated
     * @throws IllegalStateException the pool had already terminated
     */
    public PoolState tick() {
        synchronized (schedLock) {
            PoolState current = state.get();
            if (current == PoolState.TERMINATED) {
                throw new IllegalStateException("pool is terminated" + (fault == null ? "" : " after fault: " + fault));
            }
            if (current == PoolState.IDLE && state.compareAndSet(PoolState.IDLE, PoolState.ACTIVE)) {
                log.info("Pool active");
            }
            try (Timer.Context ignored = tickTimer.time()) {
                monitor();
                drainIntake();
                admission.scan(pending.iterator(), this::tryAdmit);
            } catch (AccountingUnderflowException e) {
                fault = e;
                log.error("Accounting fault, stopping pool: {}", e.getMessage());
                terminate();
                throw e;
            }
            pendingDepth = pending.size();
            runningDepth = running.size();
            if (pending.isEmpty() && running.isEmpty() && noMoreJobs()) {
                terminate();
            }
            return state.get();
        }
    }

    private void monitor() {
        Iterator<Job> it = running.iterator();
        while (it.hasNext()) {
            Job job = it.next();
            Optional<JobResult> exit;
            try {
                exit = job.process().map(JobProcess::poll).orElseThrow(
                        () -> new IllegalStateException("running job " + job.id() + " has no process"));
            } catch (RuntimeException e) {
                log.warn("Job {} could not be polled, marking failed", job.id(), e);
                exit = Optional.of(JobResult.crashed(e));
            }
            if (exit.isEmpty()) continue;
            accountant.release(job.cost());
            finish(job, exit.get());
            it.remove();
        }
    }

    private void drainIntake() {
        synchronized (intakeLock) {
            Job job;
            while ((job = intake.poll()) != null) pending.add(job);
        }
    }

    private boolean tryAdmit(Job job) {
        if (!accountant.reserve(job.cost())) return false;
        admittedMeter.mark();
        try {
            if (job.preHook().isPresent()) job.preHook().get().beforeLaunch(job);
            JobProcess process = launcher.launch(job);
            job.markRunning(process, clock.instant());
            running.add(job);
            log.info("Job {} started: cost={} available={} command={}", job.id(), job.cost(), available(), job.command().label());
        } catch (Exception e) {
            log.warn("Job {} failed to launch: {}", job.id(), e.toString());
            accountant.release(job.cost());
            finish(job, JobResult.launchFailed(e));
        }
        return true;
    }

    private void finish(Job job, JobResult result) {
        if (job.postHook().isPresent()) {
            try {
                job.postHook().get().afterExit(job, result);
            } catch (Exception e) {
                log.warn("Post-processing of job {} failed", job.id(), e);
            }
        }
        Instant now = clock.instant();
        JobState end = job.finish(result, now);
        job.startedAt().ifPresent(start -> runtimeMillis.update(Duration.between(start, now).toMillis()));
        if (end == JobState.COMPLETED) {
            completedCount++;
            completedMeter.mark();
            log.info("Job {} completed", job.id());
        } else {
            failedCount++;
            failedMeter.mark();
            log.warn("Job {} failed: {}", job.id(), result.describe());
        }
    }

    private boolean noMoreJobs() {
        if (mode == PoolMode.STATIC) return true;
        synchronized (intakeLock) {
            return closed && intake.isEmpty();
        }
    }

    private void terminate() {
        state.set(PoolState.TERMINATED);
        terminatedAt = clock.instant();
        pendingDepth = pending.size();
        runningDepth = running.size();
        terminated.countDown();
        log.info("Pool terminated: completed={} failed={} rejected={}", completedCount, failedCount, rejectedCount());
    }

    /**
     * Run the scheduling loop on a dedicated thread until the pool terminates or {@link #stop()} is
     * called.
     */
    public void start() {
        synchronized (this) {
            if (loopThread != null) return;
            stopRequested = false;
            loopThread = new Thread(this::runLoop, "poolflow-scheduler");
            loopThread.setDaemon(true);
            loopThread.start();
        }
    }

    private void runLoop() {
        try {
            while (!stopRequested && tick() != PoolState.TERMINATED) {
                Thread.sleep(tickInterval.toMillis());
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        } catch (AccountingUnderflowException e) {
            log.error("Scheduler loop stopped by accounting fault", e);
        }
    }

    /** Stop the loop thread. Running jobs are not killed. */
    public void stop() {
        stopRequested = true;
        Thread t = loopThread;
        if (t != null && t != Thread.currentThread()) {
            t.interrupt();
            try { t.join(5000); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); }
        }
        synchronized (this) { loopThread = null; }
    }

    public boolean isLoopRunning() {
        Thread t = loopThread;
        return t != null && t.isAlive();
    }

    /** Block until the pool terminates. Returns false on timeout. */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public StatusSnapshot snapshot() {
        synchronized (schedLock) {
            synchronized (intakeLock) {
                List<StatusSnapshot.RunningJob> jobs = new ArrayList<>(running.size());
                for (Job j : running) {
                    jobs.add(new StatusSnapshot.RunningJob(j.id(), j.cost(), j.command().label(), j.startedAt().orElse(null)));
                }
                return new StatusSnapshot(
                        pending.size() + intake.size(),
                        jobs,
                        accountant.allocated(),
                        accountant.bounded() ? accountant.capacity() : StatusSnapshot.UNBOUNDED,
                        mode,
                        mode == PoolMode.DYNAMIC && closed,
                        state.get(),
                        accountant.bounded(),
                        completedCount,
                        failedCount,
                        rejectedCount,
                        clock.instant());
            }
        }
    }

    /** Every job the pool has seen, rejected ones included, in id order. */
    public List<JobView> jobs() {
        synchronized (intakeLock) {
            return List.copyOf(history);
        }
    }

    public Optional<JobView> job(JobId id) {
        synchronized (intakeLock) {
            for (Job j : history) if (j.id().equals(id)) return Optional.of(j);
        }
        return Optional.empty();
    }

    public PoolMode mode() { return mode; }
    public PoolState state() { return state.get(); }
    public boolean isTerminated() { return state.get() == PoolState.TERMINATED; }
    public long capacity() { return accountant.capacity(); }
    public boolean enforced() { return accountant.bounded(); }
    public long available() { return accountant.available(); }
    public Duration tickInterval() { return tickInterval; }
    public Instant createdAt() { return createdAt; }
    public Optional<Instant> terminatedAt() { return Optional.ofNullable(terminatedAt); }
    public Optional<Throwable> fault() { return Optional.ofNullable(fault); }
    public boolean limitsEnforced() { return launcher.limitsEnforced(); }

    private long rejectedCount() {
        synchronized (intakeLock) { return rejectedCount; }
    }

    @Override
    public void close() {
        stop();
        launcher.close();
    }
}
