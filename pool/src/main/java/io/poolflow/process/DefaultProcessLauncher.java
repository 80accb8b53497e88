package io.poolflow.process;

import io.poolflow.job.ExternalCommand;
import io.poolflow.job.InProcessTask;
import io.poolflow.job.JobResult;
import io.poolflow.job.JobView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Launches {@link ExternalCommand}s as operating-system processes and {@link InProcessTask}s on a
 * cached daemon thread pool. External commands can be held to their cost with {@code ulimit -v}
 * on POSIX hosts.
 */
public class DefaultProcessLauncher implements ProcessLauncher {
    private static final Logger log = LoggerFactory.getLogger(DefaultProcessLauncher.class);
    private static final Path SHELL = Path.of("/bin/sh");

    private final MemoryLimit memoryLimit;
    private final boolean posix;
    private final ExecutorService tasks;

    public DefaultProcessLauncher(MemoryLimit memoryLimit) {
        this(memoryLimit, detectPosix());
    }

    DefaultProcessLauncher(MemoryLimit memoryLimit, boolean posix) {
        this.memoryLimit = memoryLimit == null ? MemoryLimit.NONE : memoryLimit;
        this.posix = posix;
        this.tasks = Executors.newCachedThreadPool(new ThreadFactory() {
            private final AtomicInteger n = new AtomicInteger();
            @Override public Thread newThread(Runnable r) { Thread t = new Thread(r, "poolflow-task-" + n.incrementAndGet()); t.setDaemon(true); return t; }
        });
        if (this.memoryLimit != MemoryLimit.NONE && !posix) {
            log.warn("Platform {} does not support resource limitations; memory limit mode {} is ignored",
                    System.getProperty("os.name"), this.memoryLimit);
        }
    }

    @Override
    public JobProcess launch(JobView job) throws LaunchException {
        if (job.command() instanceof ExternalCommand ext) return launchExternal(job, ext);
        if (job.command() instanceof InProcessTask task) return launchTask(job, task);
        throw new LaunchException("unsupported command type " + job.command().getClass().getName());
    }

    @Override
    public boolean limitsEnforced() { return memoryLimit != MemoryLimit.NONE && posix; }

    @Override
    public void close() { tasks.shutdown(); }

    private JobProcess launchExternal(JobView job, ExternalCommand cmd) throws LaunchException {
        ProcessBuilder pb = new ProcessBuilder(commandLine(cmd.argv(), job.cost()));
        if (cmd.workingDir() != null) pb.directory(cmd.workingDir().toFile());
        if (cmd.logFile() != null) {
            try {
                Path parent = cmd.logFile().toAbsolutePath().getParent();
                if (parent != null) Files.createDirectories(parent);
            } catch (IOException e) {
                throw new LaunchException("cannot create log directory for job " + job.id(), e);
            }
            pb.redirectErrorStream(true);
            pb.redirectOutput(ProcessBuilder.Redirect.appendTo(cmd.logFile().toFile()));
        } else {
            pb.inheritIO();
        }
        try {
            Process p = pb.start();
            log.debug("Job {} started as pid {}: {}", job.id(), p.pid(), cmd.label());
            return new OsProcess(p);
        } catch (IOException | SecurityException e) {
            throw new LaunchException("cannot start '" + cmd.label() + "' for job " + job.id(), e);
        }
    }

    private JobProcess launchTask(JobView job, InProcessTask task) throws LaunchException {
        try {
            return new TaskProcess(tasks.submit(task.task()));
        } catch (RejectedExecutionException e) {
            throw new LaunchException("launcher is shut down; cannot run job " + job.id(), e);
        }
    }

    List<String> commandLine(List<String> argv, long costBytes) {
        if (memoryLimit == MemoryLimit.NONE || !posix || costBytes <= 0) return argv;
        long kib = costBytes / 1024 + (costBytes % 1024 == 0 ? 0 : 1);
        String ulimit = memoryLimit == MemoryLimit.SOFT ? "ulimit -S -v " + kib : "ulimit -v " + kib;
        List<String> wrapped = new ArrayList<>(argv.size() + 3);
        wrapped.add(SHELL.toString());
        wrapped.add("-c");
        wrapped.add(ulimit + " && exec \"$0\" \"$@\"");
        wrapped.addAll(argv);
        return wrapped;
    }

    private static boolean detectPosix() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        return !os.startsWith("windows") && Files.isExecutable(SHELL);
    }

    static final class OsProcess implements JobProcess {
        private final Process process;

        OsProcess(Process process) { this.process = process; }

        @Override
        public Optional<JobResult> poll() {
            if (process.isAlive()) return Optional.empty();
            return Optional.of(JobResult.exited(process.exitValue()));
        }
    }

    static final class TaskProcess implements JobProcess {
        private final Future<Integer> future;

        TaskProcess(Future<Integer> future) { this.future = future; }

        @Override
        public Optional<JobResult> poll() {
            if (!future.isDone()) return Optional.empty();
            try {
                Integer code = future.get();
                return Optional.of(JobResult.exited(code == null ? 0 : code));
            } catch (ExecutionException e) {
                return Optional.of(JobResult.crashed(e.getCause() == null ? e : e.getCause()));
            } catch (CancellationException e) {
                return Optional.of(JobResult.crashed(e));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
        }
    }
}
