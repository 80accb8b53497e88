package io.poolflow.runtime;

import io.poolflow.job.JobId;
import io.poolflow.job.JobResult;
import io.poolflow.job.JobView;
import io.poolflow.process.JobProcess;
import io.poolflow.process.LaunchException;
import io.poolflow.process.ProcessLauncher;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Launcher whose processes run until the test finishes them. */
class FakeLauncher implements ProcessLauncher {
    final List<JobId> launched = new ArrayList<>();
    final Map<JobId, FakeProcess> processes = new HashMap<>();
    final Set<JobId> failLaunch = new HashSet<>();
    boolean closed;

    @Override
    public JobProcess launch(JobView job) throws LaunchException {
        if (failLaunch.contains(job.id())) throw new LaunchException("no such binary");
        FakeProcess p = new FakeProcess();
        launched.add(job.id());
        processes.put(job.id(), p);
        return p;
    }

    void exit(long id, int code) { processes.get(new JobId(id)).result = JobResult.exited(code); }

    void exitAll(int code) { processes.values().forEach(p -> { if (p.result == null) p.result = JobResult.exited(code); }); }

    @Override
    public void close() { closed = true; }

    static class FakeProcess implements JobProcess {
        volatile JobResult result;
        volatile RuntimeException pollError;
        int polls;

        @Override
        public Optional<JobResult> poll() {
            polls++;
            if (pollError != null) throw pollError;
            return Optional.ofNullable(result);
        }
    }
}
