package io.poolflow.job;

import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * A task run on a launcher-owned thread inside this JVM. The returned integer is treated as the
 * exit code; a thrown exception fails the job.
 */
public record InProcessTask(String name, Callable<Integer> task) implements JobCommand {
    public InProcessTask {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(task, "task");
    }

    public static InProcessTask of(String name, Runnable body) {
        return new InProcessTask(name, () -> { body.run(); return 0; });
    }

    @Override
    public String label() { return name; }
}
