package io.poolflow.job;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * An operating-system command line. {@code workingDir} and {@code logFile} are optional; without a
 * log file the process inherits the scheduler's standard streams.
 */
public record ExternalCommand(List<String> argv, Path workingDir, Path logFile) implements JobCommand {
    public ExternalCommand {
        Objects.requireNonNull(argv, "argv");
        if (argv.isEmpty()) throw new IllegalArgumentException("argv must not be empty");
        argv = List.copyOf(argv);
    }

    public static ExternalCommand of(String... argv) {
        return new ExternalCommand(List.of(argv), null, null);
    }

    public ExternalCommand withWorkingDir(Path dir) { return new ExternalCommand(argv, dir, logFile); }
    public ExternalCommand withLogFile(Path file) { return new ExternalCommand(argv, workingDir, file); }

    @Override
    public String label() { return String.join(" ", argv); }
}
