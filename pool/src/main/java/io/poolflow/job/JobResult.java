package io.poolflow.job;

/**
 * How a job ended. {@code launched} is false when the process never started, in which case
 * {@code exitCode} is {@link #NOT_LAUNCHED} and {@code error} holds the cause.
 */
public record JobResult(int exitCode, Throwable error, boolean launched) {
    public static final int NOT_LAUNCHED = -1;

    public static JobResult exited(int exitCode) { return new JobResult(exitCode, null, true); }

    public static JobResult crashed(Throwable error) { return new JobResult(1, error, true); }

    public static JobResult launchFailed(Throwable error) { return new JobResult(NOT_LAUNCHED, error, false); }

    public boolean success() { return launched && error == null && exitCode == 0; }

    public String describe() {
        if (!launched) return "launch failed: " + error;
        if (error != null) return "exit " + exitCode + " (" + error + ")";
        return "exit " + exitCode;
    }
}
