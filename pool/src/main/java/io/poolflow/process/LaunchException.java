package io.poolflow.process;

/** The launcher could not start a job. */
public class LaunchException extends Exception {
    public LaunchException(String message) { super(message); }
    public LaunchException(String message, Throwable cause) { super(message, cause); }
}
