package com.phillippitts.commandkit.exception;

/**
 * Thrown by {@code waitFor} when a process terminated abnormally, either with a
 * non-zero exit code or because it was killed.
 */
public class ProcessExitException extends CommandKitException {

    /** Exit code used when the failure was not produced by a real exit status. */
    public static final int UNKNOWN_EXIT_CODE = -1;

    private final String commandLine;
    private final int exitCode;

    public ProcessExitException(String message) {
        super(message);
        this.commandLine = "";
        this.exitCode = UNKNOWN_EXIT_CODE;
    }

    public ProcessExitException(String commandLine, int exitCode) {
        super("Non-zero exit (exitCode=" + exitCode + ", command=" + commandLine + ")");
        this.commandLine = commandLine;
        this.exitCode = exitCode;
    }

    public String getCommandLine() {
        return commandLine;
    }

    public int getExitCode() {
        return exitCode;
    }
}
