package com.phillippitts.commandkit.exception;

/**
 * Thrown when a process cannot be started: either its error stream could not be
 * acquired or the operating system refused to spawn it. The process never runs.
 */
public class ProcessStartException extends CommandKitException {

    private final String commandLine;

    public ProcessStartException(String message) {
        super(message);
        this.commandLine = "";
    }

    public ProcessStartException(String message, String commandLine, Throwable cause) {
        super(message + " (command=" + commandLine + ")", cause);
        this.commandLine = commandLine;
    }

    public String getCommandLine() {
        return commandLine;
    }
}
