package com.phillippitts.commandkit.exception;

/**
 * Thrown when a kill request could not be delivered, for example because the process
 * was never started or has already finished.
 */
public class ProcessKillException extends CommandKitException {

    private final String commandLine;

    public ProcessKillException(String message) {
        super(message);
        this.commandLine = "";
    }

    public ProcessKillException(String message, String commandLine, Throwable cause) {
        super(message + " (command=" + commandLine + ")", cause);
        this.commandLine = commandLine;
    }

    public String getCommandLine() {
        return commandLine;
    }
}
