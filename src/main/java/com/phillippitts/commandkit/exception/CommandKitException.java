package com.phillippitts.commandkit.exception;

/**
 * Base exception for all command-kit process errors.
 * All lifecycle exceptions extend this class so callers can handle them in one place.
 */
public class CommandKitException extends RuntimeException {

    public CommandKitException(String message) {
        super(message);
    }

    public CommandKitException(String message, Throwable cause) {
        super(message, cause);
    }

    public CommandKitException(Throwable cause) {
        super(cause);
    }
}
