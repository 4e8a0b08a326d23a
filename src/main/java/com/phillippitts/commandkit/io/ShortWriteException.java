package com.phillippitts.commandkit.io;

import java.io.IOException;

/**
 * Thrown when a sink accepted fewer bytes than requested without reporting an error.
 */
public class ShortWriteException extends IOException {

    private final int written;
    private final int requested;

    public ShortWriteException(int written, int requested) {
        super("Short write (written=" + written + ", requested=" + requested + ")");
        this.written = written;
        this.requested = requested;
    }

    public int getWritten() {
        return written;
    }

    public int getRequested() {
        return requested;
    }
}
