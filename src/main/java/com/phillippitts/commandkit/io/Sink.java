package com.phillippitts.commandkit.io;

import java.io.IOException;

/**
 * Destination for bytes produced by a process stream.
 *
 * <p>A sink reports how many bytes it accepted. Accepting fewer than requested without
 * throwing is treated as a short write by {@link OutputBroadcaster}. A sink that also
 * implements {@link java.io.Closeable} is closed when the stream it observes ends.
 */
@FunctionalInterface
public interface Sink {

    /**
     * Writes {@code length} bytes of {@code buffer} starting at {@code offset}.
     *
     * @param buffer source bytes
     * @param offset start offset in {@code buffer}
     * @param length number of bytes to write
     * @return number of bytes accepted
     * @throws IOException if the destination failed
     */
    int write(byte[] buffer, int offset, int length) throws IOException;
}
