package com.phillippitts.commandkit.io;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

/**
 * Adapters from {@link OutputStream} to {@link Sink}.
 */
public final class Sinks {

    private Sinks() {}

    /**
     * Wraps a stream in a sink that is closed together with the process stream.
     *
     * @param stream destination stream
     * @return closing sink
     */
    public static Sink of(OutputStream stream) {
        return new StreamSink(Objects.requireNonNull(stream, "stream"));
    }

    /**
     * Wraps a stream in a sink that never closes it. Use for shared streams such as
     * {@code System.out}.
     *
     * @param stream destination stream
     * @return non-closing sink
     */
    public static Sink nonClosing(OutputStream stream) {
        Objects.requireNonNull(stream, "stream");
        return (buffer, offset, length) -> {
            stream.write(buffer, offset, length);
            stream.flush();
            return length;
        };
    }

    private static final class StreamSink implements Sink, Closeable {
        private final OutputStream stream;

        StreamSink(OutputStream stream) {
            this.stream = stream;
        }

        @Override
        public int write(byte[] buffer, int offset, int length) throws IOException {
            stream.write(buffer, offset, length);
            stream.flush();
            return length;
        }

        @Override
        public void close() throws IOException {
            stream.close();
        }
    }
}
