package com.phillippitts.commandkit.io;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Replicates one byte stream to every registered {@link Sink}.
 *
 * <p>The sink list is append-only. Registration order is delivery order for every write
 * and the order in which sinks are closed. A sink registered while data is flowing only
 * receives writes that start after its registration.
 *
 * <p><b>Thread Safety:</b> {@link #register}, {@link #write} and {@link #close} are
 * serialized by a {@link ReentrantLock}.
 *
 * @since 1.0
 */
public final class OutputBroadcaster implements Sink, Closeable {

    static final int COPY_BUFFER_SIZE = 8192;

    private final Lock lock = new ReentrantLock();
    private final List<Sink> sinks = new ArrayList<>();

    /**
     * Adds a sink to the end of the delivery list.
     *
     * @param sink destination to add
     * @throws NullPointerException if sink is null
     */
    public void register(Sink sink) {
        Objects.requireNonNull(sink, "sink");
        lock.lock();
        try {
            sinks.add(sink);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return number of registered sinks
     */
    public int size() {
        lock.lock();
        try {
            return sinks.size();
        } finally {
            lock.unlock();
        }
    }

    public int write(byte[] buffer) throws IOException {
        return write(buffer, 0, buffer.length);
    }

    /**
     * Writes the range to each sink in registration order.
     *
     * <p>Delivery stops at the first failing sink: sinks after it do not see this buffer.
     *
     * @return {@code length} when every sink accepted the full range
     * @throws ShortWriteException if a sink accepted fewer bytes without failing
     * @throws IOException the first failure raised by a sink
     */
    @Override
    public int write(byte[] buffer, int offset, int length) throws IOException {
        lock.lock();
        try {
            for (Sink sink : sinks) {
                int written = sink.write(buffer, offset, length);
                if (written != length) {
                    throw new ShortWriteException(written, length);
                }
            }
            return length;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes every sink that implements {@link Closeable}, in registration order,
     * stopping at the first failure. Other sinks are skipped.
     *
     * @throws IOException the first close failure
     */
    @Override
    public void close() throws IOException {
        lock.lock();
        try {
            for (Sink sink : sinks) {
                if (sink instanceof Closeable closeable) {
                    closeable.close();
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forwards everything read from {@code source} until end-of-stream, then closes the
     * sinks. The close is attempted even when reading or writing failed; in that case the
     * original failure is rethrown with any close failure attached as suppressed.
     *
     * @param source stream to drain
     * @return number of bytes copied
     * @throws IOException read, write or close failure
     */
    public long copy(InputStream source) throws IOException {
        byte[] buffer = new byte[COPY_BUFFER_SIZE];
        long total = 0;
        try {
            int read;
            while ((read = source.read(buffer)) != -1) {
                write(buffer, 0, read);
                total += read;
            }
        } catch (IOException | RuntimeException e) {
            try {
                close();
            } catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
        close();
        return total;
    }
}
