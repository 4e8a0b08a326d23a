package com.phillippitts.commandkit.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * In-memory sink that accumulates everything written to it.
 *
 * <p>An optional byte cap bounds memory use. Once the cap is reached the sink keeps
 * accepting writes, so the process stream continues to drain, but discards the excess and
 * logs a warning once. The sink is not {@link java.io.Closeable}; its content stays
 * readable after the stream ends.
 *
 * <p>Thread-safe: writers and readers synchronize on the sink.
 */
public final class CapturingSink implements Sink {

    private static final Logger LOG = LogManager.getLogger(CapturingSink.class);

    /** Cap value meaning "no limit". */
    public static final int UNLIMITED = Integer.MAX_VALUE;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final int maxBytes;
    private boolean capReached;

    public CapturingSink() {
        this(UNLIMITED);
    }

    /**
     * @param maxBytes maximum number of bytes retained (must be positive)
     */
    public CapturingSink(int maxBytes) {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive: " + maxBytes);
        }
        this.maxBytes = maxBytes;
    }

    @Override
    public synchronized int write(byte[] src, int offset, int length) {
        int available = maxBytes - buffer.size();
        if (length > available) {
            buffer.write(src, offset, Math.max(0, available));
            if (!capReached) {
                LOG.warn("Capturing sink reached {}B cap; discarding further output", maxBytes);
                capReached = true;
            }
        } else {
            buffer.write(src, offset, length);
        }
        return length;
    }

    public synchronized byte[] toByteArray() {
        return buffer.toByteArray();
    }

    public synchronized String toString(Charset charset) {
        return buffer.toString(charset);
    }

    /**
     * @return captured bytes decoded as UTF-8
     */
    @Override
    public String toString() {
        return toString(StandardCharsets.UTF_8);
    }

    public synchronized int size() {
        return buffer.size();
    }

    public synchronized boolean isCapReached() {
        return capReached;
    }
}
