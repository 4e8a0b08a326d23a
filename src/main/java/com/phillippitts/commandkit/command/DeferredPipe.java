package com.phillippitts.commandkit.command;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Read end of a process pipe handed out before the process exists.
 *
 * <p>Reads block until the process is spawned and the real stream is connected. If the
 * spawn fails, reads fail with the spawn's {@link IOException}.
 */
final class DeferredPipe extends InputStream {

    private final CompletableFuture<InputStream> source = new CompletableFuture<>();

    void connect(InputStream stream) {
        source.complete(stream);
    }

    void fail(IOException cause) {
        source.completeExceptionally(cause);
    }

    @Override
    public int read() throws IOException {
        return await().read();
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws IOException {
        return await().read(buffer, offset, length);
    }

    @Override
    public int available() throws IOException {
        return source.isDone() ? await().available() : 0;
    }

    @Override
    public void close() throws IOException {
        if (source.isDone() && !source.isCompletedExceptionally()) {
            source.join().close();
        }
    }

    private InputStream await() throws IOException {
        try {
            return source.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException("Interrupted waiting for process pipe");
            interrupted.initCause(e);
            throw interrupted;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            throw new IOException("Process pipe unavailable", cause);
        }
    }
}
