package com.phillippitts.commandkit.command;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Production {@link NativeProcess} backed by {@link ProcessBuilder}.
 *
 * <p>Streams whose pipe was not acquired are discarded. Without an input source the
 * child's standard input is closed right after spawning, so reads see end-of-stream.
 */
final class ProcessBuilderNativeProcess implements NativeProcess {

    private static final Logger LOG = LogManager.getLogger(ProcessBuilderNativeProcess.class);

    private final Executor taskExecutor;

    private DeferredPipe errorPipe;
    private DeferredPipe outputPipe;
    private InputStream input;
    private volatile Process process;

    ProcessBuilderNativeProcess(Executor taskExecutor) {
        this.taskExecutor = Objects.requireNonNull(taskExecutor, "taskExecutor");
    }

    @Override
    public synchronized InputStream errorPipe() throws IOException {
        if (process != null) {
            throw new IOException("Error pipe requested after process started");
        }
        if (errorPipe != null) {
            throw new IOException("Error pipe already acquired");
        }
        errorPipe = new DeferredPipe();
        return errorPipe;
    }

    @Override
    public synchronized InputStream outputPipe() throws IOException {
        if (process != null) {
            throw new IOException("Output pipe requested after process started");
        }
        if (outputPipe != null) {
            throw new IOException("Output pipe already acquired");
        }
        outputPipe = new DeferredPipe();
        return outputPipe;
    }

    @Override
    public synchronized void setInput(InputStream source) {
        this.input = source;
    }

    @Override
    public synchronized void spawn(List<String> command) throws IOException {
        if (process != null) {
            throw new IOException("Process already started");
        }
        ProcessBuilder pb = new ProcessBuilder(command);
        // Keep stderr separate from stdout (each has its own broadcaster)
        pb.redirectErrorStream(false);
        pb.redirectError(errorPipe != null ? ProcessBuilder.Redirect.PIPE : ProcessBuilder.Redirect.DISCARD);
        pb.redirectOutput(outputPipe != null ? ProcessBuilder.Redirect.PIPE : ProcessBuilder.Redirect.DISCARD);

        Process started;
        try {
            started = pb.start();
        } catch (IOException e) {
            failPipes(e);
            throw e;
        }
        this.process = started;

        if (errorPipe != null) {
            errorPipe.connect(started.getErrorStream());
        }
        if (outputPipe != null) {
            outputPipe.connect(started.getInputStream());
        }
        feedInput(started);
    }

    @Override
    public int waitFor() throws InterruptedException {
        Process p = this.process;
        if (p == null) {
            throw new IllegalStateException("Process not started");
        }
        return p.waitFor();
    }

    @Override
    public void kill() throws IOException {
        Process p = this.process;
        if (p == null) {
            throw new IOException("Process not started");
        }
        if (!p.isAlive()) {
            throw new IOException("Process already finished");
        }
        p.destroyForcibly();
    }

    private void failPipes(IOException cause) {
        if (errorPipe != null) {
            errorPipe.fail(cause);
        }
        if (outputPipe != null) {
            outputPipe.fail(cause);
        }
    }

    private void feedInput(Process started) {
        InputStream source = this.input;
        OutputStream stdin = started.getOutputStream();
        if (source == null) {
            try {
                stdin.close();
            } catch (IOException e) {
                LOG.debug("Closing stdin of pid {} failed: {}", started.pid(), e.toString());
            }
            return;
        }
        taskExecutor.execute(() -> {
            try (OutputStream out = stdin) {
                source.transferTo(out);
            } catch (IOException e) {
                // Usual when the child exits without reading all of its input
                LOG.debug("Input pump for pid {} stopped: {}", started.pid(), e.toString());
            }
        });
    }
}
