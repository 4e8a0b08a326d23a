package com.phillippitts.commandkit.command;

import com.phillippitts.commandkit.exception.CommandKitException;
import com.phillippitts.commandkit.exception.ProcessExitException;
import com.phillippitts.commandkit.exception.ProcessKillException;
import com.phillippitts.commandkit.exception.ProcessStartException;
import com.phillippitts.commandkit.io.OutputBroadcaster;
import com.phillippitts.commandkit.io.Sink;
import com.phillippitts.commandkit.util.CommandLines;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * {@link CommandProcess} backed by a real operating-system process.
 *
 * <p>Responsibilities:
 * - Finalize the argument list (base arguments followed by appended ones)
 * - Start one drain task per stream before spawning, so no output is missed
 * - Spawn via {@link NativeProcess}
 * - Translate native failures into the exception hierarchy
 *
 * <p>{@link #waitFor()} only waits for the OS process. The drain tasks may still be
 * delivering the tail of the output when it returns; {@link #waitAndDrain()} waits for both.
 */
final class SystemProcess implements CommandProcess {

    private static final Logger LOG = LogManager.getLogger(SystemProcess.class);

    private final NativeProcess nativeProcess;
    private final List<String> baseCommand;
    private final Executor drainExecutor;
    private final List<String> extraArguments = new ArrayList<>();
    private final OutputBroadcaster output = new OutputBroadcaster();
    private final OutputBroadcaster error = new OutputBroadcaster();

    private volatile List<String> commandLine;
    private volatile CompletableFuture<Void> errorDrain;
    private volatile CompletableFuture<Void> outputDrain;

    SystemProcess(NativeProcess nativeProcess, List<String> baseCommand, Executor drainExecutor) {
        this.nativeProcess = Objects.requireNonNull(nativeProcess, "nativeProcess");
        this.baseCommand = List.copyOf(baseCommand);
        this.drainExecutor = Objects.requireNonNull(drainExecutor, "drainExecutor");
    }

    @Override
    public void appendArguments(String... args) {
        extraArguments.addAll(Arrays.asList(args));
    }

    @Override
    public void setInput(InputStream source) {
        nativeProcess.setInput(source);
    }

    @Override
    public void registerOutput(Sink sink) {
        output.register(sink);
    }

    @Override
    public void registerError(Sink sink) {
        error.register(sink);
    }

    @Override
    public void start() {
        List<String> command = new ArrayList<>(baseCommand);
        command.addAll(extraArguments);
        this.commandLine = List.copyOf(command);
        String rendered = CommandLines.format(command);

        InputStream errorPipe;
        try {
            errorPipe = nativeProcess.errorPipe();
        } catch (IOException e) {
            throw new ProcessStartException("Unable to acquire error stream", rendered, e);
        }
        errorDrain = drain(errorPipe, error, "stderr", rendered);

        // An output pipe failure does not abort the start: the process is spawned without
        // an output drain. Only an error pipe failure prevents spawning.
        InputStream outputPipe = null;
        try {
            outputPipe = nativeProcess.outputPipe();
        } catch (IOException e) {
            LOG.warn("Unable to acquire output stream for '{}'; running without output drain: {}",
                    rendered, e.toString());
        }
        if (outputPipe != null) {
            outputDrain = drain(outputPipe, output, "stdout", rendered);
        }

        try {
            nativeProcess.spawn(command);
        } catch (IOException e) {
            throw new ProcessStartException("Unable to spawn process", rendered, e);
        }
        LOG.debug("Started process: {}", rendered);
    }

    @Override
    public void waitFor() throws InterruptedException {
        int exitCode = nativeProcess.waitFor();
        String rendered = toString();
        LOG.debug("Process exited with code {}: {}", exitCode, rendered);
        if (exitCode != 0) {
            throw new ProcessExitException(rendered, exitCode);
        }
    }

    @Override
    public void waitAndDrain() throws InterruptedException {
        ProcessExitException exitFailure = null;
        try {
            waitFor();
        } catch (ProcessExitException e) {
            exitFailure = e;
        }
        awaitDrain(errorDrain);
        awaitDrain(outputDrain);
        if (exitFailure != null) {
            throw exitFailure;
        }
    }

    @Override
    public void kill() {
        try {
            nativeProcess.kill();
        } catch (IOException e) {
            throw new ProcessKillException(e.getMessage(), toString(), e);
        }
    }

    /**
     * @return the command line, including appended arguments, with whitespace-containing
     *         arguments quoted
     */
    @Override
    public String toString() {
        List<String> finalized = this.commandLine;
        if (finalized != null) {
            return CommandLines.format(finalized);
        }
        List<String> command = new ArrayList<>(baseCommand);
        command.addAll(extraArguments);
        return CommandLines.format(command);
    }

    private CompletableFuture<Void> drain(InputStream pipe, OutputBroadcaster broadcaster,
                                          String stream, String rendered) {
        return CompletableFuture.runAsync(() -> {
            try {
                long copied = broadcaster.copy(pipe);
                LOG.debug("Drained {} bytes of {} for '{}'", copied, stream, rendered);
            } catch (IOException e) {
                LOG.debug("Drain of {} for '{}' stopped: {}", stream, rendered, e.toString());
            }
        }, drainExecutor);
    }

    private static void awaitDrain(CompletableFuture<Void> drain) throws InterruptedException {
        if (drain == null) {
            return;
        }
        try {
            drain.get();
        } catch (ExecutionException e) {
            throw new CommandKitException("Drain task failed", e.getCause());
        }
    }
}
