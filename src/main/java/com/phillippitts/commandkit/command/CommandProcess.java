package com.phillippitts.commandkit.command;

import com.phillippitts.commandkit.io.Sink;
import com.phillippitts.commandkit.io.Sinks;

import java.io.InputStream;
import java.io.OutputStream;

/**
 * One instance of a {@link Command}. A process is not running when created and must be
 * started with {@link #start()}. It is single-use: once started it is never restarted, and
 * calling {@code start} a second time is unsupported.
 *
 * <p>State machine:
 * <pre>
 * CREATED → STARTED (via start)
 * STARTED → TERMINAL (exit, kill, or spawn failure)
 * </pre>
 *
 * <p>Everything the process writes to standard output and standard error is copied by two
 * background drain tasks into every registered sink, in registration order.
 *
 * @since 1.0
 */
public interface CommandProcess {

    /**
     * Adds instance-specific arguments after the command's base arguments. Only meaningful
     * before {@link #start()}.
     *
     * @param args arguments to append, in order
     */
    void appendArguments(String... args);

    /**
     * Sets the source for the process's standard input. Last call wins.
     *
     * @param source input bytes, or {@code null} for an immediately closed standard input
     */
    void setInput(InputStream source);

    /**
     * Adds a sink that receives everything the process writes to standard output.
     *
     * @param sink destination; closed at end of stream if it is {@link java.io.Closeable}
     */
    void registerOutput(Sink sink);

    /**
     * Adds a sink that receives everything the process writes to standard error.
     *
     * @param sink destination; closed at end of stream if it is {@link java.io.Closeable}
     */
    void registerError(Sink sink);

    /**
     * Registers {@code stream} for standard output; the stream is closed at end of stream.
     */
    default void registerOutput(OutputStream stream) {
        registerOutput(Sinks.of(stream));
    }

    /**
     * Registers {@code stream} for standard error; the stream is closed at end of stream.
     */
    default void registerError(OutputStream stream) {
        registerError(Sinks.of(stream));
    }

    /**
     * Starts the process and its drain tasks. Returns as soon as the process has been
     * spawned; it does not wait for any output.
     *
     * @throws com.phillippitts.commandkit.exception.ProcessStartException if the process
     *         could not be started
     */
    void start();

    /**
     * Blocks until the process has exited, on its own or because it was killed.
     *
     * <p>Returning from {@code waitFor} does <b>not</b> guarantee that the drain tasks have
     * delivered the last bytes to the sinks. Trailing output may still arrive afterwards.
     * Use {@link #waitAndDrain()} when the sinks must be complete.
     *
     * @throws com.phillippitts.commandkit.exception.ProcessExitException on abnormal exit
     * @throws InterruptedException if the waiting thread is interrupted
     */
    void waitFor() throws InterruptedException;

    /**
     * Like {@link #waitFor()}, but also waits until both drain tasks have finished copying
     * and closed their sinks. An exit failure is rethrown only after the drains are done.
     *
     * @throws com.phillippitts.commandkit.exception.ProcessExitException on abnormal exit
     * @throws InterruptedException if the waiting thread is interrupted
     */
    void waitAndDrain() throws InterruptedException;

    /**
     * Best-effort forced termination. Guarantees are platform-dependent.
     *
     * @throws com.phillippitts.commandkit.exception.ProcessKillException if the kill could
     *         not be delivered
     */
    void kill();
}
