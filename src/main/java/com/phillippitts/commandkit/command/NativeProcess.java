package com.phillippitts.commandkit.command;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Low-level handle on one operating-system process.
 *
 * <p>Stream handles are acquired before spawning and become readable once the process is
 * running. Production code uses {@link ProcessBuilderNativeProcess}; tests may provide a
 * stub with controlled pipes, spawn failures and exit codes.
 */
interface NativeProcess {

    /**
     * Acquires a readable handle on the process's standard error.
     *
     * @throws IOException if the handle cannot be acquired
     */
    InputStream errorPipe() throws IOException;

    /**
     * Acquires a readable handle on the process's standard output.
     *
     * @throws IOException if the handle cannot be acquired
     */
    InputStream outputPipe() throws IOException;

    /** Sets the source copied into the process's standard input; {@code null} for none. */
    void setInput(InputStream source);

    /**
     * Spawns the process. Returns as soon as the OS has created it.
     *
     * @param command executable followed by its arguments
     * @throws IOException if the process cannot be spawned
     */
    void spawn(List<String> command) throws IOException;

    /**
     * Blocks until the process has exited.
     *
     * @return exit code
     * @throws IllegalStateException if the process was never spawned
     */
    int waitFor() throws InterruptedException;

    /**
     * Forcibly terminates the process.
     *
     * @throws IOException if the process is not running
     */
    void kill() throws IOException;
}
