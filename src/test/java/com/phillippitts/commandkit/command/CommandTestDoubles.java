package com.phillippitts.commandkit.command;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Shared test doubles for process lifecycle tests.
 * Provides a scripted {@link NativeProcess} for hermetic testing without spawning anything.
 */
final class CommandTestDoubles {

    private CommandTestDoubles() {}

    /**
     * Encapsulates scripted native process behavior.
     *
     * @param stdout bytes served by the output pipe
     * @param stderr bytes served by the error pipe
     * @param exitCode value returned by waitFor
     * @param errorPipeFailure thrown when the error pipe is acquired, or null
     * @param outputPipeFailure thrown when the output pipe is acquired, or null
     * @param spawnFailure thrown by spawn, or null
     * @param killFailure thrown by kill, or null
     */
    record NativeBehavior(String stdout, String stderr, int exitCode,
                          IOException errorPipeFailure, IOException outputPipeFailure,
                          IOException spawnFailure, IOException killFailure) {

        static NativeBehavior exitingWith(String stdout, String stderr, int exitCode) {
            return new NativeBehavior(stdout, stderr, exitCode, null, null, null, null);
        }

        NativeBehavior withErrorPipeFailure(IOException failure) {
            return new NativeBehavior(stdout, stderr, exitCode, failure, outputPipeFailure, spawnFailure, killFailure);
        }

        NativeBehavior withOutputPipeFailure(IOException failure) {
            return new NativeBehavior(stdout, stderr, exitCode, errorPipeFailure, failure, spawnFailure, killFailure);
        }

        NativeBehavior withSpawnFailure(IOException failure) {
            return new NativeBehavior(stdout, stderr, exitCode, errorPipeFailure, outputPipeFailure, failure, killFailure);
        }

        NativeBehavior withKillFailure(IOException failure) {
            return new NativeBehavior(stdout, stderr, exitCode, errorPipeFailure, outputPipeFailure, spawnFailure, failure);
        }
    }

    /**
     * Scripted native process. Records the spawned command line, the input source and kill
     * requests.
     */
    static final class ScriptedNativeProcess implements NativeProcess {
        private final NativeBehavior behavior;
        private volatile List<String> spawnedCommand;
        private volatile InputStream input;
        private volatile boolean killed;
        private volatile int errorPipeRequests;
        private volatile int outputPipeRequests;

        ScriptedNativeProcess(NativeBehavior behavior) {
            this.behavior = behavior;
        }

        List<String> spawnedCommand() {
            return spawnedCommand;
        }

        InputStream input() {
            return input;
        }

        boolean wasKilled() {
            return killed;
        }

        int errorPipeRequests() {
            return errorPipeRequests;
        }

        int outputPipeRequests() {
            return outputPipeRequests;
        }

        @Override
        public InputStream errorPipe() throws IOException {
            errorPipeRequests++;
            if (behavior.errorPipeFailure() != null) {
                throw behavior.errorPipeFailure();
            }
            return new ByteArrayInputStream(behavior.stderr().getBytes(StandardCharsets.UTF_8));
        }

        @Override
        public InputStream outputPipe() throws IOException {
            outputPipeRequests++;
            if (behavior.outputPipeFailure() != null) {
                throw behavior.outputPipeFailure();
            }
            return new ByteArrayInputStream(behavior.stdout().getBytes(StandardCharsets.UTF_8));
        }

        @Override
        public void setInput(InputStream source) {
            this.input = source;
        }

        @Override
        public void spawn(List<String> command) throws IOException {
            if (behavior.spawnFailure() != null) {
                throw behavior.spawnFailure();
            }
            this.spawnedCommand = List.copyOf(command);
        }

        @Override
        public int waitFor() {
            if (spawnedCommand == null) {
                throw new IllegalStateException("Process not started");
            }
            return behavior.exitCode();
        }

        @Override
        public void kill() throws IOException {
            if (behavior.killFailure() != null) {
                throw behavior.killFailure();
            }
            killed = true;
        }
    }

    /**
     * Factory that always hands out the same scripted native process.
     */
    static final class StubNativeProcessFactory implements NativeProcessFactory {
        private final ScriptedNativeProcess nativeProcess;

        StubNativeProcessFactory(ScriptedNativeProcess nativeProcess) {
            this.nativeProcess = nativeProcess;
        }

        @Override
        public NativeProcess create(Executor taskExecutor) {
            return nativeProcess;
        }
    }
}
