package com.phillippitts.commandkit.command;

import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Creates {@link Command}s whose processes run their drain tasks on a given executor.
 *
 * <p>The executor must start every task promptly: drain tasks block until the process
 * closes its streams, so a bounded queue or caller-runs policy can stall {@code start}.
 */
public final class CommandFactory {

    private final Executor drainExecutor;
    private final NativeProcessFactory nativeProcessFactory;

    public CommandFactory(Executor drainExecutor) {
        this(drainExecutor, NativeProcessFactory.processBuilder());
    }

    CommandFactory(Executor drainExecutor, NativeProcessFactory nativeProcessFactory) {
        this.drainExecutor = Objects.requireNonNull(drainExecutor, "drainExecutor");
        this.nativeProcessFactory = Objects.requireNonNull(nativeProcessFactory, "nativeProcessFactory");
    }

    /**
     * @return factory using {@link DrainThreads#shared()}
     */
    public static CommandFactory withDefaults() {
        return new CommandFactory(DrainThreads.shared());
    }

    /**
     * Creates a command for the given executable. Base arguments are passed to every
     * process created from the command; each process may append its own.
     *
     * @param path executable path (equivalent to {@code argv[0]})
     * @param baseArguments arguments shared by every process
     * @return new command
     */
    public Command newCommand(String path, String... baseArguments) {
        return new ProcessCommand(path, Arrays.asList(baseArguments), nativeProcessFactory, drainExecutor);
    }
}
