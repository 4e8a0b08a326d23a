package com.phillippitts.commandkit.command;

import com.phillippitts.commandkit.util.CommandLines;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * {@link Command} that manufactures real operating-system processes.
 *
 * <p>The only mutable state is the path. Processes created from the same command are
 * independent of each other and of later path changes.
 */
final class ProcessCommand implements Command {

    private final List<String> baseArguments;
    private final NativeProcessFactory nativeProcessFactory;
    private final Executor drainExecutor;
    private String path;

    ProcessCommand(String path, List<String> baseArguments,
                   NativeProcessFactory nativeProcessFactory, Executor drainExecutor) {
        this.path = Objects.requireNonNull(path, "path");
        this.baseArguments = List.copyOf(baseArguments);
        this.nativeProcessFactory = Objects.requireNonNull(nativeProcessFactory, "nativeProcessFactory");
        this.drainExecutor = Objects.requireNonNull(drainExecutor, "drainExecutor");
    }

    @Override
    public String getPath() {
        return path;
    }

    @Override
    public void setPath(String path) {
        this.path = Objects.requireNonNull(path, "path");
    }

    List<String> getBaseArguments() {
        return baseArguments;
    }

    @Override
    public CommandProcess newProcess() {
        List<String> command = new ArrayList<>(baseArguments.size() + 1);
        command.add(path);
        command.addAll(baseArguments);
        return new SystemProcess(nativeProcessFactory.create(drainExecutor), command, drainExecutor);
    }

    @Override
    public String toString() {
        List<String> command = new ArrayList<>(baseArguments.size() + 1);
        command.add(path);
        command.addAll(baseArguments);
        return CommandLines.format(command);
    }
}
