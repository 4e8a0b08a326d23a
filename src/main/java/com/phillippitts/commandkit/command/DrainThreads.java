package com.phillippitts.commandkit.command;

import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Default executor for drain tasks: one named daemon thread per task.
 *
 * <p>Drain tasks block for as long as the process keeps its pipes open, so they are never
 * queued behind each other.
 */
public final class DrainThreads implements Executor {

    private static final DrainThreads SHARED = new DrainThreads("cmd-drain-");

    private final String namePrefix;
    private final AtomicInteger counter = new AtomicInteger();

    public DrainThreads(String namePrefix) {
        this.namePrefix = namePrefix;
    }

    /**
     * @return process-wide default instance
     */
    public static DrainThreads shared() {
        return SHARED;
    }

    @Override
    public void execute(Runnable task) {
        Thread thread = new Thread(task, namePrefix + counter.incrementAndGet());
        thread.setDaemon(true);
        thread.start();
    }
}
