package com.phillippitts.commandkit.command;

/**
 * Entry point for plain Java callers.
 *
 * <pre>
 * Command git = Commands.newCommand("git", "--no-pager");
 * CommandProcess log = git.newProcess();
 * log.appendArguments("log", "--oneline");
 * CapturingSink out = new CapturingSink();
 * log.registerOutput(out);
 * log.start();
 * log.waitAndDrain();
 * </pre>
 */
public final class Commands {

    private static final CommandFactory DEFAULT_FACTORY = CommandFactory.withDefaults();

    private Commands() {}

    /**
     * Creates a command whose drain tasks run on {@link DrainThreads#shared()}.
     *
     * @see CommandFactory#newCommand(String, String...)
     */
    public static Command newCommand(String path, String... baseArguments) {
        return DEFAULT_FACTORY.newCommand(path, baseArguments);
    }
}
