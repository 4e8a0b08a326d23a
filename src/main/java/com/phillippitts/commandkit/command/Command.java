package com.phillippitts.commandkit.command;

/**
 * A command to be run in the future: an executable path plus base arguments shared by
 * every process manufactured from it. Running instances are represented by
 * {@link CommandProcess}.
 *
 * @since 1.0
 */
public interface Command {

    /**
     * @return path to the executable
     */
    String getPath();

    /**
     * Replaces the executable path. No validation is done here; an invalid path surfaces
     * when a process built from it fails to start.
     */
    void setPath(String path);

    /**
     * Creates a new, not yet started process from the current path and base arguments.
     */
    CommandProcess newProcess();
}
