/**
 * Commands and the processes manufactured from them.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.commandkit.command.Command} - Reusable template: executable
 *       path plus base arguments</li>
 *   <li>{@link com.phillippitts.commandkit.command.CommandProcess} - One instance of a command,
 *       with start/wait/kill and stream registration</li>
 *   <li>{@link com.phillippitts.commandkit.command.Commands} and
 *       {@link com.phillippitts.commandkit.command.CommandFactory} - Public factories</li>
 *   <li>{@link com.phillippitts.commandkit.command.DrainThreads} - Default thread-per-task
 *       executor for drain tasks</li>
 * </ul>
 *
 * <p>Process Flow:
 * <ol>
 *   <li>Build a {@code Command} and ask it for a {@code CommandProcess}</li>
 *   <li>Append instance arguments, set input, register sinks</li>
 *   <li>{@code start()} launches the stderr and stdout drain tasks, then spawns the OS process</li>
 *   <li>{@code waitFor()} blocks until the OS process exits; {@code waitAndDrain()} also waits
 *       for the drain tasks</li>
 * </ol>
 *
 * <p>The OS primitive sits behind the package-private {@code NativeProcess} seam, backed by
 * {@link java.lang.ProcessBuilder} in production.
 *
 * @since 1.0
 */
package com.phillippitts.commandkit.command;
