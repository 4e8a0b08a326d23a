/**
 * Byte sinks and the fan-out broadcaster used for process output streams.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.commandkit.io.Sink} - Destination that reports accepted bytes</li>
 *   <li>{@link com.phillippitts.commandkit.io.OutputBroadcaster} - Lock-guarded fan-out of one
 *       stream to many sinks, with close cascade</li>
 *   <li>{@link com.phillippitts.commandkit.io.Sinks} - {@code OutputStream} adapters</li>
 *   <li>{@link com.phillippitts.commandkit.io.CapturingSink} - In-memory capture with optional cap</li>
 *   <li>{@link com.phillippitts.commandkit.io.LineSink} - Line splitting for text consumers</li>
 * </ul>
 *
 * <p>Sinks that implement {@link java.io.Closeable} are closed when the stream ends; others
 * are left untouched.
 *
 * @since 1.0
 */
package com.phillippitts.commandkit.io;
