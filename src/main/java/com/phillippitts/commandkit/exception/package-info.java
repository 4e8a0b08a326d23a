/**
 * Process lifecycle exception hierarchy.
 *
 * <p>Every failure of the process lifecycle is reported as an unchecked exception thrown at
 * the call site that caused it. Nothing is retried.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.commandkit.exception.CommandKitException} - Base exception</li>
 *   <li>{@link com.phillippitts.commandkit.exception.ProcessStartException} - The error stream
 *       could not be acquired or the spawn itself failed; thrown from {@code start}</li>
 *   <li>{@link com.phillippitts.commandkit.exception.ProcessExitException} - Non-zero or
 *       abnormal termination; thrown from {@code waitFor}</li>
 *   <li>{@link com.phillippitts.commandkit.exception.ProcessKillException} - Kill could not be
 *       delivered; thrown from {@code kill}</li>
 * </ul>
 *
 * <p>Sink failures are not part of this hierarchy. They are the {@link java.io.IOException}
 * raised by the sink itself, or a {@link com.phillippitts.commandkit.io.ShortWriteException}
 * when a sink silently accepts fewer bytes than requested.
 *
 * @since 1.0
 */
package com.phillippitts.commandkit.exception;
