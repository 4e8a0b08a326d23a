/**
 * Spring Boot integration.
 *
 * <p>{@link com.phillippitts.commandkit.config.CommandKitAutoConfiguration} is registered in
 * {@code META-INF/spring/org.springframework.boot.autoconfigure.AutoConfiguration.imports} and
 * contributes a {@link com.phillippitts.commandkit.command.CommandFactory} whose drain
 * threads are configured by {@link com.phillippitts.commandkit.config.DrainProperties}.
 *
 * <p>Configuration (application.properties):
 * <pre>
 * commandkit.drain.thread-name-prefix=cmd-drain-
 * commandkit.drain.daemon=true
 * </pre>
 *
 * @since 1.0
 */
package com.phillippitts.commandkit.config;
