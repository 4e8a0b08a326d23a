package com.phillippitts.commandkit.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for drain task threads.
 * Binds to properties prefixed with "commandkit.drain".
 *
 * <p>Example application.properties:
 * <pre>
 * commandkit.drain.thread-name-prefix=cmd-drain-
 * commandkit.drain.daemon=true
 * </pre>
 *
 * @param threadNamePrefix prefix for drain thread names, for identification in logs and profilers
 * @param daemon whether drain threads are daemon threads (they never keep the JVM alive)
 */
@ConfigurationProperties(prefix = "commandkit.drain")
@Validated
public record DrainProperties(
        @DefaultValue("cmd-drain-")
        @NotBlank(message = "Drain thread name prefix must not be blank")
        String threadNamePrefix,

        @DefaultValue("true")
        boolean daemon
) {
}
