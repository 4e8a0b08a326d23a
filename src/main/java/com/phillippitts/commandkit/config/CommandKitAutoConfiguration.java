package com.phillippitts.commandkit.config;

import com.phillippitts.commandkit.command.CommandFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Spring Boot auto-configuration exposing a {@link CommandFactory} bean.
 *
 * <p>Drain executor: {@link SimpleAsyncTaskExecutor}, one thread per task. Drain tasks block
 * until the child process closes its streams, so a bounded pool with a queue or a
 * caller-runs rejection policy would stall {@code start()}.
 *
 * <p>Thread naming: configured via {@code commandkit.drain.thread-name-prefix}.
 *
 * <p>MDC propagation: the Log4j2 ThreadContext of the thread calling {@code start()} is
 * copied to the drain threads by {@link ThreadContextTaskDecorator}.
 *
 * <p>Both beans back off when the application defines its own.
 */
@AutoConfiguration
@EnableConfigurationProperties(DrainProperties.class)
public class CommandKitAutoConfiguration {

    /**
     * @param properties drain thread settings
     * @return thread-per-task executor for drain and input pump tasks
     */
    @Bean(name = "drainExecutor")
    @ConditionalOnMissingBean(name = "drainExecutor")
    public Executor drainExecutor(DrainProperties properties) {
        SimpleAsyncTaskExecutor executor = new SimpleAsyncTaskExecutor(properties.threadNamePrefix());
        executor.setDaemon(properties.daemon());
        executor.setTaskDecorator(new ThreadContextTaskDecorator());
        return executor;
    }

    @Bean
    @ConditionalOnMissingBean
    public CommandFactory commandFactory(@Qualifier("drainExecutor") Executor drainExecutor) {
        return new CommandFactory(drainExecutor);
    }
}
