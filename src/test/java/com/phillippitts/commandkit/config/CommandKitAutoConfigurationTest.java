package com.phillippitts.commandkit.config;

import com.phillippitts.commandkit.command.CommandFactory;
import com.phillippitts.commandkit.command.CommandProcess;
import com.phillippitts.commandkit.command.DrainThreads;
import com.phillippitts.commandkit.io.CapturingSink;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class CommandKitAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(CommandKitAutoConfiguration.class));

    @Test
    void contributesCommandFactoryAndDrainExecutor() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(CommandFactory.class);
            assertThat(context).hasBean("drainExecutor");
            assertThat(context.getBean(DrainProperties.class).threadNamePrefix()).isEqualTo("cmd-drain-");
            assertThat(context.getBean(DrainProperties.class).daemon()).isTrue();
        });
    }

    @Test
    void drainThreadsUseConfiguredPrefix() {
        contextRunner.withPropertyValues("commandkit.drain.thread-name-prefix=custom-drain-")
                .run(context -> {
                    Executor executor = context.getBean("drainExecutor", Executor.class);
                    assertThat(executor).isInstanceOf(SimpleAsyncTaskExecutor.class);

                    CompletableFuture<String> threadName = new CompletableFuture<>();
                    executor.execute(() -> threadName.complete(Thread.currentThread().getName()));

                    assertThat(threadName.get(5, TimeUnit.SECONDS)).startsWith("custom-drain-");
                });
    }

    @Test
    void blankPrefixFailsValidation() {
        contextRunner.withPropertyValues("commandkit.drain.thread-name-prefix= ")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void backsOffWhenApplicationDefinesItsOwnFactory() {
        CommandFactory custom = new CommandFactory(new DrainThreads("app-"));
        contextRunner.withBean(CommandFactory.class, () -> custom)
                .run(context -> assertThat(context.getBean(CommandFactory.class)).isSameAs(custom));
    }

    @Test
    void factoryBeanRunsRealProcesses() {
        contextRunner.run(context -> {
            CommandFactory factory = context.getBean(CommandFactory.class);
            String java = Path.of(System.getProperty("java.home"), "bin", "java").toString();
            CommandProcess process = factory.newCommand(java, "-version").newProcess();
            CapturingSink stderr = new CapturingSink();
            process.registerError(stderr);

            process.start();
            process.waitAndDrain();

            assertThat(stderr.toString()).containsIgnoringCase("version");
        });
    }
}
