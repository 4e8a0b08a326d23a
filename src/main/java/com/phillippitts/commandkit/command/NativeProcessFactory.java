package com.phillippitts.commandkit.command;

import java.util.concurrent.Executor;

/**
 * Creates fresh {@link NativeProcess} handles. One handle backs exactly one process.
 */
@FunctionalInterface
interface NativeProcessFactory {

    /**
     * @param taskExecutor executor for background work the handle needs, such as feeding
     *                     standard input
     * @return new, not yet spawned handle
     */
    NativeProcess create(Executor taskExecutor);

    static NativeProcessFactory processBuilder() {
        return ProcessBuilderNativeProcess::new;
    }
}
