package com.phillippitts.commandkit.io;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Splits a byte stream into UTF-8 lines and hands each complete line to a consumer.
 *
 * <p>Lines end at {@code \n}; a preceding {@code \r} is dropped. A trailing line without a
 * terminator is delivered when the sink is closed, which happens when the observed
 * process stream ends.
 */
public final class LineSink implements Sink, Closeable {

    private final Consumer<String> consumer;
    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();

    public LineSink(Consumer<String> consumer) {
        this.consumer = Objects.requireNonNull(consumer, "consumer");
    }

    @Override
    public synchronized int write(byte[] buffer, int offset, int length) {
        for (int i = offset; i < offset + length; i++) {
            byte b = buffer[i];
            if (b == '\n') {
                emit();
            } else {
                pending.write(b);
            }
        }
        return length;
    }

    @Override
    public synchronized void close() {
        if (pending.size() > 0) {
            emit();
        }
    }

    private void emit() {
        byte[] bytes = pending.toByteArray();
        int end = bytes.length;
        if (end > 0 && bytes[end - 1] == '\r') {
            end--;
        }
        pending.reset();
        consumer.accept(new String(bytes, 0, end, StandardCharsets.UTF_8));
    }
}
