// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A description of what the calling thread is doing, active for the duration of a try-with-resources block.
 * <p>
 * Traces describe work in user-readable terms ("reading environment 'itemize' starting at line 4, column 1"). Parse
 * error conditions copy the active traces when they are created, so a diagnostic can say where the reader was and
 * why.
 * <p>
 * A trace belongs to the thread that created it.
 */
public final class Trace implements AutoCloseable {
    /**
     * Activates a trace whose message is computed only if somebody asks for it.
     */
    public Trace(final MessageSupplier supplier) {
        this.supplier = supplier;
        open();
    }

    public Trace(final String message) {
        this.message = message;
        open();
    }

    /**
     * Returns the messages of the calling thread's active traces, innermost first.
     */
    public static List<String> activeMessages() {
        final var messages = new ArrayList<String>();
        for (final var trace : activeTraces.get()) {
            messages.add(trace.message());
        }
        return messages;
    }

    /**
     * Does nothing; referencing the resource keeps the compiler from warning about an unused try-with-resources
     * variable.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    @Override
    public void close() {
        final var traces = activeTraces.get();
        assert traces.peek() == this : "Trace closed out of order or by a different thread";
        traces.pop();
    }

    private void open() {
        activeTraces.get().push(this);
    }

    private String message() {
        if (message == null) {
            assert supplier != null;
            message = supplier.get();
            supplier = null;
        }
        return message;
    }

    private @Nullable String message = null;
    private @Nullable MessageSupplier supplier = null;

    @SuppressWarnings("nullness:type.argument") // Not actually nullable, CF doesn't understand withInitial.
    private static final ThreadLocal<ArrayDeque<Trace>> activeTraces = ThreadLocal.withInitial(ArrayDeque::new);

    /**
     * Produces a trace message on demand.
     */
    @FunctionalInterface
    public interface MessageSupplier {
        String get();
    }
}
