// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * An installed condition handler, scoped with try-with-resources.
 * <p>
 * A handler declines a condition by returning, and handles it by unwinding, usually with {@link Restart#unwindTo()}
 * or by signaling an error of its own.
 */
public final class Handler implements AutoCloseable {
    /**
     * Installs a handler that sees every signaled condition.
     */
    public Handler(final @NotNull Procedure procedure) {
        this.procedure = procedure;
        ownerContext = ConditionContext.localContext();
        ownerContext.install(this);
    }

    /**
     * Installs a handler that only sees conditions of the given type, whether signaled as errors or not.
     */
    public static <C extends Condition> @NotNull Handler on(
        final @NotNull Class<C> type,
        final @NotNull TypedProcedure<? super C> procedure
    ) {
        return new Handler(signaled -> {
            if (type.isInstance(signaled.condition())) {
                procedure.handle(type.cast(signaled.condition()));
            }
        });
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
        ownerContext.uninstall(this);
    }

    void handle(final @NotNull SignaledCondition condition) throws Unwind {
        procedure.handle(condition);
    }

    private final @NotNull Procedure procedure;
    private final @NotNull ConditionContext ownerContext;

    @FunctionalInterface
    public interface Procedure {
        @SuppressWarnings("RedundantThrows")
        void handle(@NotNull SignaledCondition condition) throws Unwind;
    }

    @FunctionalInterface
    public interface TypedProcedure<C extends Condition> {
        @SuppressWarnings("RedundantThrows")
        void handle(@NotNull C condition) throws Unwind;
    }
}
