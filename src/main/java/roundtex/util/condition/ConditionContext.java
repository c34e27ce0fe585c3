// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.util.condition;

import java.util.ArrayList;
import java.util.List;
import roundtex.util.SneakyThrow;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The calling thread's stacks of installed handlers and established restart points.
 * <p>
 * There is one context per thread, so parses running on different threads never see each other's handlers. The
 * context itself is never exposed; all operations are static and act on the calling thread's context.
 *
 * @see Handler
 * @see Restart
 */
public final class ConditionContext {
    private ConditionContext() {
    }

    /**
     * Signals the given condition without requiring anybody to handle it.
     * <p>
     * Handlers run from the innermost to the outermost. The first one to unwind ends the search; if every handler
     * returns, so does this method.
     */
    public static void signal(final @NotNull Condition condition) {
        localContext().runHandlers(new SignaledCondition(condition, false));
    }

    /**
     * Signals the given condition as an error.
     * <p>
     * If no handler unwinds, an {@link UnhandledErrorError} carrying the condition is thrown. The method is declared
     * to return that error so that call sites can write {@code throw ConditionContext.error(...)}.
     */
    public static @NotNull UnhandledErrorError error(final @NotNull Condition condition) {
        localContext().runHandlers(new SignaledCondition(condition, true));
        throw new UnhandledErrorError(condition);
    }

    /**
     * Runs the body with a restart point named {@code restartName} established around it.
     *
     * @return What the body returned, or {@code null} if a handler unwound to the restart point.
     */
    public static <T> @Nullable T withRestart(
        final @NotNull String restartName,
        final @NotNull RestartBody<? extends T> body
    ) {
        final var context = localContext();
        final var restart = new Restart(restartName, context);
        context.restarts.add(restart);
        try {
            return body.call(restart);
        } catch (final Unwind unwind) {
            if (unwind.target() != restart) {
                throw SneakyThrow.doThrow(unwind);
            }
            return null;
        } finally {
            context.pop(context.restarts, restart);
        }
    }

    /**
     * Returns the established restart points, innermost first.
     */
    public static @NotNull List<@NotNull Restart> restarts() {
        final var restarts = localContext().restarts;
        final var result = new ArrayList<Restart>(restarts.size());
        for (int i = restarts.size() - 1; i >= 0; i -= 1) {
            result.add(restarts.get(i));
        }
        return result;
    }

    /**
     * Returns the innermost established restart point named {@code restartName}, or {@code null}.
     */
    public static @Nullable Restart findRestart(final @NotNull String restartName) {
        final var restarts = localContext().restarts;
        for (int i = restarts.size() - 1; i >= 0; i -= 1) {
            final var restart = restarts.get(i);
            if (restart.name().equals(restartName)) {
                return restart;
            }
        }
        return null;
    }

    static @NotNull ConditionContext localContext() {
        return localContext.get();
    }

    void install(final @NotNull Handler handler) {
        handlers.add(handler);
    }

    void uninstall(final @NotNull Handler handler) {
        pop(handlers, handler);
    }

    private void runHandlers(final @NotNull SignaledCondition condition) {
        // While a handler runs, conditions it signals only reach the handlers installed outside of it.
        final var start = (runningHandler < 0) ? handlers.size() - 1 : runningHandler - 1;
        for (int i = start; i >= 0; i -= 1) {
            final var saved = runningHandler;
            runningHandler = i;
            try {
                handlers.get(i).handle(condition);
            } catch (final Unwind unwind) {
                throw SneakyThrow.doThrow(unwind);
            } finally {
                runningHandler = saved;
            }
        }
    }

    private <T> void pop(final @NotNull List<T> stack, final @NotNull T expected) {
        assert this == localContext() : "Condition context used by a different thread";
        final var last = stack.size() - 1;
        assert last >= 0 && stack.get(last) == expected : "Handler or restart closed out of order";
        stack.remove(last);
    }

    private final List<Handler> handlers = new ArrayList<>();
    private final List<Restart> restarts = new ArrayList<>();
    private int runningHandler = -1;

    private static final ThreadLocal<@NotNull ConditionContext> localContext =
        ThreadLocal.withInitial(ConditionContext::new);

    /**
     * The code run by {@link #withRestart(String, RestartBody)}; receives the restart point it may unwind to.
     */
    @FunctionalInterface
    public interface RestartBody<T> {
        @SuppressWarnings("RedundantThrows")
        T call(@NotNull Restart restart) throws Unwind;
    }
}
