// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown by {@link ConditionContext#error(Condition)} when every handler declined the condition.
 * <p>
 * Callers that install no handlers, such as a fail-fast parse, catch this error and inspect {@link #condition()}.
 */
public final class UnhandledErrorError extends AssertionError {
    UnhandledErrorError(final @NotNull Condition condition) {
        super(condition.detailedMessage());
        this.condition = condition;
    }

    public @NotNull Condition condition() {
        return condition;
    }

    private final transient @NotNull Condition condition;
}
