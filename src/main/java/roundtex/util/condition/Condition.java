// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * Something worth telling the handlers about: a parse error, an illegal tree mutation, a malformed argument.
 * <p>
 * Conditions are plain objects, not exceptions. They are signaled with {@link ConditionContext#signal(Condition)} or
 * {@link ConditionContext#error(Condition)}, and only turn into a throwable if nobody handles a fatal one.
 */
public abstract class Condition {
    protected Condition(final @NotNull String message) {
        this.message = message;
    }

    /**
     * Returns the one-line description of this condition.
     */
    public final @NotNull String message() {
        return message;
    }

    /**
     * Returns the full description, including any context subclasses know about, such as the source location.
     */
    public @NotNull String detailedMessage() {
        return message;
    }

    @Override
    public @NotNull String toString() {
        return getClass().getSimpleName() + ": " + detailedMessage();
    }

    private final @NotNull String message;
}
