// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.util.condition;

import roundtex.util.SneakyThrow;
import org.jetbrains.annotations.NotNull;

/**
 * A named point that handlers can unwind to, established by
 * {@link ConditionContext#withRestart(String, ConditionContext.RestartBody)}.
 * <p>
 * The parser establishes one restart per environment and math body it reads, which is how best-effort parsing
 * abandons a broken construct while keeping everything read so far.
 */
public final class Restart {
    Restart(final @NotNull String name, final @NotNull ConditionContext ownerContext) {
        this.name = name;
        this.ownerContext = ownerContext;
    }

    public @NotNull String name() {
        return name;
    }

    /**
     * Abandons everything up to this restart point, making its {@code withRestart} call return {@code null}. Never
     * returns normally.
     */
    public void unwindTo() {
        assert ownerContext == ConditionContext.localContext() : "Restart " + name + " used by a different thread";
        throw SneakyThrow.doThrow(new Unwind(this));
    }

    @Override
    public @NotNull String toString() {
        return "Restart " + name;
    }

    private final @NotNull String name;
    private final @NotNull ConditionContext ownerContext;
}
