// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * Throwable used by the restart mechanism to transfer control to a restart point.
 * <p>
 * Exposed only so that functions can be declared as throwing {@code Unwind}. Never catch or throw it manually.
 * It is neither an {@link Exception} nor an {@link Error}, so ordinary {@code catch} clauses let it through.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final @NotNull Restart target) {
        super("Unwinding to a restart point", null, false, false);
        this.target = target;
    }

    @NotNull Restart target() {
        return target;
    }

    // Unwinds are never serialized, they just inherit serializability from Throwable.
    private final transient @NotNull Restart target;
}
