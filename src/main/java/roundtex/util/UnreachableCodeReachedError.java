// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.util;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when control flow reaches a point the code believes unreachable, such as an exhausted switch over a sealed
 * hierarchy.
 * <p>
 * This is a programming error, hence an {@link AssertionError}.
 */
public final class UnreachableCodeReachedError extends AssertionError {
    public UnreachableCodeReachedError() {
        super("Execution reached a point expected to be unreachable");
    }

    public UnreachableCodeReachedError(final @NotNull String message) {
        super(message);
    }

    public UnreachableCodeReachedError(final @NotNull Throwable cause) {
        super("Execution reached a point expected to be unreachable", cause);
    }
}
