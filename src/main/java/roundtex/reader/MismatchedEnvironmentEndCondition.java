// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.reader;

import roundtex.lexer.Token;
import roundtex.util.annotation.Nullable;

/**
 * A condition type indicating an {@code \end} whose name does not match the innermost open environment, or an
 * {@code \end} outside of any environment.
 */
public final class MismatchedEnvironmentEndCondition extends ParseErrorCondition {
    MismatchedEnvironmentEndCondition(
        final Token endToken,
        final SourceLocation location,
        final @Nullable String expectedName,
        final String foundName
    ) {
        super(formatMessage(expectedName, foundName), endToken, location);
        this.expectedName = expectedName;
        this.foundName = foundName;
    }

    /**
     * Returns the name of the innermost open environment, or {@code null} if there was none.
     */
    public @Nullable String expectedName() {
        return expectedName;
    }

    public String foundName() {
        return foundName;
    }

    @Override
    public boolean isRecoverable() {
        return true;
    }

    private static String formatMessage(final @Nullable String expectedName, final String foundName) {
        return (expectedName == null)
            ? ("Found '\\end{" + foundName + "}' outside of any environment")
            : ("Expected '\\end{" + expectedName + "}' but found '\\end{" + foundName + "}' instead");
    }

    private final @Nullable String expectedName;
    private final String foundName;
}
