// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.reader;

import roundtex.lexer.Token;

/**
 * A condition type indicating that a construct was not closed: the end of input, or a closing delimiter of another
 * kind, was found first.
 * <p>
 * Only unterminated environments are recoverable; an unterminated argument group is always fatal.
 */
public final class UnterminatedConstructCondition extends ParseErrorCondition {
    UnterminatedConstructCondition(
        final Token opener,
        final SourceLocation location,
        final String expectedCloser,
        final String found,
        final boolean recoverable
    ) {
        super("Expected '" + expectedCloser + "' but found " + found + " instead", opener, location);
        this.expectedCloser = expectedCloser;
        this.recoverable = recoverable;
    }

    public String expectedCloser() {
        return expectedCloser;
    }

    @Override
    public boolean isRecoverable() {
        return recoverable;
    }

    private final String expectedCloser;
    private final boolean recoverable;
}
