// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.reader;

import java.util.List;
import roundtex.lexer.Token;
import roundtex.util.Trace;
import roundtex.util.condition.Condition;

/**
 * A condition type indicating that the LaTeX source could not be parsed.
 * <p>
 * The messages of the traces active at creation are captured, so that the detailed message tells what the parser
 * was doing.
 */
public abstract sealed class ParseErrorCondition extends Condition
    permits UnterminatedConstructCondition, MismatchedEnvironmentEndCondition {
    ParseErrorCondition(final String message, final Token token, final SourceLocation location) {
        super(message);
        this.token = token;
        this.location = location;
        traceMessages = List.copyOf(Trace.activeMessages());
    }

    /**
     * Returns the token the error was detected at.
     */
    public final Token token() {
        return token;
    }

    public final SourceLocation location() {
        return location;
    }

    /**
     * Returns the trace messages active when the error was detected, innermost first.
     */
    public final List<String> traceMessages() {
        return traceMessages;
    }

    /**
     * Returns {@code true} iff best-effort parsing can continue after this error.
     */
    public abstract boolean isRecoverable();

    @Override
    public final String detailedMessage() {
        final var builder = new StringBuilder(message());
        builder.append('\n').append(location).append(", at '").append(token.text()).append('\'');
        for (final var traceMessage : traceMessages) {
            builder.append("\n  while ").append(traceMessage);
        }
        return builder.toString();
    }

    private final Token token;
    private final SourceLocation location;
    private final List<String> traceMessages;
}
