// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.lexer;

import java.util.List;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import roundtex.util.annotation.Nullable;

/**
 * An immutable run of source characters, with its absolute start offset and category.
 *
 * @param text     The characters.
 * @param position The offset of the first character in the source text.
 * @param category The category of the token.
 */
public record Token(String text, int position, TokenCategory category) {
    /**
     * Returns a token whose text is this token's text followed by the other token's text.
     * <p>
     * The result keeps this token's position and category.
     */
    @CheckReturnValue
    public Token plus(final Token other) {
        return new Token(text + other.text, position, category);
    }

    /**
     * Returns a copy of this token with a different category.
     */
    @CheckReturnValue
    public Token withCategory(final TokenCategory newCategory) {
        return new Token(text, position, newCategory);
    }

    /**
     * Returns the offset just past the last character of this token.
     */
    public int end() {
        return position + text.length();
    }

    public int length() {
        return text.length();
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }

    /**
     * Returns {@code true} iff this token carries the given category.
     */
    public boolean is(final TokenCategory expected) {
        return category == expected;
    }

    /**
     * Concatenates the given tokens, or returns {@code null} if the list is empty.
     */
    public static @Nullable Token concat(final List<Token> tokens) {
        if (tokens.isEmpty()) {
            return null;
        }
        final var first = tokens.get(0);
        if (tokens.size() == 1) {
            return first;
        }
        final var builder = new StringBuilder();
        for (final var token : tokens) {
            builder.append(token.text);
        }
        return new Token(builder.toString(), first.position, first.category);
    }

    @Override
    public String toString() {
        return text;
    }
}
