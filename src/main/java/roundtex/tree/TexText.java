// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.tree;

import roundtex.lexer.Token;
import roundtex.lexer.TokenCode;

/**
 * A leaf holding raw text: words, whitespace, stray delimiters, comments and opaque bodies.
 * <p>
 * Text leaves compare by identity like every other element; use {@link #textEquals} and {@link #contains} to
 * compare their text.
 */
public final class TexText extends TexElement {
    /**
     * Initializes a new detached text leaf holding the given token.
     */
    public TexText(final Token token) {
        super(token.position());
        this.token = token;
    }

    /**
     * Initializes a new detached text leaf from a plain string, positioned at offset zero.
     */
    public TexText(final String text) {
        this(new Token(text, 0, TokenCode.TEXT));
    }

    public Token token() {
        return token;
    }

    public String text() {
        return token.text();
    }

    /**
     * Replaces the text, keeping the position and category.
     */
    public void setText(final String newText) {
        token = new Token(newText, token.position(), token.category());
    }

    public boolean isWhitespace() {
        return token.text().isBlank();
    }

    public boolean isComment() {
        return token.is(TokenCode.COMMENT);
    }

    public boolean textEquals(final CharSequence other) {
        return token.text().contentEquals(other);
    }

    public boolean contains(final CharSequence needle) {
        return token.text().contains(needle);
    }

    @Override
    public TexText copy() {
        return new TexText(token);
    }

    @Override
    String describe() {
        return "Text '" + token.text() + "'";
    }

    private Token token;
}
