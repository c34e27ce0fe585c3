// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.lexer;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * The first stage of the reading pipeline: converts source text into single-character tokens tagged with their
 * {@link CategoryCode}.
 * <p>
 * Only ASCII letters are classified as {@link CategoryCode#LETTER}, every character without an explicit entry is
 * {@link CategoryCode#OTHER}.
 */
public final class Categorizer {
    private Categorizer() {
    }

    /**
     * Returns a restartable sequence of one-character tokens covering the whole text, in source order.
     * <p>
     * Each call of {@link Iterable#iterator()} starts from the beginning of the text.
     */
    public static Iterable<Token> categorize(final CharSequence text) {
        return () -> new CharacterIterator(text);
    }

    /**
     * Returns the category code of a single character.
     */
    public static CategoryCode categoryOf(final char ch) {
        return (ch < asciiCategories.length) ? asciiCategories[ch] : CategoryCode.OTHER;
    }

    private static final class CharacterIterator implements Iterator<Token> {
        private CharacterIterator(final CharSequence text) {
            this.text = text;
        }

        @Override
        public boolean hasNext() {
            return position < text.length();
        }

        @Override
        public Token next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            final var ch = text.charAt(position);
            final var token = new Token(String.valueOf(ch), position, categoryOf(ch));
            position += 1;
            return token;
        }

        private final CharSequence text;
        private int position = 0;
    }

    private static final CategoryCode[] asciiCategories;

    static {
        final var categories = new CategoryCode[128];
        Arrays.fill(categories, CategoryCode.OTHER);
        for (char ch = 'a'; ch <= 'z'; ch += 1) {
            categories[ch] = CategoryCode.LETTER;
        }
        for (char ch = 'A'; ch <= 'Z'; ch += 1) {
            categories[ch] = CategoryCode.LETTER;
        }
        categories['\\'] = CategoryCode.ESCAPE;
        categories['{'] = CategoryCode.GROUP_BEGIN;
        categories['}'] = CategoryCode.GROUP_END;
        categories['$'] = CategoryCode.MATH_SWITCH;
        categories['&'] = CategoryCode.ALIGNMENT;
        categories['\n'] = CategoryCode.END_OF_LINE;
        categories['\r'] = CategoryCode.END_OF_LINE;
        categories['#'] = CategoryCode.MACRO;
        categories['^'] = CategoryCode.SUPERSCRIPT;
        categories['_'] = CategoryCode.SUBSCRIPT;
        categories['\0'] = CategoryCode.IGNORED;
        categories[' '] = CategoryCode.SPACER;
        categories['\t'] = CategoryCode.SPACER;
        categories['~'] = CategoryCode.ACTIVE;
        categories['%'] = CategoryCode.COMMENT;
        categories['\u007F'] = CategoryCode.INVALID;
        categories['['] = CategoryCode.BRACKET_BEGIN;
        categories[']'] = CategoryCode.BRACKET_END;
        categories['('] = CategoryCode.PAREN_BEGIN;
        categories[')'] = CategoryCode.PAREN_END;
        asciiCategories = categories;
    }
}
