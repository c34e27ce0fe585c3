// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.lexer;

/**
 * Token-level categories produced by the {@link Tokenizer}.
 */
public enum TokenCode implements TokenCategory {
    /**
     * A size-prefixed delimiter command such as {@code \left(} or {@code \big\}}, merged into one token.
     */
    PUNCTUATION_COMMAND,
    /**
     * An escape followed by a structural character, such as {@code \{} or {@code \%}.
     */
    ESCAPED_SYMBOL,
    /**
     * A line comment, from {@code %} up to but not including the end of line.
     */
    COMMENT,
    MATH_SWITCH,
    DISPLAY_MATH_SWITCH,
    MATH_GROUP_BEGIN,
    MATH_GROUP_END,
    DISPLAY_MATH_GROUP_BEGIN,
    DISPLAY_MATH_GROUP_END,
    /**
     * An escape followed by a letter run (with an optional trailing star) or by a single other character.
     */
    COMMAND_NAME,
    /**
     * A run of spaces, tabs and line breaks containing at most two line breaks.
     */
    MERGED_SPACER,
    GROUP_BEGIN,
    GROUP_END,
    BRACKET_BEGIN,
    BRACKET_END,
    TEXT,
}
