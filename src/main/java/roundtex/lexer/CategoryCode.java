// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.lexer;

/**
 * Per-character category codes, modeled after TeX's catcode table.
 * <p>
 * The bracket and parenthesis categories do not exist in TeX; they are only used to recognize optional argument
 * delimiters and the {@code \[}, {@code \(} math delimiters.
 */
public enum CategoryCode implements TokenCategory {
    ESCAPE,
    GROUP_BEGIN,
    GROUP_END,
    MATH_SWITCH,
    ALIGNMENT,
    END_OF_LINE,
    MACRO,
    SUPERSCRIPT,
    SUBSCRIPT,
    IGNORED,
    SPACER,
    LETTER,
    OTHER,
    ACTIVE,
    COMMENT,
    INVALID,
    BRACKET_BEGIN,
    BRACKET_END,
    PAREN_BEGIN,
    PAREN_END,
}
