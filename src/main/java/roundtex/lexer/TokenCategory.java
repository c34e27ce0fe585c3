// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.lexer;

/**
 * The classification attached to a {@link Token}.
 * <p>
 * Single categorized characters carry a {@link CategoryCode}, tokens assembled by the {@link Tokenizer} carry a
 * {@link TokenCode}.
 */
public sealed interface TokenCategory permits CategoryCode, TokenCode {
}
