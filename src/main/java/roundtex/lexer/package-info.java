// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The lexical stages of the reading pipeline: character categorization and tokenization.
 * <p>
 * Every token keeps its exact source text, so concatenating all tokens of a text reproduces it.
 */
@NonNullByDefault
package roundtex.lexer;

import roundtex.util.annotation.NonNullByDefault;
