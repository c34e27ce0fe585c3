// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The LaTeX parser: turns a token stream into an expression tree, plus its configuration and error conditions.
 */
@NonNullByDefault
package roundtex.reader;

import roundtex.util.annotation.NonNullByDefault;
