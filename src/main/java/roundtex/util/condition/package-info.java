// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Common Lisp-inspired condition and restart system.
 * <p>
 * Parse errors and illegal mutations are signaled as conditions; the parser's best-effort mode is a handler that
 * unwinds to the restart point of the environment being read.
 */
@NonNullByDefault
package roundtex.util.condition;

import roundtex.util.annotation.NonNullByDefault;
