// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.reader;

/**
 * How the parser reacts to recoverable parse errors.
 */
public enum Tolerance {
    /**
     * Every parse error is signaled as a fatal condition.
     */
    FAIL_FAST,
    /**
     * Unterminated environments are returned partially built, and unmatched {@code \end} commands are kept as
     * ordinary commands. Unterminated argument groups are still fatal.
     */
    BEST_EFFORT,
}
