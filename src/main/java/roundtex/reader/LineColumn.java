// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.reader;

/**
 * A zero-based line and column pair.
 */
public record LineColumn(int line, int column) {
}
