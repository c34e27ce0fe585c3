// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.reader;

/**
 * The location of a parse error: the absolute offset and its zero-based line and column.
 * <p>
 * The string representation is one-based, for humans.
 */
public record SourceLocation(int offset, int line, int column) {
    @Override
    public String toString() {
        return "In line " + (line + 1) + ", column " + (column + 1);
    }
}
