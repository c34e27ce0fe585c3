// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.reader;

import java.util.Arrays;

/**
 * Maps character offsets to lines and columns.
 * <p>
 * A line break is a line feed, or a carriage return not followed by a line feed. A line break character belongs
 * to the line it ends.
 */
public final class LineIndex {
    private LineIndex(final int[] breakOffsets) {
        this.breakOffsets = breakOffsets;
    }

    /**
     * Builds the index of the given text.
     */
    public static LineIndex of(final CharSequence text) {
        final var length = text.length();
        var offsets = new int[16];
        var count = 0;
        for (int i = 0; i < length; i += 1) {
            final var ch = text.charAt(i);
            final var isBreak = ch == '\n' || (ch == '\r' && (i + 1 >= length || text.charAt(i + 1) != '\n'));
            if (isBreak) {
                if (count == offsets.length) {
                    offsets = Arrays.copyOf(offsets, count * 2);
                }
                offsets[count] = i;
                count += 1;
            }
        }
        return new LineIndex(Arrays.copyOf(offsets, count));
    }

    /**
     * Returns the zero-based line and column of the given offset.
     * <p>
     * Offsets past the end of the text are mapped onto the last line.
     *
     * @throws IllegalArgumentException If the offset is negative.
     */
    public LineColumn lineColumn(final int offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("Negative offset " + offset);
        }
        final var found = Arrays.binarySearch(breakOffsets, offset);
        final var line = (found >= 0) ? found : -(found + 1);
        final var lineStart = (line == 0) ? 0 : breakOffsets[line - 1] + 1;
        return new LineColumn(line, offset - lineStart);
    }

    /**
     * Returns the full location of the given offset.
     */
    public SourceLocation locate(final int offset) {
        final var lineColumn = lineColumn(offset);
        return new SourceLocation(offset, lineColumn.line(), lineColumn.column());
    }

    /**
     * Returns the number of lines, which is one more than the number of line breaks.
     */
    public int lineCount() {
        return breakOffsets.length + 1;
    }

    private final int[] breakOffsets;
}
