// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.lexer;

import roundtex.util.annotation.Nullable;

/**
 * The result of an opaque scan: raw body text, and the terminator that ended it.
 *
 * @param body       The characters between the scan start and the terminator, possibly empty.
 * @param terminator The terminator, or {@code null} if the end of input was reached first.
 */
public record RawSpan(Token body, @Nullable Token terminator) {
    public boolean terminated() {
        return terminator != null;
    }
}
