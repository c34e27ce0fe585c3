// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.reader;

/**
 * The number of required and optional arguments a command or environment takes.
 * <p>
 * A negative count means "as many as are present", which is what unknown commands get.
 */
public record Signature(int required, int optional) {
    public static final Signature NONE = new Signature(0, 0);
    public static final Signature UNCONSTRAINED = new Signature(-1, -1);

    public static Signature of(final int required, final int optional) {
        return new Signature(required, optional);
    }

    public boolean isUnconstrained() {
        return required < 0 && optional < 0;
    }
}
