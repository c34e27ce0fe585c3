// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.tree;

/**
 * A {@code {...}} group.
 * <p>
 * An <em>implicit</em> brace group stands for a required argument written without braces, as in {@code \frac12};
 * it has empty delimiters.
 */
public final class BraceGroup extends TexGroup {
    public BraceGroup(final int position) {
        this(position, false);
    }

    private BraceGroup(final int position, final boolean implicit) {
        super("BraceGroup", position);
        this.implicit = implicit;
    }

    /**
     * Returns a new detached implicit brace group.
     */
    public static BraceGroup implicit(final int position) {
        return new BraceGroup(position, true);
    }

    public boolean isImplicit() {
        return implicit;
    }

    @Override
    public String begin() {
        return implicit ? "" : "{";
    }

    @Override
    public String end() {
        return implicit ? "" : "}";
    }

    @Override
    public BraceGroup copy() {
        return copyEnvironmentInto(new BraceGroup(position(), implicit));
    }

    @Override
    String describe() {
        return "Brace group";
    }

    private final boolean implicit;
}
