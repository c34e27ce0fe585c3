// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.tree;

/**
 * A brace or bracket group, used both as a command argument and as an anonymous group in a body.
 */
public abstract sealed class TexGroup extends TexEnvironment permits BraceGroup, BracketGroup {
    TexGroup(final String name, final int position) {
        super(name, position);
    }

    /**
     * Returns {@code true} iff this group is stored as an argument of its parent, rather than among its contents.
     */
    public final boolean isArgument() {
        final var parent = parent();
        return parent != null && parent.arguments().indexOf(this) >= 0;
    }

    @Override
    public abstract TexGroup copy();

    @Override
    final boolean isRenamable() {
        return false;
    }
}
