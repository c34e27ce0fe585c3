// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.tree;

/**
 * A {@code [...]} group, only ever produced as an optional argument.
 */
public final class BracketGroup extends TexGroup {
    public BracketGroup(final int position) {
        super("BracketGroup", position);
    }

    @Override
    public String begin() {
        return "[";
    }

    @Override
    public String end() {
        return "]";
    }

    @Override
    public BracketGroup copy() {
        return copyEnvironmentInto(new BracketGroup(position()));
    }

    @Override
    String describe() {
        return "Bracket group";
    }
}
