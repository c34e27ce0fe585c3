// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.tree;

/**
 * The root of a parsed document: an environment named {@code [tex]} with empty delimiters.
 */
public final class TexRoot extends TexEnvironment {
    public TexRoot() {
        super(NAME, 0);
    }

    @Override
    public String begin() {
        return "";
    }

    @Override
    public String end() {
        return "";
    }

    @Override
    public TexRoot copy() {
        return copyEnvironmentInto(new TexRoot());
    }

    @Override
    boolean isRenamable() {
        return false;
    }

    @Override
    String describe() {
        return "Document root";
    }

    public static final String NAME = "[tex]";
}
