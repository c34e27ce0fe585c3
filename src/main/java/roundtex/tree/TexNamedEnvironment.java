// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.tree;

/**
 * A {@code \begin{name}...\end{name}} environment.
 * <p>
 * Whitespace between {@code \begin} or {@code \end} and the brace holding the name is kept, so that the markers
 * reproduce their source exactly.
 */
public final class TexNamedEnvironment extends TexEnvironment {
    public TexNamedEnvironment(final String name, final int position) {
        super(name, position);
    }

    @Override
    public String begin() {
        return "\\begin" + beginSpacing + '{' + name() + '}';
    }

    @Override
    public String end() {
        return "\\end" + endSpacing + '{' + name() + '}';
    }

    public String beginSpacing() {
        return beginSpacing;
    }

    public void setBeginSpacing(final String spacing) {
        beginSpacing = spacing;
    }

    public String endSpacing() {
        return endSpacing;
    }

    public void setEndSpacing(final String spacing) {
        endSpacing = spacing;
    }

    /**
     * Returns {@code true} iff the body was read verbatim, without being parsed.
     */
    public boolean isOpaque() {
        return opaque;
    }

    public void setOpaque(final boolean newOpaque) {
        opaque = newOpaque;
    }

    @Override
    public TexNamedEnvironment copy() {
        final var copy = new TexNamedEnvironment(name(), position());
        copy.beginSpacing = beginSpacing;
        copy.endSpacing = endSpacing;
        copy.opaque = opaque;
        return copyEnvironmentInto(copy);
    }

    @Override
    String describe() {
        return "Environment '" + name() + "'";
    }

    private String beginSpacing = "";
    private String endSpacing = "";
    private boolean opaque = false;
}
