// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.tree;

/**
 * An expression delimited by a begin and an end marker: named environments, math, groups, and the document root.
 * <p>
 * An environment whose end marker was never found (only possible when parsing in best-effort mode) is
 * <em>unterminated</em> and serializes without its end marker.
 */
public abstract sealed class TexEnvironment extends TexExpression
    permits TexNamedEnvironment, TexMathEnvironment, TexGroup, TexRoot {
    TexEnvironment(final String name, final int position) {
        super(name, position);
    }

    /**
     * Returns the exact source text of the begin marker.
     */
    public abstract String begin();

    /**
     * Returns the exact source text of the end marker.
     */
    public abstract String end();

    @Override
    public final boolean acceptsContent() {
        return true;
    }

    public final boolean isTerminated() {
        return terminated;
    }

    public final void setTerminated(final boolean newTerminated) {
        terminated = newTerminated;
    }

    final <T extends TexEnvironment> T copyEnvironmentInto(final T copy) {
        copy.setTerminated(terminated);
        return copyChildrenInto(copy);
    }

    private boolean terminated = true;
}
