// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.tree;

import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import roundtex.util.annotation.Nullable;

/**
 * The base type of the expression tree: either a run of text or an expression.
 * <p>
 * Every element has at most one parent. Elements inside an argument group have the group as their parent, the group
 * itself has the command or environment it is an argument of.
 * <p>
 * The string representation of an element is its exact source text, see {@link Serializer}.
 */
public abstract sealed class TexElement permits TexText, TexExpression {
    TexElement(final int position) {
        this.position = position;
    }

    /**
     * Returns the offset in the source text this element was parsed from.
     * <p>
     * Elements created programmatically, and elements parsed from fragments, report offsets relative to their own
     * source.
     */
    public final int position() {
        return position;
    }

    /**
     * Returns the expression this element is attached to, or {@code null} if it is detached.
     */
    public final @Nullable TexExpression parent() {
        return parent;
    }

    /**
     * Returns a detached deep copy of this element.
     */
    @CheckReturnValue
    public abstract TexElement copy();

    /**
     * Returns the exact source text of this element.
     */
    public final String toSource() {
        return Serializer.toSource(this);
    }

    @Override
    public final String toString() {
        return toSource();
    }

    /**
     * Returns a short user-readable description, used in condition messages.
     */
    abstract String describe();

    final void attachTo(final TexExpression newParent) {
        if (parent != null) {
            throw new IllegalArgumentException(describe() + " is already attached to " + parent.describe());
        }
        parent = newParent;
    }

    final void detach() {
        parent = null;
    }

    private final int position;
    private @Nullable TexExpression parent = null;
}
