// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import roundtex.util.condition.ConditionContext;

/**
 * An element with a name, an argument list, and a list of contents.
 * <p>
 * Whether an expression may hold contents depends on its kind, see {@link #acceptsContent()}. Content lists use
 * identity: an element is found, and removed, only if it is that very object.
 */
public abstract sealed class TexExpression extends TexElement permits TexCommand, TexEnvironment {
    TexExpression(final String name, final int position) {
        super(position);
        this.name = name;
        arguments = new TexArgs(this);
    }

    public final String name() {
        return name;
    }

    /**
     * Renames this expression.
     * <p>
     * Signals a {@link CapabilityViolationCondition} if the kind of this expression fixes its name, or if the new name
     * would take away the ability to hold the contents this expression already has.
     */
    public final void setName(final String newName) {
        if (!isRenamable()) {
            throw ConditionContext.error(new CapabilityViolationCondition(this, "be renamed"));
        }
        if (this instanceof TexCommand && !contents.isEmpty() && !TexCommand.holdsContent(newName)) {
            throw ConditionContext.error(new CapabilityViolationCondition(this, "be renamed to '" + newName
                + "' while it holds contents"));
        }
        name = newName;
    }

    public final TexArgs arguments() {
        return arguments;
    }

    /**
     * Returns an unmodifiable view of this expression's own contents, whitespace included.
     */
    public final List<TexElement> contents() {
        return Collections.unmodifiableList(contents);
    }

    /**
     * Returns the contents of every parsed argument, in order, followed by this expression's own contents.
     */
    public final List<TexElement> allContents() {
        final var result = new ArrayList<TexElement>();
        for (final var argument : arguments) {
            result.addAll(argument.contents());
        }
        result.addAll(contents);
        return result;
    }

    /**
     * Returns {@code true} iff this expression can hold contents of its own.
     */
    public abstract boolean acceptsContent();

    public final void appendContent(final TexElement element) {
        insertContent(contents.size(), element);
    }

    /**
     * Inserts a detached element into the contents at the given index.
     * <p>
     * Signals a {@link CapabilityViolationCondition} if this expression cannot hold contents.
     *
     * @throws IllegalArgumentException If the element is already attached somewhere.
     */
    public final void insertContent(final int index, final TexElement element) {
        if (!acceptsContent()) {
            throw ConditionContext.error(new CapabilityViolationCondition(this, "hold contents"));
        }
        Objects.checkIndex(index, contents.size() + 1);
        element.attachTo(this);
        contents.add(index, element);
    }

    /**
     * Removes and detaches the content element at the given index.
     */
    public final TexElement removeContent(final int index) {
        final var element = contents.remove(index);
        element.detach();
        return element;
    }

    /**
     * Returns the index of the given element within the contents, or -1.
     */
    public final int indexOfContent(final TexElement element) {
        return identityIndexOf(contents, element);
    }

    /**
     * Removes and detaches all contents.
     */
    public final void clearContents() {
        for (final var element : contents) {
            element.detach();
        }
        contents.clear();
    }

    /**
     * Removes a direct child, wherever it is stored: among the contents, the parsed arguments, or the argument
     * separators.
     *
     * @return {@code true} iff the element was a child of this expression.
     */
    public final boolean removeChild(final TexElement child) {
        final var index = indexOfContent(child);
        if (index >= 0) {
            removeContent(index);
            return true;
        }
        if (child instanceof final TexGroup group && arguments.remove(group)) {
            return true;
        }
        return child instanceof final TexText text && arguments.removeSeparator(text);
    }

    /**
     * Returns {@code true} iff the kind of this expression allows changing its name.
     */
    boolean isRenamable() {
        return true;
    }

    final <T extends TexExpression> T copyChildrenInto(final T copy) {
        final TexExpression target = copy;
        arguments.copyInto(target.arguments);
        for (final var element : contents) {
            final var elementCopy = element.copy();
            elementCopy.attachTo(target);
            target.contents.add(elementCopy);
        }
        return copy;
    }

    static int identityIndexOf(final List<? extends TexElement> list, final TexElement element) {
        final var size = list.size();
        for (int i = 0; i < size; i += 1) {
            if (list.get(i) == element) {
                return i;
            }
        }
        return -1;
    }

    private String name;
    private final TexArgs arguments;
    private final ArrayList<TexElement> contents = new ArrayList<>();
}
