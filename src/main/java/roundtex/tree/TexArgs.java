// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * The argument list of an expression.
 * <p>
 * Two views are kept in sync: {@link #parsed()} holds only the argument groups, {@link #all()} additionally holds
 * the whitespace separating arguments, so that the list serializes back to its exact source. Lookup and removal
 * use identity.
 */
public final class TexArgs implements Iterable<TexGroup> {
    TexArgs(final TexExpression owner) {
        this.owner = owner;
    }

    public int size() {
        return parsed.size();
    }

    public boolean isEmpty() {
        return parsed.isEmpty();
    }

    public TexGroup get(final int index) {
        return parsed.get(index);
    }

    /**
     * Returns an unmodifiable view of the argument groups.
     */
    public List<TexGroup> parsed() {
        return Collections.unmodifiableList(parsed);
    }

    /**
     * Returns an unmodifiable view of the argument groups interleaved with their separators.
     */
    public List<TexElement> all() {
        return Collections.unmodifiableList(all);
    }

    @Override
    public Iterator<TexGroup> iterator() {
        return parsed().iterator();
    }

    /**
     * Returns the index of the given group among the parsed arguments, or -1.
     */
    public int indexOf(final TexGroup group) {
        return TexExpression.identityIndexOf(parsed, group);
    }

    public void append(final TexGroup group) {
        insert(parsed.size(), group);
    }

    /**
     * Inserts a detached group so that it becomes the argument at the given index.
     * <p>
     * In the full view the group lands right before the argument previously at that index.
     *
     * @throws IllegalArgumentException If the group is already attached somewhere.
     */
    public void insert(final int index, final TexGroup group) {
        Objects.checkIndex(index, parsed.size() + 1);
        final var allIndex = (index == parsed.size())
            ? all.size()
            : TexExpression.identityIndexOf(all, parsed.get(index));
        group.attachTo(owner);
        parsed.add(index, group);
        all.add(allIndex, group);
    }

    /**
     * Removes and detaches the argument at the given index, together with the separators directly preceding it.
     */
    public TexGroup remove(final int index) {
        final var group = parsed.remove(index);
        var allIndex = TexExpression.identityIndexOf(all, group);
        all.remove(allIndex).detach();
        while (allIndex > 0 && all.get(allIndex - 1) instanceof TexText) {
            allIndex -= 1;
            all.remove(allIndex).detach();
        }
        return group;
    }

    /**
     * Removes the given argument group, see {@link #remove(int)}.
     *
     * @return {@code true} iff the group was an argument of this list.
     */
    public boolean remove(final TexGroup group) {
        final var index = indexOf(group);
        if (index < 0) {
            return false;
        }
        remove(index);
        return true;
    }

    /**
     * Replaces the argument at the given index with a detached group, keeping the surrounding separators.
     *
     * @return The detached previous argument.
     */
    public TexGroup set(final int index, final TexGroup group) {
        final var previous = parsed.get(index);
        final var allIndex = TexExpression.identityIndexOf(all, previous);
        group.attachTo(owner);
        parsed.set(index, group);
        all.set(allIndex, group);
        previous.detach();
        return previous;
    }

    /**
     * Appends whitespace that separates the previous argument from the next one.
     */
    public void appendSeparator(final TexText separator) {
        separator.attachTo(owner);
        all.add(separator);
    }

    boolean removeSeparator(final TexText separator) {
        final var index = TexExpression.identityIndexOf(all, separator);
        if (index < 0) {
            return false;
        }
        all.remove(index).detach();
        return true;
    }

    void copyInto(final TexArgs target) {
        for (final var element : all) {
            if (element instanceof final TexGroup group) {
                target.append(group.copy());
            } else if (element instanceof final TexText separator) {
                target.appendSeparator(separator.copy());
            }
        }
    }

    private final TexExpression owner;
    private final ArrayList<TexGroup> parsed = new ArrayList<>();
    private final ArrayList<TexElement> all = new ArrayList<>();
}
