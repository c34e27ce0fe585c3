// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.tree;

/**
 * A command: an escape, a name, and arguments.
 * <p>
 * Only {@code \item} holds contents of its own, namely everything up to the next item or the end of the enclosing
 * environment.
 */
public final class TexCommand extends TexExpression {
    /**
     * Initializes a new detached command without arguments.
     *
     * @param name The name without the leading escape, such as {@code section} or {@code left(}.
     */
    public TexCommand(final String name, final int position) {
        super(name, position);
    }

    @Override
    public boolean acceptsContent() {
        return holdsContent(name());
    }

    @Override
    public TexCommand copy() {
        return copyChildrenInto(new TexCommand(name(), position()));
    }

    @Override
    String describe() {
        return "Command '\\" + name() + "'";
    }

    static boolean holdsContent(final String name) {
        return name.equals("item");
    }
}
