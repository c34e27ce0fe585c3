// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.navigation;

import roundtex.tree.TexElement;
import roundtex.util.condition.Condition;

/**
 * A condition type indicating an attempt to delete or replace an element that has no parent.
 */
public final class DetachedElementCondition extends Condition {
    DetachedElementCondition(final TexElement element) {
        super("Cannot remove '" + abbreviate(element.toSource()) + "' from its parent, it has none");
        this.element = element;
    }

    public TexElement element() {
        return element;
    }

    private static String abbreviate(final String source) {
        return (source.length() <= maxQuotedLength) ? source : (source.substring(0, maxQuotedLength) + "...");
    }

    private static final int maxQuotedLength = 40;

    private final TexElement element;
}
