// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.tree;

import roundtex.util.condition.Condition;

/**
 * A condition type indicating a mutation the target element does not support, such as adding contents to a command
 * other than {@code \item} or renaming a brace group.
 */
public final class CapabilityViolationCondition extends Condition {
    public CapabilityViolationCondition(final TexElement subject, final String capability) {
        super(subject.describe() + " cannot " + capability);
        this.subject = subject;
    }

    /**
     * Returns the element the mutation was attempted on.
     */
    public TexElement subject() {
        return subject;
    }

    private final TexElement subject;
}
