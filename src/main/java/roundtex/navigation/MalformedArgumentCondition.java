// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.navigation;

import roundtex.util.condition.Condition;

/**
 * A condition type indicating that text supplied as an argument is not exactly one brace or bracket group.
 */
public final class MalformedArgumentCondition extends Condition {
    MalformedArgumentCondition(final String argumentSource) {
        super("Cannot use '" + argumentSource + "' as an argument, expected a single '{...}' or '[...]' group");
        this.argumentSource = argumentSource;
    }

    public String argumentSource() {
        return argumentSource;
    }

    private final String argumentSource;
}
