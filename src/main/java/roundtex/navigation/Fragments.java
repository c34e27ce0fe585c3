// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.navigation;

import java.util.ArrayList;
import java.util.List;
import roundtex.reader.ParseErrorCondition;
import roundtex.reader.Parser;
import roundtex.tree.BraceGroup;
import roundtex.tree.BracketGroup;
import roundtex.tree.TexElement;
import roundtex.tree.TexGroup;
import roundtex.tree.TexText;
import roundtex.util.condition.ConditionContext;
import roundtex.util.condition.Handler;

/**
 * Parses source snippets into detached elements, for use in tree mutations.
 * <p>
 * Fragments are parsed with the default options. Positions of the returned elements are relative to the snippet.
 */
public final class Fragments {
    private Fragments() {
    }

    /**
     * Parses the snippet and returns its top-level elements, detached.
     */
    public static List<TexElement> parseElements(final String source) {
        final var root = Parser.parse(source);
        final var elements = new ArrayList<TexElement>(root.contents().size());
        while (!root.contents().isEmpty()) {
            elements.add(root.removeContent(0));
        }
        return elements;
    }

    /**
     * Parses a snippet consisting of exactly one {@code {...}} or {@code [...]} group, and returns that group,
     * detached.
     * <p>
     * Signals a fatal {@link MalformedArgumentCondition} for any other snippet, including one that does not parse.
     */
    public static TexGroup parseArgument(final String source) {
        try (final var handler = Handler.on(ParseErrorCondition.class, error -> {
            throw ConditionContext.error(new MalformedArgumentCondition(source));
        })) {
            handler.use();
            return parseGroup(source);
        }
    }

    private static TexGroup parseGroup(final String source) {
        if (source.startsWith("{") && source.endsWith("}")) {
            final var elements = parseElements(source);
            if (elements.size() == 1 && elements.get(0) instanceof final BraceGroup group && !group.isImplicit()) {
                return group;
            }
        } else if (source.length() >= 2 && source.startsWith("[") && source.endsWith("]")) {
            final var elements = parseElements(source.substring(1, source.length() - 1));
            final var containsBracketEnd = elements.stream()
                .anyMatch(element -> element instanceof final TexText text && text.contains("]"));
            if (!containsBracketEnd) {
                final var group = new BracketGroup(0);
                for (final var element : elements) {
                    group.appendContent(element);
                }
                return group;
            }
        }
        throw ConditionContext.error(new MalformedArgumentCondition(source));
    }
}
