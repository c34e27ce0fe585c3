// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.reader;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import roundtex.util.annotation.Nullable;

/**
 * The built-in tables of argument signatures and opaque environments.
 */
public final class Signatures {
    private Signatures() {
    }

    /**
     * Returns the built-in signature of the given command, or {@code null} if it has none.
     */
    public static @Nullable Signature command(final String name) {
        return commands.get(name);
    }

    /**
     * Returns the built-in signature of the given environment, or {@code null} if it has none.
     */
    public static @Nullable Signature environment(final String name) {
        return environments.get(name);
    }

    /**
     * Returns {@code true} iff the body of the given environment is read verbatim by default.
     */
    public static boolean isSkipEnvironment(final String name) {
        return skipEnvironments.contains(name);
    }

    private static final Map<String, Signature> commands;
    private static final Map<String, Signature> environments;
    private static final Set<String> skipEnvironments = Set.of(
        "verbatim", "comment", "lstlisting",
        "math", "displaymath",
        "equation", "equation*",
        "align", "align*", "alignat", "alignat*",
        "flalign", "flalign*",
        "gather", "gather*",
        "multline", "multline*",
        "eqnarray", "eqnarray*",
        "split", "array");

    static {
        final var table = new HashMap<String, Signature>();
        table.put("def", Signature.of(2, 0));
        for (final var name : new String[] {"textbf", "textit", "textsc", "texttt", "textrm", "textsf", "emph",
            "underline", "label", "ref", "pageref", "eqref", "input", "include"}) {
            table.put(name, Signature.of(1, 0));
        }
        for (final var name : new String[] {"part", "chapter", "section", "subsection", "subsubsection",
            "paragraph", "subparagraph"}) {
            table.put(name, Signature.of(1, 1));
            table.put(name + '*', Signature.of(1, 0));
        }
        for (final var name : new String[] {"cite", "footnote", "caption", "sqrt", "documentclass",
            "usepackage"}) {
            table.put(name, Signature.of(1, 1));
        }
        table.put("frac", Signature.of(2, 0));
        table.put("item", Signature.of(0, 1));
        for (final var name : new String[] {"cup", "noindent", "maketitle", "newline", "par", "hline"}) {
            table.put(name, Signature.NONE);
        }
        table.put("newcommand", Signature.of(2, 2));
        table.put("renewcommand", Signature.of(2, 2));
        commands = Map.copyOf(table);

        environments = Map.of(
            "tabular", Signature.of(1, 1),
            "array", Signature.of(1, 1),
            "minipage", Signature.of(1, 1),
            "multicols", Signature.of(1, 1),
            "figure", Signature.of(0, 1),
            "table", Signature.of(0, 1),
            "lstlisting", Signature.of(0, 1),
            "alignat", Signature.of(1, 0),
            "thebibliography", Signature.of(1, 0));
    }
}
