// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.tree;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.List;
import roundtex.util.UnreachableCodeReachedError;

/**
 * The tree-to-source serializer.
 * <p>
 * For a tree produced by the parser and left unmodified, the output is exactly the parsed source.
 */
public final class Serializer {
    private Serializer(final Writer writer) {
        this.writer = writer;
    }

    /**
     * Serializes the tree rooted at {@code element}, writing the output to the given {@link Writer}.
     * <p>
     * Any {@link IOException}s thrown by the writer are allowed to propagate.
     */
    public static void serialize(final Writer writer, final TexElement element) throws IOException {
        new Serializer(writer).serializeElement(element);
    }

    /**
     * Returns the source text of the tree rooted at {@code element}.
     */
    public static String toSource(final TexElement element) {
        final var writer = new StringWriter();
        try {
            serialize(writer, element);
        } catch (final IOException e) {
            throw new UnreachableCodeReachedError(e);
        }
        return writer.toString();
    }

    /**
     * Returns the source text of the expression's own contents, without its delimiters and arguments.
     */
    public static String contentsToSource(final TexExpression expression) {
        final var writer = new StringWriter();
        try {
            new Serializer(writer).serializeAll(expression.contents());
        } catch (final IOException e) {
            throw new UnreachableCodeReachedError(e);
        }
        return writer.toString();
    }

    private void serializeElement(final TexElement element) throws IOException {
        if (element instanceof final TexText text) {
            writer.write(text.text());
        } else if (element instanceof final TexCommand command) {
            writer.write('\\');
            writer.write(command.name());
            serializeAll(command.arguments().all());
            serializeAll(command.contents());
        } else if (element instanceof final TexEnvironment environment) {
            writer.write(environment.begin());
            serializeAll(environment.arguments().all());
            serializeAll(environment.contents());
            if (environment.isTerminated()) {
                writer.write(environment.end());
            }
        } else {
            throw new UnreachableCodeReachedError();
        }
    }

    private void serializeAll(final List<? extends TexElement> elements) throws IOException {
        for (final var element : elements) {
            serializeElement(element);
        }
    }

    private final Writer writer;
}
