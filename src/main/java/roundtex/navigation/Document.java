// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.navigation;

import java.io.IOException;
import java.io.Writer;
import java.util.Map;
import java.util.stream.Stream;
import roundtex.reader.LineColumn;
import roundtex.reader.LineIndex;
import roundtex.reader.ParseOptions;
import roundtex.reader.Parser;
import roundtex.tree.Serializer;
import roundtex.tree.TexRoot;
import roundtex.util.annotation.Nullable;

/**
 * A parsed LaTeX document: the entry point of the library.
 * <p>
 * The document keeps the source it was parsed from, so offsets reported by {@link TexNode#position()} can be mapped
 * to lines and columns even after the tree was modified.
 */
public final class Document {
    private Document(final String source, final TexRoot root) {
        this.source = source;
        this.root = root;
    }

    public static Document parse(final String source) {
        return parse(source, ParseOptions.defaults());
    }

    /**
     * Parses the given source.
     * <p>
     * Parse errors are signaled as {@link roundtex.reader.ParseErrorCondition}s, see {@link Parser}.
     */
    public static Document parse(final String source, final ParseOptions options) {
        return new Document(source, Parser.parse(source, options));
    }

    /**
     * Parses the concatenation of the given lines. Lines are joined as given, so they should keep their line
     * terminators.
     */
    public static Document parse(final Iterable<? extends CharSequence> lines, final ParseOptions options) {
        final var builder = new StringBuilder();
        for (final var line : lines) {
            builder.append(line);
        }
        return parse(builder.toString(), options);
    }

    public TexNode root() {
        return TexNode.of(root);
    }

    /**
     * Returns the source text this document was parsed from, regardless of later modifications.
     */
    public String source() {
        return source;
    }

    /**
     * Maps an offset in the parsed source to its zero-based line and column.
     */
    public LineColumn charOffsetToLineColumn(final int offset) {
        if (lineIndex == null) {
            lineIndex = LineIndex.of(source);
        }
        return lineIndex.lineColumn(offset);
    }

    public @Nullable TexNode find(final @Nullable String name) {
        return root().find(name);
    }

    public @Nullable TexNode find(final @Nullable String name, final Map<String, String> attributes) {
        return root().find(name, attributes);
    }

    public Stream<TexNode> findAll(final @Nullable String name) {
        return root().findAll(name);
    }

    public Stream<TexNode> findAll(final @Nullable String name, final Map<String, String> attributes) {
        return root().findAll(name, attributes);
    }

    public long count(final @Nullable String name) {
        return root().count(name);
    }

    public long count(final @Nullable String name, final Map<String, String> attributes) {
        return root().count(name, attributes);
    }

    /**
     * Writes the current source of the document.
     * <p>
     * Any {@link IOException}s thrown by the writer are allowed to propagate.
     */
    public void write(final Writer writer) throws IOException {
        Serializer.serialize(writer, root);
    }

    /**
     * Returns the current source of the document; equal to the parsed source until the tree is modified.
     */
    @Override
    public String toString() {
        return root.toSource();
    }

    private final String source;
    private final TexRoot root;
    private @Nullable LineIndex lineIndex = null;
}
