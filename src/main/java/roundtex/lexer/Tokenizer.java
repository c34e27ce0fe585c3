// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.lexer;

import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import roundtex.util.UnreachableCodeReachedError;
import roundtex.util.annotation.Nullable;

/**
 * The second stage of the reading pipeline: groups categorized characters into {@link TokenCode} tokens.
 * <p>
 * Recognizers are tried in a fixed order, the first one that matches produces the token. The text recognizer comes
 * last and always matches, so every call of {@link #next()} makes progress.
 * <p>
 * Bodies that must not be tokenized (verbatim-like environments, math) are read with {@link #readVerbatim} and
 * {@link #readMath}, which reposition the tokenizer past the terminator.
 */
public final class Tokenizer implements Iterator<Token> {
    /**
     * Initializes a new tokenizer positioned at the beginning of the given source text.
     */
    public Tokenizer(final CharSequence source) {
        this.source = source.toString();
        chars = new TokenBuffer(Categorizer.categorize(this.source).iterator());
    }

    /**
     * Returns a restartable sequence of all tokens of the given text.
     */
    public static Iterable<Token> tokenize(final CharSequence source) {
        return () -> new Tokenizer(source);
    }

    @Override
    public boolean hasNext() {
        return chars.hasNext();
    }

    @Override
    public Token next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        for (final var recognizer : recognizers) {
            final var token = recognizer.recognize(this);
            if (token != null) {
                return token;
            }
        }
        throw new UnreachableCodeReachedError("No recognizer matched at offset " + chars.index());
    }

    /**
     * Returns the source offset of the next character to be tokenized.
     */
    public int offset() {
        return chars.index();
    }

    /**
     * Reads raw text from the given offset up to the first literal occurrence of the terminator.
     * <p>
     * Nothing inside the body is interpreted. On return the tokenizer is positioned just past the terminator, or at
     * the end of input if there was none.
     */
    public RawSpan readVerbatim(final int offset, final String terminator) {
        return finishRaw(offset, source.indexOf(terminator, offset), terminator, TokenCode.TEXT);
    }

    /**
     * Reads a math body from the given offset up to the first occurrence of the terminator outside of escape pairs
     * and comments.
     * <p>
     * An escape character always takes the following character with it, so {@code \$} never closes inline math.
     * A comment runs to the end of its line. The terminator is tested before escapes, which lets {@code \)} and
     * {@code \]} close their groups.
     */
    public RawSpan readMath(final int offset, final String terminator, final TokenCode terminatorCode) {
        final var length = source.length();
        var i = offset;
        while (i < length) {
            if (source.startsWith(terminator, i)) {
                return finishRaw(offset, i, terminator, terminatorCode);
            }
            switch (Categorizer.categoryOf(source.charAt(i))) {
                case ESCAPE -> i = Math.min(i + 2, length);
                case COMMENT -> {
                    while (i < length && Categorizer.categoryOf(source.charAt(i)) != CategoryCode.END_OF_LINE) {
                        i += 1;
                    }
                }
                default -> i += 1;
            }
        }
        return finishRaw(offset, -1, terminator, terminatorCode);
    }

    private RawSpan finishRaw(
        final int offset,
        final int terminatorStart,
        final String terminator,
        final TokenCode terminatorCode
    ) {
        if (terminatorStart < 0) {
            chars.seek(source.length());
            return new RawSpan(new Token(source.substring(offset), offset, TokenCode.TEXT), null);
        }
        chars.seek(terminatorStart + terminator.length());
        return new RawSpan(
            new Token(source.substring(offset, terminatorStart), offset, TokenCode.TEXT),
            new Token(terminator, terminatorStart, terminatorCode));
    }

    private @Nullable Token recognizePunctuationCommand() {
        if (categoryAt(0) != CategoryCode.ESCAPE) {
            return null;
        }
        final var prefixLength = letterRunLength(1);
        if (prefixLength == 0 || !sizePrefixes.contains(textAt(1, 1 + prefixLength))) {
            return null;
        }
        final var delimiterStart = 1 + prefixLength;
        final var delimiterLength = delimiterLength(delimiterStart);
        if (delimiterLength == 0) {
            return null;
        }
        return take(delimiterStart + delimiterLength, TokenCode.PUNCTUATION_COMMAND);
    }

    private int delimiterLength(final int offset) {
        final var first = chars.peek(offset);
        if (first == null) {
            return 0;
        }
        if (first.is(CategoryCode.ESCAPE)) {
            final var second = chars.peek(offset + 1);
            if (second == null) {
                return 0;
            }
            if (escapedDelimiters.contains(second.text())) {
                return 2;
            }
            final var wordLength = letterRunLength(offset + 1);
            if (wordLength > 0 && namedDelimiters.contains(textAt(offset + 1, offset + 1 + wordLength))) {
                return 1 + wordLength;
            }
            return 0;
        }
        return (plainDelimiters.indexOf(first.text().charAt(0)) >= 0) ? 1 : 0;
    }

    private @Nullable Token recognizeEscapedSymbol() {
        if (categoryAt(0) != CategoryCode.ESCAPE) {
            return null;
        }
        final var next = categoryAt(1);
        if (next == null || !escapableCategories.contains(next)) {
            return null;
        }
        return take(2, TokenCode.ESCAPED_SYMBOL);
    }

    private @Nullable Token recognizeComment() {
        if (categoryAt(0) != CategoryCode.COMMENT) {
            return null;
        }
        final var comment = chars.forwardUntil(token -> token.is(CategoryCode.END_OF_LINE));
        assert comment != null;
        return comment.withCategory(TokenCode.COMMENT);
    }

    private @Nullable Token recognizeMathSwitch() {
        final var first = categoryAt(0);
        if (first == CategoryCode.MATH_SWITCH) {
            return (categoryAt(1) == CategoryCode.MATH_SWITCH)
                ? take(2, TokenCode.DISPLAY_MATH_SWITCH)
                : take(1, TokenCode.MATH_SWITCH);
        }
        if (first != CategoryCode.ESCAPE) {
            return null;
        }
        final var second = categoryAt(1);
        if (second == null) {
            return null;
        }
        return switch (second) {
            case BRACKET_BEGIN -> take(2, TokenCode.DISPLAY_MATH_GROUP_BEGIN);
            case BRACKET_END -> take(2, TokenCode.DISPLAY_MATH_GROUP_END);
            case PAREN_BEGIN -> take(2, TokenCode.MATH_GROUP_BEGIN);
            case PAREN_END -> take(2, TokenCode.MATH_GROUP_END);
            default -> null;
        };
    }

    private @Nullable Token recognizeCommandName() {
        if (categoryAt(0) != CategoryCode.ESCAPE) {
            return null;
        }
        final var letters = letterRunLength(1);
        if (letters == 0) {
            // A control symbol, or a lone escape at the end of input.
            return take(chars.hasNext(2) ? 2 : 1, TokenCode.COMMAND_NAME);
        }
        final var star = chars.peek(1 + letters);
        final var length = (star != null && star.text().equals("*")) ? 2 + letters : 1 + letters;
        return take(length, TokenCode.COMMAND_NAME);
    }

    private @Nullable Token recognizeSpacer() {
        final var first = categoryAt(0);
        if (first != CategoryCode.SPACER && first != CategoryCode.END_OF_LINE) {
            return null;
        }
        var length = 0;
        var lineBreaks = 0;
        while (lineBreaks < 2) {
            final var token = chars.peek(length);
            if (token == null) {
                break;
            }
            if (token.is(CategoryCode.SPACER)) {
                length += 1;
            } else if (token.is(CategoryCode.END_OF_LINE)) {
                length += 1;
                lineBreaks += 1;
                final var following = chars.peek(length);
                if (token.text().equals("\r") && following != null && following.text().equals("\n")) {
                    length += 1;
                }
            } else {
                break;
            }
        }
        return take(length, TokenCode.MERGED_SPACER);
    }

    private @Nullable Token recognizeDelimiter() {
        final var category = categoryAt(0);
        if (category == null) {
            return null;
        }
        return switch (category) {
            case GROUP_BEGIN -> take(1, TokenCode.GROUP_BEGIN);
            case GROUP_END -> take(1, TokenCode.GROUP_END);
            case BRACKET_BEGIN -> take(1, TokenCode.BRACKET_BEGIN);
            case BRACKET_END -> take(1, TokenCode.BRACKET_END);
            default -> null;
        };
    }

    private Token recognizeText() {
        var length = 1;
        while (true) {
            final var token = chars.peek(length);
            if (token == null || textStoppers.contains((CategoryCode) token.category())) {
                break;
            }
            length += 1;
        }
        return take(length, TokenCode.TEXT);
    }

    private @Nullable CategoryCode categoryAt(final int offset) {
        final var token = chars.peek(offset);
        return (token == null) ? null : (CategoryCode) token.category();
    }

    private int letterRunLength(final int offset) {
        var length = 0;
        while (categoryAt(offset + length) == CategoryCode.LETTER) {
            length += 1;
        }
        return length;
    }

    private String textAt(final int from, final int to) {
        final var token = chars.peek(from, to);
        return (token == null) ? "" : token.text();
    }

    private Token take(final int length, final TokenCode code) {
        final var token = chars.forward(length);
        assert token != null;
        return token.withCategory(code);
    }

    @FunctionalInterface
    private interface Recognizer {
        @Nullable Token recognize(Tokenizer tokenizer);
    }

    private static final List<Recognizer> recognizers = List.of(
        Tokenizer::recognizePunctuationCommand,
        Tokenizer::recognizeEscapedSymbol,
        Tokenizer::recognizeComment,
        Tokenizer::recognizeMathSwitch,
        Tokenizer::recognizeCommandName,
        Tokenizer::recognizeSpacer,
        Tokenizer::recognizeDelimiter,
        Tokenizer::recognizeText);

    private static final Set<String> sizePrefixes = Set.of(
        "left", "right", "middle",
        "big", "Big", "bigg", "Bigg",
        "bigl", "Bigl", "biggl", "Biggl",
        "bigr", "Bigr", "biggr", "Biggr",
        "bigm", "Bigm", "biggm", "Biggm");

    private static final String plainDelimiters = "()[]<>|./";

    private static final Set<String> escapedDelimiters = Set.of("{", "}", "|");

    private static final Set<String> namedDelimiters = Set.of(
        "langle", "rangle", "lfloor", "rfloor", "lceil", "rceil",
        "vert", "Vert", "lvert", "rvert", "lVert", "rVert",
        "lbrace", "rbrace", "lgroup", "rgroup", "lmoustache", "rmoustache",
        "uparrow", "downarrow", "updownarrow", "Uparrow", "Downarrow", "Updownarrow",
        "ulcorner", "urcorner", "llcorner", "lrcorner", "lbrack", "rbrack",
        "backslash");

    private static final Set<CategoryCode> escapableCategories = EnumSet.of(
        CategoryCode.ESCAPE,
        CategoryCode.GROUP_BEGIN,
        CategoryCode.GROUP_END,
        CategoryCode.MATH_SWITCH,
        CategoryCode.COMMENT);

    private static final Set<CategoryCode> textStoppers = EnumSet.of(
        CategoryCode.ESCAPE,
        CategoryCode.GROUP_BEGIN,
        CategoryCode.GROUP_END,
        CategoryCode.MATH_SWITCH,
        CategoryCode.COMMENT,
        CategoryCode.BRACKET_BEGIN,
        CategoryCode.BRACKET_END,
        CategoryCode.SPACER,
        CategoryCode.END_OF_LINE);

    private final String source;
    private final TokenBuffer chars;
}
