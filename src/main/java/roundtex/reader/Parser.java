// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.reader;

import roundtex.lexer.Token;
import roundtex.lexer.TokenBuffer;
import roundtex.lexer.TokenCode;
import roundtex.lexer.Tokenizer;
import roundtex.tree.BraceGroup;
import roundtex.tree.BracketGroup;
import roundtex.tree.Serializer;
import roundtex.tree.TexCommand;
import roundtex.tree.TexElement;
import roundtex.tree.TexExpression;
import roundtex.tree.TexGroup;
import roundtex.tree.TexMathEnvironment;
import roundtex.tree.TexNamedEnvironment;
import roundtex.tree.TexRoot;
import roundtex.tree.TexText;
import roundtex.util.Trace;
import roundtex.util.UnreachableCodeReachedError;
import roundtex.util.annotation.Nullable;
import roundtex.util.condition.ConditionContext;
import roundtex.util.condition.Handler;
import roundtex.util.condition.UnhandledErrorError;

/**
 * The LaTeX parser: the primary means of converting source text into an expression tree.
 * <p>
 * The tree is lossless: serializing the returned root reproduces the source exactly. Parse errors are signaled as
 * {@link ParseErrorCondition}s. Under {@link Tolerance#BEST_EFFORT} the parser handles the recoverable ones itself by
 * unwinding to the restart established around every environment it reads.
 */
public final class Parser {
    private Parser(final String source, final ParseOptions options) {
        this.source = source;
        this.options = options;
        tokenizer = new Tokenizer(source);
        tokens = new TokenBuffer(tokenizer);
    }

    /**
     * Parses the given source text with the default options.
     */
    public static TexRoot parse(final CharSequence source) {
        return parse(source, ParseOptions.defaults());
    }

    /**
     * Parses the given source text.
     *
     * <ul>
     * <li>If the text was parsed, the root of the expression tree is returned.
     * <li>If a parse error occurs that the tolerance level does not cover, a fatal {@link ParseErrorCondition} is
     * signaled.
     * </ul>
     */
    public static TexRoot parse(final CharSequence source, final ParseOptions options) {
        final var parser = new Parser(source.toString(), options);
        try (final var trace = new Trace("parsing LaTeX source")) {
            trace.use();
            if (options.tolerance() == Tolerance.FAIL_FAST) {
                return parser.readRoot();
            }
            try (final var handler = Handler.on(ParseErrorCondition.class, Parser::recoverIfPossible)) {
                handler.use();
                return parser.readRoot();
            }
        }
    }

    private static void recoverIfPossible(final ParseErrorCondition error) {
        if (error.isRecoverable()) {
            final var restart = ConditionContext.findRestart(recoveryRestartName);
            if (restart != null) {
                restart.unwindTo();
            }
        }
    }

    private TexRoot readRoot() {
        final var root = new TexRoot();
        while (tokens.hasNext()) {
            root.appendContent(readElement(Scope.ROOT));
        }
        return root;
    }

    private TexElement readElement(final Scope scope) {
        final var token = current();
        return switch (code(token)) {
            case MATH_SWITCH, DISPLAY_MATH_SWITCH, MATH_GROUP_BEGIN, DISPLAY_MATH_GROUP_BEGIN -> readMath();
            case COMMAND_NAME -> readCommand(scope);
            case PUNCTUATION_COMMAND -> {
                tokens.next();
                yield new TexCommand(token.text().substring(1), token.position());
            }
            case GROUP_BEGIN -> readGroup(Scope.BRACE_GROUP);
            case COMMENT -> new TexText(tokens.next());
            default -> readText(scope);
        };
    }

    private TexText readText(final Scope scope) {
        var text = tokens.next();
        while (tokens.hasNext() && isTextual(current(), scope)) {
            text = text.plus(tokens.next());
        }
        return new TexText(text);
    }

    private TexExpression readCommand(final Scope scope) {
        final var nameToken = tokens.next();
        final var name = nameToken.text().substring(1);
        if (name.equals("begin")) {
            final var environment = readNamedEnvironment(nameToken);
            if (environment != null) {
                return environment;
            }
        }
        final var command = new TexCommand(name, nameToken.position());
        final var signature = signatureOf(name);
        readArguments(command, (signature != null) ? signature : Signature.UNCONSTRAINED, signature != null);
        if (name.equals("item")) {
            final var inBrackets = scope == Scope.BRACKET_GROUP || scope == Scope.BRACKET_ITEM;
            readItemContents(command, inBrackets ? Scope.BRACKET_ITEM : Scope.ITEM);
        } else if (name.equals("end") && scope == Scope.ROOT) {
            reportStrayEnd(nameToken, command);
        }
        return command;
    }

    private void readItemContents(final TexCommand item, final Scope scope) {
        while (tokens.hasNext()) {
            final var next = current();
            if (next.is(TokenCode.GROUP_END) || isCommand(next, "item") || isCommand(next, "end")) {
                break;
            }
            if (scope == Scope.BRACKET_ITEM && next.is(TokenCode.BRACKET_END)) {
                break;
            }
            item.appendContent(readElement(scope));
        }
    }

    private void reportStrayEnd(final Token nameToken, final TexCommand command) {
        final var arguments = command.arguments();
        final var first = arguments.isEmpty() ? null : arguments.get(0);
        if (!(first instanceof final BraceGroup nameGroup) || nameGroup.isImplicit()) {
            return;
        }
        final var foundName = Serializer.contentsToSource(nameGroup);
        ConditionContext.withRestart(recoveryRestartName, restart -> {
            throw ConditionContext.error(new MismatchedEnvironmentEndCondition(
                nameToken, locate(nameToken), null, foundName));
        });
    }

    private @Nullable TexNamedEnvironment readNamedEnvironment(final Token beginToken) {
        final var afterBegin = tokens.index();
        final var spacing = readSeparator();
        if (spacing.lineBreaks() > 1 || !tokens.hasNext() || !current().is(TokenCode.GROUP_BEGIN)) {
            tokens.seek(afterBegin);
            return null;
        }
        final var name = Serializer.contentsToSource(readGroup(Scope.BRACE_GROUP));
        final var environment = new TexNamedEnvironment(name, beginToken.position());
        environment.setBeginSpacing(spacing.text());
        try (final var trace = new Trace(() -> "reading environment '" + name + "' starting at " + at(beginToken))) {
            trace.use();
            final var skip = options.isSkipEnvironment(name);
            environment.setOpaque(skip);
            final var signature = Signatures.environment(name);
            if (signature != null) {
                readArguments(environment, signature, true);
            } else if (!skip) {
                readArguments(environment, Signature.UNCONSTRAINED, false);
            }
            ConditionContext.withRestart(recoveryRestartName, restart -> {
                if (skip) {
                    readVerbatimBody(environment, beginToken);
                } else {
                    readEnvironmentBody(environment, beginToken);
                }
                return environment;
            });
        }
        return environment;
    }

    private void readEnvironmentBody(final TexNamedEnvironment environment, final Token beginToken) {
        while (true) {
            if (!tokens.hasNext()) {
                environment.setTerminated(false);
                throw signalUnterminated(beginToken, environment.end(), "end of input", true);
            }
            final var next = current();
            if (isCommand(next, "end")) {
                final var endStart = tokens.index();
                final var endTag = readEndTag();
                if (endTag != null) {
                    if (endTag.name().equals(environment.name())) {
                        environment.setEndSpacing(endTag.spacing());
                        return;
                    }
                    tokens.seek(endStart);
                    environment.setTerminated(false);
                    throw ConditionContext.error(new MismatchedEnvironmentEndCondition(
                        next, locate(next), environment.name(), endTag.name()));
                }
            }
            environment.appendContent(readElement(Scope.ENVIRONMENT));
        }
    }

    private void readVerbatimBody(final TexNamedEnvironment environment, final Token beginToken) {
        final var terminator = "\\end{" + environment.name() + "}";
        final var offset = lastConsumedEnd();
        tokens.discardLookahead();
        final var span = tokenizer.readVerbatim(offset, terminator);
        if (!span.body().isEmpty()) {
            environment.appendContent(new TexText(span.body()));
        }
        if (!span.terminated()) {
            environment.setTerminated(false);
            throw signalUnterminated(beginToken, terminator, "end of input", true);
        }
    }

    private @Nullable EndTag readEndTag() {
        final var start = tokens.index();
        tokens.next();
        final var spacing = readSeparator();
        if (spacing.lineBreaks() > 1 || !tokens.hasNext() || !current().is(TokenCode.GROUP_BEGIN)) {
            tokens.seek(start);
            return null;
        }
        return new EndTag(Serializer.contentsToSource(readGroup(Scope.BRACE_GROUP)), spacing.text());
    }

    private TexMathEnvironment readMath() {
        final var opener = tokens.next();
        final var delimiters = switch (code(opener)) {
            case MATH_SWITCH -> TexMathEnvironment.Delimiters.INLINE;
            case DISPLAY_MATH_SWITCH -> TexMathEnvironment.Delimiters.DISPLAY;
            case MATH_GROUP_BEGIN -> TexMathEnvironment.Delimiters.INLINE_GROUP;
            case DISPLAY_MATH_GROUP_BEGIN -> TexMathEnvironment.Delimiters.DISPLAY_GROUP;
            default -> throw new UnreachableCodeReachedError("readMath called on " + opener.category());
        };
        final var closerCode = switch (delimiters) {
            case INLINE -> TokenCode.MATH_SWITCH;
            case DISPLAY -> TokenCode.DISPLAY_MATH_SWITCH;
            case INLINE_GROUP -> TokenCode.MATH_GROUP_END;
            case DISPLAY_GROUP -> TokenCode.DISPLAY_MATH_GROUP_END;
        };
        final var environment = new TexMathEnvironment(delimiters, opener.position());
        try (final var trace = new Trace(() -> "reading math starting at " + at(opener))) {
            trace.use();
            ConditionContext.withRestart(recoveryRestartName, restart -> {
                tokens.discardLookahead();
                final var span = tokenizer.readMath(opener.end(), delimiters.end(), closerCode);
                if (!span.body().isEmpty()) {
                    environment.appendContent(new TexText(span.body()));
                }
                if (!span.terminated()) {
                    environment.setTerminated(false);
                    throw signalUnterminated(opener, delimiters.end(), "end of input", true);
                }
                return environment;
            });
        }
        return environment;
    }

    private TexGroup readGroup(final Scope scope) {
        final var opener = tokens.next();
        final var isBracket = scope == Scope.BRACKET_GROUP;
        final TexGroup group = isBracket ? new BracketGroup(opener.position()) : new BraceGroup(opener.position());
        final var closer = isBracket ? TokenCode.BRACKET_END : TokenCode.GROUP_END;
        while (true) {
            if (!tokens.hasNext()) {
                throw signalUnterminated(opener, group.end(), "end of input", false);
            }
            final var next = current();
            if (next.is(closer)) {
                tokens.next();
                return group;
            }
            if (isBracket && next.is(TokenCode.GROUP_END)) {
                throw signalUnterminated(opener, group.end(), "'}'", false);
            }
            group.appendContent(readElement(scope));
        }
    }

    private void readArguments(final TexExpression owner, final Signature signature, final boolean known) {
        var required = signature.required();
        var optional = signature.optional();
        while (required != 0 || optional != 0) {
            final var start = tokens.index();
            final var separator = readSeparator();
            final var next = tokens.peek();
            TexGroup argument = null;
            if (next != null && separator.lineBreaks() <= 1) {
                if (optional != 0 && next.is(TokenCode.BRACKET_BEGIN)) {
                    argument = readGroup(Scope.BRACKET_GROUP);
                    optional = Math.max(optional - 1, -1);
                } else if (required != 0 && next.is(TokenCode.GROUP_BEGIN)) {
                    argument = readGroup(Scope.BRACE_GROUP);
                    required = Math.max(required - 1, -1);
                } else if (known && required > 0 && canBeImplicitArgument(next)) {
                    argument = readImplicitArgument();
                    required -= 1;
                }
            }
            if (argument == null) {
                tokens.seek(start);
                return;
            }
            if (separator.token() != null) {
                owner.arguments().appendSeparator(new TexText(separator.token()));
            }
            owner.arguments().append(argument);
        }
    }

    private BraceGroup readImplicitArgument() {
        final var token = current();
        final var firstCharLength = Character.charCount(token.text().codePointAt(0));
        if (token.is(TokenCode.TEXT) && firstCharLength < token.length()) {
            tokens.split(firstCharLength);
        }
        final var taken = tokens.next();
        final var group = BraceGroup.implicit(taken.position());
        group.appendContent(new TexText(taken));
        return group;
    }

    private static boolean canBeImplicitArgument(final Token token) {
        return switch (code(token)) {
            case TEXT, ESCAPED_SYMBOL -> true;
            case COMMAND_NAME -> !isCommand(token, "begin") && !isCommand(token, "end") && !isCommand(token, "item");
            default -> false;
        };
    }

    private Separator readSeparator() {
        Token spacing = null;
        var lineBreaks = 0;
        while (tokens.hasNext() && current().is(TokenCode.MERGED_SPACER)) {
            final var token = tokens.next();
            lineBreaks += countLineBreaks(token.text());
            spacing = (spacing == null) ? token : spacing.plus(token);
        }
        return new Separator(spacing, lineBreaks);
    }

    private @Nullable Signature signatureOf(final String name) {
        if (name.isEmpty() || !isAsciiLetter(name.charAt(0))) {
            return Signature.NONE;
        }
        return options.commandSignature(name);
    }

    private Token current() {
        final var token = tokens.peek();
        assert token != null : "current() called at the end of input";
        return token;
    }

    private int lastConsumedEnd() {
        final var previous = tokens.peek(-1);
        return (previous == null) ? 0 : previous.end();
    }

    private SourceLocation locate(final Token token) {
        if (lineIndex == null) {
            lineIndex = LineIndex.of(source);
        }
        return lineIndex.locate(token.position());
    }

    private String at(final Token token) {
        final var location = locate(token);
        return "line " + (location.line() + 1) + ", column " + (location.column() + 1);
    }

    private UnhandledErrorError signalUnterminated(
        final Token opener,
        final String expectedCloser,
        final String found,
        final boolean recoverable
    ) {
        throw ConditionContext.error(
            new UnterminatedConstructCondition(opener, locate(opener), expectedCloser, found, recoverable));
    }

    private static boolean isTextual(final Token token, final Scope scope) {
        return switch (code(token)) {
            case TEXT, MERGED_SPACER, ESCAPED_SYMBOL, BRACKET_BEGIN, MATH_GROUP_END, DISPLAY_MATH_GROUP_END -> true;
            case BRACKET_END -> scope != Scope.BRACKET_GROUP && scope != Scope.BRACKET_ITEM;
            case GROUP_END -> scope == Scope.ROOT || scope == Scope.ENVIRONMENT;
            default -> false;
        };
    }

    private static boolean isCommand(final Token token, final String name) {
        return token.is(TokenCode.COMMAND_NAME) && token.text().equals("\\" + name);
    }

    private static TokenCode code(final Token token) {
        return (TokenCode) token.category();
    }

    private static int countLineBreaks(final String text) {
        var count = 0;
        final var length = text.length();
        for (int i = 0; i < length; i += 1) {
            final var ch = text.charAt(i);
            if (ch == '\n' || (ch == '\r' && (i + 1 >= length || text.charAt(i + 1) != '\n'))) {
                count += 1;
            }
        }
        return count;
    }

    private static boolean isAsciiLetter(final char ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z');
    }

    private static final String recoveryRestartName = "roundtex.reader.recover";

    private final String source;
    private final ParseOptions options;
    private final Tokenizer tokenizer;
    private final TokenBuffer tokens;
    private @Nullable LineIndex lineIndex = null;

    /**
     * Where an element is being read; decides which tokens end a text run.
     */
    private enum Scope {
        ROOT,
        ENVIRONMENT,
        ITEM,
        // An item inside a bracket group, ended by the closing bracket.
        BRACKET_ITEM,
        BRACE_GROUP,
        BRACKET_GROUP,
    }

    private record Separator(@Nullable Token token, int lineBreaks) {
        private String text() {
            return (token == null) ? "" : token.text();
        }
    }

    private record EndTag(String name, String spacing) {
    }
}
