// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.test;

import roundtex.reader.MismatchedEnvironmentEndCondition;
import roundtex.reader.ParseOptions;
import roundtex.reader.Parser;
import roundtex.reader.Tolerance;
import roundtex.reader.UnterminatedConstructCondition;
import roundtex.tree.TexCommand;
import roundtex.tree.TexMathEnvironment;
import roundtex.tree.TexNamedEnvironment;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

final class ToleranceTest {
    @Test
    void unterminatedEnvironmentFailsFast() {
        final var condition = Signals.unhandled(UnterminatedConstructCondition.class,
            () -> Parser.parse("\\begin{itemize}\\item a"));
        assertThat(condition.expectedCloser()).isEqualTo("\\end{itemize}");
        assertThat(condition.isRecoverable()).isTrue();
        assertThat(condition.token().text()).isEqualTo("\\begin");
        assertThat(condition.message()).isEqualTo("Expected '\\end{itemize}' but found end of input instead");
    }

    @Test
    void unterminatedEnvironmentIsKeptInBestEffortMode() {
        final var source = "\\begin{itemize}\\item a";
        final var root = Parser.parse(source, bestEffort);
        final var itemize = (TexNamedEnvironment) root.contents().get(0);
        assertThat(itemize.isTerminated()).isFalse();
        assertThat(itemize.contents()).hasSize(1);
        assertThat(root.toSource()).isEqualTo(source);
    }

    @Test
    void mismatchedEndFailsFast() {
        final var condition = Signals.unhandled(MismatchedEnvironmentEndCondition.class,
            () -> Parser.parse("\\begin{a}\\begin{b}x\\end{a}"));
        assertThat(condition.expectedName()).isEqualTo("b");
        assertThat(condition.foundName()).isEqualTo("a");
        assertThat(condition.message()).isEqualTo("Expected '\\end{b}' but found '\\end{a}' instead");
    }

    @Test
    void mismatchedEndClosesTheOuterEnvironmentInBestEffortMode() {
        final var source = "\\begin{a}\\begin{b}x\\end{a}";
        final var root = Parser.parse(source, bestEffort);
        assertThat(root.contents()).hasSize(1);
        final var outer = (TexNamedEnvironment) root.contents().get(0);
        assertThat(outer.isTerminated()).isTrue();
        final var inner = (TexNamedEnvironment) outer.contents().get(0);
        assertThat(inner.name()).isEqualTo("b");
        assertThat(inner.isTerminated()).isFalse();
        assertThat(root.toSource()).isEqualTo(source);
    }

    @Test
    void strayEndFailsFast() {
        final var condition = Signals.unhandled(MismatchedEnvironmentEndCondition.class,
            () -> Parser.parse("text\\end{x}"));
        assertThat(condition.expectedName()).isNull();
        assertThat(condition.foundName()).isEqualTo("x");
        assertThat(condition.location().offset()).isEqualTo(4);
    }

    @Test
    void strayEndIsAnOrdinaryCommandInBestEffortMode() {
        final var source = "text\\end{x} more";
        final var root = Parser.parse(source, bestEffort);
        assertThat(root.contents()).hasSize(3);
        assertThat(((TexCommand) root.contents().get(1)).name()).isEqualTo("end");
        assertThat(root.toSource()).isEqualTo(source);
    }

    @ParameterizedTest(name = "unterminated math \"{0}\"")
    @ValueSource(strings = {"$x", "$$x", "\\(x", "\\[x", "a $x\\$"})
    void unterminatedMath(final String source) {
        Signals.unhandled(UnterminatedConstructCondition.class, () -> Parser.parse(source));

        final var root = Parser.parse(source, bestEffort);
        final var math = (TexMathEnvironment) root.contents().get(root.contents().size() - 1);
        assertThat(math.isTerminated()).isFalse();
        assertThat(root.toSource()).isEqualTo(source);
    }

    @Test
    void unterminatedVerbatimIsKeptInBestEffortMode() {
        final var source = "\\begin{verbatim}{ raw";
        Signals.unhandled(UnterminatedConstructCondition.class, () -> Parser.parse(source));
        assertThat(Parser.parse(source, bestEffort).toSource()).isEqualTo(source);
    }

    @ParameterizedTest(name = "unterminated group \"{0}\" is fatal")
    @ValueSource(strings = {"\\textbf{x", "{x", "\\item[x", "\\foo[a}"})
    void unterminatedGroupIsFatalEvenInBestEffortMode(final String source) {
        final var condition = Signals.unhandled(UnterminatedConstructCondition.class,
            () -> Parser.parse(source, bestEffort));
        assertThat(condition.isRecoverable()).isFalse();
    }

    @Test
    void conditionCarriesLocationAndTrace() {
        final var condition = Signals.unhandled(UnterminatedConstructCondition.class,
            () -> Parser.parse("intro\n\\begin{x}\n$y"));
        assertThat(condition.expectedCloser()).isEqualTo("$");
        assertThat(condition.location().line()).isEqualTo(2);
        assertThat(condition.location().column()).isZero();
        assertThat(condition.location()).hasToString("In line 3, column 1");
        assertThat(condition.traceMessages()).containsExactly(
            "reading math starting at line 3, column 1",
            "reading environment 'x' starting at line 2, column 1",
            "parsing LaTeX source");
        assertThat(condition.detailedMessage())
            .startsWith(condition.message())
            .contains("In line 3, column 1, at '$'")
            .contains("\n  while reading environment 'x' starting at line 2, column 1");
    }

    private static final ParseOptions bestEffort = ParseOptions.defaults().withTolerance(Tolerance.BEST_EFFORT);
}
