// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.test;

import roundtex.reader.ParseOptions;
import roundtex.reader.Parser;
import roundtex.reader.Signature;
import roundtex.reader.UnterminatedConstructCondition;
import roundtex.tree.BraceGroup;
import roundtex.tree.BracketGroup;
import roundtex.tree.Serializer;
import roundtex.tree.TexCommand;
import roundtex.tree.TexElement;
import roundtex.tree.TexMathEnvironment;
import roundtex.tree.TexNamedEnvironment;
import roundtex.tree.TexText;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

final class ParserTest {
    @Test
    void commandWithRequiredArgument() {
        final var root = Parser.parse("\\section{Title}");
        assertThat(root.contents()).hasSize(1);
        final var section = as(TexCommand.class, root.contents().get(0));
        assertThat(section.name()).isEqualTo("section");
        assertThat(section.arguments().size()).isEqualTo(1);
        final var argument = section.arguments().get(0);
        assertThat(argument).isInstanceOf(BraceGroup.class);
        assertThat(argument.isArgument()).isTrue();
        assertThat(Serializer.contentsToSource(argument)).isEqualTo("Title");
        assertThat(argument.parent()).isSameAs(section);
    }

    @Test
    void itemsSplitAListEnvironment() {
        final var root = Parser.parse("\\begin{itemize}\\item a\\item b\\end{itemize}");
        final var itemize = as(TexNamedEnvironment.class, root.contents().get(0));
        assertThat(itemize.name()).isEqualTo("itemize");
        assertThat(itemize.contents()).hasSize(2).allSatisfy(element -> {
            final var item = as(TexCommand.class, element);
            assertThat(item.name()).isEqualTo("item");
            assertThat(item.arguments().isEmpty()).isTrue();
        });
        assertThat(Serializer.contentsToSource((TexCommand) itemize.contents().get(0))).isEqualTo(" a");
        assertThat(Serializer.contentsToSource((TexCommand) itemize.contents().get(1))).isEqualTo(" b");
    }

    @Test
    void itemTakesAnOptionalLabel() {
        final var root = Parser.parse("\\begin{description}\\item[Term] Definition\\end{description}");
        final var description = as(TexNamedEnvironment.class, root.contents().get(0));
        final var item = as(TexCommand.class, description.contents().get(0));
        assertThat(item.arguments().get(0)).isInstanceOf(BracketGroup.class);
        assertThat(item.arguments().get(0).toSource()).isEqualTo("[Term]");
        assertThat(Serializer.contentsToSource(item)).isEqualTo(" Definition");
    }

    @Test
    void itemInsideBracketsEndsAtTheClosingBracket() {
        final var source = "\\foo[\\item x] y";
        final var root = Parser.parse(source);
        final var foo = as(TexCommand.class, root.contents().get(0));
        final var label = foo.arguments().get(0);
        assertThat(label).isInstanceOf(BracketGroup.class);
        final var item = as(TexCommand.class, label.contents().get(0));
        assertThat(Serializer.contentsToSource(item)).isEqualTo(" x");
        assertThat(root.toSource()).isEqualTo(source);
    }

    @Test
    void skipEnvironmentsAreMarkedOpaque() {
        final var options = ParseOptions.defaults().withSkipEnvironments("myraw");
        final var root = Parser.parse("\\begin{myraw}a\\end{myraw}\\begin{center}b\\end{center}", options);
        final var raw = as(TexNamedEnvironment.class, root.contents().get(0));
        assertThat(raw.isOpaque()).isTrue();
        assertThat(raw.copy().isOpaque()).isTrue();
        assertThat(as(TexNamedEnvironment.class, root.contents().get(1)).isOpaque()).isFalse();
    }

    @Test
    void verbatimBodyIsOpaque() {
        final var root = Parser.parse("\\begin{verbatim}\\textbf{not parsed}\\end{verbatim}");
        final var verbatim = as(TexNamedEnvironment.class, root.contents().get(0));
        assertThat(verbatim.contents()).hasSize(1);
        assertThat(as(TexText.class, verbatim.contents().get(0)).text()).isEqualTo("\\textbf{not parsed}");
    }

    @Test
    void verbatimBodyMayHoldUnbalancedBraces() {
        final var source = "\\begin{verbatim}{ \\foo } } \\\n\\end{verbatim}after";
        final var root = Parser.parse(source);
        assertThat(root.contents()).hasSize(2);
        assertThat(root.toSource()).isEqualTo(source);
    }

    @Test
    void configuredSkipEnvironmentIsOpaque() {
        final var source = "\\begin{myraw}\\x{\\end{myraw}";
        final var root = Parser.parse(source, ParseOptions.defaults().withSkipEnvironments("myraw"));
        final var raw = as(TexNamedEnvironment.class, root.contents().get(0));
        assertThat(raw.contents()).hasSize(1);
        assertThat(as(TexText.class, raw.contents().get(0)).text()).isEqualTo("\\x{");

        final var condition = Signals.unhandled(UnterminatedConstructCondition.class, () -> Parser.parse(source));
        assertThat(condition.expectedCloser()).isEqualTo("}");
    }

    @Test
    void mathBodyIsOpaque() {
        final var root = Parser.parse("$\\frac{a}{b}$");
        final var math = as(TexMathEnvironment.class, root.contents().get(0));
        assertThat(math.delimiters()).isEqualTo(TexMathEnvironment.Delimiters.INLINE);
        assertThat(math.contents()).hasSize(1);
        assertThat(as(TexText.class, math.contents().get(0)).text()).isEqualTo("\\frac{a}{b}");
    }

    @ParameterizedTest(name = "\"{0}\" is math named {1}")
    @CsvSource(delimiter = '|', value = {
        "$x$|$",
        "$$x$$|$$",
        "\\(x\\)|math",
        "\\[x\\]|displaymath",
    })
    void mathEnvironmentNames(final String source, final String name) {
        final var math = as(TexMathEnvironment.class, Parser.parse(source).contents().get(0));
        assertThat(math.name()).isEqualTo(name);
        assertThat(math.isTerminated()).isTrue();
        assertThat(math.toSource()).isEqualTo(source);
    }

    @Test
    void escapedDollarDoesNotCloseMath() {
        final var root = Parser.parse("$a\\$b$ c");
        assertThat(root.contents()).hasSize(2);
        final var math = as(TexMathEnvironment.class, root.contents().get(0));
        assertThat(Serializer.contentsToSource(math)).isEqualTo("a\\$b");
        assertThat(as(TexText.class, root.contents().get(1)).text()).isEqualTo(" c");
    }

    @Test
    void adjacentInlineMath() {
        final var root = Parser.parse("$a$$b$");
        assertThat(root.contents()).hasSize(2).allSatisfy(element -> assertThat(element)
            .isInstanceOf(TexMathEnvironment.class));
    }

    @Test
    void singleLineBreakSeparatesArguments() {
        final var command = as(TexCommand.class,
            Parser.parse("\\mytitle{Essay title}\n{Essay subheading.}").contents().get(0));
        assertThat(command.arguments().size()).isEqualTo(2);
        assertThat(command.arguments().all()).hasSize(3);
        assertThat(as(TexText.class, command.arguments().all().get(1)).text()).isEqualTo("\n");
    }

    @Test
    void blankLineEndsArguments() {
        final var root = Parser.parse("\\mytitle{Essay title}\n\n{Essay subheading.}");
        assertThat(root.contents()).hasSize(3);
        final var command = as(TexCommand.class, root.contents().get(0));
        assertThat(command.arguments().size()).isEqualTo(1);
        assertThat(as(TexText.class, root.contents().get(1)).text()).isEqualTo("\n\n");
        final var group = as(BraceGroup.class, root.contents().get(2));
        assertThat(group.isArgument()).isFalse();
    }

    @Test
    void blankLineAlsoEndsKnownSignatures() {
        final var root = Parser.parse("\\section\n\n{Title}");
        final var section = as(TexCommand.class, root.contents().get(0));
        assertThat(section.arguments().isEmpty()).isTrue();
        assertThat(root.contents()).hasSize(3);
    }

    @Test
    void singleCharacterImplicitArguments() {
        final var source = "\\frac12";
        final var root = Parser.parse(source);
        assertThat(root.contents()).hasSize(1);
        final var frac = as(TexCommand.class, root.contents().get(0));
        assertThat(frac.arguments().size()).isEqualTo(2);
        assertThat(frac.arguments()).allSatisfy(argument -> assertThat(((BraceGroup) argument).isImplicit())
            .isTrue());
        assertThat(Serializer.contentsToSource(frac.arguments().get(0))).isEqualTo("1");
        assertThat(Serializer.contentsToSource(frac.arguments().get(1))).isEqualTo("2");
        assertThat(root.toSource()).isEqualTo(source);
    }

    @Test
    void commandNamesAsImplicitArguments() {
        final var frac = as(TexCommand.class, Parser.parse("\\frac\\alpha\\beta").contents().get(0));
        assertThat(frac.arguments().size()).isEqualTo(2);
        assertThat(Serializer.contentsToSource(frac.arguments().get(0))).isEqualTo("\\alpha");
        assertThat(Serializer.contentsToSource(frac.arguments().get(1))).isEqualTo("\\beta");
    }

    @Test
    void unknownCommandsTakeNoImplicitArguments() {
        final var root = Parser.parse("\\foo bar");
        final var foo = as(TexCommand.class, root.contents().get(0));
        assertThat(foo.arguments().isEmpty()).isTrue();
        assertThat(as(TexText.class, root.contents().get(1)).text()).isEqualTo(" bar");
    }

    @Test
    void signatureLimitsArgumentCount() {
        final var source = "\\foo{a}{b}";
        assertThat(as(TexCommand.class, Parser.parse(source).contents().get(0)).arguments().size()).isEqualTo(2);

        final var options = ParseOptions.defaults().withCommandSignature("foo", Signature.of(1, 0));
        final var root = Parser.parse(source, options);
        assertThat(root.contents()).hasSize(2);
        assertThat(as(TexCommand.class, root.contents().get(0)).arguments().size()).isEqualTo(1);
        assertThat(as(BraceGroup.class, root.contents().get(1)).isArgument()).isFalse();
    }

    @Test
    void environmentSignature() {
        final var root = Parser.parse("\\begin{tabular}{ll}a & b\\end{tabular}");
        final var tabular = as(TexNamedEnvironment.class, root.contents().get(0));
        assertThat(tabular.arguments().size()).isEqualTo(1);
        assertThat(Serializer.contentsToSource(tabular)).isEqualTo("a & b");
    }

    @Test
    void punctuationCommandsHaveNoArguments() {
        final var root = Parser.parse("\\left(x\\right)");
        assertThat(root.contents()).hasSize(3);
        assertThat(as(TexCommand.class, root.contents().get(0)).name()).isEqualTo("left(");
        assertThat(as(TexText.class, root.contents().get(1)).text()).isEqualTo("x");
        assertThat(as(TexCommand.class, root.contents().get(2)).name()).isEqualTo("right)");
    }

    @Test
    void controlSymbolTakesNoArguments() {
        final var root = Parser.parse("\\,{x}");
        assertThat(root.contents()).hasSize(2);
        assertThat(as(TexCommand.class, root.contents().get(0)).arguments().isEmpty()).isTrue();
        assertThat(as(BraceGroup.class, root.contents().get(1)).isArgument()).isFalse();
    }

    @Test
    void bodyBraceGroup() {
        final var root = Parser.parse("{\\bf x}");
        final var group = as(BraceGroup.class, root.contents().get(0));
        assertThat(group.contents()).hasSize(2);
        assertThat(as(TexCommand.class, group.contents().get(0)).name()).isEqualTo("bf");
        assertThat(as(TexText.class, group.contents().get(1)).text()).isEqualTo(" x");
    }

    @Test
    void strayClosingBraceAtTopLevelIsText() {
        final var root = Parser.parse("a}b");
        assertThat(root.contents()).hasSize(1);
        assertThat(as(TexText.class, root.contents().get(0)).text()).isEqualTo("a}b");
    }

    @Test
    void spacingAroundEnvironmentNamesIsKept() {
        final var source = "\\begin {itemize}\\end {itemize}";
        final var root = Parser.parse(source);
        final var itemize = as(TexNamedEnvironment.class, root.contents().get(0));
        assertThat(itemize.name()).isEqualTo("itemize");
        assertThat(itemize.beginSpacing()).isEqualTo(" ");
        assertThat(itemize.endSpacing()).isEqualTo(" ");
        assertThat(root.toSource()).isEqualTo(source);
    }

    @Test
    void beginWithoutNameIsAnOrdinaryCommand() {
        final var root = Parser.parse("\\begin x");
        assertThat(as(TexCommand.class, root.contents().get(0)).name()).isEqualTo("begin");
        assertThat(as(TexText.class, root.contents().get(1)).text()).isEqualTo(" x");
    }

    @Test
    void commentsAreSeparateLeaves() {
        final var root = Parser.parse("a % note\nb");
        assertThat(root.contents()).extracting(TexElement::toSource).containsExactly("a ", "% note", "\nb");
        assertThat(as(TexText.class, root.contents().get(1)).isComment()).isTrue();
    }

    @Test
    void positionsAreSourceOffsets() {
        final var root = Parser.parse("ab \\textbf{c}");
        final var textbf = as(TexCommand.class, root.contents().get(1));
        assertThat(textbf.position()).isEqualTo(3);
        assertThat(textbf.arguments().get(0).position()).isEqualTo(10);
    }

    private static <T extends TexElement> T as(final Class<T> type, final TexElement element) {
        assertThat(element).isInstanceOf(type);
        return type.cast(element);
    }
}
