// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.test;

import java.util.List;
import java.util.NoSuchElementException;
import roundtex.lexer.CategoryCode;
import roundtex.lexer.Token;
import roundtex.lexer.TokenBuffer;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

final class TokenBufferTest {
    @BeforeEach
    void createBuffer() {
        final var tokens = List.of(
            letter("a", 0), letter("b", 1), letter("c", 2), letter("d", 3), letter("e", 4), letter("f", 5));
        buffer = new TokenBuffer(tokens.iterator());
    }

    @Test
    void peekDoesNotConsume() {
        assertThat(text(buffer.peek())).isEqualTo("a");
        assertThat(text(buffer.peek())).isEqualTo("a");
        assertThat(buffer.index()).isZero();
    }

    @Test
    void peekOutsideOfTheStreamGivesNull() {
        assertThat(buffer.peek(-1)).isNull();
        assertThat(buffer.peek(6)).isNull();
        assertThat(text(buffer.peek(5))).isEqualTo("f");
    }

    @Test
    void peekRangeConcatenates() {
        buffer.next();
        final var range = buffer.peek(0, 3);
        assertThat(text(range)).isEqualTo("bcd");
        assertThat(range.position()).isEqualTo(1);
    }

    @Test
    void forwardAndBackward() {
        buffer.next();
        assertThat(text(buffer.forward(2))).isEqualTo("bc");
        assertThat(buffer.index()).isEqualTo(3);
        assertThat(text(buffer.backward(2))).isEqualTo("bc");
        assertThat(buffer.index()).isEqualTo(1);
        assertThatExceptionOfType(IllegalArgumentException.class).isThrownBy(() -> buffer.backward(5));
    }

    @Test
    void forwardPastTheEndStopsAtTheEnd() {
        buffer.forward(4);
        assertThat(text(buffer.forward(100))).isEqualTo("ef");
        assertThat(buffer.hasNext()).isFalse();
        assertThatExceptionOfType(NoSuchElementException.class).isThrownBy(buffer::next);
    }

    @Test
    void forwardUntilStopsBeforeTheMatchingToken() {
        buffer.next();
        assertThat(text(buffer.forwardUntil(token -> token.text().equals("e")))).isEqualTo("bcd");
        assertThat(text(buffer.peek())).isEqualTo("e");
        assertThat(buffer.startsWith("ef")).isTrue();
        assertThat(buffer.startsWith("eg")).isFalse();
        assertThat(buffer.endsWith("abcd")).isTrue();
        assertThat(buffer.endsWith("bcde")).isFalse();
    }

    @Test
    void hasNextLooksAhead() {
        assertThat(buffer.hasNext(6)).isTrue();
        assertThat(buffer.hasNext(7)).isFalse();
    }

    @Test
    void seekRewinds() {
        buffer.forward(5);
        buffer.seek(0);
        assertThat(text(buffer.peek())).isEqualTo("a");
        assertThatExceptionOfType(IllegalArgumentException.class).isThrownBy(() -> buffer.seek(7));
    }

    @Test
    void splitKeepsCategoryAndPositions() {
        final var words = new TokenBuffer(List.of(new Token("hello", 10, CategoryCode.OTHER)).iterator());
        words.split(1);
        assertThat(words.next()).isEqualTo(new Token("h", 10, CategoryCode.OTHER));
        assertThat(words.next()).isEqualTo(new Token("ello", 11, CategoryCode.OTHER));
        assertThat(words.hasNext()).isFalse();
    }

    @Test
    void tokenConcatenationKeepsTheFirstPosition() {
        final var joined = letter("ab", 3).plus(letter("cd", 5));
        assertThat(joined.text()).isEqualTo("abcd");
        assertThat(joined.position()).isEqualTo(3);
        assertThat(joined.end()).isEqualTo(7);
        assertThat(Token.concat(List.of())).isNull();
    }

    private static Token letter(final String text, final int position) {
        return new Token(text, position, CategoryCode.LETTER);
    }

    private static String text(final Token token) {
        assertThat(token).isNotNull();
        return token.text();
    }

    private TokenBuffer buffer;
}
