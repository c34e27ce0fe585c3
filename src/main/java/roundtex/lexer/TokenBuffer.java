// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.lexer;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.Predicate;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import roundtex.util.annotation.Nullable;

/**
 * A cursor over a stream of tokens with arbitrary lookahead and backtracking.
 * <p>
 * Every token pulled from the underlying iterator is kept, so the cursor can be moved back to any earlier index.
 * Lookahead is only pulled on demand. Both stages of the reading pipeline use this class: the tokenizer over
 * categorized characters, the parser over tokens.
 */
public final class TokenBuffer {
    /**
     * Initializes a new buffer positioned before the first token of the given iterator.
     */
    public TokenBuffer(final Iterator<Token> source) {
        this.source = source;
    }

    /**
     * Returns {@code true} iff at least one more token is available.
     */
    public boolean hasNext() {
        return hasNext(1);
    }

    /**
     * Returns {@code true} iff at least {@code count} more tokens are available.
     */
    public boolean hasNext(final int count) {
        return fill(index + count);
    }

    /**
     * Returns the current token without consuming it, or {@code null} at the end.
     */
    public @Nullable Token peek() {
        return peek(0);
    }

    /**
     * Returns the token at the given offset from the cursor without consuming anything.
     * <p>
     * Negative offsets look at already consumed tokens. Returns {@code null} if the offset falls outside the stream.
     */
    public @Nullable Token peek(final int offset) {
        final var target = index + offset;
        if (target < 0 || !fill(target + 1)) {
            return null;
        }
        return cache.get(target);
    }

    /**
     * Returns the concatenation of the tokens at offsets {@code from} (inclusive) to {@code to} (exclusive), or
     * {@code null} if none of them exists.
     */
    public @Nullable Token peek(final int from, final int to) {
        final var tokens = new ArrayList<Token>();
        for (int offset = from; offset < to; offset += 1) {
            final var token = peek(offset);
            if (token != null) {
                tokens.add(token);
            }
        }
        return Token.concat(tokens);
    }

    /**
     * Consumes and returns the current token.
     *
     * @throws NoSuchElementException If the end was reached.
     */
    public Token next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Token buffer exhausted at index " + index);
        }
        final var token = cache.get(index);
        index += 1;
        return token;
    }

    /**
     * Consumes up to {@code count} tokens and returns their concatenation, or {@code null} if nothing was consumed.
     * <p>
     * A negative count moves backward instead, see {@link #backward(int)}.
     */
    public @Nullable Token forward(final int count) {
        if (count < 0) {
            return backward(-count);
        }
        final var start = index;
        fill(index + count);
        index = Math.min(index + count, cache.size());
        return Token.concat(cache.subList(start, index));
    }

    /**
     * Moves the cursor {@code count} tokens back and returns the concatenation of the tokens moved over, or
     * {@code null} if the count is zero.
     *
     * @throws IllegalArgumentException If that would move the cursor before the first token.
     */
    public @Nullable Token backward(final int count) {
        if (count < 0) {
            return forward(-count);
        }
        if (index - count < 0) {
            throw new IllegalArgumentException("Cannot move " + count + " tokens back from index " + index);
        }
        index -= count;
        return Token.concat(cache.subList(index, index + count));
    }

    /**
     * Consumes tokens until the given predicate accepts the current token or the end is reached, and returns the
     * concatenation of the consumed tokens, or {@code null} if the predicate accepted the current token right away.
     */
    public @Nullable Token forwardUntil(final Predicate<? super Token> stop) {
        final var start = index;
        while (hasNext() && !stop.test(cache.get(index))) {
            index += 1;
        }
        return Token.concat(cache.subList(start, index));
    }

    /**
     * Returns {@code true} iff the text of the upcoming tokens starts with the given string.
     */
    @CheckReturnValue
    public boolean startsWith(final String prefix) {
        final var builder = new StringBuilder();
        for (int offset = 0; builder.length() < prefix.length(); offset += 1) {
            final var token = peek(offset);
            if (token == null) {
                return false;
            }
            builder.append(token.text());
        }
        return builder.toString().startsWith(prefix);
    }

    /**
     * Returns {@code true} iff the text of the already consumed tokens ends with the given string.
     */
    @CheckReturnValue
    public boolean endsWith(final String suffix) {
        final var builder = new StringBuilder();
        for (int i = index - 1; i >= 0 && builder.length() < suffix.length(); i -= 1) {
            builder.insert(0, cache.get(i).text());
        }
        return builder.toString().endsWith(suffix);
    }

    /**
     * Returns the number of tokens consumed so far.
     */
    public int index() {
        return index;
    }

    /**
     * Moves the cursor to the given absolute index, pulling tokens as needed.
     *
     * @throws IllegalArgumentException If the index is negative or past the end of the stream.
     */
    public void seek(final int newIndex) {
        if (newIndex < 0 || !fill(newIndex)) {
            throw new IllegalArgumentException("Cannot seek to token index " + newIndex);
        }
        index = newIndex;
    }

    /**
     * Replaces the current token with two tokens: its first {@code length} characters and the rest.
     * <p>
     * Both parts keep the category of the original token.
     *
     * @throws IllegalArgumentException If there is no current token, or the split point is not strictly inside it.
     */
    public void split(final int length) {
        final var token = peek();
        if (token == null || length <= 0 || length >= token.length()) {
            throw new IllegalArgumentException("Cannot split the current token at " + length);
        }
        final var text = token.text();
        cache.set(index, new Token(text.substring(0, length), token.position(), token.category()));
        cache.add(index + 1, new Token(text.substring(length), token.position() + length, token.category()));
    }

    /**
     * Forgets every token pulled but not yet consumed.
     * <p>
     * Used when the underlying source was repositioned behind the buffer's back, so that stale lookahead is
     * regenerated from the new source position.
     */
    public void discardLookahead() {
        cache.subList(index, cache.size()).clear();
    }

    private boolean fill(final int size) {
        while (cache.size() < size) {
            if (!source.hasNext()) {
                return false;
            }
            cache.add(source.next());
        }
        return true;
    }

    private final Iterator<Token> source;
    private final ArrayList<Token> cache = new ArrayList<>();
    private int index = 0;
}
