// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.test;

import java.util.ArrayList;
import roundtex.util.Trace;
import roundtex.util.condition.Condition;
import roundtex.util.condition.ConditionContext;
import roundtex.util.condition.Handler;
import roundtex.util.condition.UnhandledErrorError;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import org.junit.jupiter.api.Test;

final class ConditionContextTest {
    @Test
    void signalWithoutHandlersReturns() {
        ConditionContext.signal(new Note("nobody listens"));
    }

    @Test
    void unhandledErrorCarriesTheCondition() {
        final var note = new Note("boom");
        final var condition = Signals.unhandled(Note.class, () -> {
            throw ConditionContext.error(note);
        });
        assertThat(condition).isSameAs(note);
    }

    @Test
    void handlersRunNewestFirst() {
        final var seen = new ArrayList<String>();
        try (final var outer = new Handler(signaled -> seen.add("outer " + signaled.condition().message()))) {
            outer.use();
            try (final var inner = new Handler(signaled -> seen.add("inner " + signaled.condition().message()))) {
                inner.use();
                ConditionContext.signal(new Note("x"));
            }
            ConditionContext.signal(new Note("y"));
        }
        assertThat(seen).containsExactly("inner x", "outer x", "outer y");
    }

    @Test
    void conditionSignaledFromHandlerSkipsTheRunningHandler() {
        final var seen = new ArrayList<String>();
        try (final var outer = new Handler(signaled -> seen.add("outer " + signaled.condition().message()))) {
            outer.use();
            try (final var inner = new Handler(signaled -> {
                seen.add("inner " + signaled.condition().message());
                if (signaled.condition().message().equals("first")) {
                    ConditionContext.signal(new Note("nested"));
                }
            })) {
                inner.use();
                ConditionContext.signal(new Note("first"));
            }
        }
        assertThat(seen).containsExactly("inner first", "outer nested", "outer first");
    }

    @Test
    void handlerUnwindsToRestart() {
        final var result = ConditionContext.withRestart("retry", restart -> {
            try (final var handler = new Handler(signaled -> {
                final var found = ConditionContext.findRestart("retry");
                assertThat(found).isSameAs(restart);
                found.unwindTo();
            })) {
                handler.use();
                throw ConditionContext.error(new Note("recover me"));
            }
        });
        assertThat(result).isNull();
        assertThat(ConditionContext.findRestart("retry")).isNull();
    }

    @Test
    void typedHandlerOnlySeesItsConditions() {
        final var seen = new ArrayList<String>();
        try (final var handler = Handler.on(Note.class, note -> seen.add(note.message()))) {
            handler.use();
            ConditionContext.signal(new Note("noted"));
            ConditionContext.signal(new Other("ignored"));
        }
        assertThat(seen).containsExactly("noted");
    }

    @Test
    void unhandledErrorMessageIsTheDetailedMessage() {
        final var error = catchThrowableOfType(() -> {
            throw ConditionContext.error(new Other("broken"));
        }, UnhandledErrorError.class);
        assertThat(error).hasMessage("broken, in detail");
        assertThat(error.condition()).hasToString("Other: broken, in detail");
    }

    @Test
    void restartReturnsTheCallbackValue() {
        final String result = ConditionContext.withRestart("unused", restart -> "value");
        assertThat(result).isEqualTo("value");
    }

    @Test
    void restartsAreListedNewestFirst() {
        ConditionContext.withRestart("outer", outer -> ConditionContext.withRestart("inner", inner -> {
            assertThat(ConditionContext.restarts()).startsWith(inner, outer);
            assertThat(ConditionContext.findRestart("outer")).isSameAs(outer);
            return null;
        }));
        assertThat(ConditionContext.restarts()).isEmpty();
    }

    @Test
    void traceMessagesAreLazyAndInnermostFirst() {
        final var evaluated = new ArrayList<String>();
        try (final var outer = new Trace("outer")) {
            outer.use();
            try (final var inner = new Trace(() -> {
                evaluated.add("inner");
                return "inner";
            })) {
                inner.use();
                assertThat(evaluated).isEmpty();
                assertThat(Trace.activeMessages()).containsExactly("inner", "outer");
                assertThat(evaluated).containsExactly("inner");
            }
        }
        assertThat(Trace.activeMessages()).isEmpty();
    }

    private static final class Note extends Condition {
        Note(final String message) {
            super(message);
        }
    }

    private static final class Other extends Condition {
        Other(final String message) {
            super(message);
        }

        @Override
        public String detailedMessage() {
            return message() + ", in detail";
        }
    }
}
