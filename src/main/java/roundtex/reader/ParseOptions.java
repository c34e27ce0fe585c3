// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.reader;

import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import roundtex.util.annotation.Nullable;

/**
 * Parser configuration.
 *
 * @param skipEnvironments  Environment names whose bodies are read verbatim, in addition to the built-in ones.
 * @param tolerance         The reaction to recoverable parse errors.
 * @param commandSignatures Command signatures taking precedence over the built-in table.
 */
public record ParseOptions(
    Set<String> skipEnvironments,
    Tolerance tolerance,
    Map<String, Signature> commandSignatures
) {
    public ParseOptions {
        skipEnvironments = Set.copyOf(skipEnvironments);
        commandSignatures = Map.copyOf(commandSignatures);
    }

    /**
     * Returns the default options: no extra skip environments, fail-fast, built-in signatures only.
     */
    public static ParseOptions defaults() {
        return defaults;
    }

    /**
     * Returns a copy of these options with the given names added to the skip environments.
     */
    @CheckReturnValue
    public ParseOptions withSkipEnvironments(final String... names) {
        final var merged = new HashSet<>(skipEnvironments);
        merged.addAll(Arrays.asList(names));
        return new ParseOptions(merged, tolerance, commandSignatures);
    }

    @CheckReturnValue
    public ParseOptions withTolerance(final Tolerance newTolerance) {
        return new ParseOptions(skipEnvironments, newTolerance, commandSignatures);
    }

    /**
     * Returns a copy of these options with the given command signature overriding the built-in one.
     */
    @CheckReturnValue
    public ParseOptions withCommandSignature(final String name, final Signature signature) {
        final var signatures = new HashMap<>(commandSignatures);
        signatures.put(name, signature);
        return new ParseOptions(skipEnvironments, tolerance, signatures);
    }

    /**
     * Returns {@code true} iff the body of the given environment is read verbatim.
     */
    public boolean isSkipEnvironment(final String name) {
        return skipEnvironments.contains(name) || Signatures.isSkipEnvironment(name);
    }

    /**
     * Returns the signature of the given command, or {@code null} if neither these options nor the built-in table
     * know it.
     */
    public @Nullable Signature commandSignature(final String name) {
        final var custom = commandSignatures.get(name);
        return (custom != null) ? custom : Signatures.command(name);
    }

    private static final ParseOptions defaults = new ParseOptions(Set.of(), Tolerance.FAIL_FAST, Map.of());
}
