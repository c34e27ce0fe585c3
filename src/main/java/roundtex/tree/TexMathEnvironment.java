// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.tree;

/**
 * A math environment introduced by a math switch or a math group delimiter.
 * <p>
 * Math bodies are opaque: the contents are a single text leaf holding the body verbatim.
 */
public final class TexMathEnvironment extends TexEnvironment {
    public TexMathEnvironment(final Delimiters delimiters, final int position) {
        super(delimiters.environmentName(), position);
        this.delimiters = delimiters;
    }

    public Delimiters delimiters() {
        return delimiters;
    }

    @Override
    public String begin() {
        return delimiters.begin();
    }

    @Override
    public String end() {
        return delimiters.end();
    }

    @Override
    public TexMathEnvironment copy() {
        return copyEnvironmentInto(new TexMathEnvironment(delimiters, position()));
    }

    @Override
    boolean isRenamable() {
        return false;
    }

    @Override
    String describe() {
        return "Math environment '" + delimiters.begin() + "'";
    }

    private final Delimiters delimiters;

    /**
     * The four ways of delimiting math.
     */
    public enum Delimiters {
        INLINE("$", "$", "$"),
        DISPLAY("$$", "$$", "$$"),
        INLINE_GROUP("math", "\\(", "\\)"),
        DISPLAY_GROUP("displaymath", "\\[", "\\]");

        Delimiters(final String environmentName, final String begin, final String end) {
            this.environmentName = environmentName;
            this.begin = begin;
            this.end = end;
        }

        public String environmentName() {
            return environmentName;
        }

        public String begin() {
            return begin;
        }

        public String end() {
            return end;
        }

        private final String environmentName;
        private final String begin;
        private final String end;
    }
}
