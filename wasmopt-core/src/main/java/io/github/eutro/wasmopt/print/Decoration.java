package io.github.eutro.wasmopt.print;

/**
 * A strategy for decorating groups of printed tokens, for example with terminal colours.
 * <p>
 * Decorations only ever add text around a token group, never change the group itself,
 * so removing what a decoration added always gives the output of {@link #PLAIN}.
 */
public interface Decoration {
    /**
     * No decoration at all.
     */
    Decoration PLAIN = new Decoration() {
        @Override
        public void begin(StringBuilder out, Style style) {
        }

        @Override
        public void end(StringBuilder out, Style style) {
        }
    };

    /**
     * Emit whatever precedes a token group of the given style.
     *
     * @param out   The output.
     * @param style The style of the group.
     */
    void begin(StringBuilder out, Style style);

    /**
     * Emit whatever follows a token group of the given style.
     *
     * @param out   The output.
     * @param style The style of the group.
     */
    void end(StringBuilder out, Style style);

    /**
     * Get the decoration selected by the environment: {@link AnsiDecoration}
     * if {@code WASMOPT_COLORS} is {@code 1}, otherwise {@link #PLAIN}.
     *
     * @return The decoration.
     */
    static Decoration fromEnvironment() {
        return "1".equals(System.getenv("WASMOPT_COLORS")) ? AnsiDecoration.INSTANCE : PLAIN;
    }

    /**
     * The kinds of token group.
     */
    enum Style {
        /**
         * Top-level forms: modules and functions.
         */
        MAJOR,
        /**
         * Instructions and other entities.
         */
        NORMAL,
        /**
         * Minor forms: nops, constants, parameters, results and locals.
         */
        MINOR,
        /**
         * The contents of string literals.
         */
        TEXT,
    }
}
