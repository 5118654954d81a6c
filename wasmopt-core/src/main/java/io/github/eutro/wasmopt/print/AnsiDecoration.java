package io.github.eutro.wasmopt.print;

/**
 * Decorates output with ANSI terminal colours.
 */
public final class AnsiDecoration implements Decoration {
    public static final AnsiDecoration INSTANCE = new AnsiDecoration();

    static final String RESET = "\033[0m";

    private AnsiDecoration() {
    }

    @Override
    public void begin(StringBuilder out, Style style) {
        switch (style) {
            case MAJOR:
                out.append("\033[31m\033[1m"); // red, bold
                break;
            case NORMAL:
                out.append("\033[35m\033[1m"); // magenta, bold
                break;
            case MINOR:
                out.append("\033[33m"); // orange
                break;
            case TEXT:
                out.append("\033[32m"); // green
                break;
            default:
                throw new AssertionError();
        }
    }

    @Override
    public void end(StringBuilder out, Style style) {
        out.append(RESET);
    }
}
