package io.github.eutro.wasmopt.print;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Formatting of float literals for the text format.
 */
public final class NumberFormat {
    private NumberFormat() {
    }

    /**
     * Format a double in its shortest form that reads back as the same double.
     * <p>
     * The form is compact: a zero before the decimal point is left out ({@code .5}),
     * integral values have no decimal point ({@code 100}), and very large or small
     * magnitudes use an exponent without a plus sign ({@code 1e21}, {@code 1.5e-7}).
     *
     * @param d The double.
     * @return Its compact text.
     */
    public static String shortest(double d) {
        if (Double.isNaN(d)) return "nan";
        if (Double.isInfinite(d)) return d > 0 ? "infinity" : "-infinity";
        boolean negative = Double.doubleToRawLongBits(d) < 0;
        if (d == 0) return negative ? "-0" : "0";
        BigDecimal exact = new BigDecimal(d);
        for (int p = 1; p < 17; p++) {
            BigDecimal rounded = exact.round(new MathContext(p, RoundingMode.HALF_EVEN));
            if (Double.doubleToRawLongBits(Double.parseDouble(rounded.toString())) == Double.doubleToRawLongBits(d)) {
                return compact(rounded, negative);
            }
        }
        return compact(exact.round(new MathContext(17, RoundingMode.HALF_EVEN)), negative);
    }

    /**
     * Format a float in its shortest form that reads back as the same float.
     *
     * @param f The float.
     * @return Its compact text.
     * @see #shortest(double)
     */
    public static String shortest(float f) {
        if (Float.isNaN(f)) return "nan";
        if (Float.isInfinite(f)) return f > 0 ? "infinity" : "-infinity";
        boolean negative = Float.floatToRawIntBits(f) < 0;
        if (f == 0) return negative ? "-0" : "0";
        BigDecimal exact = new BigDecimal((double) f);
        for (int p = 1; p < 9; p++) {
            BigDecimal rounded = exact.round(new MathContext(p, RoundingMode.HALF_EVEN));
            if (Float.floatToRawIntBits(Float.parseFloat(rounded.toString())) == Float.floatToRawIntBits(f)) {
                return compact(rounded, negative);
            }
        }
        return compact(exact.round(new MathContext(9, RoundingMode.HALF_EVEN)), negative);
    }

    /**
     * Make compact text acceptable to the text format, which rejects literals starting with a bare {@code .}.
     *
     * @param text The text, as from {@link #shortest(double)}.
     * @return The text, with a {@code 0} before any leading decimal point.
     */
    public static String normalize(String text) {
        if (text.startsWith(".")) {
            return "0" + text;
        } else if (text.startsWith("-.")) {
            return "-0." + text.substring(2);
        }
        return text;
    }

    /**
     * Format a double for a {@code f64.const}.
     *
     * @param d The double.
     * @return The {@link #normalize(String) normalized} {@link #shortest(double) shortest} text.
     */
    public static String floatLiteral(double d) {
        return normalize(shortest(d));
    }

    /**
     * Format a float for a {@code f32.const}.
     *
     * @param f The float.
     * @return The {@link #normalize(String) normalized} {@link #shortest(float) shortest} text.
     */
    public static String floatLiteral(float f) {
        return normalize(shortest(f));
    }

    // digits are the fewest that read back as the same value, at most 17 (double) or 9 (float)
    private static String compact(BigDecimal value, boolean negative) {
        BigDecimal dec = value.stripTrailingZeros();
        String digits = dec.unscaledValue().abs().toString();
        int k = digits.length();
        int n = k - dec.scale(); // value = 0.digits * 10^n

        StringBuilder sb = new StringBuilder();
        if (negative) sb.append('-');
        if (k <= n && n <= 21) {
            sb.append(digits);
            for (int i = k; i < n; i++) sb.append('0');
        } else if (0 < n && n <= 21) {
            sb.append(digits, 0, n).append('.').append(digits, n, k);
        } else if (-6 < n && n <= 0) {
            sb.append('.');
            for (int i = n; i < 0; i++) sb.append('0');
            sb.append(digits);
        } else {
            sb.append(digits.charAt(0));
            if (k > 1) sb.append('.').append(digits, 1, k);
            sb.append('e').append(n - 1);
        }
        return sb.toString();
    }
}
