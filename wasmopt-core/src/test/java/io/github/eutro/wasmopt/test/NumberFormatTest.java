package io.github.eutro.wasmopt.test;

import io.github.eutro.wasmopt.print.NumberFormat;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class NumberFormatTest {
    @Test
    void shortestDoubles() {
        assertEquals(".5", NumberFormat.shortest(0.5));
        assertEquals("-.25", NumberFormat.shortest(-0.25));
        assertEquals("100", NumberFormat.shortest(100.0));
        assertEquals("1.25", NumberFormat.shortest(1.25));
        assertEquals("123456.789", NumberFormat.shortest(123456.789));
        assertEquals("100000000000000000000", NumberFormat.shortest(1e20));
        assertEquals("1e21", NumberFormat.shortest(1e21));
        assertEquals(".000001", NumberFormat.shortest(1e-6));
        assertEquals("1e-7", NumberFormat.shortest(1e-7));
        assertEquals("1.5e-7", NumberFormat.shortest(1.5e-7));
        assertEquals("0", NumberFormat.shortest(0.0));
        assertEquals("-0", NumberFormat.shortest(-0.0));
    }

    @Test
    void shortestDigitsRatherThanJavaToString() {
        assertEquals("1e23", NumberFormat.shortest(1e23));
        assertEquals("5e-324", NumberFormat.shortest(Double.MIN_VALUE));
        assertEquals("282879384806159000", NumberFormat.shortest(2.82879384806159E17));
        assertEquals("1e-45", NumberFormat.shortest(Float.MIN_VALUE));
        assertEquals("1.7976931348623157e308", NumberFormat.shortest(Double.MAX_VALUE));
    }

    @Test
    void nonFinite() {
        assertEquals("nan", NumberFormat.shortest(Double.NaN));
        assertEquals("infinity", NumberFormat.shortest(Double.POSITIVE_INFINITY));
        assertEquals("-infinity", NumberFormat.shortest(Float.NEGATIVE_INFINITY));
        assertEquals("nan", NumberFormat.floatLiteral(Float.NaN));
    }

    @Test
    void shortestFloatsUseSinglePrecisionDigits() {
        assertEquals(".1", NumberFormat.shortest(0.1f));
        assertEquals("-.5", NumberFormat.shortest(-0.5f));
        assertEquals("3.4028235e38", NumberFormat.shortest(Float.MAX_VALUE));
    }

    @Test
    void normalization() {
        assertEquals("0.5", NumberFormat.normalize(".5"));
        assertEquals("-0.25", NumberFormat.normalize("-.25"));
        assertEquals("12", NumberFormat.normalize("12"));
        assertEquals("0.5", NumberFormat.floatLiteral(0.5));
        assertEquals("-0.5", NumberFormat.floatLiteral(-0.5f));
        assertEquals("-0", NumberFormat.floatLiteral(-0.0));
    }
}
