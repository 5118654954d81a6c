package io.github.eutro.wasmopt.types;

/**
 * A constant value of one of the four number types.
 * <p>
 * The payload is stored as raw bits, and its interpretation is always given by {@link #getType()}.
 * Two literals are equal if they have the same type and the same bits, so a NaN literal
 * is equal to itself, and {@code -0.0} is not equal to {@code 0.0}.
 */
public final class Literal {
    private final WasmType type;
    private final long bits;

    private Literal(WasmType type, long bits) {
        this.type = type;
        this.bits = bits;
    }

    public static Literal i32(int value) {
        return new Literal(WasmType.I32, value);
    }

    public static Literal i64(long value) {
        return new Literal(WasmType.I64, value);
    }

    public static Literal f32(float value) {
        return new Literal(WasmType.F32, Float.floatToRawIntBits(value));
    }

    public static Literal f64(double value) {
        return new Literal(WasmType.F64, Double.doubleToRawLongBits(value));
    }

    /**
     * Get the zero of a type.
     *
     * @param type The type.
     * @return The (positive) zero literal of the type.
     * @throws IllegalArgumentException If the type is {@link WasmType#NONE}.
     */
    public static Literal zero(WasmType type) {
        switch (type) {
            case I32:
                return i32(0);
            case I64:
                return i64(0);
            case F32:
                return f32(0);
            case F64:
                return f64(0);
            case NONE:
                throw new IllegalArgumentException("none has no literals");
            default:
                throw new AssertionError();
        }
    }

    public WasmType getType() {
        return type;
    }

    private void checkType(WasmType expected) {
        if (type != expected) {
            throw new IllegalStateException("literal is " + type + ", not " + expected);
        }
    }

    public int getI32() {
        checkType(WasmType.I32);
        return (int) bits;
    }

    public long getI64() {
        checkType(WasmType.I64);
        return bits;
    }

    public float getF32() {
        checkType(WasmType.F32);
        return Float.intBitsToFloat((int) bits);
    }

    public double getF64() {
        checkType(WasmType.F64);
        return Double.longBitsToDouble(bits);
    }

    /**
     * Get the value of this literal, boxed.
     *
     * @return An {@link Integer}, {@link Long}, {@link Float} or {@link Double}, depending on the type.
     */
    public Number getValue() {
        switch (type) {
            case I32:
                return getI32();
            case I64:
                return getI64();
            case F32:
                return getF32();
            case F64:
                return getF64();
            default:
                throw new AssertionError();
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Literal literal = (Literal) o;
        return bits == literal.bits && type == literal.type;
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + Long.hashCode(bits);
    }

    @Override
    public String toString() {
        return type + ":" + getValue();
    }
}
