package io.github.eutro.wasmopt.types;

import java.util.Locale;

/**
 * A WebAssembly value type, or {@link #NONE} for expressions that produce no value.
 */
public enum WasmType {
    /**
     * No value. Has no size.
     */
    NONE,
    /**
     * A 32-bit integer.
     */
    I32,
    /**
     * A 64-bit integer.
     */
    I64,
    /**
     * A 32-bit IEEE 754 float.
     */
    F32,
    /**
     * A 64-bit IEEE 754 float.
     */
    F64,
    ;

    /**
     * Get the size of a value of this type, in bytes.
     *
     * @return The size.
     * @throws IllegalArgumentException If this is {@link #NONE}.
     */
    public int getSize() {
        switch (this) {
            case I32:
            case F32:
                return 4;
            case I64:
            case F64:
                return 8;
            case NONE:
                throw new IllegalArgumentException("none has no size");
            default:
                throw new AssertionError();
        }
    }

    /**
     * Whether this is a floating-point type.
     *
     * @return {@code true} for {@link #F32} and {@link #F64}.
     */
    public boolean isFloat() {
        return this == F32 || this == F64;
    }

    /**
     * Get the type of a memory access of the given width.
     * <p>
     * Accesses narrower than 4 bytes are always i32.
     *
     * @param bytes   The width of the access, in bytes.
     * @param isFloat Whether the access is of a float.
     * @return The type.
     * @throws IllegalArgumentException If there is no type of that width.
     */
    public static WasmType fromSizeAndKind(int bytes, boolean isFloat) {
        if (bytes < 4) return I32;
        if (bytes == 4) return isFloat ? F32 : I32;
        if (bytes == 8) return isFloat ? F64 : I64;
        throw new IllegalArgumentException("no type is " + bytes + " bytes wide");
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
