package io.github.eutro.wasmopt.types;

import org.jetbrains.annotations.Nullable;

/**
 * A conversion between value types.
 * <p>
 * The result type of a conversion is the output type of the expression it is used in;
 * the operand type is determined by the operator and, for the reinterprets, by the width
 * of the result.
 */
public enum ConvertOp {
    EXTEND_S_INT32(OpClass.INT, WasmType.I64, WasmType.I32),
    EXTEND_U_INT32(OpClass.INT, WasmType.I64, WasmType.I32),
    WRAP_INT64(OpClass.INT, WasmType.I32, WasmType.I64),
    TRUNC_S_FLOAT32(OpClass.INT, null, WasmType.F32),
    TRUNC_U_FLOAT32(OpClass.INT, null, WasmType.F32),
    TRUNC_S_FLOAT64(OpClass.INT, null, WasmType.F64),
    TRUNC_U_FLOAT64(OpClass.INT, null, WasmType.F64),
    REINTERPRET_FLOAT(OpClass.INT, null, null),

    CONVERT_S_INT32(OpClass.FLOAT, null, WasmType.I32),
    CONVERT_U_INT32(OpClass.FLOAT, null, WasmType.I32),
    CONVERT_S_INT64(OpClass.FLOAT, null, WasmType.I64),
    CONVERT_U_INT64(OpClass.FLOAT, null, WasmType.I64),
    PROMOTE_FLOAT32(OpClass.FLOAT, WasmType.F64, WasmType.F32),
    DEMOTE_FLOAT64(OpClass.FLOAT, WasmType.F32, WasmType.F64),
    REINTERPRET_INT(OpClass.FLOAT, null, null),
    ;

    private final OpClass resultClass;
    @Nullable
    private final WasmType fixedResult;
    @Nullable
    private final WasmType fixedOperand;

    ConvertOp(OpClass resultClass, @Nullable WasmType fixedResult, @Nullable WasmType fixedOperand) {
        this.resultClass = resultClass;
        this.fixedResult = fixedResult;
        this.fixedOperand = fixedOperand;
    }

    public OpClass getResultClass() {
        return resultClass;
    }

    /**
     * Check whether this conversion can produce the given type.
     *
     * @param result The result type.
     * @return Whether it can.
     */
    public boolean appliesTo(WasmType result) {
        return resultClass.contains(result) && (fixedResult == null || fixedResult == result);
    }

    /**
     * Get the type of the operand of this conversion, given its result.
     *
     * @param result The result type, which this must {@link #appliesTo(WasmType) apply to}.
     * @return The operand type.
     * @throws IllegalArgumentException If this does not apply to {@code result}.
     */
    public WasmType getOperandType(WasmType result) {
        if (!appliesTo(result)) {
            throw new IllegalArgumentException(this + " cannot produce " + result);
        }
        if (fixedOperand != null) return fixedOperand;
        return WasmType.fromSizeAndKind(result.getSize(), !result.isFloat());
    }
}
