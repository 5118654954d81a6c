package io.github.eutro.wasmopt.types;

/**
 * A comparison operator. Applicability is checked against the compared operands'
 * type, since the result is always i32.
 */
public enum RelationalOp {
    EQ(OpClass.ANY),
    NE(OpClass.ANY),

    LT_S(OpClass.INT),
    LT_U(OpClass.INT),
    LE_S(OpClass.INT),
    LE_U(OpClass.INT),
    GT_S(OpClass.INT),
    GT_U(OpClass.INT),
    GE_S(OpClass.INT),
    GE_U(OpClass.INT),

    LT(OpClass.FLOAT),
    LE(OpClass.FLOAT),
    GT(OpClass.FLOAT),
    GE(OpClass.FLOAT),
    ;

    private final OpClass opClass;

    RelationalOp(OpClass opClass) {
        this.opClass = opClass;
    }

    public OpClass getOpClass() {
        return opClass;
    }

    public boolean appliesTo(WasmType inputType) {
        return opClass.contains(inputType);
    }
}
