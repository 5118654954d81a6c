package io.github.eutro.wasmopt.types;

public enum BinaryOp {
    ADD(OpClass.ANY),
    SUB(OpClass.ANY),
    MUL(OpClass.ANY),

    DIV_S(OpClass.INT),
    DIV_U(OpClass.INT),
    REM_S(OpClass.INT),
    REM_U(OpClass.INT),
    AND(OpClass.INT),
    OR(OpClass.INT),
    XOR(OpClass.INT),
    SHL(OpClass.INT),
    SHR_U(OpClass.INT),
    SHR_S(OpClass.INT),

    DIV(OpClass.FLOAT),
    COPY_SIGN(OpClass.FLOAT),
    MIN(OpClass.FLOAT),
    MAX(OpClass.FLOAT),
    ;

    private final OpClass opClass;

    BinaryOp(OpClass opClass) {
        this.opClass = opClass;
    }

    public OpClass getOpClass() {
        return opClass;
    }

    public boolean appliesTo(WasmType type) {
        return opClass.contains(type);
    }
}
