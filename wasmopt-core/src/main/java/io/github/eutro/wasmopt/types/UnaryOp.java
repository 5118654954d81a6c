package io.github.eutro.wasmopt.types;

public enum UnaryOp {
    CLZ(OpClass.INT),
    CTZ(OpClass.INT),
    POPCNT(OpClass.INT),

    NEG(OpClass.FLOAT),
    ABS(OpClass.FLOAT),
    CEIL(OpClass.FLOAT),
    FLOOR(OpClass.FLOAT),
    TRUNC(OpClass.FLOAT),
    NEAREST(OpClass.FLOAT),
    SQRT(OpClass.FLOAT),
    ;

    private final OpClass opClass;

    UnaryOp(OpClass opClass) {
        this.opClass = opClass;
    }

    public OpClass getOpClass() {
        return opClass;
    }

    public boolean appliesTo(WasmType type) {
        return opClass.contains(type);
    }
}
