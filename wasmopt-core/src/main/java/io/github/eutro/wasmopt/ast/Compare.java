package io.github.eutro.wasmopt.ast;

import io.github.eutro.wasmopt.types.RelationalOp;
import io.github.eutro.wasmopt.types.WasmType;

/**
 * A comparison of two values of type {@link #inputType}. The result is always i32.
 */
public final class Compare extends Expression {
    public RelationalOp op;
    public WasmType inputType;
    public Expression left;
    public Expression right;

    public Compare() {
        type = WasmType.I32;
    }

    public Compare(RelationalOp op, WasmType inputType, Expression left, Expression right) {
        this();
        this.op = op;
        this.inputType = inputType;
        this.left = left;
        this.right = right;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitCompare(this);
    }
}
