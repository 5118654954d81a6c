package io.github.eutro.wasmopt.ast;

import io.github.eutro.wasmopt.types.BinaryOp;
import io.github.eutro.wasmopt.types.WasmType;

public final class Binary extends Expression {
    public BinaryOp op;
    public Expression left;
    public Expression right;

    public Binary() {
    }

    public Binary(WasmType type, BinaryOp op, Expression left, Expression right) {
        this.type = type;
        this.op = op;
        this.left = left;
        this.right = right;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }
}
