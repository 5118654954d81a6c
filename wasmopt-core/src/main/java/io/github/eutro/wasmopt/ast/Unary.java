package io.github.eutro.wasmopt.ast;

import io.github.eutro.wasmopt.types.UnaryOp;
import io.github.eutro.wasmopt.types.WasmType;

public final class Unary extends Expression {
    public UnaryOp op;
    public Expression value;

    public Unary() {
    }

    public Unary(WasmType type, UnaryOp op, Expression value) {
        this.type = type;
        this.op = op;
        this.value = value;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }
}
