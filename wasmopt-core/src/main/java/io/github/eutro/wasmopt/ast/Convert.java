package io.github.eutro.wasmopt.ast;

import io.github.eutro.wasmopt.types.ConvertOp;
import io.github.eutro.wasmopt.types.WasmType;

public final class Convert extends Expression {
    public ConvertOp op;
    public Expression value;

    public Convert() {
    }

    public Convert(WasmType type, ConvertOp op, Expression value) {
        this.type = type;
        this.op = op;
        this.value = value;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitConvert(this);
    }
}
