package io.github.eutro.wasmopt.ast;

import io.github.eutro.wasmopt.types.Name;
import io.github.eutro.wasmopt.types.WasmType;

public final class SetLocal extends Expression {
    public Name id;
    public Expression value;

    public SetLocal() {
    }

    public SetLocal(WasmType type, Name id, Expression value) {
        this.type = type;
        this.id = id;
        this.value = value;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitSetLocal(this);
    }
}
