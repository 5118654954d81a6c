package io.github.eutro.wasmopt.ast;

import io.github.eutro.wasmopt.types.Name;
import io.github.eutro.wasmopt.types.WasmType;

public final class GetLocal extends Expression {
    public Name id;

    public GetLocal() {
    }

    public GetLocal(WasmType type, Name id) {
        this.type = type;
        this.id = id;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitGetLocal(this);
    }
}
