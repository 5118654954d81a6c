package io.github.eutro.wasmopt.ast;

import io.github.eutro.wasmopt.types.Literal;

public final class Const extends Expression {
    public Literal value;

    public Const() {
    }

    public Const(Literal value) {
        set(value);
    }

    /**
     * Set the value of this constant, and its type to match.
     *
     * @param value The value.
     * @return This.
     */
    public Const set(Literal value) {
        this.value = value;
        this.type = value.getType();
        return this;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitConst(this);
    }
}
