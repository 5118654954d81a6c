package io.github.eutro.wasmopt.ast;

import io.github.eutro.wasmopt.types.Name;

/**
 * A bare label. Has no textual form of its own, so it cannot be printed.
 */
public final class Label extends Expression {
    public Name name;

    public Label() {
    }

    public Label(Name name) {
        this.name = name;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitLabel(this);
    }
}
