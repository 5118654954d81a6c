package io.github.eutro.wasmopt.ast;

public final class Nop extends Expression {
    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitNop(this);
    }
}
