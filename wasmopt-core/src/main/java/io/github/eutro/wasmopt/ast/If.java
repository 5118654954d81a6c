package io.github.eutro.wasmopt.ast;

import io.github.eutro.wasmopt.types.WasmType;
import org.jetbrains.annotations.Nullable;

public final class If extends Expression {
    public Expression condition;
    public Expression ifTrue;
    @Nullable
    public Expression ifFalse;

    public If() {
    }

    public If(WasmType type, Expression condition, Expression ifTrue, @Nullable Expression ifFalse) {
        this.type = type;
        this.condition = condition;
        this.ifTrue = ifTrue;
        this.ifFalse = ifFalse;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitIf(this);
    }
}
