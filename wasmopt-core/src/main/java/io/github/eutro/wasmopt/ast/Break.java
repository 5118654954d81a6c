package io.github.eutro.wasmopt.ast;

import io.github.eutro.wasmopt.types.Name;
import io.github.eutro.wasmopt.types.WasmType;
import org.jetbrains.annotations.Nullable;

/**
 * A branch to the block or loop labelled {@link #name}, taken only if {@link #condition}
 * is non-zero when present, carrying {@link #value} when present.
 */
public final class Break extends Expression {
    public Name name;
    @Nullable
    public Expression condition;
    @Nullable
    public Expression value;

    public Break() {
    }

    public Break(WasmType type, Name name, @Nullable Expression condition, @Nullable Expression value) {
        this.type = type;
        this.name = name;
        this.condition = condition;
        this.value = value;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBreak(this);
    }
}
