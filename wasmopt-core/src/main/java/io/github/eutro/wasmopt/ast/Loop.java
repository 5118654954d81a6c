package io.github.eutro.wasmopt.ast;

import io.github.eutro.wasmopt.types.Name;
import io.github.eutro.wasmopt.types.WasmType;
import org.jetbrains.annotations.Nullable;

/**
 * A loop. Breaking to {@link #out} exits the loop, breaking to {@link #in} continues it.
 * <p>
 * {@link #in} is only printed if {@link #out} is present.
 */
public final class Loop extends Expression {
    @Nullable
    public Name out;
    @Nullable
    public Name in;
    public Expression body;

    public Loop() {
    }

    public Loop(WasmType type, @Nullable Name out, @Nullable Name in, Expression body) {
        this.type = type;
        this.out = out;
        this.in = in;
        this.body = body;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitLoop(this);
    }
}
