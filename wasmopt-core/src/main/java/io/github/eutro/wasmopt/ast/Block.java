package io.github.eutro.wasmopt.ast;

import io.github.eutro.wasmopt.types.Name;
import io.github.eutro.wasmopt.types.WasmType;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A sequence of expressions, optionally labelled so that breaks can target it.
 */
public final class Block extends Expression {
    @Nullable
    public Name name;
    public final List<Expression> list = new ArrayList<>();

    public Block() {
    }

    public Block(WasmType type, @Nullable Name name, Expression... list) {
        this.type = type;
        this.name = name;
        this.list.addAll(Arrays.asList(list));
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBlock(this);
    }
}
