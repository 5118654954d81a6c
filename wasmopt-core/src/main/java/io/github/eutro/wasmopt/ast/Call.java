package io.github.eutro.wasmopt.ast;

import io.github.eutro.wasmopt.types.Name;
import io.github.eutro.wasmopt.types.WasmType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A direct call to a function of the module, by name.
 */
public class Call extends Expression {
    public Name target;
    public final List<Expression> operands = new ArrayList<>();

    public Call() {
    }

    public Call(WasmType type, Name target, Expression... operands) {
        this.type = type;
        this.target = target;
        this.operands.addAll(Arrays.asList(operands));
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitCall(this);
    }
}
