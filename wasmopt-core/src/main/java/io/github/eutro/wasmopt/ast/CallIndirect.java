package io.github.eutro.wasmopt.ast;

import io.github.eutro.wasmopt.entity.FunctionType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A call through the table, to the function at index {@link #target}, which must have type {@link #fnType}.
 */
public final class CallIndirect extends Expression {
    public FunctionType fnType;
    public Expression target;
    public final List<Expression> operands = new ArrayList<>();

    public CallIndirect() {
    }

    public CallIndirect(FunctionType fnType, Expression target, Expression... operands) {
        this.type = fnType.result;
        this.fnType = fnType;
        this.target = target;
        this.operands.addAll(Arrays.asList(operands));
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitCallIndirect(this);
    }
}
