package io.github.eutro.wasmopt.ast;

import io.github.eutro.wasmopt.types.HostOp;
import io.github.eutro.wasmopt.types.WasmType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public final class Host extends Expression {
    public HostOp op;
    public final List<Expression> operands = new ArrayList<>();

    public Host() {
    }

    public Host(WasmType type, HostOp op, Expression... operands) {
        this.type = type;
        this.op = op;
        this.operands.addAll(Arrays.asList(operands));
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitHost(this);
    }
}
