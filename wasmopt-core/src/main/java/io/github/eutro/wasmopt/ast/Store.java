package io.github.eutro.wasmopt.ast;

import io.github.eutro.wasmopt.types.WasmType;

/**
 * A store of the low {@link #bytes} bytes of {@link #value} to linear memory
 * at {@link #ptr} plus {@link #offset}.
 */
public final class Store extends Expression {
    public int bytes;
    public boolean isFloat;
    public int offset;
    public int align;
    public Expression ptr;
    public Expression value;

    public Store() {
    }

    public Store(int bytes, boolean isFloat, int align, Expression ptr, Expression value) {
        this.type = WasmType.fromSizeAndKind(bytes, isFloat);
        this.bytes = bytes;
        this.isFloat = isFloat;
        this.align = align;
        this.ptr = ptr;
        this.value = value;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitStore(this);
    }
}
