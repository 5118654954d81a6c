package io.github.eutro.wasmopt.ast;

import io.github.eutro.wasmopt.types.WasmType;

/**
 * A load of {@link #bytes} bytes from linear memory at {@link #ptr} plus {@link #offset}.
 * <p>
 * Loads narrower than their type are sign- or zero-extended according to {@link #signed}.
 */
public final class Load extends Expression {
    public int bytes;
    public boolean signed;
    public boolean isFloat;
    public int offset;
    public int align;
    public Expression ptr;

    public Load() {
    }

    public Load(int bytes, boolean signed, boolean isFloat, int align, Expression ptr) {
        this.type = WasmType.fromSizeAndKind(bytes, isFloat);
        this.bytes = bytes;
        this.signed = signed;
        this.isFloat = isFloat;
        this.align = align;
        this.ptr = ptr;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitLoad(this);
    }
}
