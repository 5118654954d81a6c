package io.github.eutro.wasmopt.ast;

import io.github.eutro.wasmopt.types.Name;
import io.github.eutro.wasmopt.types.WasmType;

/**
 * A call to an imported function.
 */
public final class CallImport extends Call {
    public CallImport() {
    }

    public CallImport(WasmType type, Name target, Expression... operands) {
        super(type, target, operands);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitCallImport(this);
    }
}
