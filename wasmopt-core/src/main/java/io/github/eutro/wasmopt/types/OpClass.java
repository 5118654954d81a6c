package io.github.eutro.wasmopt.types;

/**
 * The class of value types an operator can be applied to.
 */
public enum OpClass {
    INT,
    FLOAT,
    ANY,
    ;

    /**
     * Check whether a value type belongs to this class.
     *
     * @param type The type.
     * @return Whether it does. {@link WasmType#NONE} belongs to no class.
     */
    public boolean contains(WasmType type) {
        if (type == WasmType.NONE) return false;
        switch (this) {
            case INT:
                return !type.isFloat();
            case FLOAT:
                return type.isFloat();
            case ANY:
                return true;
            default:
                throw new AssertionError();
        }
    }
}
