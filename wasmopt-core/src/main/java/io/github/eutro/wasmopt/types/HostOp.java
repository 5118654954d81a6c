package io.github.eutro.wasmopt.types;

/**
 * An operation on the host environment.
 */
public enum HostOp {
    PAGE_SIZE(0),
    MEMORY_SIZE(0),
    GROW_MEMORY(1),
    HAS_FEATURE(0),
    ;

    private final int arity;

    HostOp(int arity) {
        this.arity = arity;
    }

    /**
     * Get the number of operands this operation takes.
     *
     * @return The arity.
     */
    public int getArity() {
        return arity;
    }
}
