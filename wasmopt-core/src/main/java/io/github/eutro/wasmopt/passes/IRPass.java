package io.github.eutro.wasmopt.passes;

import io.github.eutro.wasmopt.passes.misc.ChainedPass;

/**
 * A pass over some part of the IR, producing a (possibly different) result.
 *
 * @param <A> The type of the input.
 * @param <B> The type of the output.
 */
public interface IRPass<A, B> {
    /**
     * Run the pass.
     *
     * @param a The input.
     * @return The output.
     */
    B run(A a);

    /**
     * Whether this pass modifies its input and returns it, rather than returning something new.
     *
     * @return Whether this pass is in-place.
     */
    default boolean isInPlace() {
        return false;
    }

    /**
     * Compose this pass with another, running {@code next} on the result of this.
     *
     * @param next The pass to run after this one.
     * @param <C>  The output type of the next pass.
     * @return The composed pass.
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
