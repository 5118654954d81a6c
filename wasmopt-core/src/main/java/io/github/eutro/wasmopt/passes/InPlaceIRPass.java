package io.github.eutro.wasmopt.passes;

/**
 * A pass that rewrites its input where it stands, such as an
 * {@link io.github.eutro.wasmopt.walk.ExpressionWalker} over a function body.
 *
 * @param <T> The type of IR rewritten.
 */
public interface InPlaceIRPass<T> extends IRPass<T, T> {
    void runInPlace(T t);

    @Override
    default T run(T t) {
        runInPlace(t);
        return t;
    }

    @Override
    default boolean isInPlace() {
        return true;
    }

    /**
     * Run {@code next} on the same input, after this.
     *
     * @param next The pass to run second.
     * @return The combined pass, itself in-place.
     */
    default InPlaceIRPass<T> andThen(InPlaceIRPass<T> next) {
        InPlaceIRPass<T> first = this;
        return t -> {
            first.runInPlace(t);
            next.runInPlace(t);
        };
    }
}
