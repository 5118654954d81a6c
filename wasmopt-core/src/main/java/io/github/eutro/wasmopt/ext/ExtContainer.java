package io.github.eutro.wasmopt.ext;

import io.github.eutro.wasmopt.passes.IRPass;
import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * Something that scratch data can be attached to under {@link Ext} keys.
 * At most one value is held per key.
 *
 * @see io.github.eutro.wasmopt.ext
 */
public interface ExtContainer {
    /**
     * Set the value under {@code ext}, replacing any previous one.
     *
     * @param ext   The key.
     * @param value The value.
     * @param <T>   The value type.
     */
    <T> void attachExt(Ext<T> ext, T value);

    <T> void removeExt(Ext<T> ext);

    /**
     * Look up the value under {@code ext}.
     *
     * @param ext The key.
     * @param <T> The value type.
     * @return The value, or null if there is none.
     */
    <T> @Nullable T getNullable(Ext<T> ext);

    default <T> Optional<T> getExt(Ext<T> ext) {
        return Optional.ofNullable(getNullable(ext));
    }

    /**
     * Look up the value under {@code ext}, which must be present.
     *
     * @param ext The key.
     * @param <T> The value type.
     * @return The value.
     * @throws IllegalStateException If there is no value.
     */
    default <T> T getExtOrThrow(Ext<T> ext) {
        T value = getNullable(ext);
        if (value == null) {
            throw new IllegalStateException("Ext not present: " + ext);
        }
        return value;
    }

    /**
     * Look up the value under {@code ext}, computing it first if it is missing.
     * <p>
     * This is how analyses are run lazily: {@code pass} is expected to attach the ext,
     * and is run on {@code o} only if it has not been attached yet.
     *
     * @param ext  The key.
     * @param o    What to run the pass on, usually this container or its owner.
     * @param pass The pass computing the value.
     * @param <T>  The value type.
     * @param <O>  The type the pass runs on.
     * @return The value.
     * @throws IllegalStateException If the pass did not attach the ext.
     */
    default <T, O> T getExtOrRun(Ext<T> ext, O o, IRPass<O, ?> pass) {
        T value = getNullable(ext);
        if (value != null) return value;
        pass.run(o);
        return getExtOrThrow(ext);
    }
}
