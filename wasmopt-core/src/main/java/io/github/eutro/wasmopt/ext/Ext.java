package io.github.eutro.wasmopt.ext;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A key for scratch data of type {@code T} on IR objects.
 * <p>
 * Exts compare by identity.
 *
 * @param <T> The type of value stored under this key.
 */
public class Ext<T> {
    private static final AtomicInteger NEXT_ID = new AtomicInteger();

    private final int id = NEXT_ID.getAndIncrement();
    private final Class<T> type;
    private final String name;

    private Ext(Class<T> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Create a fresh key.
     * <p>
     * The value type {@code R} can be narrower than the class given, which allows keys
     * of generic types such as {@code Ext<List<Name>>} to be created from {@code List.class}.
     *
     * @param type The class of the values.
     * @param name A name for the key, shown in error messages.
     * @param <T>  The class type.
     * @param <R>  The value type.
     * @return The key.
     */
    @SuppressWarnings("unchecked")
    public static <T, R extends T> Ext<R> create(Class<T> type, String name) {
        return (Ext<R>) new Ext<>(type, name);
    }

    public Class<T> getType() {
        return type;
    }

    public Optional<T> getIn(ExtContainer container) {
        return container.getExt(this);
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return name + " (" + type.getSimpleName() + ")";
    }
}
