package io.github.eutro.wasmopt.ext;

import org.jetbrains.annotations.Nullable;

import java.util.Arrays;

/**
 * The plain {@link ExtContainer}, which {@link io.github.eutro.wasmopt.ast.Expression},
 * {@link io.github.eutro.wasmopt.entity.Function} and {@link io.github.eutro.wasmopt.entity.Module} extend.
 * <p>
 * Entries live in two parallel arrays, allocated on first use
 * and dropped again when the last ext is removed.
 */
public class ExtHolder implements ExtContainer {
    @Nullable
    private Ext<?>[] keys;
    @Nullable
    private Object[] values;
    private int count;

    private int indexOf(Ext<?> ext) {
        for (int i = 0; i < count; i++) {
            if (keys[i] == ext) return i;
        }
        return -1;
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        int i = indexOf(ext);
        if (i != -1) {
            values[i] = value;
            return;
        }
        if (keys == null) {
            keys = new Ext<?>[2];
            values = new Object[2];
        } else if (count == keys.length) {
            keys = Arrays.copyOf(keys, count * 2);
            values = Arrays.copyOf(values, count * 2);
        }
        keys[count] = ext;
        values[count] = value;
        count++;
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        int i = indexOf(ext);
        if (i == -1) return;
        count--;
        keys[i] = keys[count];
        values[i] = values[count];
        keys[count] = null;
        values[count] = null;
        if (count == 0) {
            keys = null;
            values = null;
        }
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        int i = indexOf(ext);
        return i == -1 ? null : (T) values[i];
    }
}
