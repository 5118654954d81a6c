package io.github.eutro.wasmopt.ast;

import io.github.eutro.wasmopt.arena.Arena;
import io.github.eutro.wasmopt.ext.CommonExts;
import io.github.eutro.wasmopt.ext.Ext;
import io.github.eutro.wasmopt.ext.ExtHolder;
import io.github.eutro.wasmopt.types.WasmType;
import org.jetbrains.annotations.Nullable;

/**
 * An expression, the base node of the AST.
 * <p>
 * The set of expressions is closed: every subclass is listed in {@link ExpressionVisitor},
 * and all dispatch over expressions goes through {@link #accept(ExpressionVisitor)}.
 */
public abstract class Expression extends ExtHolder {
    /**
     * The type of this expression: its output, not necessarily the type of its inputs.
     */
    public WasmType type = WasmType.NONE;

    Expression() {
    }

    /**
     * Dispatch to the method of {@code visitor} for this kind of expression.
     *
     * @param visitor The visitor.
     * @param <R>     The return type of the visitor.
     * @return What the visitor returned.
     */
    public abstract <R> R accept(ExpressionVisitor<R> visitor);

    public boolean is(Class<? extends Expression> kind) {
        return kind.isInstance(this);
    }

    public <T extends Expression> T cast(Class<T> kind) {
        return kind.cast(this);
    }

    /**
     * Get the arena this was allocated from.
     *
     * @return The arena, or null if this was not allocated from one.
     */
    @Nullable
    public Arena getArena() {
        return arena;
    }

    /**
     * Get the handle of this expression in its arena.
     *
     * @return The handle, or -1 if this was not allocated from an arena.
     */
    public int getHandle() {
        return handle;
    }

    @Override
    public String toString() {
        String kind = getClass().getSimpleName();
        return handle == -1 ? kind : kind + "#" + handle;
    }

    // exts
    private Arena arena = null;
    private int handle = -1;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_ARENA) {
            return (T) arena;
        } else if (ext == CommonExts.ARENA_HANDLE) {
            return handle == -1 ? null : (T) (Integer) handle;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_ARENA) {
            arena = (Arena) value;
            return;
        } else if (ext == CommonExts.ARENA_HANDLE) {
            handle = (Integer) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_ARENA) {
            arena = null;
            return;
        } else if (ext == CommonExts.ARENA_HANDLE) {
            handle = -1;
            return;
        }
        super.removeExt(ext);
    }
}
