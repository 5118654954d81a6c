package io.github.eutro.wasmopt.ext;

import io.github.eutro.wasmopt.arena.Arena;

/**
 * Exts which are shared by every part of the IR.
 * <p>
 * {@link #OWNING_ARENA} and {@link #ARENA_HANDLE} are stored directly in fields of
 * {@link io.github.eutro.wasmopt.ast.Expression}, since every allocated node has them.
 */
public class CommonExts {
    /**
     * The arena an expression was allocated from.
     */
    public static final Ext<Arena> OWNING_ARENA = Ext.create(Arena.class, "OWNING_ARENA");
    /**
     * The arena-relative handle of an expression, see {@link Arena#get(int)}.
     */
    public static final Ext<Integer> ARENA_HANDLE = Ext.create(Integer.class, "ARENA_HANDLE");
    /**
     * The stack trace of where an expression was allocated,
     * only present if {@link Arena#TRACK_ALLOCATIONS} is set.
     */
    public static final Ext<Throwable> ALLOCATED_AT = Ext.create(Throwable.class, "ALLOCATED_AT");
}
