/**
 * The ext API allows for associating arbitrary data with
 * instances of {@link io.github.eutro.wasmopt.ext.ExtContainer},
 * such as expressions, functions and modules.
 *
 * <pre>{@code
 * class DepthExts {
 *   public static final Ext<Integer> DEPTH = Ext.create(Integer.class, "DEPTH");
 * }
 *
 * Expression expr = arena.alloc(Nop::new);
 * expr.attachExt(DEPTH, 3);
 *
 * expr.getExtOrThrow(DEPTH); // => 3
 * }</pre>
 * <p>
 * This is useful for passes which need some scratch data on each node
 * of a tree, and discard it after, without resorting to ad-hoc
 * identity maps passed around between walkers.
 * <p>
 * Specialised implementations of {@link io.github.eutro.wasmopt.ext.ExtContainer}
 * may store certain {@link io.github.eutro.wasmopt.ext.Ext}s directly in fields.
 */
package io.github.eutro.wasmopt.ext;
