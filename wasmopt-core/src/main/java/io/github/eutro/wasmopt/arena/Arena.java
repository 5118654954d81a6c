package io.github.eutro.wasmopt.arena;

import io.github.eutro.wasmopt.ast.Expression;
import io.github.eutro.wasmopt.ext.CommonExts;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bulk storage for the nodes of one compilation unit.
 * <p>
 * Objects are allocated into fixed-size chunks, and are all released together by {@link #release()}.
 * Every allocation gets a handle, its position in allocation order, which stays valid
 * (see {@link #get(int)}) until the arena is released, however much the arena grows.
 * Allocated {@link Expression}s also know their arena and handle.
 * <p>
 * Nothing is ever freed individually. Payloads that own resources should implement
 * {@link AutoCloseable}; they are closed, in reverse allocation order, on release.
 * <p>
 * Arenas are not thread-safe. Each compilation unit should have its own, and nodes
 * of one arena should not be linked into trees of another.
 */
public final class Arena implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(Arena.class.getName());

    /**
     * Whether to record where each expression was allocated, see {@link CommonExts#ALLOCATED_AT}.
     */
    public static boolean TRACK_ALLOCATIONS = System.getenv("WASMOPT_TRACK_ALLOCATIONS") != null;

    /**
     * The number of objects that fit in one chunk.
     */
    public static final int CHUNK_SIZE = 10000;

    private final List<Object[]> chunks = new ArrayList<>();
    private int index; // in last chunk
    private boolean released = false;

    /**
     * Allocate a new object in this arena.
     *
     * @param ctor The constructor of the object, typically a {@code Nop::new} style reference.
     * @param <T>  The type of the object.
     * @return The freshly constructed object.
     * @throws IllegalStateException If this arena was released.
     */
    @NotNull
    public <T> T alloc(Supplier<T> ctor) {
        checkLive();
        T ret = ctor.get();
        if (ret == null) throw new IllegalArgumentException("constructor returned null");
        if (chunks.isEmpty() || index >= CHUNK_SIZE) {
            chunks.add(new Object[CHUNK_SIZE]);
            index = 0;
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("opened chunk " + chunks.size() + " of arena " + Integer.toHexString(hashCode()));
            }
        }
        int handle = (chunks.size() - 1) * CHUNK_SIZE + index;
        chunks.get(chunks.size() - 1)[index++] = ret;
        if (ret instanceof Expression) {
            Expression expr = (Expression) ret;
            expr.attachExt(CommonExts.OWNING_ARENA, this);
            expr.attachExt(CommonExts.ARENA_HANDLE, handle);
            if (TRACK_ALLOCATIONS) {
                expr.attachExt(CommonExts.ALLOCATED_AT, new Throwable("allocated"));
            }
        }
        return ret;
    }

    /**
     * Look up an object by its handle.
     *
     * @param handle The handle.
     * @param <T>    The expected type of the object.
     * @return The object.
     * @throws IndexOutOfBoundsException If no object has the handle.
     * @throws IllegalStateException     If this arena was released.
     */
    @SuppressWarnings("unchecked")
    public <T> T get(int handle) {
        checkLive();
        if (handle < 0 || handle >= size()) {
            throw new IndexOutOfBoundsException("handle " + handle + " out of " + size());
        }
        return (T) chunks.get(handle / CHUNK_SIZE)[handle % CHUNK_SIZE];
    }

    /**
     * Check whether an object was allocated from this arena.
     *
     * @param o The object.
     * @return Whether it was, and this arena has not been released since.
     */
    public boolean owns(Object o) {
        if (released) return false;
        if (o instanceof Expression) {
            return ((Expression) o).getArena() == this;
        }
        for (Object[] chunk : chunks) {
            for (Object slot : chunk) {
                if (slot == o) return true;
            }
        }
        return false;
    }

    /**
     * Get the number of objects allocated in this arena.
     *
     * @return The number of objects.
     */
    public int size() {
        return chunks.isEmpty() ? 0 : (chunks.size() - 1) * CHUNK_SIZE + index;
    }

    public int chunkCount() {
        return chunks.size();
    }

    public boolean isReleased() {
        return released;
    }

    /**
     * Release everything allocated in this arena.
     * <p>
     * {@link AutoCloseable} payloads are closed first, in reverse allocation order. If any fail,
     * the rest are still closed, and the first failure is rethrown after everything is released,
     * with the others suppressed.
     * <p>
     * Releasing an arena twice does nothing.
     */
    public void release() {
        if (released) return;
        released = true;
        RuntimeException failure = null;
        for (int c = chunks.size() - 1; c >= 0; c--) {
            Object[] chunk = chunks.get(c);
            int end = c == chunks.size() - 1 ? index : CHUNK_SIZE;
            for (int i = end - 1; i >= 0; i--) {
                if (chunk[i] instanceof AutoCloseable) {
                    try {
                        ((AutoCloseable) chunk[i]).close();
                    } catch (Exception e) {
                        if (failure == null) {
                            failure = new RuntimeException("closing arena object " + (c * CHUNK_SIZE + i), e);
                        } else {
                            failure.addSuppressed(e);
                        }
                    }
                }
            }
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("released " + chunks.size() + " chunks of arena " + Integer.toHexString(hashCode()));
        }
        chunks.clear();
        index = 0;
        if (failure != null) throw failure;
    }

    @Override
    public void close() {
        release();
    }

    private void checkLive() {
        if (released) throw new IllegalStateException("arena was released");
    }
}
