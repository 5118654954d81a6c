package io.github.eutro.wasmopt.types;

import org.jetbrains.annotations.NotNull;

/**
 * The name of a function, type, label or local.
 * <p>
 * The text format requires every name to be prefixed with {@code $}, which {@link #toString()} does.
 */
public final class Name implements Comparable<Name> {
    private final String str;

    private Name(String str) {
        this.str = str;
    }

    public static Name of(String str) {
        if (str.isEmpty()) throw new IllegalArgumentException("empty name");
        return new Name(str);
    }

    /**
     * Get the raw text of this name, without the sigil.
     *
     * @return The text.
     */
    public String str() {
        return str;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return str.equals(((Name) o).str);
    }

    @Override
    public int hashCode() {
        return str.hashCode();
    }

    @Override
    public int compareTo(@NotNull Name o) {
        return str.compareTo(o.str);
    }

    @Override
    public String toString() {
        return '$' + str;
    }
}
