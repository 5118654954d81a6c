package io.github.eutro.wasmopt.entity;

import io.github.eutro.wasmopt.types.Name;

/**
 * An export of the internal function {@link #value} under the external name {@link #name}.
 */
public final class Export {
    public String name;
    public Name value;

    public Export() {
    }

    public Export(String name, Name value) {
        this.name = name;
        this.value = value;
    }
}
