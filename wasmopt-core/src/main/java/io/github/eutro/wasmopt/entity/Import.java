package io.github.eutro.wasmopt.entity;

import io.github.eutro.wasmopt.types.Name;

/**
 * A function imported from the host, as {@code module.base}.
 */
public final class Import {
    public Name name;
    public String module;
    public String base;
    public FunctionType type;

    public Import() {
    }

    public Import(Name name, String module, String base, FunctionType type) {
        this.name = name;
        this.module = module;
        this.base = base;
        this.type = type;
    }
}
