package io.github.eutro.wasmopt.entity;

import io.github.eutro.wasmopt.types.Name;
import io.github.eutro.wasmopt.types.WasmType;

/**
 * A named, typed parameter or local of a function.
 */
public final class NameType {
    public final Name name;
    public final WasmType type;

    public NameType(Name name, WasmType type) {
        this.name = name;
        this.type = type;
    }

    @Override
    public String toString() {
        return name + " " + type;
    }
}
