package io.github.eutro.wasmopt.entity;

import io.github.eutro.wasmopt.types.Name;
import io.github.eutro.wasmopt.types.WasmType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A named function signature.
 * <p>
 * Note that equality takes the name into account, so two types with the same
 * signature but different names are not equal.
 */
public final class FunctionType {
    public Name name;
    public WasmType result = WasmType.NONE;
    public final List<WasmType> params = new ArrayList<>();

    public FunctionType() {
    }

    public FunctionType(Name name, WasmType result, WasmType... params) {
        this.name = name;
        this.result = result;
        this.params.addAll(Arrays.asList(params));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FunctionType that = (FunctionType) o;
        return Objects.equals(name, that.name)
                && result == that.result
                && params.equals(that.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, result, params);
    }

    @Override
    public String toString() {
        return name + params.toString() + " -> " + result;
    }
}
