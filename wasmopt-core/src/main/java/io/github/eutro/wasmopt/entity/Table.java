package io.github.eutro.wasmopt.entity;

import io.github.eutro.wasmopt.types.Name;

import java.util.ArrayList;
import java.util.List;

/**
 * The indirect call table: {@link io.github.eutro.wasmopt.ast.CallIndirect} targets index into this.
 */
public final class Table {
    public final List<Name> names = new ArrayList<>();
}
