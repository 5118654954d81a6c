package io.github.eutro.wasmopt.entity;

import io.github.eutro.wasmopt.ext.ExtHolder;
import io.github.eutro.wasmopt.types.Name;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A whole compilation unit.
 * <p>
 * Types and imports are keyed, and printed, in order of their names.
 */
public final class Module extends ExtHolder {
    public final Map<Name, FunctionType> functionTypes = new TreeMap<>();
    public final Map<Name, Import> imports = new TreeMap<>();
    public final List<Export> exports = new ArrayList<>();
    public final Table table = new Table();
    public final List<Function> functions = new ArrayList<>();

    public void addFunctionType(FunctionType type) {
        functionTypes.put(type.name, type);
    }

    public void addImport(Import imp) {
        imports.put(imp.name, imp);
    }
}
