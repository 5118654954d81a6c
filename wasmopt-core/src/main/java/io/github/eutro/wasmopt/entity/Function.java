package io.github.eutro.wasmopt.entity;

import io.github.eutro.wasmopt.ast.Expression;
import io.github.eutro.wasmopt.ext.ExtHolder;
import io.github.eutro.wasmopt.types.Name;
import io.github.eutro.wasmopt.types.WasmType;

import java.util.ArrayList;
import java.util.List;

public final class Function extends ExtHolder {
    public Name name;
    public WasmType result = WasmType.NONE;
    public final List<NameType> params = new ArrayList<>();
    public final List<NameType> locals = new ArrayList<>();
    public Expression body;

    public Function() {
    }

    public Function(Name name, WasmType result, Expression body) {
        this.name = name;
        this.result = result;
        this.body = body;
    }

    public Function addParam(String name, WasmType type) {
        params.add(new NameType(Name.of(name), type));
        return this;
    }

    public Function addLocal(String name, WasmType type) {
        locals.add(new NameType(Name.of(name), type));
        return this;
    }

    @Override
    public String toString() {
        return "func " + name;
    }
}
