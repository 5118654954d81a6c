package io.github.eutro.wasmopt.test;

import io.github.eutro.wasmopt.ast.Const;
import io.github.eutro.wasmopt.ast.GetLocal;
import io.github.eutro.wasmopt.types.Literal;
import io.github.eutro.wasmopt.types.Name;
import io.github.eutro.wasmopt.types.WasmType;

public class Utils {
    static Name name(String str) {
        return Name.of(str);
    }

    static GetLocal local(WasmType type, String id) {
        return new GetLocal(type, Name.of(id));
    }

    static Const i32(int value) {
        return new Const(Literal.i32(value));
    }

    static String lines(String... lines) {
        return String.join("\n", lines);
    }

    static String stripAnsi(String text) {
        return text.replaceAll("\u001B\\[[0-9;]*m", "");
    }
}
