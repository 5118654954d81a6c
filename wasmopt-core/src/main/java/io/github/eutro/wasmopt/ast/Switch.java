package io.github.eutro.wasmopt.ast;

import io.github.eutro.wasmopt.types.Literal;
import io.github.eutro.wasmopt.types.Name;
import io.github.eutro.wasmopt.types.WasmType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A multi-way branch on {@link #value}.
 * <p>
 * Each case whose literal matches runs its body, then continues into the next case's body
 * if it is marked {@link Case#fallthru}. If no case matches, {@link #defaultBody} runs.
 */
public final class Switch extends Expression {
    public Name name;
    public Expression value;
    public final List<Case> cases = new ArrayList<>();
    public Expression defaultBody;

    public Switch() {
    }

    public Switch(WasmType type, Name name, Expression value, Expression defaultBody, Case... cases) {
        this.type = type;
        this.name = name;
        this.value = value;
        this.defaultBody = defaultBody;
        this.cases.addAll(Arrays.asList(cases));
    }

    public static final class Case {
        public Literal value;
        public Expression body;
        public boolean fallthru;

        public Case() {
        }

        public Case(Literal value, Expression body, boolean fallthru) {
            this.value = value;
            this.body = body;
            this.fallthru = fallthru;
        }
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitSwitch(this);
    }
}
