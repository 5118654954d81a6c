package io.github.eutro.wasmopt.test;

import io.github.eutro.wasmopt.ast.Binary;
import io.github.eutro.wasmopt.ast.Label;
import io.github.eutro.wasmopt.ast.Nop;
import io.github.eutro.wasmopt.entity.Export;
import io.github.eutro.wasmopt.entity.Function;
import io.github.eutro.wasmopt.entity.FunctionType;
import io.github.eutro.wasmopt.entity.Import;
import io.github.eutro.wasmopt.entity.Module;
import io.github.eutro.wasmopt.entity.Table;
import io.github.eutro.wasmopt.print.AnsiDecoration;
import io.github.eutro.wasmopt.print.Decoration;
import io.github.eutro.wasmopt.print.UnsupportedFeatureException;
import io.github.eutro.wasmopt.print.UnsupportedFeaturePolicy;
import io.github.eutro.wasmopt.print.WasmPrinter;
import io.github.eutro.wasmopt.types.BinaryOp;
import org.junit.jupiter.api.Test;

import static io.github.eutro.wasmopt.test.Utils.*;
import static io.github.eutro.wasmopt.types.WasmType.*;
import static org.junit.jupiter.api.Assertions.*;

public class ModulePrinterTest {
    private final WasmPrinter printer = new WasmPrinter();

    @Test
    void functionTypes() {
        FunctionType type = new FunctionType(name("T"), F32, I32, I64);
        assertEquals("(type $T (func (param i32 i64) (result f32)))", printer.printFunctionType(type, true));
        assertEquals(" (param i32 i64) (result f32)", printer.printFunctionType(type, false));
        FunctionType empty = new FunctionType(name("v"), NONE);
        assertEquals("(type $v (func))", printer.printFunctionType(empty, true));
        assertEquals("", printer.printFunctionType(empty, false));
    }

    @Test
    void functions() {
        Function add = new Function(name("add"), I32,
                new Binary(I32, BinaryOp.ADD, local(I32, "x"), local(I32, "y")))
                .addParam("x", I32)
                .addParam("y", I32)
                .addLocal("t", F64);
        assertEquals(lines(
                "(func $add (param $x i32) (param $y i32) (result i32)",
                "  (local $t f64)",
                "  (i32.add",
                "    (get_local $x)",
                "    (get_local $y)",
                "  )",
                ")"
        ), printer.printFunction(add));
        assertEquals(lines(
                "(func $f",
                "  (nop)",
                ")"
        ), printer.printFunction(new Function(name("f"), NONE, new Nop())));
        assertThrows(IllegalStateException.class, () -> printer.printFunction(new Function(name("f"), NONE, null)));
    }

    @Test
    void importsExportsAndTables() {
        Import imp = new Import(name("print"), "env", "print", new FunctionType(name("v_i"), NONE, I32));
        assertEquals("(import $print \"env\" \"print\" (param i32))", printer.printImport(imp));
        assertEquals("(export \"add\" $add)", printer.printExport(new Export("add", name("add"))));
        assertEquals("(export \"a\\\"b\\\\c\" $x)", printer.printExport(new Export("a\"b\\c", name("x"))));
        Table table = new Table();
        table.names.add(name("a"));
        table.names.add(name("b"));
        assertEquals("(table $a $b)", printer.printTable(table));
    }

    static Module module() {
        Module module = new Module();
        module.addFunctionType(new FunctionType(name("U"), NONE));
        module.addFunctionType(new FunctionType(name("T"), I32, I32));
        module.addImport(new Import(name("print"), "env", "print", new FunctionType(name("v_i"), NONE, I32)));
        module.exports.add(new Export("f", name("f")));
        module.table.names.add(name("f"));
        module.functions.add(new Function(name("f"), NONE, new Nop()));
        return module;
    }

    @Test
    void modules() {
        assertEquals(lines(
                "(module",
                "  (memory 16777216)",
                "  (type $T (func (param i32) (result i32)))",
                "  (type $U (func))",
                "  (export \"f\" $f)",
                "  (table $f)",
                "  (func $f",
                "    (nop)",
                "  )",
                ")",
                ""
        ), printer.printModule(module()));
    }

    @Test
    void emptyModule() {
        assertEquals(lines(
                "(module",
                "  (memory 16777216)",
                ")",
                ""
        ), printer.printModule(new Module()));
    }

    static Module moduleWithLabel() {
        Module module = module();
        module.functions.add(0, new Function(name("bad"), NONE, new Label(name("l"))));
        return module;
    }

    @Test
    void unsupportedFeaturePolicies() {
        assertThrows(UnsupportedFeatureException.class, () -> printer.printModule(moduleWithLabel()));

        String expected = printer.printModule(module());
        WasmPrinter skipping = new WasmPrinter(Decoration.PLAIN, UnsupportedFeaturePolicy.SKIP);
        WasmPrinter warning = new WasmPrinter(Decoration.PLAIN, UnsupportedFeaturePolicy.WARN);
        assertEquals(expected, skipping.printModule(moduleWithLabel()));
        assertEquals(expected, warning.printModule(moduleWithLabel()));

        // single functions are never skipped
        assertThrows(UnsupportedFeatureException.class,
                () -> skipping.printFunction(moduleWithLabel().functions.get(0)));
    }

    @Test
    void decoration() {
        WasmPrinter colored = new WasmPrinter(AnsiDecoration.INSTANCE);
        String text = colored.printModule(module());
        assertNotEquals(printer.printModule(module()), text);
        assertEquals(printer.printModule(module()), stripAnsi(text));
        assertTrue(text.startsWith("(\u001B[31m\u001B[1mmodule\u001B[0m"));

        Import imp = new Import(name("print"), "env", "print", new FunctionType(name("v_i"), NONE, I32));
        assertEquals(printer.printImport(imp), stripAnsi(colored.printImport(imp)));
        assertTrue(colored.printImport(imp).contains("\"\u001B[32menv\u001B[0m\""));

        Decoration fromEnv = Decoration.fromEnvironment();
        assertSame("1".equals(System.getenv("WASMOPT_COLORS")) ? AnsiDecoration.INSTANCE : Decoration.PLAIN, fromEnv);
    }
}
