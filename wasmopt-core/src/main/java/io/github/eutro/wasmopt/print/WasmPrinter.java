package io.github.eutro.wasmopt.print;

import io.github.eutro.wasmopt.ast.*;
import io.github.eutro.wasmopt.entity.Export;
import io.github.eutro.wasmopt.entity.Function;
import io.github.eutro.wasmopt.entity.FunctionType;
import io.github.eutro.wasmopt.entity.Import;
import io.github.eutro.wasmopt.entity.Module;
import io.github.eutro.wasmopt.entity.NameType;
import io.github.eutro.wasmopt.entity.Table;
import io.github.eutro.wasmopt.print.Decoration.Style;
import io.github.eutro.wasmopt.types.*;
import org.jetbrains.annotations.Nullable;

import java.util.logging.Logger;

/**
 * Prints the IR in the s-expression text format accepted by the reference interpreter.
 * <p>
 * Every instruction prints as {@code (mnemonic children...)}, with each child of a compound
 * form on its own line, indented two spaces deeper than the form, and the closing parenthesis
 * on a line of its own at the indentation of the form:
 *
 * <pre>{@code
 * (i32.add
 *   (get_local $x)
 *   (i32.const 1)
 * )
 * }</pre>
 * <p>
 * Printing is pure: the printer holds only its configuration, and the same tree always
 * prints to the same text.
 * <p>
 * Two kinds of failure are distinguished. A tree that is malformed, such as one missing
 * a required child or applying an operator to the wrong type, causes an
 * {@link IllegalStateException}. A well-formed tree using something this printer does not
 * support causes an {@link UnsupportedFeatureException}.
 */
public class WasmPrinter {
    private static final Logger LOGGER = Logger.getLogger(WasmPrinter.class.getName());

    /**
     * The size of the memory declared by every printed module.
     */
    public static final int MEMORY_SIZE = 16777216;

    private final Decoration decoration;
    private final UnsupportedFeaturePolicy policy;

    public WasmPrinter() {
        this(Decoration.PLAIN, UnsupportedFeaturePolicy.ABORT);
    }

    public WasmPrinter(Decoration decoration) {
        this(decoration, UnsupportedFeaturePolicy.ABORT);
    }

    /**
     * Construct a printer.
     *
     * @param decoration The decoration to apply to token groups.
     * @param policy     What to do with functions that can't be printed, when printing a whole module.
     */
    public WasmPrinter(Decoration decoration, UnsupportedFeaturePolicy policy) {
        this.decoration = decoration;
        this.policy = policy;
    }

    /**
     * Print an expression tree, as if at the top level.
     *
     * @param expr The root of the tree.
     * @return The text.
     */
    public String print(Expression expr) {
        return print(expr, 0);
    }

    /**
     * Print an expression tree, as if nested at the given depth.
     * <p>
     * The first line is not indented, but the children and closing parenthesis are,
     * relative to {@code indent}.
     *
     * @param expr   The root of the tree.
     * @param indent The depth.
     * @return The text.
     */
    public String print(Expression expr, int indent) {
        Out out = new Out();
        new Renderer(out, indent).print(expr);
        return out.toString();
    }

    /**
     * Print a function type.
     *
     * @param type The function type.
     * @param full Whether to print the whole {@code (type $name (func ...))} definition,
     *             rather than only the signature.
     * @return The text. If not full, this is empty or begins with a space.
     */
    public String printFunctionType(FunctionType type, boolean full) {
        Out out = new Out();
        printFunctionType(out, type, full);
        return out.toString();
    }

    public String printFunction(Function func) {
        Out out = new Out();
        printFunction(out, func, 0);
        return out.toString();
    }

    public String printImport(Import imp) {
        Out out = new Out();
        printImport(out, imp);
        return out.toString();
    }

    public String printExport(Export export) {
        Out out = new Out();
        printExport(out, export);
        return out.toString();
    }

    public String printTable(Table table) {
        Out out = new Out();
        printTable(out, table);
        return out.toString();
    }

    /**
     * Print a whole module.
     * <p>
     * Sections are printed in a fixed order: the memory, the function types, the exports,
     * the table (if not empty), then the functions. Imports are not printed.
     * <p>
     * Functions that use unsupported features are handled according to this printer's
     * {@link UnsupportedFeaturePolicy}.
     *
     * @param module The module.
     * @return The text, ending in a newline.
     * @throws UnsupportedFeatureException If a function uses an unsupported feature,
     *                                     and the policy is {@link UnsupportedFeaturePolicy#ABORT}.
     */
    public String printModule(Module module) {
        Out out = new Out();
        int indent = 0;
        out.open(Style.MAJOR, "module");
        indent = out.incIndent(indent);

        out.doIndent(indent);
        out.open(Style.NORMAL, "memory").append(' ').append(MEMORY_SIZE).append(")\n");
        for (FunctionType type : module.functionTypes.values()) {
            out.doIndent(indent);
            printFunctionType(out, type, true);
            out.append('\n');
        }
        for (Export export : module.exports) {
            out.doIndent(indent);
            printExport(out, export);
            out.append('\n');
        }
        if (!module.table.names.isEmpty()) {
            out.doIndent(indent);
            printTable(out, module.table);
            out.append('\n');
        }
        for (Function func : module.functions) {
            Out funcOut = new Out();
            try {
                printFunction(funcOut, func, indent);
            } catch (UnsupportedFeatureException e) {
                switch (policy) {
                    case ABORT:
                        throw e;
                    case WARN:
                        LOGGER.warning("skipping " + func + ": " + e.getMessage());
                        continue;
                    case SKIP:
                        continue;
                    default:
                        throw new AssertionError();
                }
            }
            out.doIndent(indent);
            out.append(funcOut).append('\n');
        }

        out.decIndent(indent);
        out.append('\n');
        return out.toString();
    }

    private void printFunctionType(Out out, FunctionType type, boolean full) {
        if (full) {
            out.open(Style.NORMAL, "type").append(' ').append(required(type.name, type, "name")).append(" (func");
        }
        if (!type.params.isEmpty()) {
            out.append(' ');
            out.open(Style.MINOR, "param");
            for (WasmType param : type.params) {
                out.append(' ').append(param);
            }
            out.append(')');
        }
        if (type.result != WasmType.NONE) {
            out.append(' ');
            out.open(Style.MINOR, "result ").append(type.result).append(')');
        }
        if (full) {
            out.append("))");
        }
    }

    private void printFunction(Out out, Function func, int indent) {
        out.open(Style.MAJOR, "func ").append(required(func.name, func, "name"));
        for (NameType param : func.params) {
            out.append(' ');
            out.open(Style.MINOR, "param ").append(param.name).append(' ').append(param.type).append(')');
        }
        if (func.result != WasmType.NONE) {
            out.append(' ');
            out.open(Style.MINOR, "result ").append(func.result).append(')');
        }
        indent = out.incIndent(indent);
        for (NameType local : func.locals) {
            out.doIndent(indent);
            out.open(Style.MINOR, "local ").append(local.name).append(' ').append(local.type).append(")\n");
        }
        Renderer renderer = new Renderer(out, indent);
        renderer.printFullLine(required(func.body, func, "body"));
        out.decIndent(indent);
    }

    private void printImport(Out out, Import imp) {
        out.open(Style.NORMAL, "import ").append(required(imp.name, imp, "name")).append(' ');
        out.text(required(imp.module, imp, "module")).append(' ');
        out.text(required(imp.base, imp, "base"));
        printFunctionType(out, required(imp.type, imp, "type"), false);
        out.append(')');
    }

    private void printExport(Out out, Export export) {
        out.open(Style.NORMAL, "export ");
        out.text(required(export.name, export, "name")).append(' ').append(required(export.value, export, "value")).append(')');
    }

    private void printTable(Out out, Table table) {
        out.open(Style.NORMAL, "table");
        for (Name name : table.names) {
            out.append(' ').append(name);
        }
        out.append(')');
    }

    private static <T> T required(@Nullable T value, Object owner, String slot) {
        if (value == null) {
            throw new IllegalStateException(owner + " has no " + slot);
        }
        return value;
    }

    private static void checkApplies(boolean applies, Expression curr, Object op, WasmType type) {
        if (!applies) {
            throw new IllegalStateException(op + " cannot be applied to " + type + ", in " + curr);
        }
    }

    /**
     * Get the text of a literal's value, as it appears after {@code <type>.const}.
     *
     * @param literal The literal.
     * @return The text.
     */
    public static String literalText(Literal literal) {
        switch (literal.getType()) {
            case I32:
                return Integer.toString(literal.getI32());
            case I64:
                return Long.toString(literal.getI64());
            case F32:
                return NumberFormat.floatLiteral(literal.getF32());
            case F64:
                return NumberFormat.floatLiteral(literal.getF64());
            default:
                throw new AssertionError();
        }
    }

    /**
     * Output with an indentation helper and decoration.
     */
    private class Out {
        private final StringBuilder sb = new StringBuilder();

        Out append(Object o) {
            sb.append(o);
            return this;
        }

        Out append(char c) {
            sb.append(c);
            return this;
        }

        Out append(int i) {
            sb.append(i);
            return this;
        }

        Out append(Out other) {
            sb.append(other.sb);
            return this;
        }

        Out styled(Style style, String text) {
            decoration.begin(sb, style);
            sb.append(text);
            decoration.end(sb, style);
            return this;
        }

        Out open(Style style, String text) {
            sb.append('(');
            return styled(style, text);
        }

        Out text(String str) {
            sb.append('"');
            styled(Style.TEXT, str.replace("\\", "\\\\").replace("\"", "\\\""));
            sb.append('"');
            return this;
        }

        void doIndent(int indent) {
            for (int i = 0; i < indent; i++) {
                sb.append("  ");
            }
        }

        int incIndent(int indent) {
            sb.append('\n');
            return indent + 1;
        }

        int decIndent(int indent) {
            indent--;
            doIndent(indent);
            sb.append(')');
            return indent;
        }

        @Override
        public String toString() {
            return sb.toString();
        }
    }

    private class Renderer implements ExpressionVisitor<Void> {
        private final Out out;
        private int indent;

        Renderer(Out out, int indent) {
            this.out = out;
            this.indent = indent;
        }

        void print(Expression expr) {
            expr.accept(this);
        }

        void printFullLine(Expression expr) {
            out.doIndent(indent);
            print(expr);
            out.append('\n');
        }

        private void inc() {
            indent = out.incIndent(indent);
        }

        private void dec() {
            indent = out.decIndent(indent);
        }

        private void printOperands(Iterable<Expression> operands, Expression owner) {
            for (Expression operand : operands) {
                printFullLine(required(operand, owner, "operand"));
            }
        }

        @Override
        public Void visitNop(Nop curr) {
            out.open(Style.MINOR, "nop").append(')');
            return null;
        }

        @Override
        public Void visitBlock(Block curr) {
            out.open(Style.NORMAL, "block");
            if (curr.name != null) {
                out.append(' ').append(curr.name);
            }
            inc();
            for (Expression expression : curr.list) {
                printFullLine(required(expression, curr, "element"));
            }
            dec();
            return null;
        }

        @Override
        public Void visitIf(If curr) {
            out.open(Style.NORMAL, "if");
            inc();
            printFullLine(required(curr.condition, curr, "condition"));
            printFullLine(required(curr.ifTrue, curr, "true branch"));
            if (curr.ifFalse != null) printFullLine(curr.ifFalse);
            dec();
            return null;
        }

        @Override
        public Void visitLoop(Loop curr) {
            out.open(Style.NORMAL, "loop");
            if (curr.out != null) {
                out.append(' ').append(curr.out);
                if (curr.in != null) {
                    out.append(' ').append(curr.in);
                }
            }
            inc();
            printFullLine(required(curr.body, curr, "body"));
            dec();
            return null;
        }

        @Override
        public Void visitLabel(Label curr) {
            throw new UnsupportedFeatureException(curr, "label");
        }

        @Override
        public Void visitBreak(Break curr) {
            out.open(Style.NORMAL, "break ").append(required(curr.name, curr, "name"));
            inc();
            if (curr.condition != null) printFullLine(curr.condition);
            if (curr.value != null) printFullLine(curr.value);
            dec();
            return null;
        }

        @Override
        public Void visitSwitch(Switch curr) {
            out.open(Style.NORMAL, "switch ").append(required(curr.name, curr, "name"));
            inc();
            printFullLine(required(curr.value, curr, "value"));
            for (Switch.Case c : curr.cases) {
                out.doIndent(indent);
                out.open(Style.NORMAL, "case ").append(literalText(required(c.value, curr, "case value")));
                inc();
                printFullLine(required(c.body, curr, "case body"));
                if (c.fallthru) {
                    out.doIndent(indent);
                    out.append("fallthrough\n");
                }
                dec();
                out.append('\n');
            }
            printFullLine(required(curr.defaultBody, curr, "default"));
            dec();
            return null;
        }

        private void printCall(String mnemonic, Call curr) {
            out.open(Style.NORMAL, mnemonic).append(required(curr.target, curr, "target"));
            if (!curr.operands.isEmpty()) {
                inc();
                printOperands(curr.operands, curr);
                dec();
            } else {
                out.append(')');
            }
        }

        @Override
        public Void visitCall(Call curr) {
            printCall("call ", curr);
            return null;
        }

        @Override
        public Void visitCallImport(CallImport curr) {
            printCall("call_import ", curr);
            return null;
        }

        @Override
        public Void visitCallIndirect(CallIndirect curr) {
            FunctionType fnType = required(curr.fnType, curr, "function type");
            out.open(Style.NORMAL, "call_indirect ").append(required(fnType.name, curr, "function type name"));
            inc();
            printFullLine(required(curr.target, curr, "target"));
            printOperands(curr.operands, curr);
            dec();
            return null;
        }

        @Override
        public Void visitGetLocal(GetLocal curr) {
            out.open(Style.NORMAL, "get_local ").append(required(curr.id, curr, "id")).append(')');
            return null;
        }

        @Override
        public Void visitSetLocal(SetLocal curr) {
            out.open(Style.NORMAL, "set_local ").append(required(curr.id, curr, "id"));
            inc();
            printFullLine(required(curr.value, curr, "value"));
            dec();
            return null;
        }

        private String memoryMnemonic(Expression curr, String base, int bytes, boolean isFloat, int offset) {
            if (offset != 0) {
                throw new UnsupportedFeatureException(curr, "non-zero memory offset");
            }
            if (bytes != 1 && bytes != 2 && bytes != 4 && bytes != 8) {
                throw new IllegalStateException("invalid access width " + bytes + ", in " + curr);
            }
            StringBuilder sb = new StringBuilder();
            sb.append(WasmType.fromSizeAndKind(bytes, isFloat)).append('.').append(base);
            if (bytes == 1) {
                sb.append('8');
            } else if (bytes == 2) {
                sb.append("16");
            }
            return sb.toString();
        }

        @Override
        public Void visitLoad(Load curr) {
            String mnemonic = memoryMnemonic(curr, "load", curr.bytes, curr.isFloat, curr.offset);
            if (curr.bytes < 4) {
                mnemonic += curr.signed ? "_s" : "_u";
            }
            out.open(Style.NORMAL, mnemonic).append(" align=").append(curr.align);
            inc();
            printFullLine(required(curr.ptr, curr, "pointer"));
            dec();
            return null;
        }

        @Override
        public Void visitStore(Store curr) {
            String mnemonic = memoryMnemonic(curr, "store", curr.bytes, curr.isFloat, curr.offset);
            out.open(Style.NORMAL, mnemonic).append(" align=").append(curr.align);
            inc();
            printFullLine(required(curr.ptr, curr, "pointer"));
            printFullLine(required(curr.value, curr, "value"));
            dec();
            return null;
        }

        @Override
        public Void visitConst(Const curr) {
            Literal value = required(curr.value, curr, "value");
            out.append('(').styled(Style.MINOR, value.getType() + ".const " + literalText(value)).append(')');
            return null;
        }

        @Override
        public Void visitUnary(Unary curr) {
            UnaryOp op = required(curr.op, curr, "operator");
            checkApplies(op.appliesTo(curr.type), curr, op, curr.type);
            String name;
            switch (op) {
                case CLZ:
                    name = "clz";
                    break;
                case CTZ:
                    name = "ctz";
                    break;
                case POPCNT:
                    name = "popcnt";
                    break;
                case NEG:
                    name = "neg";
                    break;
                case ABS:
                    name = "abs";
                    break;
                case CEIL:
                    name = "ceil";
                    break;
                case FLOOR:
                    name = "floor";
                    break;
                case TRUNC:
                    name = "trunc";
                    break;
                case NEAREST:
                    name = "nearest";
                    break;
                case SQRT:
                    name = "sqrt";
                    break;
                default:
                    throw new UnsupportedFeatureException(curr, "unary operator " + op);
            }
            out.open(Style.NORMAL, curr.type + "." + name);
            inc();
            printFullLine(required(curr.value, curr, "operand"));
            dec();
            return null;
        }

        @Override
        public Void visitBinary(Binary curr) {
            BinaryOp op = required(curr.op, curr, "operator");
            checkApplies(op.appliesTo(curr.type), curr, op, curr.type);
            String name;
            switch (op) {
                case ADD:
                    name = "add";
                    break;
                case SUB:
                    name = "sub";
                    break;
                case MUL:
                    name = "mul";
                    break;
                case DIV_S:
                    name = "div_s";
                    break;
                case DIV_U:
                    name = "div_u";
                    break;
                case REM_S:
                    name = "rem_s";
                    break;
                case REM_U:
                    name = "rem_u";
                    break;
                case AND:
                    name = "and";
                    break;
                case OR:
                    name = "or";
                    break;
                case XOR:
                    name = "xor";
                    break;
                case SHL:
                    name = "shl";
                    break;
                case SHR_U:
                    name = "shr_u";
                    break;
                case SHR_S:
                    name = "shr_s";
                    break;
                case DIV:
                    name = "div";
                    break;
                case COPY_SIGN:
                    name = "copysign";
                    break;
                case MIN:
                    name = "min";
                    break;
                case MAX:
                    name = "max";
                    break;
                default:
                    throw new UnsupportedFeatureException(curr, "binary operator " + op);
            }
            out.open(Style.NORMAL, curr.type + "." + name);
            inc();
            printFullLine(required(curr.left, curr, "left operand"));
            printFullLine(required(curr.right, curr, "right operand"));
            dec();
            return null;
        }

        @Override
        public Void visitCompare(Compare curr) {
            RelationalOp op = required(curr.op, curr, "operator");
            WasmType inputType = required(curr.inputType, curr, "input type");
            checkApplies(op.appliesTo(inputType), curr, op, inputType);
            String name;
            switch (op) {
                case EQ:
                    name = "eq";
                    break;
                case NE:
                    name = "ne";
                    break;
                case LT_S:
                    name = "lt_s";
                    break;
                case LT_U:
                    name = "lt_u";
                    break;
                case LE_S:
                    name = "le_s";
                    break;
                case LE_U:
                    name = "le_u";
                    break;
                case GT_S:
                    name = "gt_s";
                    break;
                case GT_U:
                    name = "gt_u";
                    break;
                case GE_S:
                    name = "ge_s";
                    break;
                case GE_U:
                    name = "ge_u";
                    break;
                case LT:
                    name = "lt";
                    break;
                case LE:
                    name = "le";
                    break;
                case GT:
                    name = "gt";
                    break;
                case GE:
                    name = "ge";
                    break;
                default:
                    throw new UnsupportedFeatureException(curr, "relational operator " + op);
            }
            out.open(Style.NORMAL, inputType + "." + name);
            inc();
            printFullLine(required(curr.left, curr, "left operand"));
            printFullLine(required(curr.right, curr, "right operand"));
            dec();
            return null;
        }

        @Override
        public Void visitConvert(Convert curr) {
            ConvertOp op = required(curr.op, curr, "operator");
            checkApplies(op.appliesTo(curr.type), curr, op, curr.type);
            String name;
            switch (op) {
                case EXTEND_S_INT32:
                    name = "extend_s";
                    break;
                case EXTEND_U_INT32:
                    name = "extend_u";
                    break;
                case WRAP_INT64:
                    name = "wrap";
                    break;
                case TRUNC_S_FLOAT32:
                case TRUNC_S_FLOAT64:
                    name = "trunc_s";
                    break;
                case TRUNC_U_FLOAT32:
                case TRUNC_U_FLOAT64:
                    name = "trunc_u";
                    break;
                case REINTERPRET_FLOAT:
                case REINTERPRET_INT:
                    name = "reinterpret";
                    break;
                case CONVERT_S_INT32:
                case CONVERT_S_INT64:
                    name = "convert_s";
                    break;
                case CONVERT_U_INT32:
                case CONVERT_U_INT64:
                    name = "convert_u";
                    break;
                case PROMOTE_FLOAT32:
                    name = "promote";
                    break;
                case DEMOTE_FLOAT64:
                    name = "demote";
                    break;
                default:
                    throw new UnsupportedFeatureException(curr, "conversion " + op);
            }
            out.open(Style.NORMAL, curr.type + "." + name + "/" + op.getOperandType(curr.type));
            inc();
            printFullLine(required(curr.value, curr, "operand"));
            dec();
            return null;
        }

        @Override
        public Void visitHost(Host curr) {
            HostOp op = required(curr.op, curr, "operator");
            String name;
            switch (op) {
                case PAGE_SIZE:
                    name = "page_size";
                    break;
                case MEMORY_SIZE:
                    name = "memory_size";
                    break;
                case GROW_MEMORY:
                    name = "grow_memory";
                    break;
                case HAS_FEATURE:
                    // the feature name has nowhere to live in the node
                    throw new UnsupportedFeatureException(curr, "host operator has_feature");
                default:
                    throw new UnsupportedFeatureException(curr, "host operator " + op);
            }
            if (curr.operands.size() != op.getArity()) {
                throw new IllegalStateException(name + " takes " + op.getArity()
                        + " operands, but has " + curr.operands.size() + ", in " + curr);
            }
            out.open(Style.NORMAL, name);
            if (curr.operands.isEmpty()) {
                out.append(')');
            } else {
                inc();
                printOperands(curr.operands, curr);
                dec();
            }
            return null;
        }
    }
}
