package io.github.eutro.wasmopt.ast;

/**
 * A visitor over every kind of {@link Expression}.
 * <p>
 * Implementors must handle every kind, so adding a kind of expression
 * is a compile error in every dispatcher until it is handled.
 *
 * @param <R> The return type of the visit methods.
 */
public interface ExpressionVisitor<R> {
    R visitNop(Nop curr);

    R visitBlock(Block curr);

    R visitIf(If curr);

    R visitLoop(Loop curr);

    R visitLabel(Label curr);

    R visitBreak(Break curr);

    R visitSwitch(Switch curr);

    R visitCall(Call curr);

    R visitCallImport(CallImport curr);

    R visitCallIndirect(CallIndirect curr);

    R visitGetLocal(GetLocal curr);

    R visitSetLocal(SetLocal curr);

    R visitLoad(Load curr);

    R visitStore(Store curr);

    R visitConst(Const curr);

    R visitUnary(Unary curr);

    R visitBinary(Binary curr);

    R visitCompare(Compare curr);

    R visitConvert(Convert curr);

    R visitHost(Host curr);
}
