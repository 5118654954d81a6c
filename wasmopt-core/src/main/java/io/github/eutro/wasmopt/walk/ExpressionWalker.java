package io.github.eutro.wasmopt.walk;

import io.github.eutro.wasmopt.arena.Arena;
import io.github.eutro.wasmopt.ast.*;
import io.github.eutro.wasmopt.entity.Function;
import io.github.eutro.wasmopt.passes.InPlaceIRPass;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.ListIterator;

/**
 * A children-first rewriter of expression trees.
 * <p>
 * Each {@code walkX} hook receives a node after all of its children have been walked,
 * and the node is replaced by whatever the hook returns. By default, every hook returns
 * its argument, so the tree is left unchanged. A hook may equally well mutate its argument
 * in place and return it.
 * <p>
 * Children are walked in a fixed order for each kind of node: operands left to right,
 * with conditions before bodies, pointers before values, and the call target of a
 * {@link CallIndirect} before its operands. Absent optional children are skipped,
 * without any hook being called for them.
 * <p>
 * As an {@link InPlaceIRPass}, a walker rewrites the body of a function.
 */
public class ExpressionWalker implements InPlaceIRPass<Function> {
    /**
     * The arena to allocate replacement nodes from, or null if this walker doesn't allocate.
     */
    @Nullable
    protected final Arena allocator;

    private final Dispatcher dispatcher = new Dispatcher();

    public ExpressionWalker() {
        this(null);
    }

    public ExpressionWalker(@Nullable Arena allocator) {
        this.allocator = allocator;
    }

    protected Expression walkNop(Nop curr) {
        return curr;
    }

    protected Expression walkBlock(Block curr) {
        return curr;
    }

    protected Expression walkIf(If curr) {
        return curr;
    }

    protected Expression walkLoop(Loop curr) {
        return curr;
    }

    protected Expression walkLabel(Label curr) {
        return curr;
    }

    protected Expression walkBreak(Break curr) {
        return curr;
    }

    protected Expression walkSwitch(Switch curr) {
        return curr;
    }

    protected Expression walkCall(Call curr) {
        return curr;
    }

    protected Expression walkCallImport(CallImport curr) {
        return curr;
    }

    protected Expression walkCallIndirect(CallIndirect curr) {
        return curr;
    }

    protected Expression walkGetLocal(GetLocal curr) {
        return curr;
    }

    protected Expression walkSetLocal(SetLocal curr) {
        return curr;
    }

    protected Expression walkLoad(Load curr) {
        return curr;
    }

    protected Expression walkStore(Store curr) {
        return curr;
    }

    protected Expression walkConst(Const curr) {
        return curr;
    }

    protected Expression walkUnary(Unary curr) {
        return curr;
    }

    protected Expression walkBinary(Binary curr) {
        return curr;
    }

    protected Expression walkCompare(Compare curr) {
        return curr;
    }

    protected Expression walkConvert(Convert curr) {
        return curr;
    }

    protected Expression walkHost(Host curr) {
        return curr;
    }

    /**
     * Walk a tree, children first.
     *
     * @param curr The root of the tree, or null.
     * @return What the root should be replaced with, or null if it was null.
     */
    @Contract("null -> null; !null -> !null")
    public Expression walk(@Nullable Expression curr) {
        if (curr == null) return null;
        return curr.accept(dispatcher);
    }

    /**
     * Walk the body of a function, replacing it with the result.
     *
     * @param func The function.
     */
    public void startWalk(Function func) {
        func.body = walk(func.body);
    }

    @Override
    public void runInPlace(Function func) {
        startWalk(func);
    }

    private void walkAll(List<Expression> list) {
        ListIterator<Expression> it = list.listIterator();
        while (it.hasNext()) {
            it.set(walk(it.next()));
        }
    }

    private class Dispatcher implements ExpressionVisitor<Expression> {
        @Override
        public Expression visitNop(Nop curr) {
            return walkNop(curr);
        }

        @Override
        public Expression visitBlock(Block curr) {
            walkAll(curr.list);
            return walkBlock(curr);
        }

        @Override
        public Expression visitIf(If curr) {
            curr.condition = walk(curr.condition);
            curr.ifTrue = walk(curr.ifTrue);
            curr.ifFalse = walk(curr.ifFalse);
            return walkIf(curr);
        }

        @Override
        public Expression visitLoop(Loop curr) {
            curr.body = walk(curr.body);
            return walkLoop(curr);
        }

        @Override
        public Expression visitLabel(Label curr) {
            return walkLabel(curr);
        }

        @Override
        public Expression visitBreak(Break curr) {
            curr.condition = walk(curr.condition);
            curr.value = walk(curr.value);
            return walkBreak(curr);
        }

        @Override
        public Expression visitSwitch(Switch curr) {
            curr.value = walk(curr.value);
            for (Switch.Case c : curr.cases) {
                c.body = walk(c.body);
            }
            curr.defaultBody = walk(curr.defaultBody);
            return walkSwitch(curr);
        }

        @Override
        public Expression visitCall(Call curr) {
            walkAll(curr.operands);
            return walkCall(curr);
        }

        @Override
        public Expression visitCallImport(CallImport curr) {
            walkAll(curr.operands);
            return walkCallImport(curr);
        }

        @Override
        public Expression visitCallIndirect(CallIndirect curr) {
            curr.target = walk(curr.target);
            walkAll(curr.operands);
            return walkCallIndirect(curr);
        }

        @Override
        public Expression visitGetLocal(GetLocal curr) {
            return walkGetLocal(curr);
        }

        @Override
        public Expression visitSetLocal(SetLocal curr) {
            curr.value = walk(curr.value);
            return walkSetLocal(curr);
        }

        @Override
        public Expression visitLoad(Load curr) {
            curr.ptr = walk(curr.ptr);
            return walkLoad(curr);
        }

        @Override
        public Expression visitStore(Store curr) {
            curr.ptr = walk(curr.ptr);
            curr.value = walk(curr.value);
            return walkStore(curr);
        }

        @Override
        public Expression visitConst(Const curr) {
            return walkConst(curr);
        }

        @Override
        public Expression visitUnary(Unary curr) {
            curr.value = walk(curr.value);
            return walkUnary(curr);
        }

        @Override
        public Expression visitBinary(Binary curr) {
            curr.left = walk(curr.left);
            curr.right = walk(curr.right);
            return walkBinary(curr);
        }

        @Override
        public Expression visitCompare(Compare curr) {
            curr.left = walk(curr.left);
            curr.right = walk(curr.right);
            return walkCompare(curr);
        }

        @Override
        public Expression visitConvert(Convert curr) {
            curr.value = walk(curr.value);
            return walkConvert(curr);
        }

        @Override
        public Expression visitHost(Host curr) {
            walkAll(curr.operands);
            return walkHost(curr);
        }
    }
}
