package io.github.eutro.wasmopt.passes.misc;

import io.github.eutro.wasmopt.entity.Function;
import io.github.eutro.wasmopt.entity.Module;
import io.github.eutro.wasmopt.passes.IRPass;
import io.github.eutro.wasmopt.passes.InPlaceIRPass;

import java.util.ListIterator;

/**
 * Lifts passes which operate on smaller IR parts into ones that operate on bigger parts.
 */
public class ForPass {
    /**
     * Lift a function pass to operate on every function of a module, in order.
     *
     * @param pass The function pass.
     * @return The module pass.
     */
    public static Functions liftFunctions(IRPass<Function, Function> pass) {
        return new Functions(pass);
    }

    /**
     * A function pass lifted to operate on a full module.
     */
    public static class Functions implements InPlaceIRPass<Module> {
        private final IRPass<Function, Function> pass;

        private Functions(IRPass<Function, Function> pass) {
            this.pass = pass;
        }

        @Override
        public void runInPlace(Module module) {
            ListIterator<Function> iter = module.functions.listIterator();
            int i = 0;
            try {
                if (pass.isInPlace()) {
                    while (iter.hasNext()) {
                        pass.run(iter.next());
                        i++;
                    }
                } else {
                    while (iter.hasNext()) {
                        iter.set(pass.run(iter.next()));
                        i++;
                    }
                }
            } catch (Throwable t) {
                t.addSuppressed(new RuntimeException("in element " + i));
                throw t;
            }
        }
    }
}
