package io.github.eutro.wasmopt.passes.misc;

import io.github.eutro.wasmopt.passes.IRPass;

import java.util.ArrayList;
import java.util.List;

/**
 * Two passes run one after the other, the second receiving the result of the first.
 * <p>
 * Chains of chains are flattened on construction, so a long sequence of
 * {@link IRPass#then(IRPass)} calls runs as one loop. If a stage fails, the exception
 * notes which stage, counting from zero.
 *
 * @param <A> The input type.
 * @param <B> The type passed between the two halves.
 * @param <C> The output type.
 */
public class ChainedPass<A, B, C> implements IRPass<A, C> {
    private final List<IRPass<?, ?>> stages = new ArrayList<>();
    private final boolean isInPlace;

    public ChainedPass(IRPass<A, B> firstPass, IRPass<B, C> nextPass) {
        addStages(firstPass);
        addStages(nextPass);
        isInPlace = firstPass.isInPlace() && nextPass.isInPlace();
    }

    private void addStages(IRPass<?, ?> pass) {
        if (pass instanceof ChainedPass) {
            stages.addAll(((ChainedPass<?, ?, ?>) pass).stages);
        } else {
            stages.add(pass);
        }
    }

    /**
     * Get the number of passes this runs, after flattening.
     *
     * @return The number of stages.
     */
    public int stageCount() {
        return stages.size();
    }

    @Override
    public boolean isInPlace() {
        return isInPlace;
    }

    @SuppressWarnings("unchecked")
    @Override
    public C run(A a) {
        Object value = a;
        for (int i = 0; i < stages.size(); i++) {
            try {
                value = ((IRPass<Object, Object>) stages.get(i)).run(value);
            } catch (Throwable t) {
                t.addSuppressed(new RuntimeException("running pass " + i + " in chain"));
                throw t;
            }
        }
        return (C) value;
    }
}
