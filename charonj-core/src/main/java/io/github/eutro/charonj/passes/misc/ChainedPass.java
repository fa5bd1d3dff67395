package io.github.eutro.charonj.passes.misc;

import io.github.eutro.charonj.passes.IRPass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A pass which composes two others, executing the first, and giving its result to the second.
 *
 * @param <A> The input type.
 * @param <B> The intermediate type.
 * @param <C> The output type.
 */
public class ChainedPass<A, B, C> implements IRPass<A, C> {
    private final IRPass<A, B> firstPass;
    private final IRPass<B, C> nextPass;
    private final boolean isInPlace;

    /**
     * Construct a chained pass.
     *
     * @param firstPass The first pass to run.
     * @param nextPass  The next pass to run.
     */
    public ChainedPass(IRPass<A, B> firstPass, IRPass<B, C> nextPass) {
        this.firstPass = firstPass;
        this.nextPass = nextPass;
        isInPlace = firstPass.isInPlace() && nextPass.isInPlace();
    }

    /**
     * Flatten a (left-nested) chain into the list of its passes, in running order.
     */
    @SuppressWarnings("unchecked")
    private List<IRPass<Object, Object>> listPasses() {
        List<IRPass<?, ?>> passes = new ArrayList<>();
        IRPass<?, ?> pass = this;
        while (pass instanceof ChainedPass) {
            ChainedPass<?, ?, ?> cPass = (ChainedPass<?, ?, ?>) pass;
            passes.add(cPass.nextPass);
            pass = cPass.firstPass;
        }
        passes.add(pass);
        Collections.reverse(passes);
        return (List<IRPass<Object, Object>>) (Object) passes;
    }

    @Override
    public boolean isInPlace() {
        return isInPlace;
    }

    @SuppressWarnings("unchecked")
    @Override
    public C run(A a) {
        List<IRPass<Object, Object>> passes = listPasses();
        Object acc = a;
        for (int i = 0; i < passes.size(); i++) {
            IRPass<Object, Object> pass = passes.get(i);
            try {
                acc = pass.run(acc);
            } catch (RuntimeException | Error t) {
                t.addSuppressed(new RuntimeException("running pass " + i + " in chain ("
                        + pass.getClass().getSimpleName() + ")"));
                throw t;
            }
        }
        return (C) acc;
    }
}
