package io.github.eutro.charonj.decls;

import io.github.eutro.charonj.types.Ty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The signature of a function. Its generics are those of the {@link FunDecl}.
 */
public final class FunSig {
    public final boolean isUnsafe;
    public final List<Ty> inputs;
    public final Ty output;

    public FunSig(boolean isUnsafe, List<Ty> inputs, Ty output) {
        this.isUnsafe = isUnsafe;
        this.inputs = Collections.unmodifiableList(new ArrayList<>(inputs));
        this.output = output;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FunSig funSig = (FunSig) o;
        return isUnsafe == funSig.isUnsafe && inputs.equals(funSig.inputs) && output.equals(funSig.output);
    }

    @Override
    public int hashCode() {
        return Objects.hash(isUnsafe, inputs, output);
    }

    @Override
    public String toString() {
        return (isUnsafe ? "unsafe fn" : "fn") + inputs + " -> " + output;
    }
}
