package io.github.eutro.charonj.expr;

import io.github.eutro.charonj.types.Ty;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A local variable of a body. Local 0 is the return place, locals {@code 1..argCount} are the arguments.
 */
public final class Local {
    public final int index;
    public final @Nullable String name;
    public final Ty ty;

    public Local(int index, @Nullable String name, Ty ty) {
        this.index = index;
        this.name = name;
        this.ty = ty;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Local local = (Local) o;
        return index == local.index && Objects.equals(name, local.name) && ty.equals(local.ty);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, name, ty);
    }

    @Override
    public String toString() {
        return (name == null ? "_" + index : name + "_" + index) + ": " + ty;
    }
}
