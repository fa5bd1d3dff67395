package io.github.eutro.charonj.types;

import io.github.eutro.charonj.decls.DeclId;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A const generic argument: a global, a const generic variable, or a literal value.
 */
public final class ConstGeneric {
    public enum Kind {
        GLOBAL,
        VAR,
        VALUE,
    }

    public final Kind kind;
    public final @Nullable DeclId global;
    public final int index;
    public final @Nullable Literal value;

    private ConstGeneric(Kind kind, @Nullable DeclId global, int index, @Nullable Literal value) {
        this.kind = kind;
        this.global = global;
        this.index = index;
        this.value = value;
    }

    public static ConstGeneric global(DeclId id) {
        return new ConstGeneric(Kind.GLOBAL, id, 0, null);
    }

    public static ConstGeneric var(int index) {
        return new ConstGeneric(Kind.VAR, null, index, null);
    }

    public static ConstGeneric value(Literal value) {
        return new ConstGeneric(Kind.VALUE, null, 0, value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConstGeneric that = (ConstGeneric) o;
        return index == that.index
                && kind == that.kind
                && Objects.equals(global, that.global)
                && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, global, index, value);
    }

    @Override
    public String toString() {
        switch (kind) {
            case GLOBAL:
                return String.valueOf(global);
            case VAR:
                return "@C" + index;
            default:
                return String.valueOf(value);
        }
    }
}
