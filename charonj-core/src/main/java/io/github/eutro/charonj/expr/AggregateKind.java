package io.github.eutro.charonj.expr;

import io.github.eutro.charonj.decls.DeclId;
import io.github.eutro.charonj.types.GenericArgs;
import io.github.eutro.charonj.types.Ty;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * What an {@link Rvalue.Aggregate} builds.
 */
public final class AggregateKind {
    public enum Kind {
        ADT,
        TUPLE,
        ARRAY,
    }

    public final Kind kind;
    public final @Nullable DeclId adt;
    /**
     * The variant, for enums.
     */
    public final @Nullable Integer variant;
    public final GenericArgs generics;
    /**
     * The element type, for arrays.
     */
    public final @Nullable Ty elemTy;

    private AggregateKind(Kind kind, @Nullable DeclId adt, @Nullable Integer variant, GenericArgs generics, @Nullable Ty elemTy) {
        this.kind = kind;
        this.adt = adt;
        this.variant = variant;
        this.generics = generics;
        this.elemTy = elemTy;
    }

    public static AggregateKind adt(DeclId adt, @Nullable Integer variant, GenericArgs generics) {
        return new AggregateKind(Kind.ADT, adt, variant, generics, null);
    }

    public static AggregateKind tuple() {
        return new AggregateKind(Kind.TUPLE, null, null, GenericArgs.EMPTY, null);
    }

    public static AggregateKind array(Ty elemTy) {
        return new AggregateKind(Kind.ARRAY, null, null, GenericArgs.EMPTY, elemTy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AggregateKind that = (AggregateKind) o;
        return kind == that.kind
                && Objects.equals(adt, that.adt)
                && Objects.equals(variant, that.variant)
                && generics.equals(that.generics)
                && Objects.equals(elemTy, that.elemTy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, adt, variant, generics, elemTy);
    }

    @Override
    public String toString() {
        switch (kind) {
            case ADT:
                return adt + (variant == null ? "" : "::" + variant) + generics;
            case TUPLE:
                return "tuple";
            default:
                return "[" + elemTy + "]";
        }
    }
}
