package io.github.eutro.charonj.types;

import io.github.eutro.charonj.decls.DeclId;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * What an {@link Ty.Adt} refers to: a user type declaration, a tuple, or a builtin type.
 */
public final class TypeId {
    public enum Kind {
        ADT,
        TUPLE,
        BOX,
        ARRAY,
        SLICE,
        STR,
    }

    public static final TypeId TUPLE = new TypeId(Kind.TUPLE, null);
    public static final TypeId BOX = new TypeId(Kind.BOX, null);
    public static final TypeId ARRAY = new TypeId(Kind.ARRAY, null);
    public static final TypeId SLICE = new TypeId(Kind.SLICE, null);
    public static final TypeId STR = new TypeId(Kind.STR, null);

    public final Kind kind;
    /**
     * The type declaration, only for {@link Kind#ADT}.
     */
    public final @Nullable DeclId adt;

    private TypeId(Kind kind, @Nullable DeclId adt) {
        this.kind = kind;
        this.adt = adt;
    }

    public static TypeId adt(DeclId id) {
        if (id.kind != DeclId.Kind.TYPE) throw new IllegalArgumentException("not a type id: " + id);
        return new TypeId(Kind.ADT, id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TypeId typeId = (TypeId) o;
        return kind == typeId.kind && Objects.equals(adt, typeId.adt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, adt);
    }

    @Override
    public String toString() {
        return kind == Kind.ADT ? String.valueOf(adt) : kind.name().toLowerCase();
    }
}
