package io.github.eutro.charonj.expr;

import io.github.eutro.charonj.decls.DeclId;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * One step of a {@link Place} projection.
 */
public final class ProjectionElem {
    public enum Kind {
        DEREF,
        FIELD,
        INDEX,
    }

    public static final ProjectionElem DEREF = new ProjectionElem(Kind.DEREF, null, null, 0, 0);

    public final Kind kind;
    /**
     * For {@link Kind#FIELD}: the ADT the field belongs to, or null for a tuple field.
     */
    public final @Nullable DeclId adt;
    /**
     * For {@link Kind#FIELD} of an enum: the variant.
     */
    public final @Nullable Integer variant;
    public final int field;
    /**
     * For {@link Kind#INDEX}: the local holding the index.
     */
    public final int indexLocal;

    private ProjectionElem(Kind kind, @Nullable DeclId adt, @Nullable Integer variant, int field, int indexLocal) {
        this.kind = kind;
        this.adt = adt;
        this.variant = variant;
        this.field = field;
        this.indexLocal = indexLocal;
    }

    public static ProjectionElem field(@Nullable DeclId adt, @Nullable Integer variant, int field) {
        return new ProjectionElem(Kind.FIELD, adt, variant, field, 0);
    }

    public static ProjectionElem index(int local) {
        return new ProjectionElem(Kind.INDEX, null, null, 0, local);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProjectionElem that = (ProjectionElem) o;
        return field == that.field
                && indexLocal == that.indexLocal
                && kind == that.kind
                && Objects.equals(adt, that.adt)
                && Objects.equals(variant, that.variant);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, adt, variant, field, indexLocal);
    }

    @Override
    public String toString() {
        switch (kind) {
            case DEREF:
                return "*";
            case FIELD:
                return "." + (variant == null ? "" : variant + ".") + field;
            default:
                return "[_" + indexLocal + "]";
        }
    }
}
