package io.github.eutro.charonj.expr;

import io.github.eutro.charonj.types.Literal;
import io.github.eutro.charonj.types.Ty;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * An operand: a copy or move out of a place, or a constant.
 */
public final class Operand {
    public enum Kind {
        COPY,
        MOVE,
        CONST,
    }

    public final Kind kind;
    public final @Nullable Place place;
    /**
     * The type of a constant.
     */
    public final @Nullable Ty ty;
    /**
     * The value of a constant, null for a constant of zero-sized type.
     */
    public final @Nullable Literal value;

    private Operand(Kind kind, @Nullable Place place, @Nullable Ty ty, @Nullable Literal value) {
        this.kind = kind;
        this.place = place;
        this.ty = ty;
        this.value = value;
    }

    public static Operand copy(Place place) {
        return new Operand(Kind.COPY, place, null, null);
    }

    public static Operand move(Place place) {
        return new Operand(Kind.MOVE, place, null, null);
    }

    public static Operand constant(Ty ty, @Nullable Literal value) {
        return new Operand(Kind.CONST, null, ty, value);
    }

    public static Operand literal(Literal value) {
        return constant(Ty.literal(value.ty), value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Operand operand = (Operand) o;
        return kind == operand.kind
                && Objects.equals(place, operand.place)
                && Objects.equals(ty, operand.ty)
                && Objects.equals(value, operand.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, place, ty, value);
    }

    @Override
    public String toString() {
        switch (kind) {
            case COPY:
                return "copy " + place;
            case MOVE:
                return "move " + place;
            default:
                return value == null ? "const " + ty : value.toString();
        }
    }
}
