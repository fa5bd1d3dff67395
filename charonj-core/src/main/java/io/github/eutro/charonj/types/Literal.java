package io.github.eutro.charonj.types;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A literal value. Booleans are stored as 0 and 1, characters as their code point.
 */
public final class Literal {
    public final LiteralTy ty;
    public final BigInteger value;

    private Literal(LiteralTy ty, BigInteger value) {
        this.ty = ty;
        this.value = value;
    }

    public static Literal of(LiteralTy ty, BigInteger value) {
        if (!ty.fits(value)) {
            throw new IllegalArgumentException(value + " does not fit in " + ty.text);
        }
        return new Literal(ty, value);
    }

    public static Literal integer(LiteralTy ty, long value) {
        return of(ty, BigInteger.valueOf(value));
    }

    public static Literal bool(boolean value) {
        return new Literal(LiteralTy.BOOL, value ? BigInteger.ONE : BigInteger.ZERO);
    }

    public static Literal character(int codePoint) {
        return of(LiteralTy.CHAR, BigInteger.valueOf(codePoint));
    }

    public boolean isTrue() {
        return ty == LiteralTy.BOOL && value.signum() != 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Literal literal = (Literal) o;
        return ty == literal.ty && value.equals(literal.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ty, value);
    }

    @Override
    public String toString() {
        switch (ty) {
            case BOOL:
                return isTrue() ? "true" : "false";
            case CHAR:
                return "'" + new String(Character.toChars(value.intValue())) + "'";
            default:
                return value + ty.text;
        }
    }
}
