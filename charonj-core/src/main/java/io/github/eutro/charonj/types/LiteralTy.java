package io.github.eutro.charonj.types;

import org.jetbrains.annotations.Nullable;

import java.math.BigInteger;

/**
 * The types of literal values: machine integers, booleans and characters.
 */
public enum LiteralTy {
    ISIZE("isize", true, 64),
    I8("i8", true, 8),
    I16("i16", true, 16),
    I32("i32", true, 32),
    I64("i64", true, 64),
    I128("i128", true, 128),
    USIZE("usize", false, 64),
    U8("u8", false, 8),
    U16("u16", false, 16),
    U32("u32", false, 32),
    U64("u64", false, 64),
    U128("u128", false, 128),
    BOOL("bool", false, 1),
    CHAR("char", false, 32),
    ;

    public final String text;
    public final boolean signed;
    public final int bits;

    LiteralTy(String text, boolean signed, int bits) {
        this.text = text;
        this.signed = signed;
        this.bits = bits;
    }

    public boolean isInteger() {
        return this != BOOL && this != CHAR;
    }

    /**
     * Check whether a value fits in this type.
     *
     * @param value The value.
     * @return Whether it is representable.
     */
    public boolean fits(BigInteger value) {
        if (this == CHAR) {
            return value.signum() >= 0 && value.compareTo(BigInteger.valueOf(Character.MAX_CODE_POINT)) <= 0;
        }
        if (signed) {
            BigInteger half = BigInteger.ONE.shiftLeft(bits - 1);
            return value.compareTo(half.negate()) >= 0 && value.compareTo(half) < 0;
        }
        return value.signum() >= 0 && value.bitLength() <= bits;
    }

    /**
     * Look up a literal type by its textual name, e.g. {@code u32}.
     *
     * @param text The name.
     * @return The type, or null if there is none.
     */
    public static @Nullable LiteralTy fromText(String text) {
        for (LiteralTy ty : values()) {
            if (ty.text.equals(text)) return ty;
        }
        return null;
    }
}
