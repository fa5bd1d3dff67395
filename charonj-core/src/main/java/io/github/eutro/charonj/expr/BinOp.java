package io.github.eutro.charonj.expr;

import org.jetbrains.annotations.Nullable;

public enum BinOp {
    ADD("add", "+"),
    SUB("sub", "-"),
    MUL("mul", "*"),
    DIV("div", "/"),
    REM("rem", "%"),
    BIT_XOR("bit_xor", "^"),
    BIT_AND("bit_and", "&"),
    BIT_OR("bit_or", "|"),
    SHL("shl", "<<"),
    SHR("shr", ">>"),
    EQ("eq", "=="),
    NE("ne", "!="),
    LT("lt", "<"),
    LE("le", "<="),
    GT("gt", ">"),
    GE("ge", ">="),
    ;

    public final String feedName;
    public final String symbol;

    BinOp(String feedName, String symbol) {
        this.feedName = feedName;
        this.symbol = symbol;
    }

    public static @Nullable BinOp fromFeedName(String name) {
        for (BinOp op : values()) {
            if (op.feedName.equals(name)) return op;
        }
        return null;
    }
}
