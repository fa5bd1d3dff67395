package io.github.eutro.charonj.expr;

public enum UnOp {
    NOT,
    NEG,
}
