package io.github.eutro.charonj.expr;

public enum BorrowKind {
    SHARED,
    MUT,
    TWO_PHASE_MUT,
    SHALLOW,
}
