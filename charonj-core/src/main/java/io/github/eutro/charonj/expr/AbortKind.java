package io.github.eutro.charonj.expr;

/**
 * Why a body aborts.
 */
public enum AbortKind {
    PANIC,
    UNDEFINED_BEHAVIOR,
}
