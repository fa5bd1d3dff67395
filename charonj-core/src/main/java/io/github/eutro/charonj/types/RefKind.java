package io.github.eutro.charonj.types;

/**
 * The mutability of a reference or raw pointer.
 */
public enum RefKind {
    SHARED,
    MUT,
}
