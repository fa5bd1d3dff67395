package io.github.eutro.charonj.util;

/**
 * A successor function, or any other unary function the graph algorithms take.
 * Kept apart from {@link java.util.function.Function} so call sites read as graph code.
 *
 * @param <A> The argument type.
 * @param <B> The result type.
 */
@FunctionalInterface
public interface F<A, B> {
    B apply(A a);
}
