package io.github.eutro.charonj.passes;

/**
 * An IR pass which mutates its input, such as a body analysis attaching exts,
 * or a crate pass filling in the LLBC bodies of a {@link io.github.eutro.charonj.decls.DeclTable}.
 * <p>
 * Chains of these, made with {@link #then(IRPass)}, are in-place too.
 *
 * @param <T> The type of IR mutated.
 */
public interface InPlaceIRPass<T> extends IRPass<T, T> {
    void runInPlace(T t);

    @Override
    default T run(T t) {
        runInPlace(t);
        return t;
    }

    @Override
    default boolean isInPlace() {
        return true;
    }
}
