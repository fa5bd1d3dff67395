package io.github.eutro.charonj.decls;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Whether a function is free-standing, or a method of a trait or trait implementation.
 */
public final class FunKind {
    public enum Kind {
        REGULAR,
        /**
         * A method declared in a trait. {@link #provided} if the trait gives a default body.
         */
        TRAIT_METHOD_DECL,
        /**
         * A method defined in a trait implementation.
         */
        TRAIT_METHOD_IMPL,
    }

    public static final FunKind REGULAR = new FunKind(Kind.REGULAR, null, null, null, false);

    public final Kind kind;
    public final @Nullable DeclId traitDecl;
    public final @Nullable DeclId traitImpl;
    public final @Nullable String method;
    public final boolean provided;

    private FunKind(Kind kind, @Nullable DeclId traitDecl, @Nullable DeclId traitImpl, @Nullable String method, boolean provided) {
        this.kind = kind;
        this.traitDecl = traitDecl;
        this.traitImpl = traitImpl;
        this.method = method;
        this.provided = provided;
    }

    public static FunKind traitMethodDecl(DeclId traitDecl, String method, boolean provided) {
        return new FunKind(Kind.TRAIT_METHOD_DECL, traitDecl, null, method, provided);
    }

    public static FunKind traitMethodImpl(DeclId traitImpl, DeclId traitDecl, String method) {
        return new FunKind(Kind.TRAIT_METHOD_IMPL, traitDecl, traitImpl, method, false);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FunKind funKind = (FunKind) o;
        return provided == funKind.provided
                && kind == funKind.kind
                && Objects.equals(traitDecl, funKind.traitDecl)
                && Objects.equals(traitImpl, funKind.traitImpl)
                && Objects.equals(method, funKind.method);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, traitDecl, traitImpl, method, provided);
    }

    @Override
    public String toString() {
        switch (kind) {
            case TRAIT_METHOD_DECL:
                return "method " + method + " of " + traitDecl;
            case TRAIT_METHOD_IMPL:
                return "method " + method + " of " + traitImpl;
            default:
                return "regular";
        }
    }
}
