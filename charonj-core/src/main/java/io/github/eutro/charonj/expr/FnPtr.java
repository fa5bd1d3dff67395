package io.github.eutro.charonj.expr;

import io.github.eutro.charonj.decls.DeclId;
import io.github.eutro.charonj.types.GenericArgs;
import io.github.eutro.charonj.types.TraitRef;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * The function a {@link FnCall} calls.
 */
public final class FnPtr {
    public enum Kind {
        /**
         * A function declaration, by id.
         */
        REGULAR,
        /**
         * A method of a trait, dispatched through a trait reference.
         */
        TRAIT_METHOD,
        /**
         * A function built into the host language, by name.
         */
        ASSUMED,
    }

    public final Kind kind;
    /**
     * For {@link Kind#REGULAR}: the function. For {@link Kind#TRAIT_METHOD}: the method's
     * declaration in the trait, if the trait declares one.
     */
    public final @Nullable DeclId fun;
    public final @Nullable TraitRef traitRef;
    /**
     * The method name, or the name of the assumed function.
     */
    public final @Nullable String name;
    public final GenericArgs generics;

    private FnPtr(Kind kind, @Nullable DeclId fun, @Nullable TraitRef traitRef, @Nullable String name, GenericArgs generics) {
        this.kind = kind;
        this.fun = fun;
        this.traitRef = traitRef;
        this.name = name;
        this.generics = generics;
    }

    public static FnPtr regular(DeclId fun, GenericArgs generics) {
        return new FnPtr(Kind.REGULAR, fun, null, null, generics);
    }

    public static FnPtr traitMethod(TraitRef traitRef, String name, @Nullable DeclId methodDecl, GenericArgs generics) {
        return new FnPtr(Kind.TRAIT_METHOD, methodDecl, traitRef, name, generics);
    }

    public static FnPtr assumed(String name, GenericArgs generics) {
        return new FnPtr(Kind.ASSUMED, null, null, name, generics);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FnPtr fnPtr = (FnPtr) o;
        return kind == fnPtr.kind
                && Objects.equals(fun, fnPtr.fun)
                && Objects.equals(traitRef, fnPtr.traitRef)
                && Objects.equals(name, fnPtr.name)
                && generics.equals(fnPtr.generics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, fun, traitRef, name, generics);
    }

    @Override
    public String toString() {
        switch (kind) {
            case REGULAR:
                return fun + generics.toString();
            case TRAIT_METHOD:
                return traitRef + "::" + name + generics;
            default:
                return "@" + name + generics;
        }
    }
}
