package io.github.eutro.charonj.types;

import io.github.eutro.charonj.decls.DeclId;

import java.util.Objects;

/**
 * A trait applied to arguments, {@code generics.types[0]} being the {@code Self} type.
 */
public final class TraitDeclRef {
    public final DeclId traitId;
    public final GenericArgs generics;

    public TraitDeclRef(DeclId traitId, GenericArgs generics) {
        if (traitId.kind != DeclId.Kind.TRAIT_DECL) {
            throw new IllegalArgumentException("not a trait id: " + traitId);
        }
        this.traitId = traitId;
        this.generics = generics;
    }

    public Ty selfTy() {
        return generics.types.get(0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TraitDeclRef that = (TraitDeclRef) o;
        return traitId.equals(that.traitId) && generics.equals(that.generics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(traitId, generics);
    }

    @Override
    public String toString() {
        return traitId + generics.toString();
    }
}
