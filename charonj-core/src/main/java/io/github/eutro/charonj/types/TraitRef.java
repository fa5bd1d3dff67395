package io.github.eutro.charonj.types;

import java.util.Objects;

/**
 * A resolved (or unresolved) trait obligation: which implementation provides
 * {@link #traitDeclRef}, and with what generic arguments.
 */
public final class TraitRef {
    public final TraitInstanceId instance;
    /**
     * The arguments of the implementation, for {@link TraitInstanceId.TraitImpl}; empty otherwise.
     */
    public final GenericArgs generics;
    public final TraitDeclRef traitDeclRef;

    public TraitRef(TraitInstanceId instance, GenericArgs generics, TraitDeclRef traitDeclRef) {
        this.instance = instance;
        this.generics = generics;
        this.traitDeclRef = traitDeclRef;
    }

    public boolean isResolved() {
        return instance.isResolved();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TraitRef traitRef = (TraitRef) o;
        return instance.equals(traitRef.instance)
                && generics.equals(traitRef.generics)
                && traitDeclRef.equals(traitRef.traitDeclRef);
    }

    @Override
    public int hashCode() {
        return Objects.hash(instance, generics, traitDeclRef);
    }

    @Override
    public String toString() {
        return "<" + traitDeclRef + " by " + instance + generics + ">";
    }
}
