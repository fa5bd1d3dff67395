package io.github.eutro.charonj.types;

import io.github.eutro.charonj.decls.DeclId;

import java.util.Objects;

/**
 * A where-clause of a declaration: {@code Self: Trait<Args>}, where {@code generics.types[0]} is {@code Self}.
 */
public final class TraitClause {
    /**
     * The index of the clause within the declaration, referred to by {@link TraitInstanceId.Clause}.
     */
    public final int clauseId;
    public final DeclId traitId;
    public final GenericArgs generics;

    public TraitClause(int clauseId, DeclId traitId, GenericArgs generics) {
        this.clauseId = clauseId;
        this.traitId = traitId;
        this.generics = generics;
    }

    public TraitDeclRef asDeclRef() {
        return new TraitDeclRef(traitId, generics);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TraitClause that = (TraitClause) o;
        return clauseId == that.clauseId && traitId.equals(that.traitId) && generics.equals(that.generics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(clauseId, traitId, generics);
    }

    @Override
    public String toString() {
        return "[@TraitClause" + clauseId + "]: " + asDeclRef();
    }
}
