package io.github.eutro.charonj.decls;

import io.github.eutro.charonj.names.Name;
import io.github.eutro.charonj.types.TraitDeclRef;
import io.github.eutro.charonj.types.TraitRef;
import io.github.eutro.charonj.types.Ty;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An implementation of a trait for some type.
 */
public final class TraitImpl extends Declaration {
    /**
     * The implemented trait, {@code Self} first in its arguments. Null only while the impl is a stub.
     */
    public @Nullable TraitDeclRef implTrait;
    /**
     * Where the parent clauses of the implemented trait are satisfied, in the trait's order.
     */
    public List<TraitRef> parentTraitRefs = new ArrayList<>();
    public Map<String, Ty> assocTypes = new LinkedHashMap<>();
    /**
     * Associated constants, by name, to the globals holding their values.
     */
    public Map<String, DeclId> consts = new LinkedHashMap<>();
    /**
     * Methods, by name, to the functions implementing them.
     */
    public Map<String, DeclId> methods = new LinkedHashMap<>();

    public TraitImpl(DeclId id, Name name) {
        super(id, name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TraitImpl that = (TraitImpl) o;
        return commonEquals(that)
                && Objects.equals(implTrait, that.implTrait)
                && parentTraitRefs.equals(that.parentTraitRefs)
                && assocTypes.equals(that.assocTypes)
                && consts.equals(that.consts)
                && methods.equals(that.methods);
    }
}
