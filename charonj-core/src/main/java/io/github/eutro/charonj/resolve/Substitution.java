package io.github.eutro.charonj.resolve;

import io.github.eutro.charonj.types.*;

/**
 * Instantiates the generic parameters of an item with arguments: type, region and const generic
 * variables by index, and references to where-clauses by the corresponding trait reference.
 * <p>
 * Variables with no corresponding argument are left as they are.
 */
public final class Substitution extends TyFolder {
    private final GenericArgs args;

    private Substitution(GenericArgs args) {
        this.args = args;
    }

    public static Substitution of(GenericArgs args) {
        return new Substitution(args);
    }

    @Override
    public Ty visitTypeVar(Ty.TypeVar ty) {
        return ty.index < args.types.size() ? args.types.get(ty.index) : ty;
    }

    @Override
    public Region fold(Region region) {
        if (region.kind == Region.Kind.VAR && region.index < args.regions.size()) {
            return args.regions.get(region.index);
        }
        return region;
    }

    @Override
    public ConstGeneric fold(ConstGeneric cg) {
        if (cg.kind == ConstGeneric.Kind.VAR && cg.index < args.constGenerics.size()) {
            return args.constGenerics.get(cg.index);
        }
        return cg;
    }

    @Override
    public TraitRef fold(TraitRef ref) {
        if (ref.instance instanceof TraitInstanceId.Clause) {
            int clause = ((TraitInstanceId.Clause) ref.instance).clauseId;
            if (clause < args.traitRefs.size()) return args.traitRefs.get(clause);
        }
        return super.fold(ref);
    }

    public TraitDeclRef instantiate(TraitClause clause) {
        return fold(clause.asDeclRef());
    }
}
