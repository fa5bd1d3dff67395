package io.github.eutro.charonj.types;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@link Ty.Visitor} that rebuilds a type bottom-up. By default every node is rebuilt as is;
 * subclasses override the cases they rewrite.
 */
public abstract class TyFolder implements Ty.Visitor<Ty> {
    public Ty fold(Ty ty) {
        return ty.accept(this);
    }

    public List<Ty> fold(List<Ty> tys) {
        List<Ty> out = new ArrayList<>(tys.size());
        for (Ty ty : tys) out.add(fold(ty));
        return out;
    }

    public Region fold(Region region) {
        return region;
    }

    public ConstGeneric fold(ConstGeneric cg) {
        return cg;
    }

    public GenericArgs fold(GenericArgs args) {
        if (args.isEmpty()) return args;
        List<Region> regions = new ArrayList<>(args.regions.size());
        for (Region region : args.regions) regions.add(fold(region));
        List<ConstGeneric> consts = new ArrayList<>(args.constGenerics.size());
        for (ConstGeneric cg : args.constGenerics) consts.add(fold(cg));
        List<TraitRef> refs = new ArrayList<>(args.traitRefs.size());
        for (TraitRef ref : args.traitRefs) refs.add(fold(ref));
        return new GenericArgs(regions, fold(args.types), consts, refs);
    }

    public TraitDeclRef fold(TraitDeclRef ref) {
        return new TraitDeclRef(ref.traitId, fold(ref.generics));
    }

    public TraitRef fold(TraitRef ref) {
        return new TraitRef(ref.instance, fold(ref.generics), fold(ref.traitDeclRef));
    }

    @Override
    public Ty visitAdt(Ty.Adt ty) {
        return new Ty.Adt(ty.id, fold(ty.generics));
    }

    @Override
    public Ty visitTypeVar(Ty.TypeVar ty) {
        return ty;
    }

    @Override
    public Ty visitLiteral(Ty.Literal ty) {
        return ty;
    }

    @Override
    public Ty visitNever(Ty.Never ty) {
        return ty;
    }

    @Override
    public Ty visitRef(Ty.Ref ty) {
        return new Ty.Ref(fold(ty.region), fold(ty.ty), ty.refKind);
    }

    @Override
    public Ty visitRawPtr(Ty.RawPtr ty) {
        return new Ty.RawPtr(fold(ty.ty), ty.refKind);
    }

    @Override
    public Ty visitTraitType(Ty.TraitType ty) {
        return new Ty.TraitType(fold(ty.traitRef), ty.name);
    }

    @Override
    public Ty visitArrow(Ty.Arrow ty) {
        return new Ty.Arrow(fold(ty.inputs), fold(ty.output));
    }
}
