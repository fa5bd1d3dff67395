package io.github.eutro.charonj.resolve;

import io.github.eutro.charonj.types.*;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One-way matching of a pattern against a target.
 * <p>
 * Type and const generic variables of the pattern bind to whatever they are matched against;
 * variables of the target are rigid, and only match a pattern variable or themselves.
 * Regions are ignored.
 */
public final class Unifier {
    private final Map<Integer, Ty> types = new HashMap<>();
    private final Map<Integer, ConstGeneric> consts = new HashMap<>();

    private Unifier() {
    }

    /**
     * Match the arguments of a trait reference pattern against a target.
     *
     * @param pattern The pattern, e.g. the trait an impl implements.
     * @param target  The target, e.g. an obligation.
     * @return The bindings, or null if the pattern does not match.
     */
    public static @Nullable Unifier match(GenericArgs pattern, GenericArgs target) {
        Unifier u = new Unifier();
        return u.args(pattern, target) ? u : null;
    }

    /**
     * Build the arguments for a set of generic parameters from these bindings.
     * Unbound variables are left as variables.
     *
     * @param params The parameters of the pattern.
     * @return The arguments, with no trait references.
     */
    public GenericArgs toArgs(GenericParams params) {
        List<Ty> tys = new ArrayList<>();
        for (int i = 0; i < params.types.size(); i++) {
            Ty bound = types.get(i);
            tys.add(bound == null ? new Ty.TypeVar(i) : bound);
        }
        List<ConstGeneric> cgs = new ArrayList<>();
        for (int i = 0; i < params.constGenerics.size(); i++) {
            ConstGeneric bound = consts.get(i);
            cgs.add(bound == null ? ConstGeneric.var(i) : bound);
        }
        List<Region> regions = new ArrayList<>();
        for (int i = 0; i < params.regions.size(); i++) {
            regions.add(Region.ERASED);
        }
        return new GenericArgs(regions, tys, cgs, new ArrayList<>());
    }

    private boolean args(GenericArgs pattern, GenericArgs target) {
        if (pattern.types.size() != target.types.size()) return false;
        if (pattern.constGenerics.size() != target.constGenerics.size()) return false;
        for (int i = 0; i < pattern.types.size(); i++) {
            if (!ty(pattern.types.get(i), target.types.get(i))) return false;
        }
        for (int i = 0; i < pattern.constGenerics.size(); i++) {
            if (!constGeneric(pattern.constGenerics.get(i), target.constGenerics.get(i))) return false;
        }
        return true;
    }

    private boolean constGeneric(ConstGeneric pattern, ConstGeneric target) {
        if (pattern.kind == ConstGeneric.Kind.VAR) {
            ConstGeneric bound = consts.get(pattern.index);
            if (bound == null) {
                consts.put(pattern.index, target);
                return true;
            }
            return bound.equals(target);
        }
        return pattern.equals(target);
    }

    private boolean tys(List<Ty> pattern, List<Ty> target) {
        if (pattern.size() != target.size()) return false;
        for (int i = 0; i < pattern.size(); i++) {
            if (!ty(pattern.get(i), target.get(i))) return false;
        }
        return true;
    }

    private boolean ty(Ty pattern, Ty target) {
        if (pattern instanceof Ty.TypeVar) {
            int index = ((Ty.TypeVar) pattern).index;
            Ty bound = types.get(index);
            if (bound == null) {
                types.put(index, target);
                return true;
            }
            return bound.equals(target);
        }
        return pattern.accept(new Ty.Visitor<Boolean>() {
            @Override
            public Boolean visitAdt(Ty.Adt p) {
                if (!(target instanceof Ty.Adt)) return false;
                Ty.Adt t = (Ty.Adt) target;
                return p.id.equals(t.id) && args(p.generics, t.generics);
            }

            @Override
            public Boolean visitTypeVar(Ty.TypeVar p) {
                throw new IllegalStateException();
            }

            @Override
            public Boolean visitLiteral(Ty.Literal p) {
                return p.equals(target);
            }

            @Override
            public Boolean visitNever(Ty.Never p) {
                return p.equals(target);
            }

            @Override
            public Boolean visitRef(Ty.Ref p) {
                if (!(target instanceof Ty.Ref)) return false;
                Ty.Ref t = (Ty.Ref) target;
                return p.refKind == t.refKind && ty(p.ty, t.ty);
            }

            @Override
            public Boolean visitRawPtr(Ty.RawPtr p) {
                if (!(target instanceof Ty.RawPtr)) return false;
                Ty.RawPtr t = (Ty.RawPtr) target;
                return p.refKind == t.refKind && ty(p.ty, t.ty);
            }

            @Override
            public Boolean visitTraitType(Ty.TraitType p) {
                return p.equals(target);
            }

            @Override
            public Boolean visitArrow(Ty.Arrow p) {
                if (!(target instanceof Ty.Arrow)) return false;
                Ty.Arrow t = (Ty.Arrow) target;
                return tys(p.inputs, t.inputs) && ty(p.output, t.output);
            }
        });
    }
}
