package io.github.eutro.charonj.resolve;

import io.github.eutro.charonj.decls.*;
import io.github.eutro.charonj.types.*;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves trait obligations to where they are satisfied.
 * <p>
 * An obligation is resolved, in order of preference, to:
 * <ol>
 *     <li>a where-clause of the scope, {@link TraitInstanceId.Clause};</li>
 *     <li>a clause implied by the parent clauses of a where-clause, {@link TraitInstanceId.ParentClause};</li>
 *     <li>{@code Self}, inside the declaration of the trait itself, {@link TraitInstanceId.SelfId};</li>
 *     <li>the single trait implementation that matches it, {@link TraitInstanceId.TraitImpl},
 *     with the implementation's own where-clauses resolved in turn;</li>
 *     <li>a builtin trait with no matching implementation, {@link TraitInstanceId.BuiltinOrAuto}.</li>
 * </ol>
 * Anything else is {@link TraitInstanceId.Unresolved}, and reported on the table as a {@link Diagnostic}.
 * <p>
 * Every trait implementation must be registered, with its implemented trait and generics, before
 * anything is resolved, since every one of them is a candidate.
 */
public final class TraitResolver {
    /**
     * How deep implementations' where-clauses are resolved before giving up.
     */
    public static final int MAX_DEPTH = 32;

    private final DeclTable table;

    public TraitResolver(DeclTable table) {
        this.table = table;
    }

    /**
     * Resolve an obligation, reporting a diagnostic for every part of it that could not be resolved.
     *
     * @param obligation The obligation.
     * @param scope      The scope it occurs in.
     * @return The trait reference.
     */
    public TraitRef resolve(TraitDeclRef obligation, Scope scope) {
        List<String> failures = new ArrayList<>();
        TraitRef ref = resolve(obligation, scope, 0, failures);
        for (String failure : failures) {
            table.report(new Diagnostic(Diagnostic.Kind.UNRESOLVED_CLAUSE, scope.owner, failure));
        }
        return ref;
    }

    /**
     * Resolve the where-clauses of an item, instantiated with the arguments it is used with.
     *
     * @param params The generics of the item.
     * @param args   The arguments it is used with; their trait references are ignored.
     * @param scope  The scope of the use.
     * @return The arguments, with the trait references filled in.
     */
    public GenericArgs resolveArgs(GenericParams params, GenericArgs args, Scope scope) {
        Substitution subst = Substitution.of(args.withTraitRefs(new ArrayList<>()));
        List<TraitRef> refs = new ArrayList<>();
        for (TraitClause clause : params.traitClauses) {
            refs.add(resolve(subst.instantiate(clause), scope));
        }
        return args.withTraitRefs(refs);
    }

    private TraitRef resolve(TraitDeclRef obligation, Scope scope, int depth, List<String> failures) {
        for (TraitClause clause : scope.params.traitClauses) {
            if (sameArgs(clause.asDeclRef(), obligation)) {
                return new TraitRef(new TraitInstanceId.Clause(clause.clauseId), GenericArgs.EMPTY, obligation);
            }
        }
        for (TraitClause clause : scope.params.traitClauses) {
            TraitInstanceId found = searchParents(
                    new TraitInstanceId.Clause(clause.clauseId), clause.asDeclRef(), obligation, 0);
            if (found != null) return new TraitRef(found, GenericArgs.EMPTY, obligation);
        }
        if (scope.selfTrait != null) {
            TraitDeclRef self = selfRef(scope.selfTrait);
            if (sameArgs(self, obligation)) {
                return new TraitRef(TraitInstanceId.SELF, GenericArgs.EMPTY, obligation);
            }
            TraitInstanceId found = searchParents(TraitInstanceId.SELF, self, obligation, 0);
            if (found != null) return new TraitRef(found, GenericArgs.EMPTY, obligation);
        }

        List<TraitImpl> candidates = new ArrayList<>();
        List<Unifier> bindings = new ArrayList<>();
        for (TraitImpl impl : table.getTraitImpls()) {
            if (impl.implTrait == null || !impl.implTrait.traitId.equals(obligation.traitId)) continue;
            Unifier u = Unifier.match(impl.implTrait.generics, obligation.generics);
            if (u != null) {
                candidates.add(impl);
                bindings.add(u);
            }
        }
        if (candidates.size() == 1) {
            TraitImpl impl = candidates.get(0);
            GenericArgs implArgs = bindings.get(0).toArgs(impl.generics);
            if (depth >= MAX_DEPTH) {
                return unresolved(obligation, "recursion limit reached resolving " + obligation, failures);
            }
            Substitution subst = Substitution.of(implArgs);
            List<TraitRef> refs = new ArrayList<>();
            for (TraitClause clause : impl.generics.traitClauses) {
                refs.add(resolve(subst.instantiate(clause), scope, depth + 1, failures));
            }
            return new TraitRef(new TraitInstanceId.TraitImpl(impl.id), implArgs.withTraitRefs(refs), obligation);
        }
        TraitDecl trait = table.getTraitDecl(obligation.traitId);
        if (candidates.isEmpty() && trait.builtin) {
            return new TraitRef(new TraitInstanceId.BuiltinOrAuto(trait.id), GenericArgs.EMPTY, obligation);
        }
        String reason = candidates.isEmpty()
                ? "no implementation of " + trait.name + " for " + obligation.generics
                : candidates.size() + " implementations of " + trait.name + " match " + obligation.generics;
        return unresolved(obligation, reason, failures);
    }

    private static TraitRef unresolved(TraitDeclRef obligation, String reason, List<String> failures) {
        failures.add(reason);
        return new TraitRef(new TraitInstanceId.Unresolved(reason), GenericArgs.EMPTY, obligation);
    }

    private static boolean sameArgs(TraitDeclRef a, TraitDeclRef b) {
        return a.traitId.equals(b.traitId)
                && a.generics.types.equals(b.generics.types)
                && a.generics.constGenerics.equals(b.generics.constGenerics);
    }

    /**
     * The reference {@code Self: Trait<P1, ..>} a trait declaration makes to itself.
     */
    private TraitDeclRef selfRef(DeclId traitId) {
        TraitDecl trait = table.getTraitDecl(traitId);
        List<Ty> tys = new ArrayList<>();
        for (int i = 0; i < trait.generics.types.size(); i++) tys.add(new Ty.TypeVar(i));
        List<ConstGeneric> cgs = new ArrayList<>();
        for (int i = 0; i < trait.generics.constGenerics.size(); i++) cgs.add(ConstGeneric.var(i));
        return new TraitDeclRef(traitId, new GenericArgs(new ArrayList<>(), tys, cgs, new ArrayList<>()));
    }

    private @Nullable TraitInstanceId searchParents(TraitInstanceId instance,
                                                    TraitDeclRef ref,
                                                    TraitDeclRef obligation,
                                                    int depth) {
        if (depth >= MAX_DEPTH) return null;
        TraitDecl trait = table.getTraitDecl(ref.traitId);
        Substitution subst = Substitution.of(ref.generics);
        for (TraitClause parent : trait.parentClauses) {
            TraitDeclRef parentRef = subst.instantiate(parent);
            TraitInstanceId parentInstance = new TraitInstanceId.ParentClause(instance, ref.traitId, parent.clauseId);
            if (sameArgs(parentRef, obligation)) return parentInstance;
            TraitInstanceId found = searchParents(parentInstance, parentRef, obligation, depth + 1);
            if (found != null) return found;
        }
        return null;
    }

    /**
     * Replace every associated type projection whose trait reference resolved to an implementation
     * by the type the implementation gives it.
     *
     * @param ty The type.
     * @return The normalised type.
     */
    public Ty normalize(Ty ty) {
        return new TyFolder() {
            @Override
            public Ty visitTraitType(Ty.TraitType tt) {
                TraitRef ref = fold(tt.traitRef);
                if (ref.instance instanceof TraitInstanceId.TraitImpl) {
                    TraitImpl impl = table.getTraitImpl(((TraitInstanceId.TraitImpl) ref.instance).implId);
                    Ty assoc = impl.assocTypes.get(tt.name);
                    if (assoc != null) {
                        return fold(Substitution.of(ref.generics).fold(assoc));
                    }
                }
                return new Ty.TraitType(ref, tt.name);
            }
        }.fold(ty);
    }
}
