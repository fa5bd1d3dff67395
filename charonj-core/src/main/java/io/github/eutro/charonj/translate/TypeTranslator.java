package io.github.eutro.charonj.translate;

import io.github.eutro.charonj.decls.DeclId;
import io.github.eutro.charonj.decls.MalformedFeedException;
import io.github.eutro.charonj.feed.Feed;
import io.github.eutro.charonj.resolve.Scope;
import io.github.eutro.charonj.resolve.TraitResolver;
import io.github.eutro.charonj.types.*;
import org.jetbrains.annotations.Nullable;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Translates the types, literals and generics of the feed, registering the items they name.
 */
final class TypeTranslator {
    private final Importer importer;
    private final TraitResolver resolver;

    TypeTranslator(Importer importer, TraitResolver resolver) {
        this.importer = importer;
        this.resolver = resolver;
    }

    Ty translate(@Nullable Feed.Ty ty, Scope scope) {
        if (ty == null) throw new MalformedFeedException("missing type in " + scope.owner);
        if (ty.kind == null) throw new MalformedFeedException("type without a kind in " + scope.owner);
        switch (ty.kind) {
            case "adt":
                return new Ty.Adt(TypeId.adt(importer.ref(required(ty.name, "adt name", scope), DeclId.Kind.TYPE)),
                        args(ty.args, ty.constArgs, scope));
            case "tuple":
                return Ty.tuple(translate(ty.args, scope));
            case "box":
                return new Ty.Adt(TypeId.BOX, GenericArgs.ofTypes(elem(ty, scope)));
            case "slice":
                return new Ty.Adt(TypeId.SLICE, GenericArgs.ofTypes(elem(ty, scope)));
            case "array": {
                if (ty.constArgs.size() != 1) {
                    throw new MalformedFeedException("array type without a length in " + scope.owner);
                }
                List<ConstGeneric> len = new ArrayList<>();
                len.add(constArg(ty.constArgs.get(0), scope));
                return new Ty.Adt(TypeId.ARRAY, new GenericArgs(new ArrayList<>(), elem(ty, scope), len, new ArrayList<>()));
            }
            case "str":
                return new Ty.Adt(TypeId.STR, GenericArgs.EMPTY);
            case "var": {
                int index = required(ty.index, "type variable index", scope);
                if (index < 0 || index >= scope.params.types.size()) {
                    throw new MalformedFeedException("type variable " + index + " out of range in " + scope.owner);
                }
                return new Ty.TypeVar(index);
            }
            case "never":
                return Ty.NEVER;
            case "ref":
                return new Ty.Ref(region(ty.region, scope), translate(ty.ty, scope), ty.isMut ? RefKind.MUT : RefKind.SHARED);
            case "ptr":
                return new Ty.RawPtr(translate(ty.ty, scope), ty.isMut ? RefKind.MUT : RefKind.SHARED);
            case "projection": {
                TraitDeclRef obligation = clause(required(ty.trait, "projection trait", scope), scope);
                String item = required(ty.item, "projection item", scope);
                if (!importer.getTable().getTraitDecl(obligation.traitId).assocTypes.contains(item)) {
                    throw new MalformedFeedException("trait " + ty.trait.trait + " has no associated type "
                            + item + ", in " + scope.owner);
                }
                return resolver.normalize(new Ty.TraitType(resolver.resolve(obligation, scope), item));
            }
            case "fn":
                return new Ty.Arrow(translate(ty.inputs, scope), translate(ty.output, scope));
            default: {
                LiteralTy lit = LiteralTy.fromText(ty.kind);
                if (lit == null) {
                    throw new MalformedFeedException("unknown type kind '" + ty.kind + "' in " + scope.owner);
                }
                return Ty.literal(lit);
            }
        }
    }

    private List<Ty> elem(Feed.Ty ty, Scope scope) {
        List<Ty> tys = new ArrayList<>();
        tys.add(translate(ty.ty, scope));
        return tys;
    }

    List<Ty> translate(List<Feed.Ty> tys, Scope scope) {
        List<Ty> out = new ArrayList<>(tys.size());
        for (Feed.Ty ty : tys) {
            out.add(translate(ty, scope));
        }
        return out;
    }

    GenericArgs args(List<Feed.Ty> tys, List<Feed.ConstArg> consts, Scope scope) {
        List<ConstGeneric> cgs = new ArrayList<>(consts.size());
        for (Feed.ConstArg arg : consts) {
            cgs.add(constArg(arg, scope));
        }
        return new GenericArgs(new ArrayList<>(), translate(tys, scope), cgs, new ArrayList<>());
    }

    ConstGeneric constArg(Feed.ConstArg arg, Scope scope) {
        if (arg.var != null) {
            if (arg.var < 0 || arg.var >= scope.params.constGenerics.size()) {
                throw new MalformedFeedException("const generic variable " + arg.var + " out of range in " + scope.owner);
            }
            return ConstGeneric.var(arg.var);
        }
        if (arg.global != null) {
            return ConstGeneric.global(importer.ref(arg.global, DeclId.Kind.GLOBAL));
        }
        if (arg.value != null) {
            return ConstGeneric.value(literal(literalTy(arg.ty == null ? "usize" : arg.ty, scope), arg.value, scope));
        }
        throw new MalformedFeedException("empty const generic argument in " + scope.owner);
    }

    TraitDeclRef clause(Feed.Clause clause, Scope scope) {
        DeclId trait = importer.ref(required(clause.trait, "clause trait", scope), DeclId.Kind.TRAIT_DECL);
        if (clause.args.isEmpty()) {
            throw new MalformedFeedException("clause on " + clause.trait + " without a Self type in " + scope.owner);
        }
        return new TraitDeclRef(trait, args(clause.args, clause.constArgs, scope));
    }

    /**
     * Translate the generic parameters and where-clauses of an item. Where-clauses are numbered
     * in the order they are declared, and may refer to every parameter.
     */
    GenericParams generics(Feed.Generics generics, List<Feed.Clause> predicates, Scope scope) {
        List<GenericParams.Param> regions = new ArrayList<>();
        for (String name : generics.regions) {
            regions.add(new GenericParams.Param(regions.size(), name));
        }
        List<GenericParams.Param> types = new ArrayList<>();
        for (String name : generics.types) {
            types.add(new GenericParams.Param(types.size(), name));
        }
        List<GenericParams.ConstParam> consts = new ArrayList<>();
        for (Feed.ConstParam cp : generics.consts) {
            LiteralTy ty = literalTy(cp.ty, scope);
            if (!ty.isInteger() && ty != LiteralTy.BOOL && ty != LiteralTy.CHAR) {
                throw new MalformedFeedException("bad const generic type " + cp.ty + " in " + scope.owner);
            }
            consts.add(new GenericParams.ConstParam(consts.size(), cp.name, ty));
        }
        GenericParams params = new GenericParams(regions, types, consts, new ArrayList<>());
        Scope inner = new Scope(scope.owner, params, scope.selfTrait);
        List<TraitClause> clauses = new ArrayList<>();
        for (Feed.Clause predicate : predicates) {
            TraitDeclRef ref = clause(predicate, inner);
            clauses.add(new TraitClause(clauses.size(), ref.traitId, ref.generics));
        }
        return params.withTraitClauses(clauses);
    }

    Region region(@Nullable String region, Scope scope) {
        if (region == null || region.equals("erased")) return Region.ERASED;
        if (region.equals("static")) return Region.STATIC;
        int index;
        try {
            index = Integer.parseInt(region);
        } catch (NumberFormatException e) {
            throw new MalformedFeedException("bad region '" + region + "' in " + scope.owner, e);
        }
        if (index < 0 || index >= scope.params.regions.size()) {
            throw new MalformedFeedException("region variable " + index + " out of range in " + scope.owner);
        }
        return Region.var(index);
    }

    LiteralTy literalTy(@Nullable String text, Scope scope) {
        LiteralTy ty = text == null ? null : LiteralTy.fromText(text);
        if (ty == null) throw new MalformedFeedException("unknown literal type '" + text + "' in " + scope.owner);
        return ty;
    }

    /**
     * Parse a literal: {@code true}/{@code false} for booleans, a single character or a code point
     * for characters, and a decimal integer otherwise.
     */
    Literal literal(LiteralTy ty, String text, Scope scope) {
        if (ty == LiteralTy.BOOL) {
            if (text.equals("true")) return Literal.bool(true);
            if (text.equals("false")) return Literal.bool(false);
            throw new MalformedFeedException("bad bool literal '" + text + "' in " + scope.owner);
        }
        if (ty == LiteralTy.CHAR && text.codePointCount(0, text.length()) == 1) {
            return Literal.character(text.codePointAt(0));
        }
        BigInteger value;
        try {
            value = new BigInteger(text);
        } catch (NumberFormatException e) {
            throw new MalformedFeedException("bad " + ty.text + " literal '" + text + "' in " + scope.owner, e);
        }
        if (!ty.fits(value)) {
            throw new MalformedFeedException("literal " + text + " does not fit in " + ty.text + ", in " + scope.owner);
        }
        return Literal.of(ty, value);
    }

    static <T> T required(@Nullable T value, String what, Scope scope) {
        if (value == null) throw new MalformedFeedException("missing " + what + " in " + scope.owner);
        return value;
    }
}
