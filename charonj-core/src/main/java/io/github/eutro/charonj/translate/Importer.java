package io.github.eutro.charonj.translate;

import io.github.eutro.charonj.decls.*;
import io.github.eutro.charonj.feed.Feed;
import io.github.eutro.charonj.names.Name;
import io.github.eutro.charonj.passes.misc.ForPass;
import io.github.eutro.charonj.passes.opts.EliminateDeadBlocks;
import io.github.eutro.charonj.resolve.Scope;
import io.github.eutro.charonj.resolve.Substitution;
import io.github.eutro.charonj.resolve.TraitResolver;
import io.github.eutro.charonj.types.*;
import io.github.eutro.charonj.ullbc.UllbcBody;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Imports a crate from the feed into a {@link DeclTable}.
 * <p>
 * Items are registered when they are first referenced, and imported from a worklist seeded with
 * the local items of the crate, in feed order. Items of other crates are only imported if
 * something refers to them. Trait implementations are the exception: all of them are registered,
 * with their implemented traits, before anything else, since every implementation is a candidate
 * for every obligation.
 */
public final class Importer {
    private final Feed.Crate crate;
    private final TranslateConfig config;
    private final DeclTable table;
    private final TraitResolver resolver;
    private final TypeTranslator types;

    private final Map<String, Feed.Item> items = new HashMap<>();
    private final Map<String, DeclId> ids = new HashMap<>();
    private final Map<DeclId, Feed.Item> itemOf = new HashMap<>();
    private final Set<DeclId> headers = new HashSet<>();
    private final Set<DeclId> imported = new HashSet<>();
    private final Deque<Feed.Item> worklist = new ArrayDeque<>();

    private Importer(Feed.Crate crate, TranslateConfig config) {
        this.crate = crate;
        this.config = config;
        this.table = new DeclTable(crate.name);
        this.resolver = new TraitResolver(table);
        this.types = new TypeTranslator(this, resolver);
    }

    /**
     * Import a crate.
     *
     * @param crate  The crate.
     * @param config The configuration, for which items are opaque.
     * @return The declarations of the crate, not yet frozen.
     * @throws MalformedFeedException If the feed is malformed.
     */
    public static DeclTable importCrate(Feed.Crate crate, TranslateConfig config) {
        Importer importer = new Importer(crate, config);
        importer.run();
        return importer.table;
    }

    DeclTable getTable() {
        return table;
    }

    private void run() {
        for (Feed.Item item : crate.items) {
            if (item == null || item.name == null) throw new MalformedFeedException("item without a name");
            kindOf(item);
            if (items.put(item.name, item) != null) {
                throw new MalformedFeedException("duplicate item name " + item.name);
            }
        }

        List<DeclId> impls = new ArrayList<>();
        for (Feed.Item item : crate.items) {
            if (kindOf(item) == DeclId.Kind.TRAIT_IMPL) impls.add(ref(item.name, DeclId.Kind.TRAIT_IMPL));
        }
        for (DeclId impl : impls) {
            importImplHeader(table.getTraitImpl(impl), itemOf.get(impl));
        }
        for (DeclId impl : impls) {
            importImplAssocTypes(table.getTraitImpl(impl), itemOf.get(impl));
        }

        for (Feed.Item item : crate.items) {
            if (item.local) worklist.add(item);
        }
        while (!worklist.isEmpty()) {
            Feed.Item item = worklist.poll();
            DeclId id = ref(item.name, kindOf(item));
            if (imported.add(id)) {
                importItem(table.lookup(id), item);
            }
        }
        ForPass.liftUllbcBodies(EliminateDeadBlocks.INSTANCE).runInPlace(table);
    }

    private static DeclId.Kind kindOf(Feed.Item item) {
        for (DeclId.Kind kind : DeclId.Kind.values()) {
            if (kind.feedName.equals(item.kind)) return kind;
        }
        throw new MalformedFeedException("item " + item.name + " has unknown kind '" + item.kind + "'");
    }

    /**
     * Get the id of a referenced item, registering it and queueing it for import if it is new.
     *
     * @param name The name of the item.
     * @param kind The kind of item expected.
     * @return Its id.
     * @throws MalformedFeedException If there is no such item, or it is of the wrong kind.
     */
    DeclId ref(String name, DeclId.Kind kind) {
        DeclId id = ids.get(name);
        if (id != null) {
            if (id.kind != kind) throw wrongKind(name, id.kind, kind);
            return id;
        }
        Feed.Item item = items.get(name);
        if (item == null) throw new MalformedFeedException("reference to unknown item " + name);
        DeclId.Kind actual = kindOf(item);
        if (actual != kind) throw wrongKind(name, actual, kind);

        Name parsed;
        try {
            parsed = Name.parse(name);
        } catch (IllegalArgumentException e) {
            throw new MalformedFeedException("bad item name " + name, e);
        }
        id = table.register(kind, parsed);
        ids.put(name, id);
        itemOf.put(id, item);
        Declaration decl = table.lookup(id);
        decl.isLocal = item.local;
        decl.opaque = item.opaque || config.isOpaque(parsed);
        worklist.add(item);
        if (kind == DeclId.Kind.TRAIT_DECL) {
            importTraitHeader((TraitDecl) decl, item);
        }
        return id;
    }

    private static MalformedFeedException wrongKind(String name, DeclId.Kind actual, DeclId.Kind expected) {
        return new MalformedFeedException("item " + name + " is a " + actual.feedName
                + ", referenced as a " + expected.feedName);
    }

    /**
     * Get the generics of a function, importing its signature if it has not been yet.
     */
    GenericParams funGenerics(DeclId fun) {
        FunDecl decl = table.getFun(fun);
        importFunHeader(decl, itemOf.get(fun));
        return decl.generics;
    }

    private void importItem(Declaration decl, Feed.Item item) {
        switch (decl.id.kind) {
            case TYPE:
                importType((TypeDecl) decl, item);
                break;
            case FUN:
                importFun((FunDecl) decl, item);
                break;
            case GLOBAL:
                importGlobal((GlobalDecl) decl, item);
                break;
            case TRAIT_DECL:
                importTrait((TraitDecl) decl, item);
                break;
            case TRAIT_IMPL:
                importImpl((TraitImpl) decl, item);
                break;
        }
    }

    private void importObligations(Declaration decl, Feed.Item item, Scope scope) {
        List<TraitRef> obligations = new ArrayList<>();
        for (Feed.Clause clause : item.obligations) {
            obligations.add(resolver.resolve(types.clause(clause, scope), scope));
        }
        decl.obligations = obligations;
    }

    private void importType(TypeDecl decl, Feed.Item item) {
        Scope scope = new Scope(decl, GenericParams.EMPTY, null);
        decl.generics = types.generics(item.generics, item.predicates, scope);
        scope = Scope.of(decl);
        importObligations(decl, item, scope);
        if (decl.opaque || item.adt == null || item.adt.equals("opaque")) {
            decl.kind = TypeDecl.Kind.OPAQUE;
            return;
        }
        switch (item.adt) {
            case "struct":
                decl.kind = TypeDecl.Kind.STRUCT;
                decl.fields = fields(item.fields, scope);
                break;
            case "enum": {
                decl.kind = TypeDecl.Kind.ENUM;
                List<TypeDecl.Variant> variants = new ArrayList<>();
                Set<Literal> seen = new HashSet<>();
                for (Feed.Variant variant : item.variants) {
                    LiteralTy discrTy = types.literalTy(variant.discriminantTy == null ? "isize" : variant.discriminantTy, scope);
                    if (!discrTy.isInteger()) {
                        throw new MalformedFeedException("non-integer discriminant type in " + decl);
                    }
                    Literal discr = variant.discriminant == null
                            ? Literal.integer(discrTy, variants.size())
                            : types.literal(discrTy, variant.discriminant, scope);
                    if (!seen.add(discr)) {
                        throw new MalformedFeedException("duplicate discriminant " + discr + " in " + decl);
                    }
                    variants.add(new TypeDecl.Variant(
                            TypeTranslator.required(variant.name, "variant name", scope),
                            fields(variant.fields, scope),
                            discr));
                }
                decl.variants = variants;
                break;
            }
            default:
                decl.kind = TypeDecl.Kind.ERROR;
                decl.error = "unknown type definition '" + item.adt + "'";
                table.report(new Diagnostic(Diagnostic.Kind.UNSUPPORTED_CONSTRUCT, decl, decl.error));
                break;
        }
    }

    private List<TypeDecl.Field> fields(List<Feed.Field> fields, Scope scope) {
        List<TypeDecl.Field> out = new ArrayList<>(fields.size());
        for (Feed.Field field : fields) {
            out.add(new TypeDecl.Field(field.name, types.translate(field.ty, scope)));
        }
        return out;
    }

    private @Nullable DeclId selfTraitOf(Feed.Item item) {
        if (item.methodOf != null && item.methodOf.impl == null && item.methodOf.trait != null) {
            return ref(item.methodOf.trait, DeclId.Kind.TRAIT_DECL);
        }
        return null;
    }

    private void importFunHeader(FunDecl decl, Feed.Item item) {
        if (!headers.add(decl.id)) return;
        DeclId selfTrait = selfTraitOf(item);
        decl.generics = types.generics(item.generics, item.predicates, new Scope(decl, GenericParams.EMPTY, selfTrait));
        Scope scope = new Scope(decl, decl.generics, selfTrait);
        decl.sig = new FunSig(item.unsafe,
                types.translate(item.inputs, scope),
                item.output == null ? Ty.UNIT : types.translate(item.output, scope));
        Feed.MethodOf of = item.methodOf;
        if (of != null) {
            String method = TypeTranslator.required(of.method, "method name", scope);
            if (of.impl != null) {
                DeclId impl = ref(of.impl, DeclId.Kind.TRAIT_IMPL);
                TraitDeclRef implTrait = table.getTraitImpl(impl).implTrait;
                if (implTrait == null) throw new MalformedFeedException("impl " + of.impl + " implements no trait");
                decl.kind = FunKind.traitMethodImpl(impl, implTrait.traitId, method);
            } else if (selfTrait != null) {
                decl.kind = FunKind.traitMethodDecl(selfTrait, method, of.provided);
            } else {
                throw new MalformedFeedException("method " + decl.name + " belongs to neither a trait nor an impl");
            }
        }
    }

    private void importFun(FunDecl decl, Feed.Item item) {
        importFunHeader(decl, item);
        Scope scope = new Scope(decl, decl.generics, selfTraitOf(item));
        importObligations(decl, item, scope);
        if (!decl.opaque && item.body != null) {
            decl.body = importBody(decl, item.body, scope);
        }
    }

    private void importGlobal(GlobalDecl decl, Feed.Item item) {
        decl.generics = types.generics(item.generics, item.predicates, new Scope(decl, GenericParams.EMPTY, null));
        Scope scope = Scope.of(decl);
        decl.ty = types.translate(item.ty, scope);
        importObligations(decl, item, scope);
        if (!decl.opaque && item.body != null) {
            decl.body = importBody(decl, item.body, scope);
        }
    }

    private @Nullable UllbcBody importBody(Declaration decl, Feed.Body body, Scope scope) {
        try {
            return new BodyBuilder(this, types, resolver, scope).build(body);
        } catch (UnsupportedConstructException e) {
            decl.opaque = true;
            table.report(new Diagnostic(Diagnostic.Kind.UNSUPPORTED_CONSTRUCT, decl, e.getMessage()));
            return null;
        }
    }

    /**
     * Import what other items need to know about a trait: its generics, parents, associated types and methods.
     * Called as soon as the trait is registered.
     */
    private void importTraitHeader(TraitDecl decl, Feed.Item item) {
        if (!headers.add(decl.id)) return;
        decl.builtin = item.builtin;
        List<String> assocTypes = new ArrayList<>();
        for (Feed.AssocType assoc : item.assocTypes) {
            assocTypes.add(assoc.name);
        }
        decl.assocTypes = assocTypes;
        decl.generics = types.generics(item.generics, item.predicates, new Scope(decl, GenericParams.EMPTY, decl.id));
        if (decl.generics.types.isEmpty()) {
            throw new MalformedFeedException("trait " + decl.name + " has no Self type parameter");
        }
        Scope scope = new Scope(decl, decl.generics, decl.id);
        List<TraitClause> parents = new ArrayList<>();
        for (Feed.Clause parent : item.parents) {
            TraitDeclRef ref = types.clause(parent, scope);
            parents.add(new TraitClause(parents.size(), ref.traitId, ref.generics));
        }
        decl.parentClauses = parents;
        List<TraitDecl.Method> methods = new ArrayList<>();
        for (Feed.Method method : item.methods) {
            methods.add(new TraitDecl.Method(
                    TypeTranslator.required(method.name, "method name", scope),
                    method.fun == null ? null : ref(method.fun, DeclId.Kind.FUN),
                    method.provided));
        }
        decl.methods = methods;
    }

    private void importTrait(TraitDecl decl, Feed.Item item) {
        Scope scope = new Scope(decl, decl.generics, decl.id);
        List<TraitDecl.AssocConst> consts = new ArrayList<>();
        for (Feed.AssocConst assoc : item.consts) {
            consts.add(new TraitDecl.AssocConst(
                    TypeTranslator.required(assoc.name, "constant name", scope),
                    types.translate(assoc.ty, scope),
                    assoc.value == null ? null : ref(assoc.value, DeclId.Kind.GLOBAL)));
        }
        decl.consts = consts;
        importObligations(decl, item, scope);
    }

    private void importImplHeader(TraitImpl decl, Feed.Item item) {
        if (!headers.add(decl.id)) return;
        decl.generics = types.generics(item.generics, item.predicates, new Scope(decl, GenericParams.EMPTY, null));
        decl.implTrait = types.clause(
                TypeTranslator.required(item.trait, "implemented trait", Scope.of(decl)),
                Scope.of(decl));
    }

    private void importImplAssocTypes(TraitImpl decl, Feed.Item item) {
        Scope scope = Scope.of(decl);
        TraitDecl trait = table.getTraitDecl(Objects.requireNonNull(decl.implTrait).traitId);
        Map<String, Ty> assocTypes = new LinkedHashMap<>();
        for (Feed.AssocType assoc : item.assocTypes) {
            if (!trait.assocTypes.contains(assoc.name)) {
                throw new MalformedFeedException("trait " + trait.name + " has no associated type "
                        + assoc.name + ", in " + decl);
            }
            assocTypes.put(assoc.name, types.translate(assoc.ty, scope));
        }
        decl.assocTypes = assocTypes;
    }

    private void importImpl(TraitImpl decl, Feed.Item item) {
        Scope scope = Scope.of(decl);
        TraitDeclRef implTrait = Objects.requireNonNull(decl.implTrait);
        TraitDecl trait = table.getTraitDecl(implTrait.traitId);
        Substitution subst = Substitution.of(implTrait.generics);
        List<TraitRef> parents = new ArrayList<>();
        for (TraitClause parent : trait.parentClauses) {
            parents.add(resolver.resolve(subst.instantiate(parent), scope));
        }
        decl.parentTraitRefs = parents;
        Map<String, DeclId> consts = new LinkedHashMap<>();
        for (Feed.AssocConst assoc : item.consts) {
            consts.put(assoc.name, ref(TypeTranslator.required(assoc.value, "constant value", scope), DeclId.Kind.GLOBAL));
        }
        decl.consts = consts;
        Map<String, DeclId> methods = new LinkedHashMap<>();
        for (Feed.Method method : item.methods) {
            if (trait.getMethod(method.name) == null) {
                throw new MalformedFeedException("trait " + trait.name + " has no method " + method.name + ", in " + decl);
            }
            methods.put(method.name, ref(TypeTranslator.required(method.fun, "method function", scope), DeclId.Kind.FUN));
        }
        decl.methods = methods;
        importObligations(decl, item, scope);
    }
}
