package io.github.eutro.charonj.decls;

import io.github.eutro.charonj.names.Name;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.*;

/**
 * Every declaration of one crate, addressed by {@link DeclId}.
 * <p>
 * The table only grows: declarations are {@link #register(DeclId.Kind, Name) registered} as stubs,
 * then filled in. Once {@link #freeze() frozen}, no new declarations may be registered, and the
 * table may be read from multiple threads.
 */
public final class DeclTable {
    public final String crateName;
    private final Map<DeclId.Kind, List<Declaration>> decls = new EnumMap<>(DeclId.Kind.class);
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private volatile boolean frozen = false;

    public DeclTable(String crateName) {
        this.crateName = crateName;
        for (DeclId.Kind kind : DeclId.Kind.values()) {
            decls.put(kind, new ArrayList<>());
        }
    }

    /**
     * Register a new declaration, as an empty stub of the given kind.
     *
     * @param kind The kind of declaration.
     * @param name The name of the declaration.
     * @return The fresh id of the declaration.
     * @throws IllegalStateException If the table is frozen.
     */
    public DeclId register(DeclId.Kind kind, Name name) {
        checkNotFrozen();
        List<Declaration> ls = decls.get(kind);
        DeclId id = DeclId.of(kind, ls.size());
        ls.add(createStub(id, name));
        return id;
    }

    /**
     * Add a fully formed declaration, whose id must be the next of its kind.
     *
     * @param decl The declaration.
     * @throws IllegalStateException If the table is frozen.
     * @throws IllegalArgumentException If the id of the declaration is not the next one.
     */
    public void restore(Declaration decl) {
        checkNotFrozen();
        List<Declaration> ls = decls.get(decl.id.kind);
        if (decl.id.index != ls.size()) {
            throw new IllegalArgumentException("Expected " + DeclId.of(decl.id.kind, ls.size()) + ", got " + decl.id);
        }
        ls.add(decl);
    }

    private static Declaration createStub(DeclId id, Name name) {
        switch (id.kind) {
            case TYPE:
                return new TypeDecl(id, name);
            case FUN:
                return new FunDecl(id, name);
            case GLOBAL:
                return new GlobalDecl(id, name);
            case TRAIT_DECL:
                return new TraitDecl(id, name);
            case TRAIT_IMPL:
                return new TraitImpl(id, name);
            default:
                throw new IllegalArgumentException(id.kind.toString());
        }
    }

    private void checkNotFrozen() {
        if (frozen) {
            throw new IllegalStateException("Declaration table of " + crateName + " is frozen");
        }
    }

    /**
     * Freeze the table. Idempotent.
     */
    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Look up a declaration.
     *
     * @param id The id of the declaration.
     * @return The declaration.
     * @throws UnknownIdException If no such declaration was registered.
     */
    @NotNull
    public Declaration lookup(DeclId id) {
        List<Declaration> ls = decls.get(id.kind);
        if (id.index >= ls.size()) {
            throw new UnknownIdException(id, "Unknown declaration " + id + " in " + crateName);
        }
        return ls.get(id.index);
    }

    @Contract("_, _ -> new")
    private static UnknownIdException wrongKind(DeclId id, DeclId.Kind expected) {
        return new UnknownIdException(id, "Expected a " + expected.feedName + " declaration, got " + id);
    }

    private <T extends Declaration> T lookup(DeclId id, DeclId.Kind kind, Class<T> type) {
        if (id.kind != kind) throw wrongKind(id, kind);
        return type.cast(lookup(id));
    }

    public TypeDecl getType(DeclId id) {
        return lookup(id, DeclId.Kind.TYPE, TypeDecl.class);
    }

    public FunDecl getFun(DeclId id) {
        return lookup(id, DeclId.Kind.FUN, FunDecl.class);
    }

    public GlobalDecl getGlobal(DeclId id) {
        return lookup(id, DeclId.Kind.GLOBAL, GlobalDecl.class);
    }

    public TraitDecl getTraitDecl(DeclId id) {
        return lookup(id, DeclId.Kind.TRAIT_DECL, TraitDecl.class);
    }

    public TraitImpl getTraitImpl(DeclId id) {
        return lookup(id, DeclId.Kind.TRAIT_IMPL, TraitImpl.class);
    }

    public int size(DeclId.Kind kind) {
        return decls.get(kind).size();
    }

    /**
     * Get every declaration of a kind, in id order.
     *
     * @param kind The kind.
     * @return The declarations.
     */
    public List<Declaration> getAll(DeclId.Kind kind) {
        return Collections.unmodifiableList(decls.get(kind));
    }

    /**
     * Get every declaration, grouped by kind in {@link DeclId.Kind} order, then in id order.
     *
     * @return The declarations.
     */
    public List<Declaration> getAll() {
        List<Declaration> all = new ArrayList<>();
        for (List<Declaration> ls : decls.values()) {
            all.addAll(ls);
        }
        return all;
    }

    @SuppressWarnings("unchecked")
    private <T extends Declaration> List<T> typed(DeclId.Kind kind) {
        return (List<T>) (List<?>) Collections.unmodifiableList(decls.get(kind));
    }

    public List<TypeDecl> getTypes() {
        return typed(DeclId.Kind.TYPE);
    }

    public List<FunDecl> getFuns() {
        return typed(DeclId.Kind.FUN);
    }

    public List<GlobalDecl> getGlobals() {
        return typed(DeclId.Kind.GLOBAL);
    }

    public List<TraitDecl> getTraitDecls() {
        return typed(DeclId.Kind.TRAIT_DECL);
    }

    public List<TraitImpl> getTraitImpls() {
        return typed(DeclId.Kind.TRAIT_IMPL);
    }

    /**
     * Get every declaration that may carry a body: functions, then globals, each in id order.
     *
     * @return The body owners.
     */
    public List<BodyOwner> getBodyOwners() {
        List<BodyOwner> owners = new ArrayList<>(getFuns());
        owners.addAll(getGlobals());
        return owners;
    }

    /**
     * Record a diagnostic.
     *
     * @param diagnostic The diagnostic.
     */
    public synchronized void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    /**
     * Get every diagnostic, in the order they were reported.
     *
     * @return The diagnostics.
     */
    public synchronized List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DeclTable that = (DeclTable) o;
        return crateName.equals(that.crateName)
                && decls.equals(that.decls)
                && getDiagnostics().equals(that.getDiagnostics());
    }

    @Override
    public int hashCode() {
        return Objects.hash(crateName, decls);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("crate ").append(crateName).append(" {\n");
        for (Declaration decl : getAll()) {
            sb.append("  ").append(decl).append("\n");
        }
        return sb.append("}").toString();
    }
}
