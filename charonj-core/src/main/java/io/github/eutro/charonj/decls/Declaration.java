package io.github.eutro.charonj.decls;

import io.github.eutro.charonj.names.Name;
import io.github.eutro.charonj.types.GenericParams;
import io.github.eutro.charonj.types.TraitRef;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An item of a crate, registered in a {@link DeclTable}.
 * <p>
 * A declaration is created as a stub when it is first referenced, and filled in when it is imported.
 * Declarations refer to each other only by {@link DeclId}.
 */
public abstract class Declaration {
    public final DeclId id;
    public final Name name;
    public boolean isLocal = true;
    public GenericParams generics = GenericParams.EMPTY;
    /**
     * The trait obligations of the item, each resolved to where it is satisfied.
     */
    public List<TraitRef> obligations = new ArrayList<>();
    /**
     * Whether only the signature of this item was imported.
     */
    public boolean opaque = false;

    protected Declaration(DeclId id, Name name) {
        this.id = id;
        this.name = name;
    }

    protected boolean commonEquals(Declaration that) {
        return isLocal == that.isLocal
                && opaque == that.opaque
                && id.equals(that.id)
                && name.equals(that.name)
                && generics.equals(that.generics)
                && obligations.equals(that.obligations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name);
    }

    @Override
    public String toString() {
        return id + " " + name;
    }
}
