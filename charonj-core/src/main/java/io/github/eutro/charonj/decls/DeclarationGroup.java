package io.github.eutro.charonj.decls;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A set of mutually dependent declarations.
 *
 * @see ReorderDecls
 */
public final class DeclarationGroup {
    public enum Kind {
        TYPE,
        FUN,
        GLOBAL,
        TRAIT_DECL,
        TRAIT_IMPL,
        /**
         * A group whose declarations are not all of the same kind.
         */
        MIXED,
    }

    public final Kind kind;
    /**
     * Whether the group refers to itself: it has several members, or its single member refers to itself.
     */
    public final boolean recursive;
    public final List<DeclId> ids;

    public DeclarationGroup(Kind kind, boolean recursive, List<DeclId> ids) {
        this.kind = kind;
        this.recursive = recursive;
        this.ids = Collections.unmodifiableList(new ArrayList<>(ids));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DeclarationGroup that = (DeclarationGroup) o;
        return recursive == that.recursive && kind == that.kind && ids.equals(that.ids);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, recursive, ids);
    }

    @Override
    public String toString() {
        return (recursive ? "rec " : "") + kind + ids;
    }
}
