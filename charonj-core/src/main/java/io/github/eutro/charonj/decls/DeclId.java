package io.github.eutro.charonj.decls;

import org.jetbrains.annotations.NotNull;

/**
 * The identifier of a {@link Declaration} in a {@link DeclTable}.
 * <p>
 * Each {@link Kind} has its own index space. Indices are assigned in registration order,
 * so they are stable for a given import feed.
 */
public final class DeclId implements Comparable<DeclId> {
    /**
     * The kind of declaration an id refers to.
     */
    public enum Kind {
        TYPE("type"),
        FUN("fun"),
        GLOBAL("global"),
        TRAIT_DECL("trait_decl"),
        TRAIT_IMPL("trait_impl"),
        ;

        /**
         * The name of this kind in the import feed.
         */
        public final String feedName;

        Kind(String feedName) {
            this.feedName = feedName;
        }
    }

    public final Kind kind;
    public final int index;

    private DeclId(Kind kind, int index) {
        this.kind = kind;
        this.index = index;
    }

    public static DeclId of(Kind kind, int index) {
        if (index < 0) throw new IllegalArgumentException("negative index " + index);
        return new DeclId(kind, index);
    }

    @Override
    public int compareTo(@NotNull DeclId o) {
        int c = kind.compareTo(o.kind);
        return c != 0 ? c : Integer.compare(index, o.index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DeclId declId = (DeclId) o;
        return index == declId.index && kind == declId.kind;
    }

    @Override
    public int hashCode() {
        return kind.ordinal() * 31 + index;
    }

    @Override
    public String toString() {
        return kind.feedName + "#" + index;
    }
}
