package io.github.eutro.charonj.types;

/**
 * A lifetime. Variables refer to the region parameters of the enclosing declaration.
 */
public final class Region {
    public enum Kind {
        STATIC,
        ERASED,
        VAR,
    }

    public static final Region STATIC = new Region(Kind.STATIC, 0);
    public static final Region ERASED = new Region(Kind.ERASED, 0);

    public final Kind kind;
    public final int index;

    private Region(Kind kind, int index) {
        this.kind = kind;
        this.index = index;
    }

    public static Region var(int index) {
        return new Region(Kind.VAR, index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Region region = (Region) o;
        return index == region.index && kind == region.kind;
    }

    @Override
    public int hashCode() {
        return kind.ordinal() * 31 + index;
    }

    @Override
    public String toString() {
        switch (kind) {
            case STATIC:
                return "'static";
            case ERASED:
                return "'_";
            default:
                return "'r" + index;
        }
    }
}
