package io.github.eutro.charonj.names;

import java.util.Objects;

/**
 * One element of a {@link Name}: either an identifier, or an anonymous {@code impl} block.
 */
public final class PathElem {
    /**
     * The kind of a path element.
     */
    public enum Kind {
        IDENT,
        IMPL,
    }

    public final Kind kind;
    /**
     * The identifier, null for {@link Kind#IMPL}.
     */
    public final String name;
    /**
     * Distinguishes elements that would otherwise print the same.
     */
    public final int disambiguator;

    private PathElem(Kind kind, String name, int disambiguator) {
        this.kind = kind;
        this.name = name;
        this.disambiguator = disambiguator;
    }

    public static PathElem ident(String name, int disambiguator) {
        return new PathElem(Kind.IDENT, name, disambiguator);
    }

    public static PathElem impl(int disambiguator) {
        return new PathElem(Kind.IMPL, null, disambiguator);
    }

    /**
     * Parse a single path element, e.g. {@code foo}, {@code foo#1} or {@code {impl#0}}.
     *
     * @param text The text.
     * @return The element.
     */
    public static PathElem parse(String text) {
        if (text.startsWith("{impl") && text.endsWith("}")) {
            String inner = text.substring("{impl".length(), text.length() - 1);
            return impl(inner.startsWith("#") ? Integer.parseInt(inner.substring(1)) : 0);
        }
        int hash = text.lastIndexOf('#');
        if (hash > 0 && isDigits(text.substring(hash + 1))) {
            return ident(text.substring(0, hash), Integer.parseInt(text.substring(hash + 1)));
        }
        return ident(text, 0);
    }

    private static boolean isDigits(String s) {
        if (s.isEmpty() || s.length() > 9) return false;
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) return false;
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PathElem pathElem = (PathElem) o;
        return disambiguator == pathElem.disambiguator
                && kind == pathElem.kind
                && Objects.equals(name, pathElem.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name, disambiguator);
    }

    @Override
    public String toString() {
        if (kind == Kind.IMPL) {
            return "{impl#" + disambiguator + "}";
        }
        return disambiguator == 0 ? name : name + "#" + disambiguator;
    }
}
