package io.github.eutro.charonj.names;

import java.util.ArrayList;
import java.util.List;

/**
 * A pattern over {@link Name}s, such as {@code core::*::fmt}.
 * <p>
 * Each segment is either a literal path element or {@code *}, which matches any single element.
 * A pattern matches a name if it matches a prefix of it, so a pattern naming a module
 * also matches everything inside that module.
 */
public final class NamePattern {
    private final List<PathElem> segments; // null entries are wildcards
    private final String source;

    private NamePattern(List<PathElem> segments, String source) {
        this.segments = segments;
        this.source = source;
    }

    /**
     * Parse a pattern.
     *
     * @param text The pattern text.
     * @return The pattern.
     */
    public static NamePattern parse(String text) {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("empty name pattern");
        }
        List<PathElem> segments = new ArrayList<>();
        for (String part : text.split("::", -1)) {
            if (part.isEmpty()) {
                throw new IllegalArgumentException("empty segment in name pattern: " + text);
            }
            segments.add("*".equals(part) ? null : PathElem.parse(part));
        }
        return new NamePattern(segments, text);
    }

    /**
     * Check whether this pattern matches the name.
     *
     * @param name The name.
     * @return Whether it matches.
     */
    public boolean matches(Name name) {
        if (name.elems.size() < segments.size()) return false;
        for (int i = 0; i < segments.size(); i++) {
            PathElem seg = segments.get(i);
            if (seg != null && !seg.equals(name.elems.get(i))) return false;
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NamePattern && source.equals(((NamePattern) o).source);
    }

    @Override
    public int hashCode() {
        return source.hashCode();
    }

    @Override
    public String toString() {
        return source;
    }
}
