package io.github.eutro.charonj.names;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The path of an item, e.g. {@code core::option::Option}.
 */
public final class Name {
    public final List<PathElem> elems;

    public Name(List<PathElem> elems) {
        this.elems = Collections.unmodifiableList(new ArrayList<>(elems));
    }

    /**
     * Parse a {@code ::} separated name.
     *
     * @param text The text of the name.
     * @return The name.
     * @throws IllegalArgumentException If the name is empty or has an empty element.
     */
    @NotNull
    public static Name parse(String text) {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("empty name");
        }
        List<PathElem> elems = new ArrayList<>();
        for (String part : text.split("::", -1)) {
            if (part.isEmpty()) {
                throw new IllegalArgumentException("empty path element in name: " + text);
            }
            elems.add(PathElem.parse(part));
        }
        return new Name(elems);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return elems.equals(((Name) o).elems);
    }

    @Override
    public int hashCode() {
        return elems.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (PathElem elem : elems) {
            if (sb.length() != 0) sb.append("::");
            sb.append(elem);
        }
        return sb.toString();
    }
}
