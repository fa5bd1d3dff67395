package io.github.eutro.charonj.decls;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A recoverable problem with one item of a crate. Translation continues past these.
 */
public final class Diagnostic {
    public enum Kind {
        /**
         * A trait obligation with no, or several, matching implementations.
         */
        UNRESOLVED_CLAUSE,
        /**
         * A function body with control flow that could not be fully structured.
         */
        IRREDUCIBLE_REGION,
        /**
         * An item with a construct that could not be translated.
         */
        UNSUPPORTED_CONSTRUCT,
    }

    public final Kind kind;
    public final @Nullable DeclId item;
    public final String itemName;
    public final String message;
    /**
     * The blocks concerned, for body diagnostics.
     */
    public final List<Integer> blocks;

    public Diagnostic(Kind kind, @Nullable DeclId item, String itemName, String message, List<Integer> blocks) {
        this.kind = kind;
        this.item = item;
        this.itemName = itemName;
        this.message = message;
        this.blocks = Collections.unmodifiableList(new ArrayList<>(blocks));
    }

    public Diagnostic(Kind kind, Declaration decl, String message) {
        this(kind, decl.id, decl.name.toString(), message, Collections.emptyList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Diagnostic that = (Diagnostic) o;
        return kind == that.kind
                && Objects.equals(item, that.item)
                && itemName.equals(that.itemName)
                && message.equals(that.message)
                && blocks.equals(that.blocks);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, item, itemName, message, blocks);
    }

    @Override
    public String toString() {
        return kind + " in " + itemName + (item == null ? "" : " (" + item + ")") + ": " + message
                + (blocks.isEmpty() ? "" : " " + blocks);
    }
}
