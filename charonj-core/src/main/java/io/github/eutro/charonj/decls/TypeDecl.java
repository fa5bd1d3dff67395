package io.github.eutro.charonj.decls;

import io.github.eutro.charonj.names.Name;
import io.github.eutro.charonj.types.Literal;
import io.github.eutro.charonj.types.Ty;
import org.jetbrains.annotations.Nullable;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A type declaration: a struct, an enum, or a type whose definition is not visible.
 */
public final class TypeDecl extends Declaration {
    public enum Kind {
        STRUCT,
        ENUM,
        OPAQUE,
        /**
         * A type whose definition could not be translated.
         */
        ERROR,
    }

    public Kind kind = Kind.OPAQUE;
    /**
     * The fields of a struct.
     */
    public List<Field> fields = new ArrayList<>();
    /**
     * The variants of an enum.
     */
    public List<Variant> variants = new ArrayList<>();
    public @Nullable String error;

    public TypeDecl(DeclId id, Name name) {
        super(id, name);
    }

    /**
     * Find the variant of this enum with the given discriminant.
     *
     * @param discriminant The discriminant value.
     * @return The index of the variant, or null if there is none.
     */
    public @Nullable Integer variantOfDiscriminant(BigInteger discriminant) {
        for (int i = 0; i < variants.size(); i++) {
            if (variants.get(i).discriminant.value.equals(discriminant)) return i;
        }
        return null;
    }

    public static final class Field {
        public final @Nullable String name;
        public final Ty ty;

        public Field(@Nullable String name, Ty ty) {
            this.name = name;
            this.ty = ty;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Field field = (Field) o;
            return Objects.equals(name, field.name) && ty.equals(field.ty);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, ty);
        }

        @Override
        public String toString() {
            return (name == null ? "" : name + ": ") + ty;
        }
    }

    public static final class Variant {
        public final String name;
        public final List<Field> fields;
        public final Literal discriminant;

        public Variant(String name, List<Field> fields, Literal discriminant) {
            this.name = name;
            this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
            this.discriminant = discriminant;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Variant variant = (Variant) o;
            return name.equals(variant.name) && fields.equals(variant.fields) && discriminant.equals(variant.discriminant);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, fields, discriminant);
        }

        @Override
        public String toString() {
            return name + fields + " = " + discriminant;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TypeDecl that = (TypeDecl) o;
        return commonEquals(that)
                && kind == that.kind
                && fields.equals(that.fields)
                && variants.equals(that.variants)
                && Objects.equals(error, that.error);
    }
}
