package io.github.eutro.charonj.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A type. This is a closed set of variants; use a {@link Visitor} to handle all of them.
 */
public abstract class Ty {
    private Ty() {
    }

    /**
     * Accept a visitor.
     *
     * @param v   The visitor.
     * @param <R> The result type.
     * @return The result of the visitor.
     */
    public abstract <R> R accept(Visitor<R> v);

    /**
     * A visitor over every {@link Ty} variant.
     *
     * @param <R> The result type.
     */
    public interface Visitor<R> {
        R visitAdt(Adt ty);

        R visitTypeVar(TypeVar ty);

        R visitLiteral(Literal ty);

        R visitNever(Never ty);

        R visitRef(Ref ty);

        R visitRawPtr(RawPtr ty);

        R visitTraitType(TraitType ty);

        R visitArrow(Arrow ty);
    }

    public static final Never NEVER = new Never();
    public static final Adt UNIT = new Adt(TypeId.TUPLE, GenericArgs.EMPTY);

    public static Ty literal(LiteralTy ty) {
        return new Literal(ty);
    }

    public static Ty tuple(List<Ty> elems) {
        return new Adt(TypeId.TUPLE, GenericArgs.ofTypes(elems));
    }

    /**
     * An algebraic data type, a tuple, or a builtin type, applied to generic arguments.
     */
    public static final class Adt extends Ty {
        public final TypeId id;
        public final GenericArgs generics;

        public Adt(TypeId id, GenericArgs generics) {
            this.id = id;
            this.generics = generics;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitAdt(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Adt adt = (Adt) o;
            return id.equals(adt.id) && generics.equals(adt.generics);
        }

        @Override
        public int hashCode() {
            return Objects.hash(id, generics);
        }

        @Override
        public String toString() {
            if (id.kind == TypeId.Kind.TUPLE) {
                StringBuilder sb = new StringBuilder("(");
                for (int i = 0; i < generics.types.size(); i++) {
                    if (i != 0) sb.append(", ");
                    sb.append(generics.types.get(i));
                }
                return sb.append(")").toString();
            }
            return id + generics.toString();
        }
    }

    /**
     * A type parameter of the enclosing declaration, by local index.
     */
    public static final class TypeVar extends Ty {
        public final int index;

        public TypeVar(int index) {
            this.index = index;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitTypeVar(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof TypeVar && ((TypeVar) o).index == index;
        }

        @Override
        public int hashCode() {
            return index;
        }

        @Override
        public String toString() {
            return "@T" + index;
        }
    }

    public static final class Literal extends Ty {
        public final LiteralTy ty;

        public Literal(LiteralTy ty) {
            this.ty = ty;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitLiteral(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Literal && ((Literal) o).ty == ty;
        }

        @Override
        public int hashCode() {
            return ty.hashCode();
        }

        @Override
        public String toString() {
            return ty.text;
        }
    }

    public static final class Never extends Ty {
        private Never() {
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitNever(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Never;
        }

        @Override
        public int hashCode() {
            return 7;
        }

        @Override
        public String toString() {
            return "!";
        }
    }

    public static final class Ref extends Ty {
        public final Region region;
        public final Ty ty;
        public final RefKind refKind;

        public Ref(Region region, Ty ty, RefKind refKind) {
            this.region = region;
            this.ty = ty;
            this.refKind = refKind;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitRef(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Ref ref = (Ref) o;
            return region.equals(ref.region) && ty.equals(ref.ty) && refKind == ref.refKind;
        }

        @Override
        public int hashCode() {
            return Objects.hash(region, ty, refKind);
        }

        @Override
        public String toString() {
            return "&" + region + (refKind == RefKind.MUT ? " mut " : " ") + ty;
        }
    }

    public static final class RawPtr extends Ty {
        public final Ty ty;
        public final RefKind refKind;

        public RawPtr(Ty ty, RefKind refKind) {
            this.ty = ty;
            this.refKind = refKind;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitRawPtr(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            RawPtr rawPtr = (RawPtr) o;
            return ty.equals(rawPtr.ty) && refKind == rawPtr.refKind;
        }

        @Override
        public int hashCode() {
            return Objects.hash(ty, refKind);
        }

        @Override
        public String toString() {
            return (refKind == RefKind.MUT ? "*mut " : "*const ") + ty;
        }
    }

    /**
     * An associated type projection, {@code <T as Trait>::Name}.
     */
    public static final class TraitType extends Ty {
        public final TraitRef traitRef;
        public final String name;

        public TraitType(TraitRef traitRef, String name) {
            this.traitRef = traitRef;
            this.name = name;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitTraitType(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            TraitType that = (TraitType) o;
            return traitRef.equals(that.traitRef) && name.equals(that.name);
        }

        @Override
        public int hashCode() {
            return Objects.hash(traitRef, name);
        }

        @Override
        public String toString() {
            return traitRef + "::" + name;
        }
    }

    /**
     * A function pointer type.
     */
    public static final class Arrow extends Ty {
        public final List<Ty> inputs;
        public final Ty output;

        public Arrow(List<Ty> inputs, Ty output) {
            this.inputs = Collections.unmodifiableList(new ArrayList<>(inputs));
            this.output = output;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitArrow(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Arrow arrow = (Arrow) o;
            return inputs.equals(arrow.inputs) && output.equals(arrow.output);
        }

        @Override
        public int hashCode() {
            return Objects.hash(inputs, output);
        }

        @Override
        public String toString() {
            return "fn" + inputs.toString().replace('[', '(').replace(']', ')') + " -> " + output;
        }
    }
}
