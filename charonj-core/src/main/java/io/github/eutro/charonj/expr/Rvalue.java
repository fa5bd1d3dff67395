package io.github.eutro.charonj.expr;

import io.github.eutro.charonj.decls.DeclId;
import io.github.eutro.charonj.types.GenericArgs;
import io.github.eutro.charonj.types.Ty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The right-hand side of an assignment. A closed set of variants.
 */
public abstract class Rvalue {
    private Rvalue() {
    }

    public abstract <R> R accept(Visitor<R> v);

    public interface Visitor<R> {
        R visitUse(Use rv);

        R visitRef(Ref rv);

        R visitUnaryOp(UnaryOp rv);

        R visitBinaryOp(BinaryOp rv);

        R visitCast(Cast rv);

        R visitDiscriminant(Discriminant rv);

        R visitAggregate(Aggregate rv);

        R visitGlobal(Global rv);

        R visitLen(Len rv);
    }

    public static final class Use extends Rvalue {
        public final Operand operand;

        public Use(Operand operand) {
            this.operand = operand;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitUse(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Use && ((Use) o).operand.equals(operand);
        }

        @Override
        public int hashCode() {
            return operand.hashCode();
        }

        @Override
        public String toString() {
            return operand.toString();
        }
    }

    public static final class Ref extends Rvalue {
        public final Place place;
        public final BorrowKind borrow;

        public Ref(Place place, BorrowKind borrow) {
            this.place = place;
            this.borrow = borrow;
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
            return place.equals(ref.place) && borrow == ref.borrow;
        }

        @Override
        public int hashCode() {
            return Objects.hash(place, borrow);
        }

        @Override
        public String toString() {
            return (borrow == BorrowKind.SHARED ? "&" : "&mut ") + place;
        }
    }

    public static final class UnaryOp extends Rvalue {
        public final UnOp op;
        public final Operand operand;

        public UnaryOp(UnOp op, Operand operand) {
            this.op = op;
            this.operand = operand;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitUnaryOp(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            UnaryOp unaryOp = (UnaryOp) o;
            return op == unaryOp.op && operand.equals(unaryOp.operand);
        }

        @Override
        public int hashCode() {
            return Objects.hash(op, operand);
        }

        @Override
        public String toString() {
            return (op == UnOp.NOT ? "!" : "-") + operand;
        }
    }

    public static final class BinaryOp extends Rvalue {
        public final BinOp op;
        public final Operand left;
        public final Operand right;

        public BinaryOp(BinOp op, Operand left, Operand right) {
            this.op = op;
            this.left = left;
            this.right = right;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitBinaryOp(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            BinaryOp binaryOp = (BinaryOp) o;
            return op == binaryOp.op && left.equals(binaryOp.left) && right.equals(binaryOp.right);
        }

        @Override
        public int hashCode() {
            return Objects.hash(op, left, right);
        }

        @Override
        public String toString() {
            return left + " " + op.symbol + " " + right;
        }
    }

    public static final class Cast extends Rvalue {
        public final Operand operand;
        public final Ty target;

        public Cast(Operand operand, Ty target) {
            this.operand = operand;
            this.target = target;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitCast(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Cast cast = (Cast) o;
            return operand.equals(cast.operand) && target.equals(cast.target);
        }

        @Override
        public int hashCode() {
            return Objects.hash(operand, target);
        }

        @Override
        public String toString() {
            return operand + " as " + target;
        }
    }

    /**
     * Reads the discriminant of an enum value.
     */
    public static final class Discriminant extends Rvalue {
        public final Place place;
        public final DeclId adt;

        public Discriminant(Place place, DeclId adt) {
            this.place = place;
            this.adt = adt;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitDiscriminant(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Discriminant that = (Discriminant) o;
            return place.equals(that.place) && adt.equals(that.adt);
        }

        @Override
        public int hashCode() {
            return Objects.hash(place, adt);
        }

        @Override
        public String toString() {
            return "discriminant(" + place + ")";
        }
    }

    public static final class Aggregate extends Rvalue {
        public final AggregateKind aggregate;
        public final List<Operand> operands;

        public Aggregate(AggregateKind aggregate, List<Operand> operands) {
            this.aggregate = aggregate;
            this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitAggregate(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Aggregate aggregate = (Aggregate) o;
            return this.aggregate.equals(aggregate.aggregate) && operands.equals(aggregate.operands);
        }

        @Override
        public int hashCode() {
            return Objects.hash(aggregate, operands);
        }

        @Override
        public String toString() {
            return aggregate + " " + operands;
        }
    }

    public static final class Global extends Rvalue {
        public final DeclId global;
        public final GenericArgs generics;

        public Global(DeclId global, GenericArgs generics) {
            this.global = global;
            this.generics = generics;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitGlobal(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Global global1 = (Global) o;
            return global.equals(global1.global) && generics.equals(global1.generics);
        }

        @Override
        public int hashCode() {
            return Objects.hash(global, generics);
        }

        @Override
        public String toString() {
            return global + generics.toString();
        }
    }

    public static final class Len extends Rvalue {
        public final Place place;

        public Len(Place place) {
            this.place = place;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitLen(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Len && ((Len) o).place.equals(place);
        }

        @Override
        public int hashCode() {
            return place.hashCode() + 11;
        }

        @Override
        public String toString() {
            return "len(" + place + ")";
        }
    }
}
