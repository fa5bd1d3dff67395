package io.github.eutro.charonj.types;

import io.github.eutro.charonj.decls.DeclId;

import java.util.Objects;

/**
 * How a trait obligation is discharged. A closed set of variants.
 */
public abstract class TraitInstanceId {
    private TraitInstanceId() {
    }

    public abstract <R> R accept(Visitor<R> v);

    public boolean isResolved() {
        return true;
    }

    public interface Visitor<R> {
        R visitTraitImpl(TraitImpl id);

        R visitBuiltinOrAuto(BuiltinOrAuto id);

        R visitClause(Clause id);

        R visitParentClause(ParentClause id);

        R visitSelfId(SelfId id);

        R visitUnresolved(Unresolved id);
    }

    public static final SelfId SELF = new SelfId();

    /**
     * A known implementation.
     */
    public static final class TraitImpl extends TraitInstanceId {
        public final DeclId implId;

        public TraitImpl(DeclId implId) {
            if (implId.kind != DeclId.Kind.TRAIT_IMPL) {
                throw new IllegalArgumentException("not a trait impl id: " + implId);
            }
            this.implId = implId;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitTraitImpl(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof TraitImpl && ((TraitImpl) o).implId.equals(implId);
        }

        @Override
        public int hashCode() {
            return implId.hashCode();
        }

        @Override
        public String toString() {
            return implId.toString();
        }
    }

    /**
     * A builtin or auto trait, implemented by the host compiler itself.
     */
    public static final class BuiltinOrAuto extends TraitInstanceId {
        public final DeclId traitId;

        public BuiltinOrAuto(DeclId traitId) {
            this.traitId = traitId;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitBuiltinOrAuto(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof BuiltinOrAuto && ((BuiltinOrAuto) o).traitId.equals(traitId);
        }

        @Override
        public int hashCode() {
            return traitId.hashCode() + 1;
        }

        @Override
        public String toString() {
            return "builtin(" + traitId + ")";
        }
    }

    /**
     * A where-clause of the enclosing declaration, to be supplied by its caller.
     */
    public static final class Clause extends TraitInstanceId {
        public final int clauseId;

        public Clause(int clauseId) {
            this.clauseId = clauseId;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitClause(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Clause && ((Clause) o).clauseId == clauseId;
        }

        @Override
        public int hashCode() {
            return clauseId;
        }

        @Override
        public String toString() {
            return "@TraitClause" + clauseId;
        }
    }

    /**
     * The {@code parentIndex}-th parent clause of trait {@code traitId}, as implemented by {@code instance}.
     */
    public static final class ParentClause extends TraitInstanceId {
        public final TraitInstanceId instance;
        public final DeclId traitId;
        public final int parentIndex;

        public ParentClause(TraitInstanceId instance, DeclId traitId, int parentIndex) {
            this.instance = instance;
            this.traitId = traitId;
            this.parentIndex = parentIndex;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitParentClause(this);
        }

        @Override
        public boolean isResolved() {
            return instance.isResolved();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            ParentClause that = (ParentClause) o;
            return parentIndex == that.parentIndex
                    && instance.equals(that.instance)
                    && traitId.equals(that.traitId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(instance, traitId, parentIndex);
        }

        @Override
        public String toString() {
            return instance + "::parent" + parentIndex;
        }
    }

    /**
     * {@code Self}, inside a trait declaration.
     */
    public static final class SelfId extends TraitInstanceId {
        private SelfId() {
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitSelfId(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof SelfId;
        }

        @Override
        public int hashCode() {
            return 3;
        }

        @Override
        public String toString() {
            return "Self";
        }
    }

    /**
     * No implementation could be found, or several could.
     */
    public static final class Unresolved extends TraitInstanceId {
        public final String reason;

        public Unresolved(String reason) {
            this.reason = reason;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitUnresolved(this);
        }

        @Override
        public boolean isResolved() {
            return false;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Unresolved && ((Unresolved) o).reason.equals(reason);
        }

        @Override
        public int hashCode() {
            return reason.hashCode();
        }

        @Override
        public String toString() {
            return "unresolved(" + reason + ")";
        }
    }
}
