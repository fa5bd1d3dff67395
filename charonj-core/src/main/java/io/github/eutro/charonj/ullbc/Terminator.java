package io.github.eutro.charonj.ullbc;

import io.github.eutro.charonj.expr.AbortKind;
import io.github.eutro.charonj.expr.FnCall;
import io.github.eutro.charonj.expr.Operand;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The control transfer at the end of a {@link BasicBlock}.
 */
public abstract class Terminator {
    private Terminator() {
    }

    public abstract <R> R accept(Visitor<R> v);

    /**
     * Get the blocks control may continue at, excluding unwind edges.
     *
     * @return The distinct targets, in order.
     */
    public abstract List<Integer> targets();

    /**
     * Get every block control may continue at, including unwind edges.
     *
     * @return The distinct targets, in order.
     */
    public List<Integer> allTargets() {
        return targets();
    }

    /**
     * Rewrite every block index this terminator refers to.
     *
     * @param mapper The mapping from old to new indices.
     * @return The rewritten terminator.
     */
    public abstract Terminator mapTargets(TargetMapper mapper);

    /**
     * A mapping between block indices.
     */
    @FunctionalInterface
    public interface TargetMapper {
        int map(int target);
    }

    public interface Visitor<R> {
        R visitGoto(Goto term);

        R visitSwitch(Switch term);

        R visitReturn(Return term);

        R visitAbort(Abort term);

        R visitCall(Call term);

        R visitAssert(Assert term);
    }

    public static final Return RETURN = new Return();

    public static final class Goto extends Terminator {
        public final int target;

        public Goto(int target) {
            this.target = target;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitGoto(this);
        }

        @Override
        public List<Integer> targets() {
            return Collections.singletonList(target);
        }

        @Override
        public Terminator mapTargets(TargetMapper mapper) {
            return new Goto(mapper.map(target));
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Goto && ((Goto) o).target == target;
        }

        @Override
        public int hashCode() {
            return target;
        }

        @Override
        public String toString() {
            return "goto bb" + target;
        }
    }

    public static final class Switch extends Terminator {
        public final Operand discriminant;
        public final SwitchTargets switchTargets;

        public Switch(Operand discriminant, SwitchTargets switchTargets) {
            this.discriminant = discriminant;
            this.switchTargets = switchTargets;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitSwitch(this);
        }

        @Override
        public List<Integer> targets() {
            return switchTargets.targets();
        }

        @Override
        public Terminator mapTargets(TargetMapper mapper) {
            return new Switch(discriminant, switchTargets.mapTargets(mapper));
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Switch aSwitch = (Switch) o;
            return discriminant.equals(aSwitch.discriminant) && switchTargets.equals(aSwitch.switchTargets);
        }

        @Override
        public int hashCode() {
            return Objects.hash(discriminant, switchTargets);
        }

        @Override
        public String toString() {
            return "switch " + discriminant + " [" + switchTargets + "]";
        }
    }

    public static final class Return extends Terminator {
        private Return() {
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitReturn(this);
        }

        @Override
        public List<Integer> targets() {
            return Collections.emptyList();
        }

        @Override
        public Terminator mapTargets(TargetMapper mapper) {
            return this;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Return;
        }

        @Override
        public int hashCode() {
            return 1;
        }

        @Override
        public String toString() {
            return "return";
        }
    }

    public static final class Abort extends Terminator {
        public final AbortKind cause;

        public Abort(AbortKind cause) {
            this.cause = cause;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitAbort(this);
        }

        @Override
        public List<Integer> targets() {
            return Collections.emptyList();
        }

        @Override
        public Terminator mapTargets(TargetMapper mapper) {
            return this;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Abort && ((Abort) o).cause == cause;
        }

        @Override
        public int hashCode() {
            return cause.hashCode();
        }

        @Override
        public String toString() {
            return "abort(" + cause + ")";
        }
    }

    public static final class Call extends Terminator {
        public final FnCall call;
        public final int target;
        /**
         * The block entered if the callee unwinds, if any.
         */
        public final @Nullable Integer unwind;

        public Call(FnCall call, int target, @Nullable Integer unwind) {
            this.call = call;
            this.target = target;
            this.unwind = unwind;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitCall(this);
        }

        @Override
        public List<Integer> targets() {
            return Collections.singletonList(target);
        }

        @Override
        public List<Integer> allTargets() {
            if (unwind == null || unwind == target) return targets();
            List<Integer> ls = new ArrayList<>(2);
            ls.add(target);
            ls.add(unwind);
            return ls;
        }

        @Override
        public Terminator mapTargets(TargetMapper mapper) {
            return new Call(call, mapper.map(target), unwind == null ? null : mapper.map(unwind));
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Call call1 = (Call) o;
            return target == call1.target && call.equals(call1.call) && Objects.equals(unwind, call1.unwind);
        }

        @Override
        public int hashCode() {
            return Objects.hash(call, target, unwind);
        }

        @Override
        public String toString() {
            return call + " -> bb" + target + (unwind == null ? "" : " (unwind bb" + unwind + ")");
        }
    }

    public static final class Assert extends Terminator {
        public final Operand cond;
        public final boolean expected;
        public final int target;

        public Assert(Operand cond, boolean expected, int target) {
            this.cond = cond;
            this.expected = expected;
            this.target = target;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitAssert(this);
        }

        @Override
        public List<Integer> targets() {
            return Collections.singletonList(target);
        }

        @Override
        public Terminator mapTargets(TargetMapper mapper) {
            return new Assert(cond, expected, mapper.map(target));
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Assert anAssert = (Assert) o;
            return expected == anAssert.expected && target == anAssert.target && cond.equals(anAssert.cond);
        }

        @Override
        public int hashCode() {
            return Objects.hash(cond, expected, target);
        }

        @Override
        public String toString() {
            return "assert(" + cond + " == " + expected + ") -> bb" + target;
        }
    }
}
