package io.github.eutro.charonj.ullbc;

import io.github.eutro.charonj.types.Literal;
import io.github.eutro.charonj.types.LiteralTy;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The targets of a {@link Terminator.Switch}.
 */
public abstract class SwitchTargets {
    private SwitchTargets() {
    }

    public abstract <R> R accept(Visitor<R> v);

    /**
     * Get the distinct targets, in order of first occurrence, the otherwise target last.
     *
     * @return The targets.
     */
    public abstract List<Integer> targets();

    abstract SwitchTargets mapTargets(Terminator.TargetMapper mapper);

    public interface Visitor<R> {
        R visitIf(If targets);

        R visitSwitchInt(SwitchInt targets);
    }

    /**
     * A boolean switch.
     */
    public static final class If extends SwitchTargets {
        public final int thenTarget;
        public final int elseTarget;

        public If(int thenTarget, int elseTarget) {
            this.thenTarget = thenTarget;
            this.elseTarget = elseTarget;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitIf(this);
        }

        @Override
        public List<Integer> targets() {
            List<Integer> ls = new ArrayList<>(2);
            ls.add(thenTarget);
            if (elseTarget != thenTarget) ls.add(elseTarget);
            return ls;
        }

        @Override
        SwitchTargets mapTargets(Terminator.TargetMapper mapper) {
            return new If(mapper.map(thenTarget), mapper.map(elseTarget));
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            If anIf = (If) o;
            return thenTarget == anIf.thenTarget && elseTarget == anIf.elseTarget;
        }

        @Override
        public int hashCode() {
            return Objects.hash(thenTarget, elseTarget);
        }

        @Override
        public String toString() {
            return "true -> bb" + thenTarget + ", false -> bb" + elseTarget;
        }
    }

    /**
     * A switch over integer values. {@code values} and {@code targets} are parallel lists.
     */
    public static final class SwitchInt extends SwitchTargets {
        public final LiteralTy intTy;
        public final List<Literal> values;
        public final List<Integer> valueTargets;
        public final @Nullable Integer otherwise;

        public SwitchInt(LiteralTy intTy, List<Literal> values, List<Integer> valueTargets, @Nullable Integer otherwise) {
            if (values.size() != valueTargets.size()) {
                throw new IllegalArgumentException("values and targets differ in length");
            }
            this.intTy = intTy;
            this.values = Collections.unmodifiableList(new ArrayList<>(values));
            this.valueTargets = Collections.unmodifiableList(new ArrayList<>(valueTargets));
            this.otherwise = otherwise;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitSwitchInt(this);
        }

        @Override
        public List<Integer> targets() {
            List<Integer> ls = new ArrayList<>();
            for (Integer target : valueTargets) {
                if (!ls.contains(target)) ls.add(target);
            }
            if (otherwise != null && !ls.contains(otherwise)) ls.add(otherwise);
            return ls;
        }

        @Override
        SwitchTargets mapTargets(Terminator.TargetMapper mapper) {
            List<Integer> mapped = new ArrayList<>(valueTargets.size());
            for (Integer target : valueTargets) mapped.add(mapper.map(target));
            return new SwitchInt(intTy, values, mapped, otherwise == null ? null : mapper.map(otherwise));
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            SwitchInt switchInt = (SwitchInt) o;
            return intTy == switchInt.intTy
                    && values.equals(switchInt.values)
                    && valueTargets.equals(switchInt.valueTargets)
                    && Objects.equals(otherwise, switchInt.otherwise);
        }

        @Override
        public int hashCode() {
            return Objects.hash(intTy, values, valueTargets, otherwise);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < values.size(); i++) {
                sb.append(values.get(i)).append(" -> bb").append(valueTargets.get(i)).append(", ");
            }
            return sb.append("_ -> ").append(otherwise == null ? "unreachable" : "bb" + otherwise).toString();
        }
    }
}
