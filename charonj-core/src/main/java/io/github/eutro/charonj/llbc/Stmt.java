package io.github.eutro.charonj.llbc;

import io.github.eutro.charonj.expr.AbortKind;
import io.github.eutro.charonj.expr.FnCall;
import io.github.eutro.charonj.expr.Operand;
import io.github.eutro.charonj.expr.Place;
import io.github.eutro.charonj.types.Literal;
import io.github.eutro.charonj.types.LiteralTy;
import io.github.eutro.charonj.ullbc.Statement;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A structured statement.
 * <p>
 * {@link Break} and {@link Continue} refer to enclosing {@link Loop}s by depth, 0 being the innermost.
 * {@link Goto} only appears inside a {@link Flattened} statement, and targets one of its pseudo-blocks.
 */
public abstract class Stmt {
    private Stmt() {
    }

    public abstract <R> R accept(Visitor<R> v);

    public interface Visitor<R> {
        R visitSimple(Simple stmt);

        R visitCall(Call stmt);

        R visitAssert(Assert stmt);

        R visitAbort(Abort stmt);

        R visitReturn(Return stmt);

        R visitBreak(Break stmt);

        R visitContinue(Continue stmt);

        R visitSequence(Sequence stmt);

        R visitIf(If stmt);

        R visitSwitch(Switch stmt);

        R visitMatch(Match stmt);

        R visitLoop(Loop stmt);

        R visitFlattened(Flattened stmt);

        R visitGoto(Goto stmt);
    }

    public static final Return RETURN = new Return();

    public static Sequence seq(Stmt... stmts) {
        return new Sequence(Arrays.asList(stmts));
    }

    /**
     * A statement that does not transfer control.
     */
    public static final class Simple extends Stmt {
        public final Statement statement;

        public Simple(Statement statement) {
            this.statement = statement;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitSimple(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Simple && ((Simple) o).statement.equals(statement);
        }

        @Override
        public int hashCode() {
            return statement.hashCode();
        }

        @Override
        public String toString() {
            return statement.toString();
        }
    }

    public static final class Call extends Stmt {
        public final FnCall call;

        public Call(FnCall call) {
            this.call = call;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitCall(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Call && ((Call) o).call.equals(call);
        }

        @Override
        public int hashCode() {
            return call.hashCode();
        }

        @Override
        public String toString() {
            return call.toString();
        }
    }

    public static final class Assert extends Stmt {
        public final Operand cond;
        public final boolean expected;

        public Assert(Operand cond, boolean expected) {
            this.cond = cond;
            this.expected = expected;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitAssert(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Assert anAssert = (Assert) o;
            return expected == anAssert.expected && cond.equals(anAssert.cond);
        }

        @Override
        public int hashCode() {
            return Objects.hash(cond, expected);
        }

        @Override
        public String toString() {
            return "assert(" + cond + " == " + expected + ")";
        }
    }

    public static final class Abort extends Stmt {
        public final AbortKind cause;

        public Abort(AbortKind cause) {
            this.cause = cause;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitAbort(this);
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

    public static final class Return extends Stmt {
        private Return() {
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitReturn(this);
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

    public static final class Break extends Stmt {
        public final int depth;

        public Break(int depth) {
            this.depth = depth;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitBreak(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Break && ((Break) o).depth == depth;
        }

        @Override
        public int hashCode() {
            return depth * 31 + 2;
        }

        @Override
        public String toString() {
            return "break " + depth;
        }
    }

    public static final class Continue extends Stmt {
        public final int depth;

        public Continue(int depth) {
            this.depth = depth;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitContinue(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Continue && ((Continue) o).depth == depth;
        }

        @Override
        public int hashCode() {
            return depth * 31 + 3;
        }

        @Override
        public String toString() {
            return "continue " + depth;
        }
    }

    public static final class Sequence extends Stmt {
        public final List<Stmt> stmts;

        public Sequence(List<Stmt> stmts) {
            this.stmts = Collections.unmodifiableList(new ArrayList<>(stmts));
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitSequence(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Sequence && ((Sequence) o).stmts.equals(stmts);
        }

        @Override
        public int hashCode() {
            return stmts.hashCode();
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("{");
            for (Stmt stmt : stmts) {
                sb.append(" ").append(stmt).append(";");
            }
            return sb.append(" }").toString();
        }
    }

    public static final class If extends Stmt {
        public final Operand cond;
        public final Sequence thenBranch;
        public final Sequence elseBranch;

        public If(Operand cond, Sequence thenBranch, Sequence elseBranch) {
            this.cond = cond;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitIf(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            If anIf = (If) o;
            return cond.equals(anIf.cond) && thenBranch.equals(anIf.thenBranch) && elseBranch.equals(anIf.elseBranch);
        }

        @Override
        public int hashCode() {
            return Objects.hash(cond, thenBranch, elseBranch);
        }

        @Override
        public String toString() {
            return "if " + cond + " " + thenBranch + " else " + elseBranch;
        }
    }

    /**
     * One arm of a {@link Switch}: every value that leads to the same code.
     */
    public static final class SwitchArm {
        public final List<Literal> values;
        public final Sequence body;

        public SwitchArm(List<Literal> values, Sequence body) {
            this.values = Collections.unmodifiableList(new ArrayList<>(values));
            this.body = body;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            SwitchArm switchArm = (SwitchArm) o;
            return values.equals(switchArm.values) && body.equals(switchArm.body);
        }

        @Override
        public int hashCode() {
            return Objects.hash(values, body);
        }

        @Override
        public String toString() {
            return values + " => " + body;
        }
    }

    public static final class Switch extends Stmt {
        public final Operand discriminant;
        public final LiteralTy intTy;
        public final List<SwitchArm> arms;
        public final @Nullable Sequence otherwise;

        public Switch(Operand discriminant, LiteralTy intTy, List<SwitchArm> arms, @Nullable Sequence otherwise) {
            this.discriminant = discriminant;
            this.intTy = intTy;
            this.arms = Collections.unmodifiableList(new ArrayList<>(arms));
            this.otherwise = otherwise;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitSwitch(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Switch aSwitch = (Switch) o;
            return discriminant.equals(aSwitch.discriminant)
                    && intTy == aSwitch.intTy
                    && arms.equals(aSwitch.arms)
                    && Objects.equals(otherwise, aSwitch.otherwise);
        }

        @Override
        public int hashCode() {
            return Objects.hash(discriminant, intTy, arms, otherwise);
        }

        @Override
        public String toString() {
            return "switch " + discriminant + " " + arms + (otherwise == null ? "" : " _ => " + otherwise);
        }
    }

    /**
     * One arm of a {@link Match}: the enum variants that lead to the same code.
     */
    public static final class MatchArm {
        public final List<Integer> variants;
        public final Sequence body;

        public MatchArm(List<Integer> variants, Sequence body) {
            this.variants = Collections.unmodifiableList(new ArrayList<>(variants));
            this.body = body;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            MatchArm matchArm = (MatchArm) o;
            return variants.equals(matchArm.variants) && body.equals(matchArm.body);
        }

        @Override
        public int hashCode() {
            return Objects.hash(variants, body);
        }

        @Override
        public String toString() {
            return variants + " => " + body;
        }
    }

    /**
     * A switch on the variant of an enum value.
     */
    public static final class Match extends Stmt {
        public final Place place;
        public final List<MatchArm> arms;
        public final @Nullable Sequence otherwise;

        public Match(Place place, List<MatchArm> arms, @Nullable Sequence otherwise) {
            this.place = place;
            this.arms = Collections.unmodifiableList(new ArrayList<>(arms));
            this.otherwise = otherwise;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitMatch(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Match match = (Match) o;
            return place.equals(match.place) && arms.equals(match.arms) && Objects.equals(otherwise, match.otherwise);
        }

        @Override
        public int hashCode() {
            return Objects.hash(place, arms, otherwise);
        }

        @Override
        public String toString() {
            return "match " + place + " " + arms + (otherwise == null ? "" : " _ => " + otherwise);
        }
    }

    public static final class Loop extends Stmt {
        public final Sequence body;

        public Loop(Sequence body) {
            this.body = body;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitLoop(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Loop && ((Loop) o).body.equals(body);
        }

        @Override
        public int hashCode() {
            return body.hashCode() * 7;
        }

        @Override
        public String toString() {
            return "loop " + body;
        }
    }

    /**
     * A block of a {@link Flattened} region, addressed by its original block index.
     */
    public static final class PseudoBlock {
        public final int block;
        public final Sequence body;

        public PseudoBlock(int block, Sequence body) {
            this.block = block;
            this.body = body;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            PseudoBlock that = (PseudoBlock) o;
            return block == that.block && body.equals(that.body);
        }

        @Override
        public int hashCode() {
            return Objects.hash(block, body);
        }

        @Override
        public String toString() {
            return "bb" + block + ": " + body;
        }
    }

    /**
     * An irreducible region, kept as a small control-flow graph entered at {@code entry}.
     */
    public static final class Flattened extends Stmt {
        public final int entry;
        public final List<PseudoBlock> blocks;

        public Flattened(int entry, List<PseudoBlock> blocks) {
            this.entry = entry;
            this.blocks = Collections.unmodifiableList(new ArrayList<>(blocks));
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitFlattened(this);
        }

        public @Nullable PseudoBlock getBlock(int block) {
            for (PseudoBlock pb : blocks) {
                if (pb.block == block) return pb;
            }
            return null;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Flattened flattened = (Flattened) o;
            return entry == flattened.entry && blocks.equals(flattened.blocks);
        }

        @Override
        public int hashCode() {
            return Objects.hash(entry, blocks);
        }

        @Override
        public String toString() {
            return "flattened(entry bb" + entry + ") " + blocks;
        }
    }

    public static final class Goto extends Stmt {
        public final int block;

        public Goto(int block) {
            this.block = block;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitGoto(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Goto && ((Goto) o).block == block;
        }

        @Override
        public int hashCode() {
            return block * 31 + 5;
        }

        @Override
        public String toString() {
            return "goto bb" + block;
        }
    }
}
