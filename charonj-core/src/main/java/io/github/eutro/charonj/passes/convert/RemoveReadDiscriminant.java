package io.github.eutro.charonj.passes.convert;

import io.github.eutro.charonj.decls.*;
import io.github.eutro.charonj.expr.Operand;
import io.github.eutro.charonj.expr.Rvalue;
import io.github.eutro.charonj.llbc.LlbcBody;
import io.github.eutro.charonj.llbc.Stmt;
import io.github.eutro.charonj.llbc.StmtRewriter;
import io.github.eutro.charonj.passes.InPlaceIRPass;
import io.github.eutro.charonj.types.Literal;
import io.github.eutro.charonj.ullbc.Statement;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A pass that rewrites reads of an enum's discriminant that are immediately switched on into a
 * {@link Stmt.Match} on the enum itself, dropping the read.
 * <p>
 * Discriminant values are mapped to the variants that have them. If one has no variant, or the
 * read is not of an enum, the code is left as it is and a diagnostic is reported.
 */
public class RemoveReadDiscriminant implements InPlaceIRPass<DeclTable> {
    /**
     * A singleton instance of this pass.
     */
    public static final RemoveReadDiscriminant INSTANCE = new RemoveReadDiscriminant();

    @Override
    public void runInPlace(DeclTable table) {
        for (BodyOwner owner : table.getBodyOwners()) {
            LlbcBody body = owner.getLlbcBody();
            if (body == null) continue;
            Rewriter rewriter = new Rewriter(table, owner.getDeclaration());
            owner.setLlbcBody(new LlbcBody(body.locals, body.argCount, rewriter.rewrite(body.body)));
        }
    }

    private static final class Rewriter extends StmtRewriter {
        private final DeclTable table;
        private final Declaration owner;

        Rewriter(DeclTable table, Declaration owner) {
            this.table = table;
            this.owner = owner;
        }

        @Override
        public Stmt visitSequence(Stmt.Sequence seq) {
            List<Stmt> stmts = new ArrayList<>(seq.stmts.size());
            for (int i = 0; i < seq.stmts.size(); i++) {
                Stmt stmt = seq.stmts.get(i);
                if (i + 1 < seq.stmts.size()) {
                    Stmt match = tryMatch(stmt, seq.stmts.get(i + 1));
                    if (match != null) {
                        stmts.add(match);
                        i++;
                        continue;
                    }
                }
                stmts.add(rewrite(stmt));
            }
            return new Stmt.Sequence(stmts);
        }

        private @Nullable Stmt tryMatch(Stmt read, Stmt next) {
            if (!(read instanceof Stmt.Simple) || !(next instanceof Stmt.Switch)) return null;
            Statement statement = ((Stmt.Simple) read).statement;
            if (!(statement instanceof Statement.Assign)) return null;
            Statement.Assign assign = (Statement.Assign) statement;
            // only a whole local can be dropped along with the read
            if (!(assign.rvalue instanceof Rvalue.Discriminant) || !assign.place.projection.isEmpty()) return null;
            Stmt.Switch sw = (Stmt.Switch) next;
            Operand discr = sw.discriminant;
            if (discr.kind == Operand.Kind.CONST || !assign.place.equals(discr.place)) return null;

            Rvalue.Discriminant rv = (Rvalue.Discriminant) assign.rvalue;
            TypeDecl adt = table.getType(rv.adt);
            if (adt.kind != TypeDecl.Kind.ENUM) {
                report("discriminant read of " + adt.name + ", which is not an enum");
                return null;
            }
            Set<Integer> covered = new HashSet<>();
            List<Stmt.MatchArm> arms = new ArrayList<>(sw.arms.size());
            for (Stmt.SwitchArm arm : sw.arms) {
                List<Integer> variants = new ArrayList<>(arm.values.size());
                for (Literal value : arm.values) {
                    Integer variant = adt.variantOfDiscriminant(value.value);
                    if (variant == null) {
                        report("discriminant " + value.value + " matches no variant of " + adt.name);
                        return null;
                    }
                    variants.add(variant);
                    covered.add(variant);
                }
                arms.add(new Stmt.MatchArm(variants, rewrite(arm.body)));
            }
            Stmt.Sequence otherwise = sw.otherwise == null || covered.size() == adt.variants.size()
                    ? null
                    : rewrite(sw.otherwise);
            return new Stmt.Match(rv.place, arms, otherwise);
        }

        private void report(String message) {
            table.report(new Diagnostic(Diagnostic.Kind.UNSUPPORTED_CONSTRUCT, owner, message));
        }
    }
}
