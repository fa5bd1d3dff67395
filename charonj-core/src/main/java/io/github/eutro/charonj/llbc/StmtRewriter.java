package io.github.eutro.charonj.llbc;

import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds a statement tree bottom-up. By default every statement is rebuilt as it was;
 * override the visit methods to rewrite specific statements.
 */
public abstract class StmtRewriter implements Stmt.Visitor<Stmt> {
    public Stmt rewrite(Stmt stmt) {
        return stmt.accept(this);
    }

    public Stmt.Sequence rewrite(Stmt.Sequence seq) {
        return (Stmt.Sequence) visitSequence(seq);
    }

    @Override
    public Stmt visitSimple(Stmt.Simple stmt) {
        return stmt;
    }

    @Override
    public Stmt visitCall(Stmt.Call stmt) {
        return stmt;
    }

    @Override
    public Stmt visitAssert(Stmt.Assert stmt) {
        return stmt;
    }

    @Override
    public Stmt visitAbort(Stmt.Abort stmt) {
        return stmt;
    }

    @Override
    public Stmt visitReturn(Stmt.Return stmt) {
        return stmt;
    }

    @Override
    public Stmt visitBreak(Stmt.Break stmt) {
        return stmt;
    }

    @Override
    public Stmt visitContinue(Stmt.Continue stmt) {
        return stmt;
    }

    @Override
    public Stmt visitSequence(Stmt.Sequence stmt) {
        List<Stmt> stmts = new ArrayList<>(stmt.stmts.size());
        for (Stmt s : stmt.stmts) {
            stmts.add(rewrite(s));
        }
        return new Stmt.Sequence(stmts);
    }

    @Override
    public Stmt visitIf(Stmt.If stmt) {
        return new Stmt.If(stmt.cond, rewrite(stmt.thenBranch), rewrite(stmt.elseBranch));
    }

    @Override
    public Stmt visitSwitch(Stmt.Switch stmt) {
        List<Stmt.SwitchArm> arms = new ArrayList<>(stmt.arms.size());
        for (Stmt.SwitchArm arm : stmt.arms) {
            arms.add(new Stmt.SwitchArm(arm.values, rewrite(arm.body)));
        }
        return new Stmt.Switch(stmt.discriminant, stmt.intTy, arms,
                stmt.otherwise == null ? null : rewrite(stmt.otherwise));
    }

    @Override
    public Stmt visitMatch(Stmt.Match stmt) {
        List<Stmt.MatchArm> arms = new ArrayList<>(stmt.arms.size());
        for (Stmt.MatchArm arm : stmt.arms) {
            arms.add(new Stmt.MatchArm(arm.variants, rewrite(arm.body)));
        }
        return new Stmt.Match(stmt.place, arms, stmt.otherwise == null ? null : rewrite(stmt.otherwise));
    }

    @Override
    public Stmt visitLoop(Stmt.Loop stmt) {
        return new Stmt.Loop(rewrite(stmt.body));
    }

    @Override
    public Stmt visitFlattened(Stmt.Flattened stmt) {
        List<Stmt.PseudoBlock> blocks = new ArrayList<>(stmt.blocks.size());
        for (Stmt.PseudoBlock block : stmt.blocks) {
            blocks.add(new Stmt.PseudoBlock(block.block, rewrite(block.body)));
        }
        return new Stmt.Flattened(stmt.entry, blocks);
    }

    @Override
    public Stmt visitGoto(Stmt.Goto stmt) {
        return stmt;
    }
}
