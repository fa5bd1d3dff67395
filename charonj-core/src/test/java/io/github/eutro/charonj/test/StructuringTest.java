package io.github.eutro.charonj.test;

import io.github.eutro.charonj.expr.Local;
import io.github.eutro.charonj.expr.Operand;
import io.github.eutro.charonj.expr.Place;
import io.github.eutro.charonj.expr.Rvalue;
import io.github.eutro.charonj.ext.CommonExts;
import io.github.eutro.charonj.llbc.LlbcBody;
import io.github.eutro.charonj.llbc.Stmt;
import io.github.eutro.charonj.passes.convert.UllbcToLlbc;
import io.github.eutro.charonj.translate.DuplicationMode;
import io.github.eutro.charonj.types.Literal;
import io.github.eutro.charonj.types.LiteralTy;
import io.github.eutro.charonj.types.Ty;
import io.github.eutro.charonj.ullbc.Statement;
import io.github.eutro.charonj.ullbc.UllbcBody;
import io.github.eutro.charonj.util.LoopForest;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static io.github.eutro.charonj.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class StructuringTest {
    static LlbcBody structure(UllbcBody body, DuplicationMode mode) {
        return new UllbcToLlbc(mode).run(body);
    }

    static UllbcBody diamond() {
        return cfg(
                branch(1, 2),
                goTo(3),
                goTo(3),
                ret()
        );
    }

    static Stmt setFlag(int local, boolean value) {
        return new Stmt.Simple(new Statement.Assign(Place.local(local),
                new Rvalue.Use(Operand.literal(Literal.bool(value)))));
    }

    @Test
    void diamondJoinsOnceInBothModes() {
        Stmt.Sequence expected = seq(
                marked(0),
                new Stmt.If(cond(), seq(marked(1)), seq(marked(2))),
                marked(3),
                Stmt.RETURN
        );
        for (DuplicationMode mode : DuplicationMode.values()) {
            LlbcBody llbc = structure(diamond(), mode);
            assertEquals(expected, llbc.body, mode.toString());
            assertEquals(3, llbc.locals.size());
        }
    }

    @Test
    void simpleLoop() {
        UllbcBody body = cfg(
                goTo(1),
                branch(2, 3),
                goTo(1),
                ret()
        );
        Stmt.Sequence expected = seq(
                marked(0),
                new Stmt.Loop(seq(
                        marked(1),
                        new Stmt.If(cond(),
                                seq(marked(2), new Stmt.Continue(0)),
                                seq(new Stmt.Break(0)))
                )),
                marked(3),
                Stmt.RETURN
        );
        assertEquals(expected, structure(body, DuplicationMode.DUPLICATE_TAILS).body);
    }

    @Test
    void selfLoopWithoutExit() {
        UllbcBody body = cfg(goTo(0));
        assertEquals(seq(new Stmt.Loop(seq(marked(0), new Stmt.Continue(0)))),
                structure(body, DuplicationMode.DUPLICATE_TAILS).body);
    }

    @Test
    void breakOutOfNestedLoops() {
        UllbcBody body = cfg(
                goTo(1),
                branch(2, 5),
                branch(3, 4),
                branch(2, 5),
                goTo(1),
                ret()
        );
        Stmt.Sequence inner = seq(
                marked(2),
                new Stmt.If(cond(),
                        seq(marked(3), new Stmt.If(cond(),
                                seq(new Stmt.Continue(0)),
                                seq(new Stmt.Break(1)))),
                        seq(new Stmt.Break(0)))
        );
        Stmt.Sequence outer = seq(
                marked(1),
                new Stmt.If(cond(),
                        seq(new Stmt.Loop(inner), marked(4), new Stmt.Continue(0)),
                        seq(new Stmt.Break(0)))
        );
        Stmt.Sequence expected = seq(marked(0), new Stmt.Loop(outer), marked(5), Stmt.RETURN);
        assertEquals(expected, structure(body, DuplicationMode.DUPLICATE_TAILS).body);
    }

    static UllbcBody partialReconvergence() {
        return cfg(
                switchOn(null, 1, 2, 3),
                goTo(4),
                goTo(4),
                goTo(5),
                goTo(5),
                ret()
        );
    }

    @Test
    void duplicatedTail() {
        Stmt.Sequence expected = seq(
                marked(0),
                new Stmt.Switch(discr(), LiteralTy.U32, Arrays.asList(
                        new Stmt.SwitchArm(u32s(0), seq(marked(1), marked(4))),
                        new Stmt.SwitchArm(u32s(1), seq(marked(2), marked(4))),
                        new Stmt.SwitchArm(u32s(2), seq(marked(3)))
                ), null),
                marked(5),
                Stmt.RETURN
        );
        assertEquals(expected, structure(partialReconvergence(), DuplicationMode.DUPLICATE_TAILS).body);
    }

    @Test
    void syntheticJoinFlag() {
        LlbcBody llbc = structure(partialReconvergence(), DuplicationMode.SYNTHETIC_JOIN);
        Stmt.Sequence expected = seq(
                setFlag(3, false),
                marked(0),
                new Stmt.Switch(discr(), LiteralTy.U32, Arrays.asList(
                        new Stmt.SwitchArm(u32s(0), seq(marked(1), setFlag(3, true))),
                        new Stmt.SwitchArm(u32s(1), seq(marked(2), setFlag(3, true))),
                        new Stmt.SwitchArm(u32s(2), seq(marked(3)))
                ), null),
                new Stmt.If(Operand.copy(Place.local(3)), seq(marked(4)), seq()),
                marked(5),
                Stmt.RETURN
        );
        assertEquals(expected, llbc.body);
        assertEquals(4, llbc.locals.size());
        assertEquals(new Local(3, "join_bb4", Ty.literal(LiteralTy.BOOL)), llbc.locals.get(3));
    }

    @Test
    void switchValuesGroupedByTarget() {
        UllbcBody body = cfg(
                switchOn(2, 1, 2, 1),
                ret(),
                ret()
        );
        Stmt.Sequence expected = seq(
                marked(0),
                new Stmt.Switch(discr(), LiteralTy.U32, Arrays.asList(
                        new Stmt.SwitchArm(u32s(0, 2), seq(marked(1), Stmt.RETURN)),
                        new Stmt.SwitchArm(u32s(1), seq())
                ), seq()),
                marked(2),
                Stmt.RETURN
        );
        assertEquals(expected, structure(body, DuplicationMode.DUPLICATE_TAILS).body);
    }

    @Test
    void irreducibleRegionFlattened() {
        UllbcBody body = cfg(
                branch(1, 2),
                branch(2, 3),
                goTo(1),
                ret()
        );
        LlbcBody llbc = structure(body, DuplicationMode.DUPLICATE_TAILS);

        LoopForest<Integer> forest = body.getExtOrThrow(CommonExts.LOOP_FOREST);
        assertFalse(forest.isReducible());
        assertEquals(1, forest.irreducibleRegions().size());
        List<Integer> region = forest.irreducibleRegions().get(0);
        assertTrue(region.containsAll(Arrays.asList(1, 2)));
        assertEquals(2, region.size());

        assertEquals(2, llbc.body.stmts.size());
        assertEquals(marked(0), llbc.body.stmts.get(0));
        Stmt.If branch = (Stmt.If) llbc.body.stmts.get(1);
        Stmt.Flattened viaOne = (Stmt.Flattened) branch.thenBranch.stmts.get(0);
        Stmt.Flattened viaTwo = (Stmt.Flattened) branch.elseBranch.stmts.get(0);
        assertEquals(1, viaOne.entry);
        assertEquals(2, viaTwo.entry);
        assertEquals(viaOne.blocks, viaTwo.blocks);

        Stmt.Sequence one = seq(marked(1), new Stmt.If(cond(),
                seq(new Stmt.Goto(2)),
                seq(marked(3), Stmt.RETURN)));
        Stmt.Sequence two = seq(marked(2), new Stmt.Goto(1));
        assertEquals(one, viaOne.getBlock(1).body);
        assertEquals(two, viaOne.getBlock(2).body);
        assertNull(viaOne.getBlock(3));
    }

    @Test
    void deterministic() {
        for (DuplicationMode mode : DuplicationMode.values()) {
            UllbcBody body = partialReconvergence();
            LlbcBody first = structure(body, mode);
            LlbcBody again = structure(body, mode);
            LlbcBody fresh = structure(partialReconvergence(), mode);
            assertEquals(first, again);
            assertEquals(first, fresh);
            assertEquals(first.toString(), fresh.toString());
        }
    }
}
