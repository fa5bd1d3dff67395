package io.github.eutro.charonj.test;

import io.github.eutro.charonj.llbc.Stmt;
import io.github.eutro.charonj.translate.DuplicationMode;
import io.github.eutro.charonj.ullbc.Terminator;
import io.github.eutro.charonj.ullbc.UllbcBody;
import io.github.eutro.charonj.util.Dominators;
import io.github.eutro.charonj.util.StronglyConnected;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static io.github.eutro.charonj.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Bodies far longer than the default thread stack allows to be walked block by block.
 */
public class LargeBodyTest {
    static final int CHAIN = 3000;
    static final int DIAMONDS = 700;

    static UllbcBody gotoChain(int n) {
        Terminator[] terms = new Terminator[n + 1];
        for (int i = 0; i < n; i++) terms[i] = goTo(i + 1);
        terms[n] = ret();
        return cfg(terms);
    }

    static UllbcBody diamondChain(int n) {
        Terminator[] terms = new Terminator[3 * n + 1];
        for (int i = 0; i < n; i++) {
            int head = 3 * i;
            terms[head] = branch(head + 1, head + 2);
            terms[head + 1] = goTo(head + 3);
            terms[head + 2] = goTo(head + 3);
        }
        terms[3 * n] = ret();
        return cfg(terms);
    }

    @Test
    void gotoChainStaysFlat() {
        List<Stmt> expected = new ArrayList<>();
        for (int i = 0; i <= CHAIN; i++) expected.add(marked(i));
        expected.add(Stmt.RETURN);
        for (DuplicationMode mode : DuplicationMode.values()) {
            assertEquals(new Stmt.Sequence(expected),
                    StructuringTest.structure(gotoChain(CHAIN), mode).body,
                    mode.toString());
        }
    }

    @Test
    void diamondChainJoinsEachDiamond() {
        List<Stmt> expected = new ArrayList<>();
        for (int i = 0; i < DIAMONDS; i++) {
            int head = 3 * i;
            expected.add(marked(head));
            expected.add(new Stmt.If(cond(), seq(marked(head + 1)), seq(marked(head + 2))));
        }
        expected.add(marked(3 * DIAMONDS));
        expected.add(Stmt.RETURN);
        for (DuplicationMode mode : DuplicationMode.values()) {
            assertEquals(new Stmt.Sequence(expected),
                    StructuringTest.structure(diamondChain(DIAMONDS), mode).body,
                    mode.toString());
        }
    }

    @Test
    void longLoopBody() {
        Terminator[] terms = new Terminator[CHAIN + 1];
        for (int i = 0; i < CHAIN - 1; i++) terms[i] = goTo(i + 1);
        terms[CHAIN - 1] = branch(0, CHAIN);
        terms[CHAIN] = ret();

        List<Stmt> loop = new ArrayList<>();
        for (int i = 0; i < CHAIN; i++) loop.add(marked(i));
        loop.add(new Stmt.If(cond(), seq(new Stmt.Continue(0)), seq(new Stmt.Break(0))));
        Stmt.Sequence expected = seq(
                new Stmt.Loop(new Stmt.Sequence(loop)),
                marked(CHAIN),
                Stmt.RETURN
        );
        assertEquals(expected, StructuringTest.structure(cfg(terms), DuplicationMode.DUPLICATE_TAILS).body);
    }

    @Test
    void dominatorsOfLongChain() {
        int[][] succs = new int[CHAIN + 1][];
        for (int i = 0; i < CHAIN; i++) succs[i] = LoopForestTest.to(i + 1);
        succs[CHAIN] = LoopForestTest.to();
        Dominators<Integer> doms = Dominators.compute(LoopForestTest.graph(succs));
        assertEquals(CHAIN + 1, doms.reachable().size());
        assertEquals(CHAIN - 1, (int) doms.idom(CHAIN));
        assertTrue(doms.dominates(0, CHAIN));
        assertTrue(doms.dominates(CHAIN / 2, CHAIN));
        assertFalse(doms.dominates(CHAIN, CHAIN / 2));
    }

    @Test
    void componentOfLongCycle() {
        List<Integer> nodes = new ArrayList<>();
        for (int i = 0; i < CHAIN; i++) nodes.add(i);
        List<List<Integer>> sccs = StronglyConnected.compute(nodes,
                n -> Collections.singletonList((n + 1) % CHAIN));
        assertEquals(1, sccs.size());
        assertEquals(nodes, sccs.get(0));
    }
}
