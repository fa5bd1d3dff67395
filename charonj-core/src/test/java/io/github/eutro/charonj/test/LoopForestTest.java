package io.github.eutro.charonj.test;

import io.github.eutro.charonj.ext.CommonExts;
import io.github.eutro.charonj.passes.meta.ComputeLoops;
import io.github.eutro.charonj.ullbc.UllbcBody;
import io.github.eutro.charonj.util.Dominators;
import io.github.eutro.charonj.util.Graph;
import io.github.eutro.charonj.util.LoopForest;
import org.junit.jupiter.api.Test;

import java.util.*;

import static io.github.eutro.charonj.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class LoopForestTest {
    static Graph<Integer> graph(int[]... succs) {
        return new Graph<Integer>() {
            @Override
            public Integer entry() {
                return 0;
            }

            @Override
            public List<Integer> nodes() {
                List<Integer> nodes = new ArrayList<>();
                for (int i = 0; i < succs.length; i++) nodes.add(i);
                return nodes;
            }

            @Override
            public List<Integer> successors(Integer node) {
                List<Integer> list = new ArrayList<>();
                for (int s : succs[node]) list.add(s);
                return list;
            }
        };
    }

    static int[] to(int... targets) {
        return targets;
    }

    static Graph<Integer> nested() {
        return graph(to(1), to(2, 5), to(3, 4), to(2, 5), to(1), to());
    }

    @Test
    void diamondDominators() {
        Dominators<Integer> doms = Dominators.compute(graph(to(1, 2), to(3), to(3), to()));
        assertNull(doms.idom(0));
        assertEquals(0, doms.idom(1));
        assertEquals(0, doms.idom(2));
        assertEquals(0, doms.idom(3));
        assertTrue(doms.dominates(0, 3));
        assertTrue(doms.dominates(3, 3));
        assertFalse(doms.dominates(1, 3));
        assertFalse(doms.dominates(2, 3));
        assertEquals(0, doms.reachable().get(0));
    }

    @Test
    void unreachableNodes() {
        Graph<Integer> g = graph(to(1), to(), to(1));
        Dominators<Integer> doms = Dominators.compute(g);
        assertFalse(doms.isReachable(2));
        assertNull(doms.idom(2));
        assertFalse(doms.dominates(0, 2));
        LoopForest<Integer> forest = LoopForest.compute(g, doms);
        assertEquals(Integer.MAX_VALUE, forest.rpoIndex(2));
        assertEquals(Arrays.asList(0, 1), forest.reversePostOrder());
    }

    @Test
    void nestedLoops() {
        Graph<Integer> g = nested();
        Dominators<Integer> doms = Dominators.compute(g);
        assertEquals(1, doms.idom(2));
        assertEquals(2, doms.idom(3));
        assertEquals(2, doms.idom(4));
        assertEquals(1, doms.idom(5));

        LoopForest<Integer> forest = LoopForest.compute(g, doms);
        assertTrue(forest.isReducible());
        assertEquals(Arrays.asList(1, 2), forest.headers());
        assertEquals(new HashSet<>(Arrays.asList(1, 2, 3, 4)), forest.body(1));
        assertEquals(new HashSet<>(Arrays.asList(2, 3)), forest.body(2));
        assertTrue(forest.body(0).isEmpty());

        assertTrue(forest.isBackEdge(3, 2));
        assertTrue(forest.isBackEdge(4, 1));
        assertFalse(forest.isBackEdge(1, 2));

        assertNull(forest.parent(1));
        assertEquals(1, forest.parent(2));
        assertEquals(2, forest.innermost(3));
        assertEquals(1, forest.innermost(4));
        assertNull(forest.innermost(5));

        // a header sits at the level of its enclosing loop
        assertNull(forest.level(1));
        assertEquals(1, forest.level(2));
        assertEquals(2, forest.level(3));
        assertNull(forest.level(5));

        assertEquals(2, forest.depth(3));
        assertEquals(1, forest.depth(4));
        assertEquals(0, forest.depth(0));
    }

    @Test
    void irreducibleRegion() {
        LoopForest<Integer> forest = LoopForest.compute(
                graph(to(1, 2), to(2, 3), to(1), to()),
                Dominators.compute(graph(to(1, 2), to(2, 3), to(1), to())));
        assertFalse(forest.isReducible());
        assertTrue(forest.headers().isEmpty());
        assertEquals(1, forest.irreducibleRegions().size());
        List<Integer> region = forest.irreducibleRegions().get(0);
        assertEquals(new HashSet<>(Arrays.asList(1, 2)), new HashSet<>(region));
        assertSame(region, forest.regionOf(1));
        assertSame(region, forest.regionOf(2));
        assertNull(forest.regionOf(0));
        assertNull(forest.regionOf(3));
    }

    @Test
    void selfLoopIsReducible() {
        Graph<Integer> g = graph(to(1), to(1, 2), to());
        LoopForest<Integer> forest = LoopForest.compute(g, Dominators.compute(g));
        assertTrue(forest.isReducible());
        assertTrue(forest.isHeader(1));
        assertEquals(Collections.singleton(1), forest.body(1));
        assertTrue(forest.isBackEdge(1, 1));
    }

    @Test
    void attachedToBodies() {
        UllbcBody body = cfg(goTo(1), branch(2, 3), goTo(1), ret());
        ComputeLoops.INSTANCE.runInPlace(body);
        LoopForest<Integer> forest = body.getExtOrThrow(CommonExts.LOOP_FOREST);
        assertEquals(Collections.singletonList(1), forest.headers());
        assertEquals(new HashSet<>(Arrays.asList(1, 2)), forest.body(1));
        assertEquals(0, body.getExtOrThrow(CommonExts.DOMINATORS).idom(1));
    }
}
