package io.github.eutro.charonj.test;

import io.github.eutro.charonj.ext.CommonExts;
import io.github.eutro.charonj.ext.MetadataState;
import io.github.eutro.charonj.llbc.Stmt;
import io.github.eutro.charonj.passes.opts.EliminateDeadBlocks;
import io.github.eutro.charonj.translate.DuplicationMode;
import io.github.eutro.charonj.ullbc.Terminator;
import io.github.eutro.charonj.ullbc.UllbcBody;
import io.github.eutro.charonj.util.Dominators;
import io.github.eutro.charonj.util.LoopForest;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static io.github.eutro.charonj.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class DeadBlocksTest {
    @Test
    void unreachableBlocksRemoved() {
        UllbcBody body = cfg(goTo(2), goTo(0), ret());
        EliminateDeadBlocks.INSTANCE.runInPlace(body);
        assertEquals(2, body.blocks.size());
        assertEquals(goTo(1), body.blocks.get(0).getTerminator());
        assertEquals(Arrays.asList(mark(0)), body.blocks.get(0).statements);
        assertEquals(Arrays.asList(mark(2)), body.blocks.get(1).statements);
    }

    @Test
    void unwindOnlyBlockKept() {
        UllbcBody body = cfg(call(1, 3), ret(), goTo(1), ret());
        EliminateDeadBlocks.INSTANCE.runInPlace(body);
        assertEquals(3, body.blocks.size());
        Terminator.Call call = (Terminator.Call) body.blocks.get(0).getTerminator();
        assertEquals(1, call.target);
        assertEquals(Integer.valueOf(2), call.unwind);
        assertEquals(Arrays.asList(mark(3)), body.blocks.get(2).statements);

        // not part of the graph that gets structured
        MetadataState ms = body.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(body, MetadataState.LOOPS);
        Dominators<Integer> doms = body.getExtOrThrow(CommonExts.DOMINATORS);
        assertEquals(Arrays.asList(0, 1), doms.reachable());
        assertFalse(doms.isReachable(2));
        LoopForest<Integer> forest = body.getExtOrThrow(CommonExts.LOOP_FOREST);
        assertTrue(forest.headers().isEmpty());

        assertEquals(seq(marked(0), new Stmt.Call(call.call), marked(1), Stmt.RETURN),
                StructuringTest.structure(body, DuplicationMode.DUPLICATE_TAILS).body);
    }
}
