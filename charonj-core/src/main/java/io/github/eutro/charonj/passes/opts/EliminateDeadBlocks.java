package io.github.eutro.charonj.passes.opts;

import io.github.eutro.charonj.ext.CommonExts;
import io.github.eutro.charonj.passes.InPlaceIRPass;
import io.github.eutro.charonj.ullbc.BasicBlock;
import io.github.eutro.charonj.ullbc.UllbcBody;
import io.github.eutro.charonj.util.GraphWalker;

import java.util.ArrayList;
import java.util.List;

/**
 * An optimisation pass that removes any blocks unreachable from the entry block,
 * renumbering the remaining blocks in their original order.
 * <p>
 * Unwind edges count as edges.
 */
public class EliminateDeadBlocks implements InPlaceIRPass<UllbcBody> {
    /**
     * An instance of this pass.
     */
    public static final EliminateDeadBlocks INSTANCE = new EliminateDeadBlocks();

    @Override
    public void runInPlace(UllbcBody body) {
        if (body.blocks.isEmpty()) return;
        boolean[] live = new boolean[body.blocks.size()];
        for (int block : GraphWalker.of(body.asFullGraph()).preOrder()) {
            live[block] = true;
        }
        int[] renumber = new int[live.length];
        List<BasicBlock> kept = new ArrayList<>();
        for (int i = 0; i < live.length; i++) {
            if (live[i]) {
                renumber[i] = kept.size();
                kept.add(body.blocks.get(i));
            } else {
                renumber[i] = -1;
            }
        }
        if (kept.size() == live.length) return;
        for (BasicBlock block : kept) {
            block.setTerminator(block.getTerminator().mapTargets(t -> renumber[t]));
        }
        body.blocks.clear();
        body.blocks.addAll(kept);
        body.getExtOrThrow(CommonExts.METADATA_STATE)
                .graphChanged();
    }
}
