package io.github.eutro.charonj.passes.meta;

import io.github.eutro.charonj.ext.CommonExts;
import io.github.eutro.charonj.ext.MetadataState;
import io.github.eutro.charonj.passes.InPlaceIRPass;
import io.github.eutro.charonj.ullbc.BasicBlock;
import io.github.eutro.charonj.ullbc.UllbcBody;
import io.github.eutro.charonj.util.Dominators;

import java.util.List;

/**
 * Computes the dominator tree of the structuring graph of a body (unwind edges excluded),
 * attaching {@link CommonExts#IDOM} and {@link CommonExts#RPO_INDEX} to each reachable block,
 * and {@link CommonExts#DOMINATORS} to the body.
 */
public class ComputeDoms implements InPlaceIRPass<UllbcBody> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeDoms INSTANCE = new ComputeDoms();

    @Override
    public void runInPlace(UllbcBody body) {
        MetadataState ms = body.getExtOrThrow(CommonExts.METADATA_STATE);
        Dominators<Integer> doms = Dominators.compute(body.asGraph());

        for (BasicBlock block : body.blocks) {
            block.removeExt(CommonExts.IDOM);
            block.removeExt(CommonExts.RPO_INDEX);
        }
        List<Integer> rpo = doms.reachable();
        for (int i = 0; i < rpo.size(); i++) {
            int node = rpo.get(i);
            BasicBlock block = body.blocks.get(node);
            block.attachExt(CommonExts.RPO_INDEX, i);
            Integer idom = doms.idom(node);
            if (idom != null) {
                block.attachExt(CommonExts.IDOM, idom);
            }
        }
        body.attachExt(CommonExts.DOMINATORS, doms);

        ms.validate(MetadataState.DOMS);
    }
}
