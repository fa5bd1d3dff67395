package io.github.eutro.charonj.passes.meta;

import io.github.eutro.charonj.ext.CommonExts;
import io.github.eutro.charonj.ext.MetadataState;
import io.github.eutro.charonj.passes.InPlaceIRPass;
import io.github.eutro.charonj.ullbc.UllbcBody;
import io.github.eutro.charonj.util.LoopForest;

/**
 * Computes {@link CommonExts#LOOP_FOREST} for a body.
 */
public class ComputeLoops implements InPlaceIRPass<UllbcBody> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeLoops INSTANCE = new ComputeLoops();

    @Override
    public void runInPlace(UllbcBody body) {
        MetadataState ms = body.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(body, MetadataState.DOMS);
        body.attachExt(CommonExts.LOOP_FOREST,
                LoopForest.compute(body.asGraph(), body.getExtOrThrow(CommonExts.DOMINATORS)));
        ms.validate(MetadataState.LOOPS);
    }
}
