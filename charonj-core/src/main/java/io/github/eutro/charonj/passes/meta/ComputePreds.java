package io.github.eutro.charonj.passes.meta;

import io.github.eutro.charonj.ext.CommonExts;
import io.github.eutro.charonj.ext.MetadataState;
import io.github.eutro.charonj.passes.InPlaceIRPass;
import io.github.eutro.charonj.ullbc.BasicBlock;
import io.github.eutro.charonj.ullbc.UllbcBody;

import java.util.ArrayList;

/**
 * Computes {@link CommonExts#PREDS} for each block.
 */
public class ComputePreds implements InPlaceIRPass<UllbcBody> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputePreds INSTANCE = new ComputePreds();

    @Override
    public void runInPlace(UllbcBody body) {
        MetadataState ms = body.getExtOrThrow(CommonExts.METADATA_STATE);

        for (BasicBlock block : body.blocks) {
            block.attachExt(CommonExts.PREDS, new ArrayList<>());
        }
        for (int i = 0; i < body.blocks.size(); i++) {
            for (int target : body.blocks.get(i).getTerminator().allTargets()) {
                body.blocks.get(target).getExtOrThrow(CommonExts.PREDS).add(i);
            }
        }

        ms.validate(MetadataState.PREDS);
    }
}
