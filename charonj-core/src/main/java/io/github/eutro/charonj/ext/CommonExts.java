package io.github.eutro.charonj.ext;

import io.github.eutro.charonj.passes.meta.ComputeDoms;
import io.github.eutro.charonj.passes.meta.ComputeLoops;
import io.github.eutro.charonj.passes.meta.ComputePreds;
import io.github.eutro.charonj.ullbc.BasicBlock;
import io.github.eutro.charonj.ullbc.UllbcBody;
import io.github.eutro.charonj.util.Dominators;
import io.github.eutro.charonj.util.LoopForest;

import java.util.List;

/**
 * A collection of {@link Ext}s for analyses over {@link UllbcBody unstructured bodies}.
 */
public class CommonExts {
    /**
     * Attached to a {@link UllbcBody}. Has metadata about which analyses are up to date.
     *
     * @see MetadataState
     */
    public static final Ext<MetadataState> METADATA_STATE = Ext.create(MetadataState.class, "METADATA_STATE");

    /**
     * Attached to a {@link BasicBlock}. The indices of the predecessors of the block, unwind edges included.
     * <p>
     * Computed by {@link ComputePreds}.
     */
    public static final Ext<List<Integer>> PREDS = Ext.create(List.class, "PREDS");

    /**
     * Attached to a {@link BasicBlock}.
     * The index of the <a href="https://en.wikipedia.org/wiki/Dominator_(graph_theory)">immediate dominator</a>
     * of the block. Absent on the entry block.
     * <p>
     * Computed by {@link ComputeDoms}.
     */
    public static final Ext<Integer> IDOM = Ext.create(Integer.class, "IDOM");
    /**
     * Attached to a {@link BasicBlock}. The position of the block in reverse post-order.
     * <p>
     * Computed by {@link ComputeDoms}.
     */
    public static final Ext<Integer> RPO_INDEX = Ext.create(Integer.class, "RPO_INDEX");
    /**
     * Attached to a {@link UllbcBody}. The full dominator tree of the structuring graph.
     * <p>
     * Computed by {@link ComputeDoms}.
     */
    public static final Ext<Dominators<Integer>> DOMINATORS = Ext.create(Dominators.class, "DOMINATORS");

    /**
     * Attached to a {@link UllbcBody}. The natural loops of the body, and its irreducible regions.
     * <p>
     * Computed by {@link ComputeLoops}.
     */
    public static final Ext<LoopForest<Integer>> LOOP_FOREST = Ext.create(LoopForest.class, "LOOP_FOREST");
}
