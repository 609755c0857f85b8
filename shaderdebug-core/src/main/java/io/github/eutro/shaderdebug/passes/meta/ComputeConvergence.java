package io.github.eutro.shaderdebug.passes.meta;

import io.github.eutro.shaderdebug.controlflow.BlockEdge;
import io.github.eutro.shaderdebug.controlflow.ConvergenceAnalysis;
import io.github.eutro.shaderdebug.ext.CommonExts;
import io.github.eutro.shaderdebug.ext.MetadataState;
import io.github.eutro.shaderdebug.passes.InPlaceIRPass;
import io.github.eutro.shaderdebug.ssa.BasicBlock;
import io.github.eutro.shaderdebug.ssa.Function;
import io.github.eutro.shaderdebug.util.GraphWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Runs the {@link ConvergenceAnalysis} over the blocks of a function reachable from its entry,
 * and attaches it as {@link CommonExts#CONVERGENCE}.
 * <p>
 * Block ids are the blocks' positions in {@link Function#blocks}.
 */
public class ComputeConvergence implements InPlaceIRPass<Function> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ComputeConvergence.class);

    public static final ComputeConvergence INSTANCE = new ComputeConvergence();

    @Override
    public void runInPlace(Function func) {
        Map<BasicBlock, Integer> ids = new IdentityHashMap<>();
        for (BasicBlock block : func.blocks) {
            ids.put(block, ids.size());
        }

        List<BlockEdge> edges = new ArrayList<>();
        List<BasicBlock> reachable = func.blocks.isEmpty()
                ? Collections.emptyList()
                : GraphWalker.blockWalker(func).preOrder();
        for (BasicBlock block : reachable) {
            for (BasicBlock target : block.getControl().targets) {
                Integer to = ids.get(target);
                if (to == null) {
                    throw new IllegalStateException("Block " + block.toTargetString()
                            + " of " + func.name + " jumps out of the function");
                }
                edges.add(new BlockEdge(ids.get(block), to));
            }
        }
        if (reachable.size() < func.blocks.size()) {
            LOGGER.debug("{} has {} unreachable blocks", func.name, func.blocks.size() - reachable.size());
        }

        func.attachExt(CommonExts.CONVERGENCE, ConvergenceAnalysis.construct(edges));
        func.getExtOrThrow(CommonExts.METADATA_STATE).validate(MetadataState.CONVERGENCE);
    }

    @Override
    public String toString() {
        return "ComputeConvergence";
    }
}
