package io.github.eutro.shaderdebug.passes.meta;

import io.github.eutro.shaderdebug.ext.CommonExts;
import io.github.eutro.shaderdebug.ext.MetadataState;
import io.github.eutro.shaderdebug.ops.CommonOps;
import io.github.eutro.shaderdebug.passes.InPlaceIRPass;
import io.github.eutro.shaderdebug.ssa.BasicBlock;
import io.github.eutro.shaderdebug.ssa.Effect;
import io.github.eutro.shaderdebug.ssa.Function;

import java.util.List;

/**
 * Checks that phis lead their blocks, and have one argument for each of their listed predecessors,
 * all of which really jump to the block.
 */
public class CheckPhis implements InPlaceIRPass<Function> {
    public static final CheckPhis INSTANCE = new CheckPhis();

    @Override
    public void runInPlace(Function func) {
        for (BasicBlock block : func.blocks) {
            if (block.getControl() == null) {
                throw new IllegalStateException("Block " + block.toTargetString() + " of " + func.name + " has no control");
            }
        }
        func.getExtOrThrow(CommonExts.METADATA_STATE).ensureValid(func, MetadataState.PREDS);
        for (BasicBlock block : func.blocks) {
            List<BasicBlock> preds = block.getExtOrThrow(CommonExts.PREDS);
            boolean pastPhis = false;
            for (Effect effect : block.getEffects()) {
                List<BasicBlock> from = CommonOps.PHI.argNullable(effect.insn().op);
                if (from == null) {
                    pastPhis = true;
                    continue;
                }
                if (pastPhis) {
                    throw new IllegalStateException("Phi after other effects: " + effect + " in " + block.toTargetString());
                }
                if (from.size() != effect.insn().arity()) {
                    throw new IllegalStateException("Phi arity mismatch: " + effect);
                }
                for (BasicBlock pred : from) {
                    if (!preds.contains(pred)) {
                        throw new IllegalStateException("Phi lists " + pred.toTargetString()
                                + ", which doesn't jump to " + block.toTargetString() + ": " + effect);
                    }
                }
            }
        }
    }

    @Override
    public String toString() {
        return "CheckPhis";
    }
}
