package io.github.eutro.shaderdebug.debug;

import io.github.eutro.shaderdebug.passes.InPlaceIRPass;
import io.github.eutro.shaderdebug.ssa.BasicBlock;
import io.github.eutro.shaderdebug.ssa.Function;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Block ids and flat instruction indices of a function, as reported in {@link ExecutionPoint}s.
 * <p>
 * Each block counts one instruction per effect, plus one for its control. Instruction indices number
 * these from 0 through the blocks in order.
 */
public final class FunctionLayout {
    /**
     * Attaches a layout to a function as {@link DebugExts#LAYOUT}.
     */
    public static final InPlaceIRPass<Function> COMPUTE = new InPlaceIRPass<Function>() {
        @Override
        public void runInPlace(Function func) {
            func.attachExt(DebugExts.LAYOUT, new FunctionLayout(func.blocks));
        }

        @Override
        public String toString() {
            return "ComputeLayout";
        }
    };

    private final Map<BasicBlock, Integer> ids = new IdentityHashMap<>();
    private final int[] offsets;

    private FunctionLayout(List<BasicBlock> blocks) {
        offsets = new int[blocks.size() + 1];
        int offset = 0;
        for (BasicBlock block : blocks) {
            offsets[ids.size()] = offset;
            ids.put(block, ids.size());
            offset += block.getEffects().size() + 1;
        }
        offsets[blocks.size()] = offset;
    }

    public static FunctionLayout of(Function func) {
        return func.getExtOrRun(DebugExts.LAYOUT, func, COMPUTE);
    }

    public int blockId(BasicBlock block) {
        Integer id = ids.get(block);
        if (id == null) throw new IllegalArgumentException("Block " + block.toTargetString() + " is not laid out");
        return id;
    }

    public int instructionIndex(int block, int effect) {
        return offsets[block] + effect;
    }

    public int blockStart(int block) {
        return offsets[block];
    }

    public int instructionCount() {
        return offsets[offsets.length - 1];
    }
}
