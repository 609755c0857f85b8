package io.github.eutro.shaderdebug.debug;

import io.github.eutro.shaderdebug.ssa.Function;

import java.util.BitSet;

/**
 * A block where lanes that split at a branch wait for each other before going on.
 */
public final class MergePoint {
    public final Function function;
    public final int depth;
    public final int block;
    private final BitSet participants;

    MergePoint(Function function, int depth, int block, BitSet participants) {
        this.function = function;
        this.depth = depth;
        this.block = block;
        this.participants = (BitSet) participants.clone();
    }

    public boolean hasParticipant(int lane) {
        return participants.get(lane);
    }

    public BitSet getParticipants() {
        return (BitSet) participants.clone();
    }

    boolean covers(Function function, int depth, int block, BitSet lanes) {
        if (this.function != function || this.depth != depth || this.block != block) return false;
        BitSet missing = (BitSet) lanes.clone();
        missing.andNot(participants);
        return missing.isEmpty();
    }

    /**
     * @return Whether the lane is waiting here: at the start of the block, in the same invocation.
     */
    boolean isAt(LaneState lane) {
        if (!lane.isRunnable() || lane.getDepth() != depth) return false;
        StackFrame frame = lane.currentFrame();
        return frame != null
                && frame.function == function
                && frame.getBlockId() == block
                && frame.atBlockStart();
    }

    @Override
    public String toString() {
        return function.name + "@" + block + " " + participants;
    }
}
