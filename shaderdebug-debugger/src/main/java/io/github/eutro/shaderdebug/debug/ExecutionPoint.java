package io.github.eutro.shaderdebug.debug;

import io.github.eutro.shaderdebug.ssa.Function;

/**
 * Where a lane is: the function, how deep in the call stack, the block and the flat instruction index.
 */
public final class ExecutionPoint {
    public final Function function;
    public final int depth;
    public final int block;
    public final int instruction;

    public ExecutionPoint(Function function, int depth, int block, int instruction) {
        this.function = function;
        this.depth = depth;
        this.block = block;
        this.instruction = instruction;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExecutionPoint)) return false;
        ExecutionPoint that = (ExecutionPoint) o;
        return function == that.function
                && depth == that.depth
                && block == that.block
                && instruction == that.instruction;
    }

    @Override
    public int hashCode() {
        int result = System.identityHashCode(function);
        result = 31 * result + depth;
        result = 31 * result + block;
        result = 31 * result + instruction;
        return result;
    }

    @Override
    public String toString() {
        return function.name + "@" + block + ":" + instruction + (depth == 0 ? "" : " (depth " + depth + ")");
    }
}
