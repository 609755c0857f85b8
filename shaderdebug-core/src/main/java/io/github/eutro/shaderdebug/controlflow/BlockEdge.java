package io.github.eutro.shaderdebug.controlflow;

/**
 * A branch edge between two blocks, identified by their ids.
 */
public final class BlockEdge {
    public final int from;
    public final int to;

    public BlockEdge(int from, int to) {
        if (from < 0 || to < 0) {
            throw new IllegalArgumentException("Negative block id in edge " + from + " -> " + to);
        }
        this.from = from;
        this.to = to;
    }

    public static BlockEdge of(int from, int to) {
        return new BlockEdge(from, to);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BlockEdge)) return false;
        BlockEdge that = (BlockEdge) o;
        return from == that.from && to == that.to;
    }

    @Override
    public int hashCode() {
        return 31 * from + to;
    }

    @Override
    public String toString() {
        return from + " -> " + to;
    }
}
