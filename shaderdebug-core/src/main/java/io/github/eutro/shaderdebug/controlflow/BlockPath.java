package io.github.eutro.shaderdebug.controlflow;

import java.util.Arrays;

/**
 * One path produced by the {@link PathEnumerator}.
 */
public final class BlockPath {
    public enum End {
        /**
         * The last block is {@link BlockGraph#pathEnd}.
         */
        EXIT,
        /**
         * The last block had already been traced, and continues wherever else it appears.
         */
        LINKED,
        /**
         * The next block would have repeated one earlier in the path, it is the {@link #getCutTarget() cut target}.
         */
        CUT,
    }

    private final int[] blocks;
    private final End end;
    private final int cutTarget;

    BlockPath(int[] blocks, End end, int cutTarget) {
        this.blocks = blocks;
        this.end = end;
        this.cutTarget = cutTarget;
    }

    public int[] getBlocks() {
        return blocks.clone();
    }

    public int length() {
        return blocks.length;
    }

    public int get(int i) {
        return blocks[i];
    }

    public int first() {
        return blocks[0];
    }

    public int last() {
        return blocks[blocks.length - 1];
    }

    public End getEnd() {
        return end;
    }

    /**
     * @return The block the path was cut before, or -1 if it wasn't cut.
     */
    public int getCutTarget() {
        return cutTarget;
    }

    public int indexOf(int block) {
        for (int i = 0; i < blocks.length; i++) {
            if (blocks[i] == block) return i;
        }
        return -1;
    }

    public boolean contains(int block) {
        return indexOf(block) >= 0;
    }

    String toString(int pathEnd) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < blocks.length; i++) {
            if (i != 0) sb.append(" -> ");
            sb.append(blocks[i] == pathEnd ? "END" : Integer.toString(blocks[i]));
        }
        if (end == End.CUT) {
            sb.append(" (-> ").append(cutTarget).append(')');
        } else if (end == End.LINKED) {
            sb.append(" ...");
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return Arrays.toString(blocks) + " " + end;
    }
}
