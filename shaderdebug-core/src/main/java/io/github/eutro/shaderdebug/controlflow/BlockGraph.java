package io.github.eutro.shaderdebug.controlflow;

import java.util.*;

/**
 * Adjacency of a set of {@link BlockEdge}s.
 * <p>
 * The graph's blocks are every id mentioned by an edge. One more id, {@link #pathEnd},
 * one past the largest block, stands for leaving the function: every block with no outgoing
 * edge gets a single edge to it. Duplicate edges collapse.
 */
public final class BlockGraph {
    private static final int[] NONE = new int[0];

    public final int pathEnd;
    private final int[] blocks;
    private final int[][] successors;
    private final int[] inDegree;

    public BlockGraph(Collection<BlockEdge> edges) {
        int max = -1;
        for (BlockEdge edge : edges) {
            max = Math.max(max, Math.max(edge.from, edge.to));
        }
        pathEnd = max + 1;

        BitSet present = new BitSet(pathEnd);
        List<SortedSet<Integer>> out = new ArrayList<>(pathEnd);
        for (int i = 0; i < pathEnd; i++) {
            out.add(new TreeSet<>());
        }
        for (BlockEdge edge : edges) {
            present.set(edge.from);
            present.set(edge.to);
            out.get(edge.from).add(edge.to);
        }

        blocks = present.stream().toArray();
        successors = new int[pathEnd + 1][];
        inDegree = new int[pathEnd + 1];
        for (int b = 0; b < pathEnd; b++) {
            if (!present.get(b)) {
                successors[b] = NONE;
                continue;
            }
            SortedSet<Integer> targets = out.get(b);
            if (targets.isEmpty()) {
                successors[b] = new int[]{pathEnd};
            } else {
                successors[b] = targets.stream().mapToInt(Integer::intValue).toArray();
            }
            for (int s : successors[b]) {
                inDegree[s]++;
            }
        }
        successors[pathEnd] = NONE;
    }

    public boolean isEmpty() {
        return blocks.length == 0;
    }

    /**
     * @return The ids of all blocks, ascending, not including {@link #pathEnd}.
     */
    public int[] getBlocks() {
        return blocks.clone();
    }

    public boolean contains(int block) {
        return block >= 0 && block < pathEnd && successors[block].length != 0;
    }

    /**
     * Get the distinct successors of a block, ascending. A block without outgoing edges has
     * {@link #pathEnd} as its only successor.
     *
     * @param block The block.
     * @return The successors, empty for {@link #pathEnd} and unknown blocks.
     */
    public int[] successors(int block) {
        if (block < 0 || block > pathEnd) return NONE;
        return successors[block].clone();
    }

    int successorCount(int block) {
        return block < 0 || block > pathEnd ? 0 : successors[block].length;
    }

    int successor(int block, int i) {
        return successors[block][i];
    }

    public int inDegree(int block) {
        return block < 0 || block > pathEnd ? 0 : inDegree[block];
    }

    public int outDegree(int block) {
        return successorCount(block);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int b : blocks) {
            sb.append(b).append(" ->");
            for (int s : successors[b]) {
                sb.append(' ').append(s == pathEnd ? "END" : Integer.toString(s));
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
