package io.github.eutro.shaderdebug.controlflow;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;

/**
 * Traces the paths of a {@link BlockGraph}.
 * <p>
 * Tracing starts from each block, in ascending order, that no earlier path covered. A path forks at
 * each branch, and stops at the first block that was already traced, which keeps the total work
 * proportional to the number of edges. In {@link Mode#NO_LOOPS} a path additionally stops just before
 * a block already in itself.
 * <p>
 * A path that stopped at an already traced block is then extended with that block's chain of single
 * successors, as long as the chain doesn't revisit a block of the path.
 */
public final class PathEnumerator {
    public enum Mode {
        WITH_LOOPS,
        NO_LOOPS,
    }

    private final BlockGraph graph;
    private final Mode mode;

    private PathEnumerator(BlockGraph graph, Mode mode) {
        this.graph = graph;
        this.mode = mode;
    }

    public static BlockPaths enumerate(BlockGraph graph, Mode mode) {
        return new PathEnumerator(graph, mode).run();
    }

    private BlockPaths run() {
        List<BlockPath> paths = new ArrayList<>();
        BitSet traced = new BitSet(graph.pathEnd + 1);
        for (int block : graph.getBlocks()) {
            if (!traced.get(block)) {
                trace(block, traced, paths);
            }
        }
        return new BlockPaths(graph.pathEnd, paths);
    }

    private void trace(int start, BitSet traced, List<BlockPath> paths) {
        Deque<IntList> pending = new ArrayDeque<>();
        traced.set(start);
        pending.push(new IntList().with(start));
        while (!pending.isEmpty()) {
            IntList prefix = pending.pop();
            int from = prefix.last();
            int count = graph.successorCount(from);
            for (int i = 0; i < count; i++) {
                int to = graph.successor(from, i);
                IntList path = i == count - 1 ? prefix : prefix.copy();
                if (to == graph.pathEnd) {
                    paths.add(path.with(to).finish(BlockPath.End.EXIT, -1));
                } else if (mode == Mode.NO_LOOPS && path.contains(to)) {
                    paths.add(path.finish(BlockPath.End.CUT, to));
                } else if (traced.get(to)) {
                    paths.add(extendChain(path.with(to)));
                } else {
                    traced.set(to);
                    pending.push(path.with(to));
                }
            }
        }
    }

    private BlockPath extendChain(IntList path) {
        int last = path.last();
        while (graph.successorCount(last) == 1) {
            int next = graph.successor(last, 0);
            if (next == graph.pathEnd) {
                return path.with(next).finish(BlockPath.End.EXIT, -1);
            }
            if (path.contains(next)) break;
            path.with(next);
            last = next;
        }
        return path.finish(BlockPath.End.LINKED, -1);
    }

    private static final class IntList {
        private int[] data = new int[8];
        private int size = 0;

        IntList with(int value) {
            if (size == data.length) {
                int[] grown = new int[size * 2];
                System.arraycopy(data, 0, grown, 0, size);
                data = grown;
            }
            data[size++] = value;
            return this;
        }

        int last() {
            return data[size - 1];
        }

        boolean contains(int value) {
            for (int i = 0; i < size; i++) {
                if (data[i] == value) return true;
            }
            return false;
        }

        IntList copy() {
            IntList copy = new IntList();
            copy.data = data.clone();
            copy.size = size;
            return copy;
        }

        BlockPath finish(BlockPath.End end, int cutTarget) {
            int[] blocks = new int[size];
            System.arraycopy(data, 0, blocks, 0, size);
            return new BlockPath(blocks, end, cutTarget);
        }
    }
}
