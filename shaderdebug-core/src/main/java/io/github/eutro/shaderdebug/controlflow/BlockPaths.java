package io.github.eutro.shaderdebug.controlflow;

import java.util.*;

/**
 * A set of {@link BlockPath}s, with the walks the analysis makes along them.
 * <p>
 * A walk continues from a block to whatever follows it in any path containing it, and from the
 * end of a cut path to its cut target, so walks reach through linked paths transitively.
 * Every walk keeps its own visited set.
 */
public final class BlockPaths {
    private final int pathEnd;
    private final List<BlockPath> paths;
    private final int[][] next;

    BlockPaths(int pathEnd, List<BlockPath> paths) {
        this.pathEnd = pathEnd;
        this.paths = Collections.unmodifiableList(paths);

        List<SortedSet<Integer>> follow = new ArrayList<>(pathEnd + 1);
        for (int i = 0; i <= pathEnd; i++) {
            follow.add(new TreeSet<>());
        }
        for (BlockPath path : paths) {
            for (int i = 0; i + 1 < path.length(); i++) {
                follow.get(path.get(i)).add(path.get(i + 1));
            }
            if (path.getEnd() == BlockPath.End.CUT) {
                follow.get(path.last()).add(path.getCutTarget());
            }
        }
        next = new int[pathEnd + 1][];
        for (int i = 0; i <= pathEnd; i++) {
            next[i] = follow.get(i).stream().mapToInt(Integer::intValue).toArray();
        }
    }

    public List<BlockPath> getPaths() {
        return paths;
    }

    /**
     * Get the paths containing a block.
     *
     * @param block The block.
     * @return The paths, in enumeration order.
     */
    public List<BlockPath> pathsThrough(int block) {
        List<BlockPath> through = new ArrayList<>();
        for (BlockPath path : paths) {
            if (path.contains(block)) through.add(path);
        }
        return through;
    }

    /**
     * Walk forward from {@code from}, taking at least one step.
     *
     * @param from The block to start from.
     * @return Every block reached, possibly including {@code from} itself and the path end.
     */
    public BitSet reachableFrom(int from) {
        BitSet visited = new BitSet(pathEnd + 1);
        Deque<Integer> queue = new ArrayDeque<>();
        for (int n : next(from)) {
            if (!visited.get(n)) {
                visited.set(n);
                queue.add(n);
            }
        }
        while (!queue.isEmpty()) {
            for (int n : next(queue.poll())) {
                if (!visited.get(n)) {
                    visited.set(n);
                    queue.add(n);
                }
            }
        }
        return visited;
    }

    /**
     * Check whether a walk from {@code from} can reach any of {@code targets} without passing through
     * {@code avoid}.
     *
     * @param from    The block to start from.
     * @param targets The blocks to look for.
     * @param avoid   The block the walk may not enter.
     * @return Whether a target is reachable.
     */
    public boolean reachesAvoiding(int from, BitSet targets, int avoid) {
        if (from == avoid) return false;
        if (targets.get(from)) return true;
        BitSet visited = new BitSet(pathEnd + 1);
        Deque<Integer> queue = new ArrayDeque<>();
        visited.set(from);
        queue.add(from);
        while (!queue.isEmpty()) {
            for (int n : next(queue.poll())) {
                if (n == avoid || visited.get(n)) continue;
                if (targets.get(n)) return true;
                visited.set(n);
                queue.add(n);
            }
        }
        return false;
    }

    /**
     * Count the fewest steps from {@code from} to every block a walk reaches.
     *
     * @param from The block to start from.
     * @return The step counts by block, -1 where unreachable. {@code from} itself only has a count
     * if it lies on a cycle.
     */
    public int[] distancesFrom(int from) {
        int[] dist = new int[pathEnd + 1];
        Arrays.fill(dist, -1);
        Deque<Integer> queue = new ArrayDeque<>();
        for (int n : next(from)) {
            if (dist[n] < 0) {
                dist[n] = 1;
                queue.add(n);
            }
        }
        while (!queue.isEmpty()) {
            int b = queue.poll();
            for (int n : next(b)) {
                if (dist[n] < 0) {
                    dist[n] = dist[b] + 1;
                    queue.add(n);
                }
            }
        }
        return dist;
    }

    private int[] next(int block) {
        return block < 0 || block > pathEnd ? new int[0] : next[block];
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < paths.size(); i++) {
            sb.append(i).append(": ").append(paths.get(i).toString(pathEnd)).append('\n');
        }
        return sb.toString();
    }
}
