package io.github.eutro.shaderdebug.controlflow;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Classifies the blocks of a control flow graph, given only its branch edges.
 * <ul>
 *     <li><b>Uniform</b> blocks are executed by every run of the function that starts at block 0,
 *     and are outside any loop.</li>
 *     <li><b>Loop</b> blocks can reach themselves.</li>
 *     <li><b>Divergent</b> blocks have more than one successor.</li>
 *     <li>The <b>convergent</b> block of a divergent block is the nearest block that every path leaving
 *     it must pass through before the function returns, where lanes that took different branches meet again.</li>
 * </ul>
 * Instances are immutable once constructed, and may be shared freely between threads.
 */
public final class ConvergenceAnalysis {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConvergenceAnalysis.class);

    /**
     * Whether to log the graph, its paths and the results of every analysis, at debug level.
     */
    public static boolean LOG_CONTROL_FLOW = System.getenv("SHADERDEBUG_CONTROLFLOW_LOGGING") != null;

    private final BlockGraph graph;
    private final BlockPaths withLoops;
    private final BlockPaths noLoops;
    private final BitSet[] forward;

    private final SortedSet<Integer> uniformBlocks = new TreeSet<>();
    private final SortedSet<Integer> loopBlocks = new TreeSet<>();
    private final SortedSet<Integer> divergentBlocks = new TreeSet<>();
    private final SortedMap<Integer, Integer> convergentBlocks = new TreeMap<>();

    private ConvergenceAnalysis(BlockGraph graph) {
        this.graph = graph;
        withLoops = PathEnumerator.enumerate(graph, PathEnumerator.Mode.WITH_LOOPS);
        noLoops = PathEnumerator.enumerate(graph, PathEnumerator.Mode.NO_LOOPS);

        forward = new BitSet[graph.pathEnd + 1];
        for (int block : graph.getBlocks()) {
            forward[block] = withLoops.reachableFrom(block);
        }

        for (int block : graph.getBlocks()) {
            if (forward[block].get(block)) loopBlocks.add(block);
            if (graph.outDegree(block) > 1) divergentBlocks.add(block);
        }
        findUniformBlocks();
        findConvergentBlocks();
    }

    /**
     * Analyse the graph with the given edges.
     *
     * @param edges The edges, in any order, possibly with duplicates.
     * @return The analysis.
     */
    public static ConvergenceAnalysis construct(Collection<BlockEdge> edges) {
        ConvergenceAnalysis analysis = new ConvergenceAnalysis(new BlockGraph(edges));
        if (LOG_CONTROL_FLOW && LOGGER.isDebugEnabled()) {
            analysis.dump();
        }
        return analysis;
    }

    private void findUniformBlocks() {
        if (!graph.contains(0)) return;
        uniformBlocks.add(0);
        BitSet exits = exitsFrom(0);
        for (int block : graph.getBlocks()) {
            if (block == 0 || !forward[0].get(block) || loopBlocks.contains(block)) continue;
            if (!noLoops.reachesAvoiding(0, exits, block)) {
                uniformBlocks.add(block);
            }
        }
    }

    // where runs starting at the block finish: the path end if they can get there,
    // otherwise the infinite loops they get stuck in
    private BitSet exitsFrom(int block) {
        BitSet exits = new BitSet(graph.pathEnd + 1);
        if (forward[block].get(graph.pathEnd)) {
            exits.set(graph.pathEnd);
        } else {
            for (int loop : loopBlocks) {
                if (loop == block || forward[block].get(loop)) exits.set(loop);
            }
        }
        return exits;
    }

    private void findConvergentBlocks() {
        BitSet candidates = new BitSet(graph.pathEnd);
        for (int block : graph.getBlocks()) {
            if (graph.inDegree(block) > 1) candidates.set(block);
        }
        for (int divergent : divergentBlocks) {
            for (int succ : graph.successors(divergent)) {
                if (succ != graph.pathEnd) candidates.set(succ);
            }
        }

        BitSet exit = new BitSet(graph.pathEnd + 1);
        exit.set(graph.pathEnd);
        for (int divergent : divergentBlocks) {
            if (!forward[divergent].get(graph.pathEnd)) {
                LOGGER.warn("Block {} branches into a loop that never exits, it has no convergent block", divergent);
                continue;
            }
            List<Integer> locallyUniform = new ArrayList<>();
            for (int c = candidates.nextSetBit(0); c >= 0; c = candidates.nextSetBit(c + 1)) {
                if (c != divergent
                        && forward[divergent].get(c)
                        && !noLoops.reachesAvoiding(divergent, exit, c)) {
                    locallyUniform.add(c);
                }
            }
            int chosen = nearest(locallyUniform);
            if (chosen < 0) {
                LOGGER.warn("Failed to find a convergent block for divergent block {}", divergent);
            } else {
                convergentBlocks.put(divergent, chosen);
            }
        }
    }

    // the candidate that comes before all others; ties to the lowest id
    private int nearest(List<Integer> candidates) {
        for (int c : candidates) {
            boolean first = true;
            for (int other : candidates) {
                if (other != c && !forward[c].get(other)) {
                    first = false;
                    break;
                }
            }
            if (first) return c;
        }
        return -1;
    }

    private void dump() {
        LOGGER.debug("Block links:\n{}", graph);
        LOGGER.debug("Paths with loops:\n{}", withLoops);
        LOGGER.debug("Paths without loops:\n{}", noLoops);
        LOGGER.debug("Loop blocks: {}", loopBlocks);
        LOGGER.debug("Uniform blocks: {}", uniformBlocks);
        LOGGER.debug("Divergent blocks: {}", divergentBlocks);
        LOGGER.debug("Convergent blocks: {}", convergentBlocks);
    }

    public Set<Integer> getBlocks() {
        Set<Integer> blocks = new TreeSet<>();
        for (int block : graph.getBlocks()) blocks.add(block);
        return Collections.unmodifiableSet(blocks);
    }

    public int getPathEnd() {
        return graph.pathEnd;
    }

    public BlockGraph getGraph() {
        return graph;
    }

    public BlockPaths getWithLoopsPaths() {
        return withLoops;
    }

    public BlockPaths getNoLoopsPaths() {
        return noLoops;
    }

    public Set<Integer> getUniformBlocks() {
        return Collections.unmodifiableSet(uniformBlocks);
    }

    public Set<Integer> getLoopBlocks() {
        return Collections.unmodifiableSet(loopBlocks);
    }

    public Set<Integer> getDivergentBlocks() {
        return Collections.unmodifiableSet(divergentBlocks);
    }

    /**
     * @return The convergent block of each divergent block that has one.
     */
    public Map<Integer, Integer> getConvergentBlocks() {
        return Collections.unmodifiableMap(convergentBlocks);
    }

    /**
     * @param divergent A divergent block.
     * @return Its convergent block, or null if it has none.
     */
    public @Nullable Integer getConvergentBlock(int divergent) {
        return convergentBlocks.get(divergent);
    }

    public boolean isUniform(int block) {
        return uniformBlocks.contains(block);
    }

    public boolean isLoop(int block) {
        return loopBlocks.contains(block);
    }

    public boolean isDivergent(int block) {
        return divergentBlocks.contains(block);
    }

    /**
     * Check whether {@code to} can be reached from {@code from} by following at least one edge.
     *
     * @param from The block to start from.
     * @param to   The block to look for.
     * @return Whether {@code to} follows {@code from} on some path.
     */
    public boolean isForwardConnection(int from, int to) {
        if (!graph.contains(from) || to < 0 || to > graph.pathEnd) return false;
        return forward[from].get(to);
    }

    /**
     * Find the uniform block reached in the fewest steps from {@code from}. Ties go to the lowest id.
     *
     * @param from The block to start from.
     * @return The uniform block, or {@code from} if none can be reached.
     */
    public int getNextUniformBlock(int from) {
        if (!graph.contains(from)) return from;
        int[] dist = withLoops.distancesFrom(from);
        int best = from;
        int bestDist = Integer.MAX_VALUE;
        for (int uniform : uniformBlocks) {
            if (dist[uniform] > 0 && dist[uniform] < bestDist) {
                best = uniform;
                bestDist = dist[uniform];
            }
        }
        return best;
    }

    @Override
    public String toString() {
        return "ConvergenceAnalysis{uniform=" + uniformBlocks
                + ", loops=" + loopBlocks
                + ", divergent=" + divergentBlocks
                + ", convergent=" + convergentBlocks + '}';
    }
}
