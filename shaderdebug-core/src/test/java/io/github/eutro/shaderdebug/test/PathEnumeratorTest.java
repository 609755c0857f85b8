package io.github.eutro.shaderdebug.test;

import io.github.eutro.shaderdebug.controlflow.*;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestFactory;

import java.util.*;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class PathEnumeratorTest {
    @TestFactory
    Stream<DynamicTest> testEveryBlockIsCovered() {
        return Stream.of(
                ConvergenceAnalysisTest.TWO_LOOPS,
                ConvergenceAnalysisTest.MANY_LOOPS,
                ConvergenceAnalysisTest.edges(0, 1, 1, 2, 2, 1, 2, 3)
        ).flatMap(edges -> Arrays.stream(PathEnumerator.Mode.values()).map(mode ->
                DynamicTest.dynamicTest(mode + " over " + edges.size() + " edges", () -> {
                    BlockGraph graph = new BlockGraph(edges);
                    BlockPaths paths = PathEnumerator.enumerate(graph, mode);
                    for (int block : graph.getBlocks()) {
                        assertFalse(paths.pathsThrough(block).isEmpty(), "block " + block);
                    }
                })));
    }

    @Test
    void testNoLoopsNeverRepeats() {
        BlockGraph graph = new BlockGraph(ConvergenceAnalysisTest.MANY_LOOPS);
        BlockPaths paths = PathEnumerator.enumerate(graph, PathEnumerator.Mode.NO_LOOPS);
        for (BlockPath path : paths.getPaths()) {
            Set<Integer> seen = new HashSet<>();
            for (int block : path.getBlocks()) {
                assertTrue(seen.add(block), "repeated " + block + " in " + path);
            }
            if (path.getEnd() == BlockPath.End.CUT) {
                assertTrue(path.contains(path.getCutTarget()));
            }
        }
    }

    @Test
    void testWithLoopsRecordsCycle() {
        BlockGraph graph = new BlockGraph(ConvergenceAnalysisTest.edges(0, 1, 1, 2, 2, 1, 2, 3));
        BlockPaths paths = PathEnumerator.enumerate(graph, PathEnumerator.Mode.WITH_LOOPS);
        boolean sawCycle = false;
        for (BlockPath path : paths.getPaths()) {
            int last = path.last();
            if (path.indexOf(last) != path.length() - 1) sawCycle = true;
        }
        assertTrue(sawCycle, paths::toString);
    }

    @Test
    void testSinksExit() {
        BlockGraph graph = new BlockGraph(ConvergenceAnalysisTest.edges(0, 1, 0, 2));
        assertEquals(3, graph.pathEnd);
        assertArrayEquals(new int[]{3}, graph.successors(1));
        assertArrayEquals(new int[]{1, 2}, graph.successors(0));
        BlockPaths paths = PathEnumerator.enumerate(graph, PathEnumerator.Mode.NO_LOOPS);
        for (BlockPath path : paths.getPaths()) {
            assertEquals(BlockPath.End.EXIT, path.getEnd());
            assertEquals(3, path.last());
        }
        assertEquals(2, paths.getPaths().size());
    }

    @Test
    void testSingleSuccessorChainsAreInlined() {
        // whichever branch is traced second links into 3 and picks up the chain 3 -> 4 -> 5
        BlockGraph graph = new BlockGraph(ConvergenceAnalysisTest.edges(0, 1, 0, 2, 1, 3, 2, 3, 3, 4, 4, 5));
        BlockPaths paths = PathEnumerator.enumerate(graph, PathEnumerator.Mode.WITH_LOOPS);
        for (BlockPath path : paths.getPaths()) {
            assertEquals(BlockPath.End.EXIT, path.getEnd(), path::toString);
            assertEquals(graph.pathEnd, path.last());
        }
    }
}
