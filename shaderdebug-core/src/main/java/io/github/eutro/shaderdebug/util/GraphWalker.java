package io.github.eutro.shaderdebug.util;

import io.github.eutro.shaderdebug.ssa.BasicBlock;
import io.github.eutro.shaderdebug.ssa.Function;

import java.util.*;

/**
 * Walks a graph depth-first from a root, in pre-order, visiting each node once.
 *
 * @param <T> The type of a node.
 */
public class GraphWalker<T> {
    final T root;
    final F<? super T, ? extends Iterable<? extends T>> getChildren;

    /**
     * @param root        The node to start from.
     * @param getChildren The successor function. Later successors are visited first.
     */
    public GraphWalker(T root, F<? super T, ? extends Iterable<? extends T>> getChildren) {
        this.root = root;
        this.getChildren = getChildren;
    }

    /**
     * Walk the blocks of a function reachable from its entry.
     *
     * @param func The function.
     * @return The walker.
     */
    public static GraphWalker<BasicBlock> blockWalker(Function func) {
        return new GraphWalker<>(func.blocks.get(0), bb -> bb.getControl().targets);
    }

    public List<T> preOrder() {
        List<T> order = new ArrayList<>();
        Deque<T> stack = new ArrayDeque<>();
        Set<T> seen = new HashSet<>();
        stack.push(root);
        seen.add(root);
        while (!stack.isEmpty()) {
            T top = stack.pop();
            order.add(top);
            for (T next : getChildren.apply(top)) {
                if (seen.add(next)) {
                    stack.push(next);
                }
            }
        }
        return order;
    }
}
