package com.dataflow.memo.engine;

import java.util.Arrays;

/**
 * Marks a node and everything downstream of it as stale.
 *
 * Traversal is an iterative depth-first walk over the dependents edges. Each
 * reachable node is stamped on first visit, so a node reachable over several
 * paths (diamonds) is expanded once and the pass stays linear in the number
 * of edges.
 */
final class Invalidator<T> {
    private final NodeArena<T> arena;

    // Reused work stack; grows to the widest frontier seen so far.
    private int[] stack = new int[16];

    Invalidator(NodeArena<T> arena) {
        this.arena = arena;
    }

    /**
     * Marks {@code origin} and all of its transitive dependents stale.
     *
     * @return The number of distinct nodes visited, origin included.
     */
    int invalidate(int origin) {
        final int gen = arena.nextGeneration();
        int top = 0;
        int visited = 0;
        arena.visit(origin, gen);
        stack[top++] = origin;

        while (top > 0) {
            int index = stack[--top];
            Node<T> node = arena.node(index);
            node.markStale();
            visited++;

            final int n = node.dependentCount();
            for (int i = 0; i < n; i++) {
                int dep = node.dependent(i);
                if (!arena.visit(dep, gen))
                    continue;
                if (top == stack.length)
                    stack = Arrays.copyOf(stack, stack.length * 2);
                stack[top++] = dep;
            }
        }
        return visited;
    }
}
