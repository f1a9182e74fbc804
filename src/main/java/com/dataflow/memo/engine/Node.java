package com.dataflow.memo.engine;

import com.dataflow.memo.fn.FnN;

import java.util.Arrays;

/**
 * Per-node state held by the arena.
 *
 * An input node has no function and no inputs. An operation node has a
 * function and an ordered array of input indices. The input array never
 * changes after construction; the dependents array only grows while nodes are
 * being appended. {@code cache == null} means stale.
 */
final class Node<T> {
    private static final int[] NO_NODES = new int[0];

    private final int[] inputs;
    private final FnN<T> fn;

    // Reverse edges, grown in place as dependents are appended.
    private int[] dependents = NO_NODES;
    private int dependentCount;

    private T cache;

    private Node(int[] inputs, FnN<T> fn) {
        this.inputs = inputs;
        this.fn = fn;
    }

    static <T> Node<T> input() {
        return new Node<>(NO_NODES, null);
    }

    static <T> Node<T> operation(int[] inputs, FnN<T> fn) {
        return new Node<>(inputs.length == 0 ? NO_NODES : inputs, fn);
    }

    boolean isInput() {
        return fn == null;
    }

    FnN<T> fn() {
        return fn;
    }

    int inputCount() {
        return inputs.length;
    }

    int input(int i) {
        return inputs[i];
    }

    int dependentCount() {
        return dependentCount;
    }

    int dependent(int i) {
        return dependents[i];
    }

    void addDependent(int index) {
        if (dependentCount == dependents.length)
            dependents = Arrays.copyOf(dependents, Math.max(2, dependents.length * 2));
        dependents[dependentCount++] = index;
    }

    boolean isStale() {
        return cache == null;
    }

    T cache() {
        return cache;
    }

    void store(T value) {
        this.cache = value;
    }

    void markStale() {
        this.cache = null;
    }
}
