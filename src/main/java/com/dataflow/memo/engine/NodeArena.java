package com.dataflow.memo.engine;

import com.dataflow.memo.api.InvalidReferenceException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Single owner of all nodes of one graph, indexed by construction order.
 *
 * Nodes are only ever appended. Because a node can only reference nodes that
 * already exist, every edge points from a lower index to a higher one and the
 * graph is acyclic by construction; traversals need no cycle check.
 *
 * The arena also owns the visit-stamp array used by traversals. Stamping with
 * a fresh generation number replaces clearing a visited set on every pass.
 */
final class NodeArena<T> {
    private final List<Node<T>> nodes;

    private int[] visitStamps;
    private int generation;

    NodeArena(int initialCapacity) {
        this.nodes = new ArrayList<>(initialCapacity);
        this.visitStamps = new int[Math.max(initialCapacity, 16)];
    }

    NodeId add(Node<T> node) {
        int index = nodes.size();
        nodes.add(node);
        if (index >= visitStamps.length)
            visitStamps = Arrays.copyOf(visitStamps, visitStamps.length * 2);
        return new NodeId(this, index);
    }

    /**
     * Resolves an id minted by this arena.
     *
     * @throws InvalidReferenceException if the id belongs to another arena or
     *                                   is out of range.
     */
    Node<T> get(NodeId id) {
        return node(checkIndex(id));
    }

    /** Validates an id and returns its index. */
    int checkIndex(NodeId id) {
        if (id == null)
            throw new InvalidReferenceException(-1, "null node id");
        if (!id.belongsTo(this))
            throw new InvalidReferenceException(id.index(), "id belongs to another graph");
        if (id.index() < 0 || id.index() >= nodes.size())
            throw new InvalidReferenceException(id.index(), "no such node");
        return id.index();
    }

    /** Unchecked access by index, for traversals over already-validated edges. */
    Node<T> node(int index) {
        return nodes.get(index);
    }

    NodeId idOf(int index) {
        return new NodeId(this, index);
    }

    int size() {
        return nodes.size();
    }

    /** Starts a new traversal; previous visit marks become irrelevant. */
    int nextGeneration() {
        if (++generation == 0) {
            // Wrapped around: old stamps could collide with new generations.
            Arrays.fill(visitStamps, 0);
            generation = 1;
        }
        return generation;
    }

    /**
     * Marks a node visited in the given traversal generation.
     *
     * @return true if this is the first visit in that generation.
     */
    boolean visit(int index, int gen) {
        if (visitStamps[index] == gen)
            return false;
        visitStamps[index] = gen;
        return true;
    }
}
