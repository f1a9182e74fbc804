package com.dataflow.memo.engine;

/**
 * Opaque handle to a node of one {@link ComputationGraph}.
 *
 * Ids are minted only by the graph's arena, in construction order. An id is
 * valid only for the graph that produced it; using it with another graph is
 * rejected with an {@link com.dataflow.memo.api.InvalidReferenceException}.
 */
public final class NodeId {
    private final NodeArena<?> arena;
    private final int index;

    NodeId(NodeArena<?> arena, int index) {
        this.arena = arena;
        this.index = index;
    }

    /** The node's construction index. Inputs of a node always have lower indices. */
    public int index() {
        return index;
    }

    boolean belongsTo(NodeArena<?> candidate) {
        return arena == candidate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof NodeId other))
            return false;
        return arena == other.arena && index == other.index;
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(arena) + index;
    }

    @Override
    public String toString() {
        return "NodeId[" + index + "]";
    }
}
