package com.dataflow.memo.engine;

import com.dataflow.memo.api.EvaluationListener;
import com.dataflow.memo.api.NotAnInputNodeException;
import com.dataflow.memo.fn.FnN;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import lombok.extern.log4j.Log4j2;

/**
 * An incremental, memoized dataflow graph.
 *
 * The graph owns every node in a single arena. Input nodes hold values set
 * from outside; operation nodes hold pure functions of their inputs' values.
 * Values are computed lazily on {@link #compute(NodeId)} and cached until an
 * upstream input changes.
 *
 * Lifecycle:
 * 1. Construction: nodes are appended with {@link #addInputNode()} and
 * {@link #addNode(List, FnN)}. Topology never changes after a node is added,
 * but construction may interleave freely with updates and queries.
 * 2. Updates: {@link #setInput(String, Object)} marks the input and all of its
 * transitive dependents stale, then stores the new value. Setting a value
 * always invalidates, even if it equals the previous one.
 * 3. Queries: {@link #compute(NodeId)} re-evaluates only the stale part of the
 * queried node's ancestry.
 *
 * Thread Safety:
 * Not thread-safe. A compute call writes caches, so updates and queries from
 * several threads must be serialized by the caller.
 *
 * @param <T> Value type of every node in the graph.
 */
@Log4j2
public final class ComputationGraph<T> {
    private static final int DEFAULT_CAPACITY = 64;

    private final String name;
    private final NodeArena<T> arena;
    private final InputRegistry registry;
    private final TopologyBuilder<T> builder;
    private final Invalidator<T> invalidator;
    private final Evaluator<T> evaluator;

    private EvaluationListener listener;
    private long epoch;

    private ComputationGraph(String name, int initialCapacity) {
        if (initialCapacity < 0)
            throw new IllegalArgumentException("Negative capacity: " + initialCapacity);
        this.name = name;
        this.arena = new NodeArena<>(initialCapacity);
        this.registry = new InputRegistry(arena);
        this.builder = new TopologyBuilder<>(arena, registry);
        this.invalidator = new Invalidator<>(arena);
        this.evaluator = new Evaluator<>(arena, registry);
    }

    /**
     * Creates an empty graph.
     *
     * @param name Graph name, used in diagnostics.
     */
    public static <T> ComputationGraph<T> create(String name) {
        return create(name, DEFAULT_CAPACITY);
    }

    /**
     * Creates an empty graph sized for the expected node count.
     *
     * @param name            Graph name, used in diagnostics.
     * @param initialCapacity Expected number of nodes.
     */
    public static <T> ComputationGraph<T> create(String name, int initialCapacity) {
        log.debug("Creating graph '{}' with capacity {}", name, initialCapacity);
        return new ComputationGraph<>(name, initialCapacity);
    }

    public String name() {
        return name;
    }

    public void setListener(EvaluationListener listener) {
        this.listener = listener;
    }

    // ── Construction ─────────────────────────────────────────────

    /** Adds an unnamed input node with no value. */
    public NodeId addInputNode() {
        return builder.addInputNode();
    }

    /**
     * Adds an input node and registers it under {@code inputName}.
     *
     * @throws com.dataflow.memo.api.DuplicateInputNameException if the name is
     *                                                           taken; no node
     *                                                           is added then.
     */
    public NodeId addInputNode(String inputName) {
        return builder.addInputNode(inputName);
    }

    /**
     * Adds an operation node.
     *
     * @param inputs Ordered inputs; the function receives their values in this
     *               order. The same node may appear more than once.
     * @param fn     Pure function of the input values.
     * @return The new node's id.
     * @throws com.dataflow.memo.api.InvalidReferenceException if an input id
     *                                                         does not belong
     *                                                         to this graph.
     */
    public NodeId addNode(List<NodeId> inputs, FnN<T> fn) {
        return builder.addNode(inputs, fn);
    }

    /** Varargs form of {@link #addNode(List, FnN)}. */
    public NodeId addNode(FnN<T> fn, NodeId... inputs) {
        return builder.addNode(Arrays.asList(inputs), fn);
    }

    /**
     * Binds a name to an input node.
     *
     * @throws com.dataflow.memo.api.DuplicateInputNameException if the name is
     *                                                           already bound.
     * @throws NotAnInputNodeException                           if the id is an
     *                                                           operation node.
     */
    public void registerInput(String inputName, NodeId id) {
        builder.registerInput(inputName, id);
    }

    // ── Updates ──────────────────────────────────────────────────

    /**
     * Sets the value of a named input.
     *
     * The input and all of its transitive dependents are marked stale before
     * the value is stored. No equality check is made against the previous
     * value.
     *
     * @throws com.dataflow.memo.api.UnknownInputNameException if the name was
     *                                                         never registered.
     */
    public void setInput(String inputName, T value) {
        Objects.requireNonNull(value, "value");
        setInput(registry.lookup(inputName), value);
    }

    /**
     * Sets the value of an input addressed by id.
     *
     * @throws NotAnInputNodeException if the id is an operation node.
     */
    public void setInput(NodeId id, T value) {
        Objects.requireNonNull(value, "value");
        int index = arena.checkIndex(id);
        Node<T> node = arena.node(index);
        if (!node.isInput())
            throw new NotAnInputNodeException(index);
        invalidateIndex(index);
        node.store(value);
    }

    /**
     * Marks a node and all of its transitive dependents stale.
     *
     * Invalidating an input node also discards its value; it must be set again
     * before anything downstream can be computed.
     *
     * @return Number of nodes marked stale, the node itself included.
     */
    public int invalidate(NodeId id) {
        return invalidateIndex(arena.checkIndex(id));
    }

    private int invalidateIndex(int index) {
        int stale = invalidator.invalidate(index);
        log.trace("Graph '{}': invalidated {} node(s) from #{}", name, stale, index);
        if (listener != null)
            listener.onInvalidated(index, stale);
        return stale;
    }

    // ── Queries ──────────────────────────────────────────────────

    /**
     * Returns the up-to-date value of a node, evaluating stale ancestors.
     *
     * @throws com.dataflow.memo.api.UnsetInputException     if an upstream
     *                                                       input has no value.
     * @throws com.dataflow.memo.api.NodeEvaluationException if a node function
     *                                                       fails.
     */
    public T compute(NodeId id) {
        int index = arena.checkIndex(id);
        final long e = ++epoch;
        final EvaluationListener l = this.listener;
        if (l != null)
            l.onComputeStart(e, index);
        try {
            return evaluator.compute(index, e, l);
        } finally {
            if (l != null)
                l.onComputeEnd(e, evaluator.lastEvaluatedCount());
        }
    }

    /** The cached value, if the node is fresh. Never triggers evaluation. */
    public Optional<T> cachedValue(NodeId id) {
        return Optional.ofNullable(arena.get(id).cache());
    }

    public boolean isStale(NodeId id) {
        return arena.get(id).isStale();
    }

    public boolean isInput(NodeId id) {
        return arena.get(id).isInput();
    }

    /** Resolves a registered input name. */
    public NodeId inputId(String inputName) {
        return registry.lookup(inputName);
    }

    /** The name registered for a node, if any. */
    public Optional<String> inputName(NodeId id) {
        return Optional.ofNullable(registry.nameOf(arena.checkIndex(id)));
    }

    /** Registered input names, in registration order. */
    public List<String> inputNames() {
        return registry.names();
    }

    /** Ordered inputs of a node; empty for input nodes. */
    public List<NodeId> inputsOf(NodeId id) {
        Node<T> node = arena.get(id);
        List<NodeId> result = new ArrayList<>(node.inputCount());
        for (int i = 0; i < node.inputCount(); i++)
            result.add(arena.idOf(node.input(i)));
        return result;
    }

    /** Direct readers of a node, in the order they were added. */
    public List<NodeId> dependentsOf(NodeId id) {
        Node<T> node = arena.get(id);
        List<NodeId> result = new ArrayList<>(node.dependentCount());
        for (int i = 0; i < node.dependentCount(); i++)
            result.add(arena.idOf(node.dependent(i)));
        return result;
    }

    /** All node ids in construction order. */
    public List<NodeId> nodes() {
        List<NodeId> result = new ArrayList<>(arena.size());
        for (int i = 0; i < arena.size(); i++)
            result.add(arena.idOf(i));
        return result;
    }

    public int nodeCount() {
        return arena.size();
    }

    /** Number of compute calls made so far. */
    public long epoch() {
        return epoch;
    }

    /** Number of nodes evaluated by the most recent compute call. */
    public int lastEvaluatedCount() {
        return evaluator.lastEvaluatedCount();
    }
}
