package com.dataflow.memo.engine;

import com.dataflow.memo.api.DuplicateInputNameException;
import com.dataflow.memo.fn.FnN;

import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * Append-only construction of input and operation nodes.
 *
 * Every edge is recorded in both directions: the new node stores its ordered
 * inputs, and each input gets the new node appended to its dependents. Inputs
 * are validated before anything is appended, so a rejected call leaves the
 * arena untouched.
 */
@Log4j2
final class TopologyBuilder<T> {
    private final NodeArena<T> arena;
    private final InputRegistry registry;

    TopologyBuilder(NodeArena<T> arena, InputRegistry registry) {
        this.arena = arena;
        this.registry = registry;
    }

    NodeId addInputNode() {
        NodeId id = arena.add(Node.input());
        log.debug("Added input node #{}", id.index());
        return id;
    }

    NodeId addInputNode(String name) {
        // Fail before appending so no orphan input is left behind.
        if (name == null)
            throw new IllegalArgumentException("Input name must not be null");
        if (registry.contains(name))
            throw new DuplicateInputNameException(name, registry.lookup(name).index());
        NodeId id = addInputNode();
        registry.register(name, id);
        return id;
    }

    NodeId addNode(List<NodeId> inputs, FnN<T> fn) {
        if (fn == null)
            throw new IllegalArgumentException("Operation node requires a function");
        int[] inputIndices = new int[inputs.size()];
        for (int i = 0; i < inputIndices.length; i++)
            inputIndices[i] = arena.checkIndex(inputs.get(i));

        NodeId id = arena.add(Node.operation(inputIndices, fn));
        for (int input : inputIndices)
            arena.node(input).addDependent(id.index());
        log.debug("Added operation node #{} with {} input(s)", id.index(), inputIndices.length);
        return id;
    }

    void registerInput(String name, NodeId id) {
        registry.register(name, id);
    }
}
