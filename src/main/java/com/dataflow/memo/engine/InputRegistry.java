package com.dataflow.memo.engine;

import com.dataflow.memo.api.DuplicateInputNameException;
import com.dataflow.memo.api.NotAnInputNodeException;
import com.dataflow.memo.api.UnknownInputNameException;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps external symbolic names to input nodes.
 *
 * A name is bound at most once, and only to an input node. The registry keeps
 * the reverse mapping too, so diagnostics and errors can refer to inputs by
 * name.
 */
final class InputRegistry {
    private final NodeArena<?> arena;
    private final Map<String, NodeId> idsByName = new LinkedHashMap<>();
    private final Map<Integer, String> namesByIndex = new HashMap<>();

    InputRegistry(NodeArena<?> arena) {
        this.arena = arena;
    }

    void register(String name, NodeId id) {
        if (name == null)
            throw new IllegalArgumentException("Input name must not be null");
        int index = arena.checkIndex(id);
        if (!arena.node(index).isInput())
            throw new NotAnInputNodeException(index);
        NodeId existing = idsByName.get(name);
        if (existing != null)
            throw new DuplicateInputNameException(name, existing.index());
        idsByName.put(name, id);
        namesByIndex.put(index, name);
    }

    NodeId lookup(String name) {
        NodeId id = idsByName.get(name);
        if (id == null)
            throw new UnknownInputNameException(name);
        return id;
    }

    boolean contains(String name) {
        return idsByName.containsKey(name);
    }

    /** The name bound to the node, or null if it has none. */
    String nameOf(int index) {
        return namesByIndex.get(index);
    }

    /** Registered names, in registration order. */
    List<String> names() {
        return List.copyOf(idsByName.keySet());
    }
}
