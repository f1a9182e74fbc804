package com.dataflow.memo.util;

import com.dataflow.memo.engine.ComputationGraph;
import com.dataflow.memo.engine.NodeId;

import java.util.List;

/**
 * Diagnostic utility for inspecting graph state and topology.
 *
 * <p>
 * Generates human-readable text for a single node or the whole graph. Nothing
 * here triggers evaluation: stale nodes are shown as stale.
 *
 * <p>
 * <b>Usage:</b> intended for debugging sessions and error reports. Do
 * <b>not</b> use on a hot path (allocates strings, walks the whole graph).
 */
public final class GraphExplain {
    private final ComputationGraph<?> graph;

    public GraphExplain(ComputationGraph<?> graph) {
        this.graph = graph;
    }

    /** Dumps the state of a single node. */
    public String explainNode(NodeId id) {
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(label(id)).append('\n')
                .append("  Kind: ").append(graph.isInput(id) ? "input" : "operation").append('\n')
                .append("  Cached value: ")
                .append(graph.cachedValue(id).map(Object::toString).orElse("<stale>")).append('\n');
        appendIds(sb.append("  Inputs: "), graph.inputsOf(id));
        appendIds(sb.append("  Dependents: "), graph.dependentsOf(id));
        return sb.toString();
    }

    /** Summary of the most recent compute call. */
    public String explainLastCompute() {
        return "Graph '" + graph.name() + "' epoch: " + graph.epoch()
                + ", evaluated: " + graph.lastEvaluatedCount() + "/" + graph.nodeCount();
    }

    /** Dumps the entire topology, one node per line with its dependents. */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph '").append(graph.name()).append("' (").append(graph.nodeCount()).append(" nodes):\n");
        for (NodeId id : graph.nodes()) {
            sb.append("  ").append(label(id));
            if (graph.isInput(id))
                sb.append(" (IN)");
            if (graph.isStale(id))
                sb.append(" *");
            List<NodeId> deps = graph.dependentsOf(id);
            if (!deps.isEmpty()) {
                sb.append(" -> ");
                for (int i = 0; i < deps.size(); i++) {
                    if (i > 0)
                        sb.append(", ");
                    sb.append(label(deps.get(i)));
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private String label(NodeId id) {
        return graph.inputName(id)
                .map(n -> "[" + id.index() + "] " + n)
                .orElse("[" + id.index() + "]");
    }

    private void appendIds(StringBuilder sb, List<NodeId> ids) {
        sb.append('(').append(ids.size()).append(')');
        for (int i = 0; i < ids.size(); i++)
            sb.append(i == 0 ? " " : ", ").append(label(ids.get(i)));
        sb.append('\n');
    }
}
