package com.dataflow.memo.util;

import com.dataflow.memo.api.NodeEvaluationException;
import com.dataflow.memo.engine.ComputationGraph;
import com.dataflow.memo.engine.NodeId;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class NodeProfileListenerTest {

    private ComputationGraph<Double> graph;
    private NodeProfileListener profile;
    private LatencyTrackingListener latency;
    private NodeId x;
    private NodeId shared;
    private NodeId result;

    @Before
    public void setUp() {
        graph = ComputationGraph.create("profiled");
        profile = new NodeProfileListener();
        latency = new LatencyTrackingListener();
        graph.setListener(new CompositeEvaluationListener().add(profile).add(latency));

        x = graph.addInputNode("x");
        shared = graph.addNode(in -> in.get(0) * 2, x);
        NodeId left = graph.addNode(in -> in.get(0) + 1, shared);
        NodeId right = graph.addNode(in -> in.get(0) - 1, shared);
        result = graph.addNode(in -> in.get(0) * in.get(1), left, right);
    }

    @Test
    public void testCountsEvaluationsPerNode() {
        graph.setInput("x", 3.0);
        assertEquals(35.0, graph.compute(result), 0.0);
        assertEquals(35.0, graph.compute(result), 0.0);

        assertEquals(1, profile.evaluations(shared.index()));
        assertEquals(1, profile.evaluations(result.index()));
        assertEquals(0, profile.evaluations(x.index()));

        graph.setInput("x", 4.0);
        assertEquals(63.0, graph.compute(result), 0.0);
        assertEquals(2, profile.evaluations(shared.index()));
        assertEquals(2, profile.invalidations());
        // Each set visits x and its four descendants, cached or not.
        assertEquals(10, profile.staleMarks());

        assertTrue(profile.dump().contains("#" + result.index()));
    }

    @Test
    public void testLatencyTracksCacheHits() {
        graph.setInput("x", 1.0);
        graph.compute(result);
        graph.compute(result);
        graph.compute(shared);

        assertEquals(3, latency.totalComputes());
        assertEquals(2, latency.cacheHits());
        assertEquals(0, latency.lastNodesEvaluated());
        assertTrue(latency.maxLatencyNanos() >= latency.minLatencyNanos());
        assertTrue(latency.dump().contains("Compute calls"));

        latency.reset();
        assertEquals(0, latency.totalComputes());
        assertEquals(0, latency.minLatencyNanos());
    }

    @Test
    public void testErrorsAreCounted() {
        ComputationGraph<Double> failing = ComputationGraph.create("failing");
        failing.setListener(profile);
        NodeId in = failing.addInputNode("in");
        NodeId boom = failing.addNode(v -> {
            throw new IllegalStateException("boom");
        }, in);
        failing.setInput("in", 1.0);

        for (int i = 0; i < 3; i++) {
            try {
                failing.compute(boom);
                fail("Expected NodeEvaluationException");
            } catch (NodeEvaluationException expected) {
            }
        }
        assertEquals(3, profile.stats(boom.index()).errors);
        assertEquals(0, profile.evaluations(boom.index()));

        profile.reset();
        assertNull(profile.stats(boom.index()));
    }

    @Test
    public void testCompositeFansOutInOrder() {
        StringBuilder order = new StringBuilder();
        CompositeEvaluationListener composite = new CompositeEvaluationListener();
        for (String tag : new String[] { "a", "b" }) {
            composite.add(new NodeProfileListener() {
                @Override
                public void onComputeStart(long epoch, int targetIndex) {
                    order.append(tag);
                }
            });
        }
        assertEquals(2, composite.size());
        composite.onComputeStart(1, 0);
        assertEquals("ab", order.toString());
    }
}
