package com.dataflow.memo.engine;

import com.dataflow.memo.api.InvalidReferenceException;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class NodeArenaTest {

    @Test
    public void testIdsFollowConstructionOrder() {
        NodeArena<String> arena = new NodeArena<>(1);
        NodeId first = arena.add(Node.input());
        NodeId second = arena.add(Node.input());
        NodeId third = arena.add(Node.operation(new int[] { 0, 1 }, in -> in.get(0) + in.get(1)));

        assertEquals(0, first.index());
        assertEquals(1, second.index());
        assertEquals(2, third.index());
        assertEquals(3, arena.size());
        assertTrue(arena.get(first).isInput());
        assertFalse(arena.get(third).isInput());
        assertTrue(arena.get(third).isStale());
    }

    @Test
    public void testGrowsPastInitialCapacity() {
        NodeArena<Integer> arena = new NodeArena<>(0);
        NodeId last = null;
        for (int i = 0; i < 100; i++)
            last = arena.add(Node.input());
        assertEquals(99, last.index());
        int gen = arena.nextGeneration();
        assertTrue(arena.visit(99, gen));
        assertFalse(arena.visit(99, gen));
        assertTrue(arena.visit(99, arena.nextGeneration()));
    }

    @Test
    public void testIdsAreScopedToTheirArena() {
        NodeArena<Integer> a = new NodeArena<>(4);
        NodeArena<Integer> b = new NodeArena<>(4);
        NodeId fromA = a.add(Node.input());
        NodeId fromB = b.add(Node.input());

        assertNotEquals(fromA, fromB);
        assertEquals(fromA, a.idOf(0));
        try {
            b.get(fromA);
            fail("Expected InvalidReferenceException");
        } catch (InvalidReferenceException e) {
            assertTrue(e.getMessage().contains("another graph"));
        }
    }

    @Test
    public void testDependentsGrow() {
        NodeArena<Integer> arena = new NodeArena<>(4);
        TopologyBuilder<Integer> builder = new TopologyBuilder<>(arena, new InputRegistry(arena));
        NodeId x = builder.addInputNode();
        for (int i = 0; i < 10; i++)
            builder.addNode(List.of(x), in -> in.get(0));

        Node<Integer> node = arena.get(x);
        assertEquals(10, node.dependentCount());
        for (int i = 0; i < 10; i++)
            assertEquals(i + 1, node.dependent(i));
    }
}
