package com.hcltech.dawg.graph;

import com.hcltech.dawg.graph.exceptions.GraphMinimizedException;
import com.hcltech.dawg.graph.exceptions.InvariantViolationException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NodeArenaTest {

    @Test
    void resolve_returnsLiveNodes() {
        NodeArena arena = new NodeArena();
        Node node = arena.create(Map.of());
        assertSame(node, arena.resolve(node.handle()));
        assertTrue(arena.isLive(node));
    }

    @Test
    void retiredHandles_neverResolveAgain() {
        NodeArena arena = new NodeArena();
        Node node = arena.create(Map.of());
        arena.retire(node);

        assertFalse(arena.isLive(node));
        assertEquals(0, arena.size());
        assertThrows(InvariantViolationException.class, () -> arena.resolve(node.handle()));
        assertThrows(InvariantViolationException.class, () -> arena.retire(node));
        assertNotEquals(node.handle(), arena.create(Map.of()).handle(), "handles are not reused");
    }

    @Test
    void nodesOfAnotherArena_areNotLive() {
        NodeArena one = new NodeArena();
        NodeArena other = new NodeArena();
        Node foreign = other.create(Map.of());
        one.create(Map.of());
        assertFalse(one.isLive(foreign), "same handle, different arena");
        assertFalse(one.isLive(null));
    }

    @Test
    void frozenArena_refusesNewNodes() {
        NodeArena arena = new NodeArena();
        Node node = arena.create(Map.of());
        arena.freeze();

        assertThrows(GraphMinimizedException.class, () -> arena.create(Map.of()));
        assertSame(node, arena.resolve(node.handle()));
        assertEquals(1, arena.size());
    }
}
