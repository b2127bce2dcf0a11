package com.hcltech.dawg.graph;

import com.hcltech.dawg.graph.exceptions.InvariantViolationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.hcltech.dawg.graph.WordGraphFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class NodeFuserTest {

    @Test
    void emptySet_isError() {
        WordGraph graph = graph("xa", "ya");
        var ex = assertThrows(IllegalArgumentException.class, () -> new NodeFuser(graph).fuse(Set.of()));
        assertTrue(ex.getMessage().contains("empty"), ex.getMessage());
    }

    @Test
    void mixedAcceptance_isError_andLeavesTheGraphAlone() {
        WordGraph graph = graph("a", "ab");
        String before = graph.dump();

        var ex = assertThrows(IllegalArgumentException.class,
                () -> new NodeFuser(graph).fuse(Set.of(graph.root(), walk(graph, "a"))));

        assertTrue(ex.getMessage().contains("mixed acceptance"), ex.getMessage());
        assertEquals(before, graph.dump());
        assertConsistent(graph);
    }

    @Test
    void nodesOfAnotherGraph_areError() {
        WordGraph graph = graph("a");
        WordGraph other = graph("a");
        assertThrows(IllegalArgumentException.class, () -> new NodeFuser(graph).fuse(Set.of(walk(other, "a"))));
    }

    @Test
    void conflictingTargets_isInvariantViolation_andLeavesTheGraphAlone() {
        WordGraph graph = graph("xa", "ya");
        String before = graph.dump();

        // x and y both read 'a' but into different, not yet fused, leaves
        assertThrows(InvariantViolationException.class,
                () -> new NodeFuser(graph).fuse(Set.of(walk(graph, "x"), walk(graph, "y"))));

        assertEquals(before, graph.dump());
        assertEquals(5, graph.arena().size());
        assertConsistent(graph);
    }

    @Test
    void fusingLeaves_rewiresEveryParentToTheNewNode() {
        WordGraph graph = graph("xa", "ya");
        Node x = walk(graph, "x");
        Node y = walk(graph, "y");
        Node xa = walk(graph, "xa");
        Node ya = walk(graph, "ya");

        Node fused = new NodeFuser(graph).fuse(Set.of(xa, ya));

        assertTrue(fused.isAccepting());
        assertSame(fused, x.transitions().get('a'));
        assertSame(fused, y.transitions().get('a'));
        assertEquals(Map.of(x.handle(), Set.of('a'), y.handle(), Set.of('a')), fused.parentHandles());
        assertFalse(graph.arena().isLive(xa));
        assertFalse(graph.arena().isLive(ya));
        assertEquals(4, graph.countNodes());
        assertEquals(List.of("xa", "ya"), words(graph));
        assertConsistent(graph);
    }

    @Test
    void fusingInnerNodes_mergesTransitions_andAggregatesParentSymbols() {
        WordGraph graph = graph("xa", "ya");
        NodeFuser fuser = new NodeFuser(graph);
        Node leaf = fuser.fuse(Set.of(walk(graph, "xa"), walk(graph, "ya")));

        Node inner = fuser.fuse(Set.of(walk(graph, "x"), walk(graph, "y")));

        assertFalse(inner.isAccepting());
        assertEquals(Map.of('a', leaf), inner.transitions());
        assertEquals(Map.of(graph.root().handle(), Set.of('x', 'y')), inner.parentHandles());
        assertEquals(Map.of(inner.handle(), Set.of('a')), leaf.parentHandles(), "children forget the fused members");
        assertSame(inner, walk(graph, "x"));
        assertSame(inner, walk(graph, "y"));
        assertEquals(3, graph.countNodes());
        assertEquals(2, graph.countWords());
        assertConsistent(graph);
    }

    @Test
    void fusingTheRoot_replacesTheGraphRoot() {
        WordGraph graph = new WordGraph();
        Node oldRoot = graph.root();

        Node fused = new NodeFuser(graph).fuse(Set.of(oldRoot));

        assertSame(fused, graph.root());
        assertNotSame(oldRoot, fused);
        assertEquals(1, graph.countNodes());
        assertConsistent(graph);
    }
}
