package me.golemcore.context.graph;

import me.golemcore.context.domain.exception.RelationshipException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RelationshipGraphTest {

    private static final String A = "ctx_aaaaaaaa";
    private static final String B = "ctx_bbbbbbbb";
    private static final String C = "ctx_cccccccc";
    private static final String D = "ctx_dddddddd";

    private RelationshipGraph graph;

    @BeforeEach
    void setUp() {
        graph = new RelationshipGraph();
    }

    @Test
    void shouldResolveHierarchyScenario() {
        graph.linkParent(B, A);
        graph.linkDerivation(C, List.of(A, B));

        assertEquals(Set.of(B, C), Set.copyOf(graph.getDescendants(A)));
        assertEquals(Set.of(A, B), Set.copyOf(graph.getDerivationChain(C)));
        assertEquals(List.of(A), graph.getAncestors(B));
    }

    @Test
    void shouldListAncestorsNearestFirst() {
        graph.linkParent(B, A);
        graph.linkParent(C, B);
        graph.linkParent(D, C);

        assertEquals(List.of(C, B, A), graph.getAncestors(D));
        assertEquals(List.of(B, C, D), graph.getDescendants(A));
        assertEquals(Optional.of(C), graph.getParent(D));
        assertEquals(Optional.empty(), graph.getParent(A));
        assertEquals(List.of(B), graph.getChildren(A));
    }

    @Test
    void shouldRejectSelfParent() {
        RelationshipException error = assertThrows(RelationshipException.class, () -> graph.linkParent(A, A));

        assertEquals(A, error.getEntryId());
        assertEquals(0, graph.parentEdgeCount());
    }

    @Test
    void shouldRejectParentCycle() {
        graph.linkParent(B, A);
        graph.linkParent(C, B);

        assertThrows(RelationshipException.class, () -> graph.linkParent(A, C));
        assertEquals(Optional.empty(), graph.getParent(A));
        assertEquals(2, graph.parentEdgeCount());
    }

    @Test
    void shouldRejectDerivationCycleWithoutPartialEdges() {
        graph.linkDerivation(B, List.of(A));
        graph.linkDerivation(C, List.of(B));

        RelationshipException error = assertThrows(RelationshipException.class,
                () -> graph.linkDerivation(A, List.of(D, C)));

        assertEquals(C, error.getRelatedId());
        assertTrue(graph.getSourceEntries(A).isEmpty());
        assertTrue(graph.getDerivedEntries(D).isEmpty());
        assertEquals(2, graph.derivationEdgeCount());
    }

    @Test
    void shouldRejectSelfDerivation() {
        assertThrows(RelationshipException.class, () -> graph.linkDerivation(A, List.of(A)));
    }

    @Test
    void shouldMoveChildWhenReparented() {
        graph.linkParent(C, A);
        graph.linkParent(C, B);

        assertTrue(graph.getChildren(A).isEmpty());
        assertEquals(List.of(C), graph.getChildren(B));
        assertEquals(1, graph.parentEdgeCount());
    }

    @Test
    void shouldWalkTransitiveDerivation() {
        graph.linkDerivation(B, List.of(A));
        graph.linkDerivation(C, List.of(B));
        graph.linkDerivation(D, List.of(B, C));

        assertEquals(List.of(B, C), graph.getSourceEntries(D));
        assertEquals(Set.of(A, B, C), Set.copyOf(graph.getDerivationChain(D)));
        assertEquals(Set.of(B, C, D), Set.copyOf(graph.getImpactScope(A)));
        assertEquals(List.of(C, D), graph.getDerivedEntries(B));
        assertEquals(4, graph.derivationEdgeCount());
    }

    @Test
    void shouldOrphanChildrenAndDerivedEntriesOnUnlink() {
        graph.linkParent(B, A);
        graph.linkDerivation(C, List.of(A, B));

        graph.unlink(A);

        assertEquals(Optional.empty(), graph.getParent(B));
        assertEquals(List.of(B), graph.getSourceEntries(C));
        assertTrue(graph.getDescendants(A).isEmpty());
        assertEquals(List.of(C), graph.getDescendants(B));
    }

    @Test
    void shouldKeepIncomingEdgesOnUnlinkOutgoing() {
        graph.linkParent(B, A);
        graph.linkParent(C, B);
        graph.linkDerivation(B, List.of(D));

        graph.unlinkOutgoing(B);

        assertEquals(Optional.empty(), graph.getParent(B));
        assertTrue(graph.getSourceEntries(B).isEmpty());
        assertTrue(graph.getDerivedEntries(D).isEmpty());
        assertEquals(List.of(C), graph.getChildren(B));
    }

    @Test
    void shouldClearAllEdges() {
        graph.linkParent(B, A);
        graph.linkDerivation(C, List.of(A));

        graph.clear();

        assertEquals(0, graph.parentEdgeCount());
        assertEquals(0, graph.derivationEdgeCount());
        assertTrue(graph.getDescendants(A).isEmpty());
    }
}
