package org.kappapathways.hypergraph;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.kappapathways.hypergraph.StoryFixture.*;

class HyperEdgeTest {

    private final EventNode a = event("a", "A");
    private final EventNode b = event("b", "B");
    private final EventNode c = event("c", "C");

    @Nested
    class Consistency {
        @Test
        void weightAndNumberAreTheMinimumOverMembers() {
            HyperEdge h = HyperEdge.of(edge(a, c, 3, 1), edge(b, c, 5, 2));
            assertEquals(3, h.weight());
            assertEquals(1, h.number());
            assertSame(c, h.target());
            assertEquals(List.of(a, b), h.sources());
        }

        @Test
        void sourcesAreDistinctButMembersAreKept() {
            HyperEdge h = HyperEdge.of(edge(a, c), edge(a, c), edge(b, c));
            assertEquals(3, h.edgelist().size());
            assertEquals(List.of(a, b), h.sources());
        }

        @Test
        void membersDisagreeingOnTargetAreAStructuralViolation() {
            StructuralViolationException e = assertThrows(StructuralViolationException.class,
                    () -> HyperEdge.of(edge(a, c), edge(a, b)));
            assertTrue(e.getMessage().contains("disagree"), e.getMessage());
        }

        @Test
        void emptyHyperEdgeIsAStructuralViolation() {
            assertThrows(StructuralViolationException.class, () -> new HyperEdge(List.of()));
        }

        @Test
        void zeroWeightIsAllowedOnOneMember() {
            HyperEdge h = HyperEdge.of(edge(intro("i", "Intro A"), c, 0, 1), edge(b, c, 4, 1));
            assertEquals(0, h.weight());
        }

        @Test
        void negativeWeightIsRejected() {
            assertThrows(IllegalArgumentException.class, () -> edge(a, b, -1, 1));
        }
    }

    @Nested
    class RelationTypes {
        @Test
        void allConflictMembersMakeAConflictHyperEdge() {
            HyperEdge h = HyperEdge.of(edge(a, c).withRelationType(RelationType.CONFLICT),
                    edge(b, c).withRelationType(RelationType.CONFLICT));
            assertEquals(RelationType.CONFLICT, h.relationType());
        }

        @Test
        void mixedMembersMakeACausalHyperEdge() {
            HyperEdge h = HyperEdge.of(edge(a, c).withRelationType(RelationType.PRECEDENCE), edge(b, c));
            assertEquals(RelationType.CAUSAL, h.relationType());
        }

        @Test
        void reverseOnlyWhenEveryMemberIsReverse() {
            assertTrue(HyperEdge.of(edge(a, c).withReverse(true), edge(b, c).withReverse(true)).isReverse());
            assertFalse(HyperEdge.of(edge(a, c).withReverse(true), edge(b, c)).isReverse());
        }
    }

    @Test
    void copyWithMapsEndpointsAndKeepsFlags() {
        HyperEdge h = HyperEdge.of(edge(a, c, 2, 3));
        h.setUnderlying(true);
        EventNode a2 = event("a2", "A");
        EventNode c2 = event("c2", "C");

        HyperEdge copy = h.copyWith(n -> n == a ? a2 : c2);

        assertTrue(copy.isUnderlying());
        assertSame(c2, copy.target());
        assertEquals(List.of(a2), copy.sources());
        assertEquals(2, copy.weight());
        assertNotSame(h.edgelist().get(0), copy.edgelist().get(0));
        assertSame(a, h.edgelist().get(0).source());
    }
}
