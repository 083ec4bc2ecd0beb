package org.kappapathways.hypergraph;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.kappapathways.hypergraph.StoryFixture.*;

class StoryValidationTest {

    @Test
    void wellFormedStoryIsReturnedAsIs() {
        CausalGraph g = diamond("d");
        assertSame(g, StoryValidation.validate(g).valueOrThrow());
    }

    @Test
    void emptyStoryIsAnError() {
        CausalGraph g = new CausalGraph("empty", null);
        String msg = String.join("\n", StoryValidation.validate(g).errorsOrThrow());
        assertTrue(msg.contains("no nodes"), msg);
    }

    @Test
    void everyProblemIsReported() {
        EventNode a = event("a", "A");
        EventNode dup = event("a", " ");
        EventNode i = intro("i", "Intro A");
        EventNode stranger = event("s", "S");
        CausalGraph g = story("bad", nodes(a, dup, i), edges(edge(a, i)));
        g.addHyperEdge(HyperEdge.of(edge(stranger, a)));

        List<String> errors = StoryValidation.validate(g).errorsOrThrow();
        String msg = String.join("\n", errors);

        assertEquals(4, errors.size(), msg);
        assertTrue(msg.contains("Duplicate node id a"), msg);
        assertTrue(msg.contains("blank label"), msg);
        assertTrue(msg.contains("Intro node"), msg);
        assertTrue(msg.contains("not in the graph"), msg);
    }

    @Test
    void rankViolationsNameTheOffendingCause() {
        CausalGraph g = diamond("d");
        rank(g);
        byLabel(g, "B").setRank(5.0);

        List<String> violations = StoryValidation.rankViolations(g);

        assertEquals(1, violations.size());
        assertTrue(violations.get(0).contains("\"B\""), violations.get(0));
    }

    @Test
    void unrankedNodesAreViolations() {
        assertEquals(4, StoryValidation.rankViolations(diamond("d")).size());
    }
}
