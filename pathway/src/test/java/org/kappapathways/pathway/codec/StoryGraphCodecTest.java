package org.kappapathways.pathway.codec;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.kappapathways.hypergraph.CausalGraph;
import org.kappapathways.hypergraph.CoverEdgeExtractor;
import org.kappapathways.hypergraph.Equivalence;
import org.kappapathways.hypergraph.HyperEdge;
import org.kappapathways.hypergraph.RelationType;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.kappapathways.pathway.PathwayFixture.*;

class StoryGraphCodecTest {

    private final StoryGraphCodec codec = new StoryGraphCodec();

    private static final String FLAT = """
            {
              "id": "s1",
              "eoi": "phos",
              // flat edges are grouped by target
              "nodes": [
                {"id": "i", "label": "Intro A", "intro": true},
                {"id": "a", "label": "bind", "rank": 1, "first": true},
                {"id": "b", "label": "phos", "rank": 2},
                {"id": "s", "label": "A(x{p})", "kind": "state", "rank": 1.5},
              ],
              "edges": [
                {"source": "i", "target": "a", "weight": 0},
                {"source": "a", "target": "b", "weight": 3, "number": 2},
                {"source": "s", "target": "b", "essential": true},
                {"source": "a", "target": "s", "relationType": "precedence"}
              ]
            }
            """;

    @Nested
    class Decode {
        @Test
        void flatEdgesAreGroupedByTarget() {
            CausalGraph g = codec.decode(FLAT).valueOrThrow();

            assertEquals("s1", g.id());
            assertEquals("phos", g.eoi());
            assertEquals(1, g.occurrence());
            assertEquals(4, g.nodes().size());
            assertEquals(1, g.stateNodes().size());
            assertTrue(byLabel(g, "Intro A").isIntro());
            assertTrue(byLabel(g, "bind").isFirst());
            assertEquals(3, g.hyperEdges().size());
            HyperEdge intoPhos = into(g, "phos").get(0);
            assertEquals(2, intoPhos.edgelist().size());
            assertEquals(1, intoPhos.weight());
            assertTrue(intoPhos.edgelist().get(1).isEssential());
            assertEquals(RelationType.PRECEDENCE, into(g, "A(x{p})").get(0).relationType());
            assertTrue(g.hasMidranks());
        }

        @Test
        void midNodesGroupPreGroupedInput() {
            String json = """
                    {"id": "h", "hypergraph": true,
                     "nodes": [{"id": "a", "label": "A"}, {"id": "b", "label": "B"}, {"id": "c", "label": "C"},
                               {"id": "m", "kind": "MID"}],
                     "edges": [{"source": "a", "target": "m"}, {"source": "b", "target": "m"}, {"source": "m", "target": "c"}]}
                    """;
            CausalGraph g = codec.decode(json).valueOrThrow();

            assertTrue(g.isHypergraph());
            assertEquals(List.of("A", "B", "C"), labels(g));
            assertEquals(1, g.hyperEdges().size());
            assertEquals(2, g.hyperEdges().get(0).sources().size());
        }

        @Test
        void everyProblemIsReported() {
            String json = """
                    {"id": "bad",
                     "nodes": [{"id": "a", "label": "A"}, {"id": "a", "label": "again"}, {"label": "no id"}],
                     "edges": [{"source": "a", "target": "x"}, {"source": "y", "target": "a"}]}
                    """;
            List<String> errors = codec.decode(json).errorsOrThrow();
            String msg = String.join("\n", errors);

            assertEquals(4, errors.size(), msg);
            assertTrue(errors.stream().allMatch(e -> e.startsWith("Story bad: ")), msg);
            assertTrue(msg.contains("Duplicate node id a"), msg);
            assertTrue(msg.contains("Node [2] has no id"), msg);
            assertTrue(msg.contains("unknown target x"), msg);
            assertTrue(msg.contains("unknown source y"), msg);
        }

        @Test
        void malformedJsonIsAnError() {
            String msg = String.join("\n", codec.decode("{\"id\": ").errorsOrThrow());
            assertTrue(msg.startsWith("Failed to parse story"), msg);
        }

        @Test
        void midNodesInGroupedInputAreRejected() {
            String json = """
                    {"id": "g", "nodes": [{"id": "m", "kind": "mid"}], "hyperEdges": []}
                    """;
            String msg = String.join("\n", codec.decode(json).errorsOrThrow());
            assertTrue(msg.contains("midnodes"), msg);
        }
    }

    @Nested
    class RoundTrip {
        @Test
        void encodedGraphDecodesToAnEquivalentGraph() {
            CausalGraph g = codec.decode(FLAT).valueOrThrow();
            g.setOccurrence(4);
            g.setPrevcores(List.of("s1", "s7"));
            CoverEdgeExtractor.extract(g);

            String json = codec.encode(g).valueOrThrow();
            CausalGraph back = codec.decode(json).valueOrThrow();

            assertTrue(Equivalence.equivalentGraphs(g, back, true));
            assertEquals(4, back.occurrence());
            assertEquals(List.of("s1", "s7"), back.prevcores());
            assertEquals("phos", back.eoi());
            assertEquals(g.coverEdges().size(), back.coverEdges().size());
            assertTrue(back.coverEdges().stream().allMatch(HyperEdge::isCover));
            assertEquals(g.hyperEdges().stream().map(HyperEdge::isUnderlying).toList(),
                    back.hyperEdges().stream().map(HyperEdge::isUnderlying).toList());
            assertEquals(0, into(back, "bind").get(0).weight());
            assertTrue(into(back, "phos").get(0).edgelist().get(1).isEssential());
        }

        @Test
        void encodingWritesGroupedHyperEdgesOnly() throws Exception {
            String json = codec.encode(codec.decode(FLAT).valueOrThrow()).valueOrThrow();
            StoryDocument doc = codec.objectMapper().readValue(json, StoryDocument.class);

            assertNull(doc.edges());
            assertEquals(3, doc.hyperEdges().size());
            assertFalse(json.contains("\"relationType\" : \"CAUSAL\""), json);
        }
    }
}
