package org.kappapathways.pathway;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.kappapathways.common.errorsor.ErrorsOr;
import org.kappapathways.hypergraph.CausalEdge;
import org.kappapathways.hypergraph.CausalGraph;
import org.kappapathways.hypergraph.EventNode;
import org.kappapathways.hypergraph.HyperEdge;
import org.kappapathways.hypergraph.HyperEdgeBuilder;
import org.kappapathways.pathway.config.PathwayConfig;
import org.kappapathways.pathway.config.PathwayConfigLoader;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.kappapathways.pathway.PathwayFixture.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PathwayFolderTest {

    @Mock
    FoldObserver observer;

    @Captor
    ArgumentCaptor<List<CausalGraph>> graphsCaptor;

    @Captor
    ArgumentCaptor<CausalGraph> pathwayCaptor;

    private static PathwayConfig config(String json) {
        return PathwayConfigLoader.fromJson(json).valueOrThrow();
    }

    @Nested
    class HappyPath {
        private final List<CausalGraph> stories = List.of(bindThenPhos("s1"), bindThenPhos("s2"), bindDimerPhos("s3"));

        @Test
        void equivalentStoriesBecomeOneCoreAndCountTwice() {
            PathwayResult result = new PathwayFolder(PathwayConfig.defaults()).fold(stories).valueOrThrow();

            assertEquals(List.of("core-1", "core-2"), result.cores().stream().map(CausalGraph::id).toList());
            assertEquals(2, result.cores().get(0).occurrence());
            assertEquals(List.of("s1", "s2"), result.cores().get(0).prevcores());
            assertEquals(List.of("s3"), result.cores().get(1).prevcores());
            assertEquals(List.of("eventpath-1", "eventpath-2"), result.eventPaths().stream().map(CausalGraph::id).toList());
        }

        @Test
        void pathwayFoldsAllEventPaths() {
            CausalGraph pathway = new PathwayFolder(PathwayConfig.defaults()).fold(stories).valueOrThrow().pathway();

            assertEquals("pathway", pathway.id());
            assertEquals(3, pathway.occurrence());
            assertEquals(List.of("Intro A", "bind", "phos", "dimer"), labels(pathway));
            assertEquals(List.of("node1", "node2", "node3", "node4"), pathway.nodes().stream().map(n -> n.id()).sorted().toList());
            assertEquals(3.0, byLabel(pathway, "phos").rank());
            assertEquals(0.0, byLabel(pathway, "Intro A").rank());
            assertEquals("phos", pathway.eoi());

            HyperEdge intoBind = into(pathway, "bind").get(0);
            assertEquals(3, intoBind.weight());
            assertTrue(intoBind.isUnderlying(), "the intro-only cause of bind is hidden");
            assertEquals(2, into(pathway, "phos").size());
        }

        @Test
        void inputStoriesAreNotModified() {
            new PathwayFolder(PathwayConfig.defaults()).fold(stories);
            CausalGraph s1 = stories.get(0);
            assertEquals("s1", s1.id());
            assertNull(byLabel(s1, "phos").rank());
            assertEquals("b", byLabel(s1, "phos").id());
        }

        @Test
        void observerSeesEveryStageInOrder() {
            PathwayResult result = new PathwayFolder(PathwayConfig.defaults(), observer).fold(stories).valueOrThrow();

            InOrder inOrder = inOrder(observer);
            inOrder.verify(observer).onCores(graphsCaptor.capture());
            inOrder.verify(observer).onEventPaths(graphsCaptor.capture());
            inOrder.verify(observer).onPathway(pathwayCaptor.capture());
            verifyNoMoreInteractions(observer);

            assertEquals(2, graphsCaptor.getAllValues().get(0).size());
            assertEquals(result.eventPaths(), graphsCaptor.getAllValues().get(1));
            assertSame(result.pathway(), pathwayCaptor.getValue());
        }
    }

    @Nested
    class Options {
        @Test
        @DisplayName("a rule that fires twice becomes a loop in the event path")
        void repeatedRuleIsLooped() {
            PathwayResult result = new PathwayFolder(PathwayConfig.defaults()).fold(List.of(bindTwice("s1"))).valueOrThrow();

            assertEquals(5, result.cores().get(0).nodes().size());
            CausalGraph eventPath = result.eventPaths().get(0);
            assertEquals(List.of("Intro A", "bind", "phos", "done"), labels(eventPath));
            assertTrue(into(eventPath, "bind").stream().anyMatch(h -> h.sources().contains(byLabel(eventPath, "phos"))));
            assertEquals(2.0, byLabel(eventPath, "done").rank());
        }

        @Test
        void introductionsCanBeDropped() {
            PathwayConfig drop = config("{\"dropIntroNodes\": true}");
            CausalGraph pathway = new PathwayFolder(drop).fold(List.of(bindThenPhos("s1"))).valueOrThrow().pathway();

            assertEquals(List.of("bind", "phos"), labels(pathway));
            assertTrue(pathway.hyperEdges().stream().noneMatch(HyperEdge::isUnderlying));
            assertEquals(1.0, byLabel(pathway, "bind").rank());
        }

        @Test
        void ignoredLabelsAreRemovedFromEventPaths() {
            PathwayConfig ignore = config("{\"ignoreList\": [\"phos\"]}");
            PathwayResult result = new PathwayFolder(ignore).fold(List.of(bindThenPhos("s1"))).valueOrThrow();

            assertEquals(3, result.cores().get(0).nodes().size());
            assertEquals(List.of("Intro A", "bind"), labels(result.pathway()));
        }

        @Test
        void shortcutImpliedByALongerPathIsReducedInThePathway() {
            EventNode i = EventNode.intro("i", "Intro A");
            EventNode a = new EventNode("a", "bind");
            EventNode b = new EventNode("b", "phos");
            EventNode d = new EventNode("d", "done");
            CausalGraph story = HyperEdgeBuilder.buildGraph("s1", null, List.of(i, a, b, d),
                    List.of(new CausalEdge(i, a), new CausalEdge(a, b), new CausalEdge(a, d), new CausalEdge(b, d)), false);

            CausalGraph reduced = new PathwayFolder(PathwayConfig.defaults()).fold(List.of(story)).valueOrThrow().pathway();
            CausalGraph kept = new PathwayFolder(config("{\"reduceRedundantEdges\": false}")).fold(List.of(story)).valueOrThrow().pathway();

            assertEquals(List.of(byLabel(reduced, "phos")), into(reduced, "done").get(0).sources());
            assertEquals(2, into(kept, "done").get(0).sources().size());
        }

        @Test
        @DisplayName("a loop closed by a repeated rule leaves the pathway unreduced")
        void loopedPathwayKeepsEveryCause() {
            EventNode i = EventNode.intro("i", "Intro A");
            EventNode s = new EventNode("s", "start");
            EventNode x1 = new EventNode("x1", "x");
            EventNode y = new EventNode("y", "y");
            EventNode x2 = new EventNode("x2", "x");
            EventNode d = new EventNode("d", "done");
            CausalGraph story = HyperEdgeBuilder.buildGraph("s1", null, List.of(i, s, x1, y, x2, d),
                    List.of(new CausalEdge(i, s), new CausalEdge(s, x1), new CausalEdge(x1, y),
                            new CausalEdge(y, x2), new CausalEdge(x2, d), new CausalEdge(y, d)), false);

            CausalGraph pathway = new PathwayFolder(PathwayConfig.defaults()).fold(List.of(story)).valueOrThrow().pathway();

            assertFalse(pathway.isAcyclic());
            List<HyperEdge> intoDone = into(pathway, "done");
            assertEquals(1, intoDone.size());
            assertEquals(2, intoDone.get(0).sources().size());
            assertNotNull(byLabel(pathway, "done").rank());
        }
    }

    @Nested
    class Failures {
        @Test
        void invalidStoriesAreAllReportedAndNothingIsObserved() {
            CausalGraph empty = new CausalGraph("empty", null);
            ErrorsOr<PathwayResult> result = new PathwayFolder(PathwayConfig.defaults(), observer)
                    .fold(List.of(bindThenPhos("ok"), empty, new CausalGraph("empty2", null)));

            List<String> errors = result.errorsOrThrow();
            assertEquals(2, errors.size(), errors.toString());
            assertTrue(errors.get(0).startsWith("validate: [1] "), errors.get(0));
            assertTrue(errors.get(1).startsWith("validate: [2] "), errors.get(1));
            verifyNoInteractions(observer);
        }

        @Test
        void rankingStallIsReturnedAsAnError() {
            ErrorsOr<PathwayResult> result = new PathwayFolder(PathwayConfig.defaults(), observer)
                    .fold(List.of(bindThenPhos("ok"), unseedable("bad")));

            String msg = String.join("\n", result.errorsOrThrow());
            assertTrue(msg.startsWith("rank: [1] RankingStalledException"), msg);
            verifyNoInteractions(observer);
        }

        @Test
        void failingStageKeepsWhatEarlierStagesReported() {
            PathwayConfig tight = config("{\"maxPaths\": 1}");
            ErrorsOr<PathwayResult> result = new PathwayFolder(tight, observer).fold(List.of(diamond("d")));

            String msg = String.join("\n", result.errorsOrThrow());
            assertTrue(msg.startsWith("eventpaths: PathBudgetExceededException"), msg);
            verify(observer).onCores(any());
            verify(observer, never()).onEventPaths(any());
            verify(observer, never()).onPathway(any());
        }

        @Test
        void nothingToFold() {
            assertEquals(List.of("No stories to fold"), new PathwayFolder(PathwayConfig.defaults()).fold(List.of()).errorsOrThrow());
        }
    }
}
