package org.kappapathways.hypergraph;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.kappapathways.hypergraph.StoryFixture.*;

class StoryMergerTest {

    @Test
    void identicalStoriesCollapseIntoOneWithSummedStatistics() {
        List<CausalGraph> cores = StoryMerger.foldEquivalentStories(List.of(bindPhos("s1"), bindPhos("s2")), true, "core");

        assertEquals(1, cores.size());
        CausalGraph core = cores.get(0);
        assertEquals("core-1", core.id());
        assertEquals(2, core.occurrence());
        assertEquals(6, core.hyperEdges().get(0).weight());
        assertEquals(4, core.hyperEdges().get(0).number());
        assertEquals(List.of("s1", "s2"), core.prevcores());
        assertEquals(2, core.nodes().size(), "no new nodes for exact duplicates");
    }

    @Test
    void resultsAreSortedByOccurrenceAndRenamed() {
        CausalGraph diamond = diamond("d1");
        CausalGraph triangle = triangle("t1");
        rank(diamond);
        rank(triangle);

        List<CausalGraph> cores = StoryMerger.foldEquivalentStories(
                List.of(diamond, triangle, triangle.copy(), diamond.copy(), triangle.copy()), true, "core");

        assertEquals(2, cores.size());
        assertEquals("core-1", cores.get(0).id());
        assertEquals(3, cores.get(0).occurrence());
        assertEquals(3, cores.get(0).nodes().size());
        assertEquals("core-2", cores.get(1).id());
        assertEquals(2, cores.get(1).occurrence());
        assertEquals(List.of("d1", "d1"), cores.get(1).prevcores());
    }

    @Test
    void tiesKeepInputOrder() {
        List<CausalGraph> cores = StoryMerger.foldEquivalentStories(List.of(diamond("d"), triangle("t")), false, "eventpath");
        assertEquals(List.of("eventpath-1", "eventpath-2"), cores.stream().map(CausalGraph::id).toList());
        assertEquals(4, cores.get(0).nodes().size());
    }

    @Test
    void enforcedRanksKeepDifferentlyRankedStoriesApart() {
        CausalGraph s1 = bindPhos("s1");
        CausalGraph s2 = bindPhos("s2");
        byLabel(s2, "phos").setRank(3.0);

        assertEquals(2, StoryMerger.foldEquivalentStories(List.of(s1, s2), true, "core").size());
        assertEquals(1, StoryMerger.foldEquivalentStories(List.of(s1, s2), false, "core").size());
    }

    @Test
    void inputsAreNotModified() {
        CausalGraph s1 = bindPhos("s1");
        StoryMerger.foldEquivalentStories(List.of(s1, bindPhos("s2")), true, "core");
        assertEquals("s1", s1.id());
        assertEquals(1, s1.occurrence());
        assertEquals(3, s1.hyperEdges().get(0).weight());
    }
}
