package co.fanki.citationtree.decomposition.domain;

import co.fanki.citationtree.graph.domain.CitationEdge;
import co.fanki.citationtree.graph.domain.CitationGraph;
import co.fanki.citationtree.graph.domain.CitationNode;
import co.fanki.citationtree.graph.domain.ExtraEdge;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link TreeExtraPartitioner}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class TreeExtraPartitionerTest {

    private CitationGraph graph;

    private Digraph digraph;

    private ComponentReport report;

    private int cycleComponent;

    @BeforeEach
    void setUp() {
        // Ten papers, one citation cycle p0 -> p1 -> p2 -> p0
        final List<CitationNode> nodes = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            nodes.add(CitationNode.of("p" + i, i, i, i % 3, 10 - i, null));
        }
        graph = CitationGraph.of(nodes, List.of(
                new CitationEdge("p0", "p1"),
                new CitationEdge("p1", "p2"),
                new CitationEdge("p2", "p0"),
                new CitationEdge("p3", "p0"),
                new CitationEdge("p2", "p4")));
        digraph = Digraph.of(graph);
        report = ComponentAnalyzer.analyze(digraph);
        cycleComponent = report.largestNonTrivial().orElseThrow();
    }

    @Test
    void whenPartitioning_givenSingleCycle_shouldMoveOneEdgeToExtra() {
        final FeedbackArcSetSolver solver = new FeedbackArcSetSolver(
                List.of(new GreedyOrderingStrategy()), 3);
        final FeedbackArcSet feedback = solver.solve(
                digraph.induced(report.component(cycleComponent)),
                FeedbackArcSetStrategyType.GREEDY_ORDERING);

        final EdgePartition partition = TreeExtraPartitioner.partition(graph,
                digraph, feedback, report, Set.of(cycleComponent));

        assertEquals(1, partition.extraEdges().size());
        assertEquals(4, partition.treeEdges().size());

        final ExtraEdge extra = partition.extraEdges().get(0);
        final Set<String> cycleNodes = Set.of("p0", "p1", "p2");
        assertTrue(cycleNodes.contains(extra.src()));
        assertTrue(cycleNodes.contains(extra.dst()));
        assertEquals("GREEDY_ORDERING", extra.edgeType());

        final Set<CitationEdge> union = new HashSet<>(partition.treeEdges());
        union.add(extra.asCitation());
        assertEquals(new HashSet<>(graph.edges()), union);
        assertTrue(AcyclicityCheck.isAcyclic(partition.treeGraph()));
    }

    @Test
    void whenPartitioning_givenSingleCycle_shouldPrioritizeByDegree() {
        final TreeMap<Integer, FeedbackArcSetStrategyType> removed =
                new TreeMap<>();
        removed.put(2, FeedbackArcSetStrategyType.CHRONOLOGICAL);
        final FeedbackArcSet feedback = new FeedbackArcSet(removed,
                List.of(FeedbackArcSetStrategyType.CHRONOLOGICAL), 1);

        final EdgePartition partition = TreeExtraPartitioner.partition(graph,
                digraph, feedback, report, Set.of(cycleComponent));

        final ExtraEdge extra = partition.extraEdges().get(0);
        assertEquals("p2", extra.src());
        assertEquals("p0", extra.dst());
        assertEquals(Math.log1p(8) + Math.log1p(10), extra.priority(), 1e-9);
    }

    @Test
    void whenPartitioning_givenEdgeOutsideBrokenComponent_shouldThrow() {
        final TreeMap<Integer, FeedbackArcSetStrategyType> removed =
                new TreeMap<>();
        removed.put(3, FeedbackArcSetStrategyType.GREEDY_ORDERING);
        removed.put(2, FeedbackArcSetStrategyType.GREEDY_ORDERING);
        final FeedbackArcSet feedback = new FeedbackArcSet(removed,
                List.of(FeedbackArcSetStrategyType.GREEDY_ORDERING), 1);

        assertThrows(DecompositionInvariantException.class,
                () -> TreeExtraPartitioner.partition(graph, digraph, feedback,
                        report, Set.of(cycleComponent)));
    }

    @Test
    void whenPartitioning_givenCycleLeftInTree_shouldThrow() {
        assertThrows(DecompositionInvariantException.class,
                () -> TreeExtraPartitioner.partition(graph, digraph,
                        FeedbackArcSet.empty(), report,
                        Set.of(cycleComponent)));
    }

    @Test
    void whenAssigningLevels_givenPartition_shouldPlaceEveryNode() {
        final FeedbackArcSetSolver solver = new FeedbackArcSetSolver(
                List.of(new GreedyOrderingStrategy()), 3);
        final FeedbackArcSet feedback = solver.solve(
                digraph.induced(report.component(cycleComponent)),
                FeedbackArcSetStrategyType.GREEDY_ORDERING);
        final EdgePartition partition = TreeExtraPartitioner.partition(graph,
                digraph, feedback, report, Set.of(cycleComponent));

        final TopologicalLevels levels = LevelAssigner.assign(
                partition.treeGraph(), LevelMode.LONGEST_PATH);

        assertEquals(10, levels.size());
        for (final CitationEdge edge : partition.treeEdges()) {
            assertTrue(levels.level(graph.indexOf(edge.dst()))
                    > levels.level(graph.indexOf(edge.src())));
        }
        assertEquals(0, levels.level(graph.indexOf("p9")));
    }

}
