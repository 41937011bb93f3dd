package co.fanki.citationtree.decomposition.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Runs a feedback arc set heuristic and proves its result.
 *
 * <p>The first round applies the requested strategy to the whole component.
 * While the residual graph still has cycles, its non trivial components are
 * solved again by the greedy ordering. A result is only returned after a
 * topological sort of the residual succeeds; when {@code maxAttempts} rounds
 * do not get there the solver throws
 * {@link DecompositionInvariantException}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class FeedbackArcSetSolver {

    private static final Logger LOG = LoggerFactory.getLogger(
            FeedbackArcSetSolver.class);

    private final Map<FeedbackArcSetStrategyType, FeedbackArcSetStrategy>
            strategies;

    private final int maxAttempts;

    /**
     * Creates a new FeedbackArcSetSolver.
     *
     * @param theStrategies the available strategies, greedy ordering included
     * @param theMaxAttempts the solving rounds allowed before giving up
     */
    public FeedbackArcSetSolver(
            final List<FeedbackArcSetStrategy> theStrategies,
            @Value("${decomposition.max-attempts:5}") final int theMaxAttempts) {
        if (theMaxAttempts <= 0) {
            throw new IllegalArgumentException("Max attempts must be positive");
        }
        this.strategies = new EnumMap<>(FeedbackArcSetStrategyType.class);
        for (final FeedbackArcSetStrategy strategy : theStrategies) {
            strategies.put(strategy.type(), strategy);
        }
        if (!strategies.containsKey(FeedbackArcSetStrategyType.GREEDY_ORDERING)) {
            throw new IllegalStateException(
                    "The greedy ordering strategy is required as fallback");
        }
        this.maxAttempts = theMaxAttempts;
    }

    /**
     * Computes a verified feedback arc set of a graph.
     *
     * @param graph the graph to make acyclic
     * @param preferred the strategy to try first
     * @return the removed edges, keyed by the graph's edge labels
     * @throws DecompositionInvariantException if the graph is still cyclic
     *         after every allowed round
     */
    public FeedbackArcSet solve(final Digraph graph,
            final FeedbackArcSetStrategyType preferred) {
        final BitSet removed = new BitSet(graph.edgeCount());
        final SortedMap<Integer, FeedbackArcSetStrategyType> removedBy =
                new TreeMap<>();
        final List<FeedbackArcSetStrategyType> used = new ArrayList<>();

        int attempts = 0;
        while (true) {
            final Digraph residual = graph.withoutEdges(removed);
            if (AcyclicityCheck.isAcyclic(residual)) {
                LOG.info("Removed {} of {} edges in {} rounds using {}",
                        removed.cardinality(), graph.edgeCount(), attempts,
                        used);
                return new FeedbackArcSet(removedBy, used, attempts);
            }
            if (attempts >= maxAttempts) {
                throw new DecompositionInvariantException("Graph of "
                        + graph.vertexCount() + " vertices still cyclic after "
                        + attempts + " rounds");
            }

            final FeedbackArcSetStrategyType requested = attempts == 0
                    ? preferred : FeedbackArcSetStrategyType.GREEDY_ORDERING;
            if (attempts > 0) {
                LOG.warn("Residual graph still cyclic after round {},"
                        + " retrying with {}", attempts, requested);
            }

            final ComponentReport report = ComponentAnalyzer.analyze(residual);
            for (final int componentId : report.nonTrivialComponents()) {
                final Digraph part = residual.induced(
                        report.component(componentId));
                final FeedbackArcSetStrategy strategy = select(requested, part);
                if (!used.contains(strategy.type())) {
                    used.add(strategy.type());
                }
                final BitSet local = strategy.findFeedbackEdges(part);
                for (int e = local.nextSetBit(0); e >= 0;
                        e = local.nextSetBit(e + 1)) {
                    final int label = part.edgeLabel(e);
                    removed.set(graph.edgeWithLabel(label));
                    removedBy.put(label, strategy.type());
                }
            }
            attempts++;
        }
    }

    private FeedbackArcSetStrategy select(
            final FeedbackArcSetStrategyType requested, final Digraph part) {
        final FeedbackArcSetStrategy strategy = strategies.get(requested);
        if (strategy != null && strategy.isApplicable(part)) {
            return strategy;
        }
        if (strategy == null) {
            LOG.warn("Strategy {} is not available, using greedy ordering",
                    requested);
        }
        return strategies.get(FeedbackArcSetStrategyType.GREEDY_ORDERING);
    }

}
