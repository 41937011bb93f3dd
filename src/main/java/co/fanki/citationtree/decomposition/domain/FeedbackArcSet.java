package co.fanki.citationtree.decomposition.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Edges removed to make a graph acyclic, keyed by their citation graph edge
 * index, together with the heuristic that removed each of them.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class FeedbackArcSet {

    private final SortedMap<Integer, FeedbackArcSetStrategyType> removedBy;

    private final List<FeedbackArcSetStrategyType> strategies;

    private final int attempts;

    FeedbackArcSet(final SortedMap<Integer, FeedbackArcSetStrategyType> theRemovedBy,
            final List<FeedbackArcSetStrategyType> theStrategies,
            final int theAttempts) {
        this.removedBy = Collections.unmodifiableSortedMap(theRemovedBy);
        this.strategies = List.copyOf(theStrategies);
        this.attempts = theAttempts;
    }

    /** @return a set removing nothing */
    public static FeedbackArcSet empty() {
        return new FeedbackArcSet(new TreeMap<>(), List.of(), 0);
    }

    /**
     * Merges the sets computed for disjoint components.
     *
     * @param sets the sets to merge
     * @return the union; attempts is the largest of the merged sets
     */
    public static FeedbackArcSet combine(final Collection<FeedbackArcSet> sets) {
        final SortedMap<Integer, FeedbackArcSetStrategyType> merged =
                new TreeMap<>();
        final List<FeedbackArcSetStrategyType> strategies = new ArrayList<>();
        int attempts = 0;
        for (final FeedbackArcSet set : sets) {
            merged.putAll(set.removedBy);
            for (final FeedbackArcSetStrategyType type : set.strategies) {
                if (!strategies.contains(type)) {
                    strategies.add(type);
                }
            }
            attempts = Math.max(attempts, set.attempts);
        }
        return new FeedbackArcSet(merged, strategies, attempts);
    }

    /**
     * @param edge the citation graph edge index
     * @return true if the edge is removed
     */
    public boolean contains(final int edge) {
        return removedBy.containsKey(edge);
    }

    /**
     * @param edge the citation graph edge index
     * @return the heuristic that removed the edge, null if not removed
     */
    public FeedbackArcSetStrategyType removedBy(final int edge) {
        return removedBy.get(edge);
    }

    /** @return removed edge index to the heuristic that removed it */
    public Map<Integer, FeedbackArcSetStrategyType> edges() {
        return removedBy;
    }

    /** @return the number of removed edges */
    public int size() {
        return removedBy.size();
    }

    /** @return the heuristics used, in order of first use */
    public List<FeedbackArcSetStrategyType> strategies() {
        return strategies;
    }

    /** @return how many solving rounds were needed */
    public int attempts() {
        return attempts;
    }

}
