package co.fanki.citationtree.decomposition.domain;

import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Deque;

/**
 * Eades, Lin and Smyth greedy ordering.
 *
 * <p>Builds a vertex sequence by repeatedly taking sinks to the tail, sources
 * to the head and, when neither exists, the vertex with the largest
 * out-degree minus in-degree to the head. Every edge pointing backwards in the
 * final sequence is returned, so the remaining edges always form a DAG.
 * Vertices waiting to be picked sit in buckets keyed by their degree delta,
 * which keeps the whole run linear in the number of edges.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class GreedyOrderingStrategy implements FeedbackArcSetStrategy {

    private static final int PENDING = 0;
    private static final int IN_BUCKET = 1;
    private static final int QUEUED = 2;
    private static final int DONE = 3;

    /** {@inheritDoc} */
    @Override
    public FeedbackArcSetStrategyType type() {
        return FeedbackArcSetStrategyType.GREEDY_ORDERING;
    }

    /** Always applicable. */
    @Override
    public boolean isApplicable(final Digraph graph) {
        return true;
    }

    /** {@inheritDoc} */
    @Override
    public BitSet findFeedbackEdges(final Digraph graph) {
        final int[] position = new Ordering(graph).run();
        final BitSet backward = new BitSet(graph.edgeCount());
        for (int e = 0; e < graph.edgeCount(); e++) {
            if (position[graph.source(e)] > position[graph.target(e)]) {
                backward.set(e);
            }
        }
        return backward;
    }

    /** State of one ordering run. */
    private static final class Ordering {

        private final Digraph graph;
        private final int n;
        private final int[] outDegree;
        private final int[] inDegree;
        private final int[] state;
        private final int offset;
        private final int[] bucketHead;
        private final int[] next;
        private final int[] prev;
        private final int[] bucketOf;
        private final Deque<Integer> sinks = new ArrayDeque<>();
        private final Deque<Integer> sources = new ArrayDeque<>();
        private int maxBucket = -1;

        Ordering(final Digraph theGraph) {
            graph = theGraph;
            n = theGraph.vertexCount();
            outDegree = new int[n];
            inDegree = new int[n];
            int maxIn = 0;
            int maxOut = 0;
            for (int v = 0; v < n; v++) {
                outDegree[v] = theGraph.outEdges(v).length;
                inDegree[v] = theGraph.inEdges(v).length;
                maxIn = Math.max(maxIn, inDegree[v]);
                maxOut = Math.max(maxOut, outDegree[v]);
            }
            state = new int[n];
            offset = maxIn;
            bucketHead = new int[maxIn + maxOut + 1];
            Arrays.fill(bucketHead, -1);
            next = new int[n];
            prev = new int[n];
            bucketOf = new int[n];
            for (int v = 0; v < n; v++) {
                classify(v);
            }
        }

        int[] run() {
            final int[] head = new int[n];
            final int[] tail = new int[n];
            int headSize = 0;
            int tailSize = 0;
            int remaining = n;
            while (remaining > 0) {
                final int v;
                if (!sinks.isEmpty()) {
                    v = sinks.pop();
                    tail[tailSize++] = v;
                } else if (!sources.isEmpty()) {
                    v = sources.pop();
                    head[headSize++] = v;
                } else {
                    v = pollMax();
                    head[headSize++] = v;
                }
                remove(v);
                remaining--;
            }

            final int[] position = new int[n];
            for (int i = 0; i < headSize; i++) {
                position[head[i]] = i;
            }
            // tail was filled back to front
            for (int i = 0; i < tailSize; i++) {
                position[tail[i]] = n - 1 - i;
            }
            return position;
        }

        private void remove(final int v) {
            state[v] = DONE;
            for (final int e : graph.inEdges(v)) {
                final int u = graph.source(e);
                if (state[u] != DONE) {
                    outDegree[u]--;
                    reclassify(u);
                }
            }
            for (final int e : graph.outEdges(v)) {
                final int w = graph.target(e);
                if (state[w] != DONE) {
                    inDegree[w]--;
                    reclassify(w);
                }
            }
        }

        private void reclassify(final int v) {
            if (state[v] == IN_BUCKET) {
                unlink(v);
                classify(v);
            }
        }

        private void classify(final int v) {
            if (outDegree[v] == 0) {
                state[v] = QUEUED;
                sinks.push(v);
            } else if (inDegree[v] == 0) {
                state[v] = QUEUED;
                sources.push(v);
            } else {
                link(v, outDegree[v] - inDegree[v] + offset);
            }
        }

        private void link(final int v, final int bucket) {
            state[v] = IN_BUCKET;
            bucketOf[v] = bucket;
            prev[v] = -1;
            next[v] = bucketHead[bucket];
            if (bucketHead[bucket] >= 0) {
                prev[bucketHead[bucket]] = v;
            }
            bucketHead[bucket] = v;
            if (bucket > maxBucket) {
                maxBucket = bucket;
            }
        }

        private void unlink(final int v) {
            final int bucket = bucketOf[v];
            if (prev[v] >= 0) {
                next[prev[v]] = next[v];
            } else {
                bucketHead[bucket] = next[v];
            }
            if (next[v] >= 0) {
                prev[next[v]] = prev[v];
            }
            state[v] = PENDING;
        }

        private int pollMax() {
            while (bucketHead[maxBucket] < 0) {
                maxBucket--;
            }
            final int v = bucketHead[maxBucket];
            unlink(v);
            return v;
        }
    }

}
