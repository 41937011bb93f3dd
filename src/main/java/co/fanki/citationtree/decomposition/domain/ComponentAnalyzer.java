package co.fanki.citationtree.decomposition.domain;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Strongly connected components by Tarjan's algorithm.
 *
 * <p>The depth first search keeps its own call stack so chains of millions of
 * citations do not overflow the thread stack.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ComponentAnalyzer {

    private ComponentAnalyzer() {
    }

    /**
     * Computes the strongly connected components of a graph.
     *
     * @param graph the graph
     * @return the components report
     */
    public static ComponentReport analyze(final Digraph graph) {
        final int n = graph.vertexCount();
        final int[] index = new int[n];
        final int[] low = new int[n];
        final boolean[] onStack = new boolean[n];
        final int[] stack = new int[n];
        final int[] callVertex = new int[n];
        final int[] callEdge = new int[n];
        final int[] componentOf = new int[n];
        final List<int[]> components = new ArrayList<>();
        Arrays.fill(index, -1);

        int counter = 0;
        int sp = 0;
        for (int root = 0; root < n; root++) {
            if (index[root] != -1) {
                continue;
            }
            int csp = 0;
            index[root] = counter;
            low[root] = counter;
            counter++;
            stack[sp++] = root;
            onStack[root] = true;
            callVertex[csp] = root;
            callEdge[csp] = 0;
            csp++;

            while (csp > 0) {
                final int v = callVertex[csp - 1];
                final int[] out = graph.outEdges(v);
                if (callEdge[csp - 1] < out.length) {
                    final int w = graph.target(out[callEdge[csp - 1]++]);
                    if (index[w] == -1) {
                        index[w] = counter;
                        low[w] = counter;
                        counter++;
                        stack[sp++] = w;
                        onStack[w] = true;
                        callVertex[csp] = w;
                        callEdge[csp] = 0;
                        csp++;
                    } else if (onStack[w]) {
                        low[v] = Math.min(low[v], index[w]);
                    }
                    continue;
                }

                csp--;
                if (csp > 0) {
                    final int parent = callVertex[csp - 1];
                    low[parent] = Math.min(low[parent], low[v]);
                }
                if (low[v] == index[v]) {
                    int size = 0;
                    while (stack[sp - 1 - size] != v) {
                        size++;
                    }
                    size++;
                    final int[] component = new int[size];
                    for (int i = 0; i < size; i++) {
                        final int w = stack[--sp];
                        onStack[w] = false;
                        componentOf[w] = components.size();
                        component[i] = w;
                    }
                    Arrays.sort(component);
                    components.add(component);
                }
            }
        }
        return new ComponentReport(components, componentOf);
    }

}
