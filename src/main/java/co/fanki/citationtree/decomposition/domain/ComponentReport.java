package co.fanki.citationtree.decomposition.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Strongly connected components of a graph, with the diagnostics reported
 * for each decomposition run.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ComponentReport {

    private final List<int[]> components;

    private final int[] componentOf;

    private final int largest;

    ComponentReport(final List<int[]> theComponents,
            final int[] theComponentOf) {
        this.components = Collections.unmodifiableList(theComponents);
        this.componentOf = theComponentOf;

        int best = -1;
        for (int c = 0; c < theComponents.size(); c++) {
            if (best < 0 || theComponents.get(c).length
                    > theComponents.get(best).length) {
                best = c;
            }
        }
        this.largest = best;
    }

    /** @return every component, each a sorted array of vertex indexes */
    public List<int[]> components() {
        return components;
    }

    /** @return the number of components, singletons included */
    public int componentCount() {
        return components.size();
    }

    /**
     * @param vertex the vertex index
     * @return the component id of the vertex
     */
    public int componentOf(final int vertex) {
        return componentOf[vertex];
    }

    /**
     * @param componentId the component id
     * @return the vertices of the component
     */
    public int[] component(final int componentId) {
        return components.get(componentId);
    }

    /**
     * Returns the largest component, if it has a cycle.
     *
     * @return the id of the largest component when it has more than one
     *         vertex
     */
    public Optional<Integer> largestNonTrivial() {
        if (largest < 0 || components.get(largest).length < 2) {
            return Optional.empty();
        }
        return Optional.of(largest);
    }

    /** @return size of the largest component, 0 for an empty graph */
    public int largestSize() {
        return largest < 0 ? 0 : components.get(largest).length;
    }

    /** @return ids of every component with at least two vertices */
    public List<Integer> nonTrivialComponents() {
        final List<Integer> result = new ArrayList<>();
        for (int c = 0; c < components.size(); c++) {
            if (components.get(c).length > 1) {
                result.add(c);
            }
        }
        return result;
    }

    /** @return the number of single vertex components */
    public int singletonCount() {
        int count = 0;
        for (final int[] component : components) {
            if (component.length == 1) {
                count++;
            }
        }
        return count;
    }

    /** @return the number of vertices that lie on some cycle */
    public int verticesInCycles() {
        int count = 0;
        for (final int[] component : components) {
            if (component.length > 1) {
                count += component.length;
            }
        }
        return count;
    }

    /** @return component size to number of components of that size */
    public Map<Integer, Integer> sizeDistribution() {
        final Map<Integer, Integer> distribution = new TreeMap<>();
        for (final int[] component : components) {
            distribution.merge(component.length, 1, Integer::sum);
        }
        return distribution;
    }

}
