package com.hcltech.fuzz.graph;

import com.hcltech.fuzz.common.errorsor.ErrorsOr;
import com.hcltech.fuzz.fset.FuzzyElement;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Structural checks that report every problem found. Never throws.
 * <ul>
 *   <li>every edge's endpoints are vertices of the graph</li>
 *   <li>for fuzzy graphs, no edge is stronger than its weaker endpoint:
 *       {@code mu(u, v) <= min(mu(u), mu(v))}</li>
 * </ul>
 */
public interface GraphValidation {

    static <V> ErrorsOr<Boolean> validate(AbstractGraph<V> graph) {
        Objects.requireNonNull(graph);
        List<String> errors = new ArrayList<>();

        for (GraphEdge<V> edge : graph.storedEdges()) {
            if (!graph.containsVertex(edge.tail()))
                errors.add("Dangling edge " + edge + ": tail " + edge.tail() + " is not a vertex");
            if (!graph.containsVertex(edge.head()))
                errors.add("Dangling edge " + edge + ": head " + edge.head() + " is not a vertex");
        }

        if (graph instanceof FuzzyGraph<V> fuzzy) {
            for (FuzzyElement<GraphEdge<V>> element : fuzzy.edgeElements()) {
                GraphEdge<V> edge = element.obj();
                double bound = Math.min(fuzzy.membership(edge.tail()), fuzzy.membership(edge.head()));
                if (element.mu() > bound)
                    errors.add("Edge " + edge + " has membership " + element.mu()
                            + " above its endpoints' minimum " + bound);
            }
        }

        return ErrorsOr.liftOrErrors(Boolean.TRUE, errors);
    }
}
