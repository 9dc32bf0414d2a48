package com.hcltech.fuzz.graph;

import com.hcltech.fuzz.common.exceptions.NotFoundException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Crisp graph whose edges carry a non-negative real weight. Edges added without one weigh 1.
 * In an undirected graph with parallel edges the lightest one counts.
 */
public class WeightedGraph<V> extends Graph<V> {
    private final Map<GraphEdge<V>, Double> weights = new HashMap<>();

    public WeightedGraph(boolean directed) {
        this(directed, GraphAlgorithmConfig.defaults());
    }

    public WeightedGraph(boolean directed, GraphAlgorithmConfig config) {
        super(List.of(), List.of(), directed, config);
    }

    public void addEdge(GraphEdge<V> edge, double weight) {
        requireWeight(weight);
        super.addEdge(edge);
        weights.put(edge, weight);
    }

    public void connect(V tail, V head, double weight) {
        addEdge(new GraphEdge<>(tail, head), weight);
    }

    public void setWeight(GraphEdge<V> edge, double weight) {
        requireWeight(weight);
        if (!storedEdges().contains(edge)) throw new NotFoundException("edge not in graph: " + edge, edge);
        weights.put(edge, weight);
    }

    /** The stored weight of this exact edge. */
    public double edgeWeight(GraphEdge<V> edge) {
        if (!storedEdges().contains(edge)) throw new NotFoundException("edge not in graph: " + edge, edge);
        return weights.getOrDefault(edge, 1.0);
    }

    @Override
    public double weight(V tail, V head) {
        if (Objects.equals(tail, head)) return 0.0;
        double best = Double.POSITIVE_INFINITY;
        for (GraphEdge<V> edge : matchingEdges(tail, head)) {
            best = Math.min(best, weights.getOrDefault(edge, 1.0));
        }
        return best;
    }

    /** Spanning tree whose edges keep their weights here. */
    @Override
    public WeightedGraph<V> minimumSpanningTree() {
        WeightedGraph<V> tree = new WeightedGraph<>(false, config);
        for (V v : vertices()) tree.addVertex(v);
        return growSpanningTree(tree, edge -> tree.addEdge(edge, edgeWeight(edge)));
    }

    @Override
    protected void removeStoredEdge(GraphEdge<V> edge) {
        super.removeStoredEdge(edge);
        weights.remove(edge);
    }

    private static void requireWeight(double weight) {
        if (!(weight >= 0.0))
            throw new IllegalArgumentException("edge weight must be non-negative but was " + weight);
    }
}
