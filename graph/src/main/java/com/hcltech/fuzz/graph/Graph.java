package com.hcltech.fuzz.graph;

import com.hcltech.fuzz.common.Hashing;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Crisp graph: a vertex set and a set of {@link GraphEdge}s between its vertices. Unweighted, so
 * {@link #weight} is 1 for adjacent vertices. Alpha cuts of a {@link FuzzyGraph} produce these.
 */
public class Graph<V> extends AbstractGraph<V> {
    private final Set<V> vertices = new LinkedHashSet<>();
    private final Set<GraphEdge<V>> edges = new LinkedHashSet<>();

    public Graph(boolean directed) {
        this(List.of(), List.of(), directed, GraphAlgorithmConfig.defaults());
    }

    public Graph(Iterable<? extends V> vertices, Iterable<? extends GraphEdge<V>> edges, boolean directed) {
        this(vertices, edges, directed, GraphAlgorithmConfig.defaults());
    }

    public Graph(Iterable<? extends V> vertices, Iterable<? extends GraphEdge<V>> edges, boolean directed,
                 GraphAlgorithmConfig config) {
        super(directed, config);
        for (V v : vertices) storeVertex(v);
        for (GraphEdge<V> e : edges) storeEdge(e);
    }

    /** Adding an existing vertex changes nothing. */
    public void addVertex(V vertex) {
        storeVertex(vertex);
    }

    public void addEdge(GraphEdge<V> edge) {
        storeEdge(edge);
    }

    public void connect(V tail, V head) {
        addEdge(new GraphEdge<>(tail, head));
    }

    @Override
    public Set<V> vertices() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(vertices));
    }

    @Override
    public boolean containsVertex(Object vertex) {
        return vertex != null && vertices.contains(vertex);
    }

    @Override
    protected Set<GraphEdge<V>> storedEdges() {
        return Collections.unmodifiableSet(edges);
    }

    @Override
    protected void removeStoredEdge(GraphEdge<V> edge) {
        edges.remove(edge);
    }

    @Override
    protected void removeStoredVertex(V vertex) {
        vertices.remove(vertex);
    }

    @Override
    public double weight(V tail, V head) {
        if (Objects.equals(tail, head)) return 0.0;
        return matchingEdges(tail, head).isEmpty() ? Double.POSITIVE_INFINITY : 1.0;
    }

    @Override
    public boolean isSubgraph(AbstractGraph<V> other) {
        requireSameKind(other);
        Graph<V> o = (Graph<V>) other;
        return o.vertices.containsAll(vertices) && o.edges.containsAll(edges);
    }

    @Override
    protected boolean isSameKind(AbstractGraph<?> other) {
        return other instanceof Graph<?>;
    }

    /** Same vertices and same edges. Vertex identity must match; isomorphism is not detected. */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof Graph<?> other && vertices.equals(other.vertices) && edges.equals(other.edges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(vertices, edges);
    }

    @Override
    public String toString() {
        return "V: " + vertices + "\nE: " + edges;
    }

    private void storeVertex(V vertex) {
        vertices.add(Hashing.requireValueHashable(vertex, "vertex"));
    }

    private void storeEdge(GraphEdge<V> edge) {
        checkNewEdge(edge);
        edges.add(edge);
    }
}
