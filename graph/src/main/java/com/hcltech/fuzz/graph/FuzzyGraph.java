package com.hcltech.fuzz.graph;

import com.hcltech.fuzz.common.Hashing;
import com.hcltech.fuzz.fset.FuzzyElement;
import com.hcltech.fuzz.fset.FuzzySet;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Fuzzy graph: vertices and edges each belong to the graph with a membership degree in [0, 1].
 * Traversal cost is the reciprocal of an edge's degree, so the shortest-path and spanning-tree
 * algorithms favour strong connections.
 * <p>
 * Alpha cuts reduce a fuzzy graph to a crisp {@link Graph}.
 */
public class FuzzyGraph<V> extends AbstractGraph<V> {
    private final FuzzySet<V> vertexSet = new FuzzySet<>();
    private final FuzzySet<GraphEdge<V>> edgeSet = new FuzzySet<>();

    public FuzzyGraph(boolean directed) {
        this(directed, GraphAlgorithmConfig.defaults());
    }

    public FuzzyGraph(boolean directed, GraphAlgorithmConfig config) {
        super(directed, config);
    }

    /** Plain vertices and edges, each with full membership. */
    public static <V> FuzzyGraph<V> of(Iterable<? extends V> vertices, Iterable<? extends GraphEdge<V>> edges,
                                       boolean directed) {
        FuzzyGraph<V> graph = new FuzzyGraph<>(directed);
        for (V v : vertices) graph.addVertex(v);
        for (GraphEdge<V> e : edges) graph.addEdge(e);
        return graph;
    }

    public static <V> FuzzyGraph<V> fromElements(Iterable<FuzzyElement<V>> vertices,
                                                 Iterable<FuzzyElement<GraphEdge<V>>> edges,
                                                 boolean directed) {
        FuzzyGraph<V> graph = new FuzzyGraph<>(directed);
        for (FuzzyElement<V> v : vertices) graph.addVertex(v);
        for (FuzzyElement<GraphEdge<V>> e : edges) graph.addEdge(e);
        return graph;
    }

    // --- vertices and edges ---

    /** Adds the vertex with full membership. */
    public void addVertex(V vertex) {
        addVertex(vertex, FuzzyElement.FULL_MEMBERSHIP);
    }

    public void addVertex(V vertex, double mu) {
        addVertex(new FuzzyElement<>(vertex, mu));
    }

    /** Re-adding a vertex replaces its degree. */
    public void addVertex(FuzzyElement<V> vertex) {
        Hashing.requireValueHashable(vertex, "vertex");
        vertexSet.add(vertex);
    }

    /** Adds the edge with full membership. */
    public void addEdge(GraphEdge<V> edge) {
        addEdge(edge, FuzzyElement.FULL_MEMBERSHIP);
    }

    public void addEdge(GraphEdge<V> edge, double mu) {
        checkNewEdge(edge);
        edgeSet.add(edge, mu);
    }

    @SuppressWarnings("unchecked")
    public void addEdge(FuzzyElement<GraphEdge<V>> edge) {
        Hashing.requireValueHashable(edge, "edge");
        GraphEdge<V> e = (GraphEdge<V>) GraphEdge.requireEdge(((FuzzyElement<?>) edge).obj());
        checkNewEdge(e);
        edgeSet.add(edge);
    }

    public void connect(V tail, V head) {
        addEdge(new GraphEdge<>(tail, head));
    }

    public void connect(V tail, V head, double mu) {
        addEdge(new GraphEdge<>(tail, head), mu);
    }

    @Override
    public Set<V> vertices() {
        return Collections.unmodifiableSet(vertexSet.objects());
    }

    @Override
    public boolean containsVertex(Object vertex) {
        return vertex != null && vertexSet.contains(vertex);
    }

    @Override
    protected Set<GraphEdge<V>> storedEdges() {
        return Collections.unmodifiableSet(edgeSet.objects());
    }

    @Override
    protected void removeStoredEdge(GraphEdge<V> edge) {
        edgeSet.remove(edge);
    }

    @Override
    protected void removeStoredVertex(V vertex) {
        vertexSet.remove(vertex);
    }

    // --- memberships ---

    /** Degree of the vertex, 0 if it is not in the graph. */
    public double membership(V vertex) {
        return vertexSet.mu(vertex);
    }

    /** Degree of the edge from tail to head (either orientation when undirected), 0 if none. */
    public double membership(V tail, V head) {
        for (GraphEdge<V> edge : matchingEdges(tail, head)) return edgeSet.mu(edge);
        return 0.0;
    }

    public void setMembership(V vertex, double mu) {
        vertexSet.element(vertex).setMu(mu);
    }

    public void setEdgeMembership(GraphEdge<V> edge, double mu) {
        edgeSet.element(edge).setMu(mu);
    }

    /** Reciprocal of the edge degree; infinite when there is no edge or its degree is 0. */
    @Override
    public double weight(V tail, V head) {
        if (Objects.equals(tail, head)) return 0.0;
        double mu = membership(tail, head);
        return mu == 0.0 ? Double.POSITIVE_INFINITY : 1.0 / mu;
    }

    // --- cuts ---

    /** Crisp graph of the vertices and edges with degree &ge; alpha. */
    public Graph<V> alpha(double alpha) {
        return cut(vertexSet.alpha(alpha), edgeSet.alpha(alpha));
    }

    /** Crisp graph of the vertices and edges with degree &gt; alpha. */
    public Graph<V> strongAlpha(double alpha) {
        return cut(vertexSet.strongAlpha(alpha), edgeSet.strongAlpha(alpha));
    }

    /** Rescales vertex and edge degrees, independently, so each set's largest degree is 1. */
    public void normalize() {
        vertexSet.normalize();
        edgeSet.normalize();
    }

    // --- relations ---

    /**
     * Fuzzy subgraph: each vertex and edge here is in {@code other} with at least the same degree.
     */
    @Override
    public boolean isSubgraph(AbstractGraph<V> other) {
        requireSameKind(other);
        FuzzyGraph<V> o = (FuzzyGraph<V>) other;
        return o.vertexSet.objects().containsAll(vertexSet.objects())
                && o.edgeSet.objects().containsAll(edgeSet.objects())
                && vertexSet.isSubsetOf(o.vertexSet)
                && edgeSet.isSubsetOf(o.edgeSet);
    }

    @Override
    protected boolean isSameKind(AbstractGraph<?> other) {
        return other instanceof FuzzyGraph<?>;
    }

    /** Same vertices and edges with the same degrees. */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof FuzzyGraph<?> other && vertexSet.equals(other.vertexSet) && edgeSet.equals(other.edgeSet);
    }

    @Override
    public int hashCode() {
        return Objects.hash(vertexSet, edgeSet);
    }

    @Override
    public String toString() {
        return "V: " + vertexSet + "\nE: " + edgeSet;
    }

    Iterable<FuzzyElement<GraphEdge<V>>> edgeElements() {
        return edgeSet;
    }

    private Graph<V> cut(Set<V> vertices, Set<GraphEdge<V>> edges) {
        Set<GraphEdge<V>> kept = new LinkedHashSet<>();
        for (GraphEdge<V> edge : edges) {
            if (vertices.contains(edge.tail()) && vertices.contains(edge.head())) kept.add(edge);
        }
        return new Graph<>(vertices, kept, isDirected(), config);
    }
}
