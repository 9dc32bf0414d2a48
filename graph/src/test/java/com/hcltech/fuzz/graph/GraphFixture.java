package com.hcltech.fuzz.graph;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static java.util.Arrays.asList;

/**
 * Reusable graphs for the graph tests.
 * - String vertices unless a test needs numbers
 * - Builders are fresh on every call, so tests may mutate them
 */
public final class GraphFixture {

    public static final String A = "A", B = "B", C = "C", D = "D";

    public static <V> GraphEdge<V> edge(V tail, V head) {
        return new GraphEdge<>(tail, head);
    }

    @SafeVarargs
    public static <T> Set<T> set(T... xs) {
        return new LinkedHashSet<>(asList(xs));
    }

    public static Graph<String> crisp(boolean directed, List<String> vertices, List<GraphEdge<String>> edges) {
        return new Graph<>(vertices, edges, directed);
    }

    /** A-B, B-C and, when {@code withAC}, A-C. Undirected. */
    public static Graph<String> triangle(boolean withAC) {
        List<GraphEdge<String>> edges = withAC
                ? List.of(edge(A, B), edge(B, C), edge(A, C))
                : List.of(edge(A, B), edge(B, C));
        return crisp(false, List.of(A, B, C), edges);
    }

    /** Undirected square 1-2-3-4 with unit sides and a heavy 1-4 closing edge. */
    public static WeightedGraph<Integer> weightedSquare() {
        WeightedGraph<Integer> g = new WeightedGraph<>(false);
        for (int v = 1; v <= 4; v++) g.addVertex(v);
        g.connect(1, 2, 1.0);
        g.connect(2, 3, 1.0);
        g.connect(3, 4, 1.0);
        g.connect(1, 4, 5.0);
        return g;
    }

    /** X and Y fully in the graph, joined by an edge of degree 0.5. */
    public static FuzzyGraph<String> halfEdge() {
        FuzzyGraph<String> g = new FuzzyGraph<>(false);
        g.addVertex("X", 1.0);
        g.addVertex("Y", 1.0);
        g.connect("X", "Y", 0.5);
        return g;
    }

    /** Directed A -> B -> C where the B -> C edge has degree 0. */
    public static FuzzyGraph<String> fuzzyChain() {
        FuzzyGraph<String> g = new FuzzyGraph<>(true);
        g.addVertex(A, 0.9);
        g.addVertex(B, 0.4);
        g.addVertex(C, 1.0);
        g.connect(A, B, 0.4);
        g.connect(B, C, 0.0);
        return g;
    }

    private GraphFixture() {}
}
