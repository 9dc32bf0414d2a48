package com.hcltech.fuzz.graph;

import com.hcltech.fuzz.common.exceptions.NotFoundException;
import com.hcltech.fuzz.common.exceptions.UnsupportedGraphException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.hcltech.fuzz.graph.GraphFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class WeightedGraphTest {

    private static WeightedGraph<String> ab(boolean directed) {
        var g = new WeightedGraph<String>(directed);
        g.addVertex(A);
        g.addVertex(B);
        return g;
    }

    @Test
    void edgesWithoutAWeightWeighOne() {
        var g = ab(true);
        g.addEdge(edge(A, B));
        assertEquals(1.0, g.weight(A, B));
        assertEquals(1.0, g.edgeWeight(edge(A, B)));
    }

    @Test
    void weightFollowsTheStoredValue() {
        var g = ab(true);
        g.connect(A, B, 2.5);
        assertEquals(2.5, g.weight(A, B));
        assertEquals(Double.POSITIVE_INFINITY, g.weight(B, A));
        g.setWeight(edge(A, B), 0.5);
        assertEquals(0.5, g.weight(A, B));
    }

    @Test
    void undirectedParallelEdgesUseTheLightest() {
        var g = ab(false);
        g.connect(A, B, 4.0);
        g.connect(B, A, 3.0);
        assertEquals(3.0, g.weight(A, B));
        assertEquals(3.0, g.weight(B, A));
    }

    @Test
    void negativeOrNaNWeightsAreRejected() {
        var g = ab(true);
        assertThrows(IllegalArgumentException.class, () -> g.connect(A, B, -1.0));
        assertThrows(IllegalArgumentException.class, () -> g.connect(A, B, Double.NaN));
        assertTrue(g.edges().isEmpty());
    }

    @Test
    void weightOfAMissingEdgeCannotBeSetOrRead() {
        var g = ab(true);
        assertThrows(NotFoundException.class, () -> g.setWeight(edge(A, B), 1.0));
        assertThrows(NotFoundException.class, () -> g.edgeWeight(edge(A, B)));
    }

    @Test
    void removedEdgesForgetTheirWeight() {
        var g = ab(true);
        g.connect(A, B, 7.0);
        g.removeEdge(A, B);
        g.addEdge(edge(A, B));
        assertEquals(1.0, g.weight(A, B));
    }

    @Test
    void removingAVertexDropsItsWeightedEdges() {
        var g = weightedSquare();
        g.removeVertex(2);
        assertEquals(List.of(edge(3, 4), edge(1, 4)), g.edgesByWeight());
        var detour = g.shortestPath(1, 3).orElseThrow();
        assertEquals(List.of(1, 4, 3), detour.vertices());
        assertEquals(6.0, detour.distance());
    }

    @Test
    void spanningTreeKeepsEdgeWeights() {
        var g = new WeightedGraph<Integer>(false);
        for (int v = 1; v <= 4; v++) g.addVertex(v);
        g.connect(1, 2, 2.0);
        g.connect(2, 3, 1.5);
        g.connect(3, 4, 0.5);
        g.connect(1, 4, 5.0);

        WeightedGraph<Integer> tree = g.minimumSpanningTree();
        assertEquals(Set.of(edge(1, 2), edge(2, 3), edge(3, 4)), tree.edges());
        assertEquals(2.0, tree.edgeWeight(edge(1, 2)));
        assertEquals(0.5, tree.weight(4, 3));
        assertEquals(4.0, tree.shortestPath(1, 4).orElseThrow().distance());
    }

    @Test
    void directedWeightedGraphHasNoSpanningTree() {
        var g = ab(true);
        g.connect(A, B, 2.0);
        assertThrows(UnsupportedGraphException.class, g::minimumSpanningTree);
    }
}
