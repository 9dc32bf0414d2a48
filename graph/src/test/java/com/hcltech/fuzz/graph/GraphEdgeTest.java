package com.hcltech.fuzz.graph;

import com.hcltech.fuzz.common.exceptions.ErrorKind;
import com.hcltech.fuzz.common.exceptions.InvalidEdgeException;
import com.hcltech.fuzz.common.exceptions.InvalidTypeException;
import com.hcltech.fuzz.common.exceptions.NotFoundException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.hcltech.fuzz.graph.GraphFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class GraphEdgeTest {

    @Test
    void equalityIsOrdered() {
        assertEquals(edge(A, B), edge(A, B));
        assertNotEquals(edge(A, B), edge(B, A));
    }

    @Test
    void hashIsSymmetric() {
        assertEquals(edge(A, B).hashCode(), edge(B, A).hashCode());
    }

    @Test
    void comparingWithANonEdgeIsNotEqual() {
        assertNotEquals(edge(A, B), List.of(A, B));
    }

    @Test
    void selfLoopsAreRejected() {
        for (Object v : List.of(A, 1, 2.5)) {
            var ex = assertThrows(InvalidEdgeException.class, () -> new GraphEdge<>(v, v));
            assertEquals(ErrorKind.INVALID_EDGE, ex.kind());
        }
        assertThrows(InvalidEdgeException.class, () -> new GraphEdge<>("x", new String("x")));
    }

    @Test
    void nullEndpointsAreTypeErrors() {
        assertThrows(InvalidTypeException.class, () -> new GraphEdge<>(null, B));
        assertThrows(InvalidTypeException.class, () -> new GraphEdge<>(A, null));
    }

    @Test
    void containsEitherEndpoint() {
        var e = edge(A, B);
        assertTrue(e.contains(A));
        assertTrue(e.contains(B));
        assertFalse(e.contains(C));
    }

    @Test
    void reverseSwapsWithoutMutating() {
        var e = edge(A, B);
        var r = e.reverse();
        assertEquals(edge(B, A), r);
        assertEquals(A, e.tail());
        assertEquals(B, e.head());
    }

    @Test
    void otherEndReturnsTheOppositeVertex() {
        var e = edge(A, B);
        assertEquals(B, e.otherEnd(A));
        assertEquals(A, e.otherEnd(B));
        assertThrows(NotFoundException.class, () -> e.otherEnd(C));
    }

    @Test
    void requireEdgeChecksTheCapability() {
        var e = edge(A, B);
        assertSame(e, GraphEdge.requireEdge(e));
        var ex = assertThrows(InvalidTypeException.class, () -> GraphEdge.requireEdge("A->B"));
        assertEquals("A->B", ex.offendingValue());
    }

    @Test
    void printsAsPair() {
        assertEquals("(A, B)", edge(A, B).toString());
    }
}
