package com.hcltech.fuzz.graph;

import com.hcltech.fuzz.common.Hashing;
import com.hcltech.fuzz.common.exceptions.InvalidEdgeException;
import com.hcltech.fuzz.common.exceptions.InvalidTypeException;
import com.hcltech.fuzz.common.exceptions.NotFoundException;

/**
 * Edge directed from {@code tail} to {@code head}. Immutable; self loops are rejected.
 * <p>
 * Equality is ordered: {@code (a, b)} is not equal to {@code (b, a)}. The hash is symmetric
 * ({@code hash(tail) ^ hash(head)}), so an edge and its reverse always collide in hash-based
 * collections. That is legal under the {@code hashCode} contract and kept for compatibility with
 * existing stored hashes; undirected graphs rely on query-time matching, not on the hash.
 */
public final class GraphEdge<V> {
    private final V tail;
    private final V head;

    public GraphEdge(V tail, V head) {
        Hashing.requireValueHashable(tail, "tail");
        Hashing.requireValueHashable(head, "head");
        if (tail.equals(head)) throw new InvalidEdgeException("tail and head must differ", tail);
        this.tail = tail;
        this.head = head;
    }

    /** Capability check for untyped input: the value must be an edge. */
    public static GraphEdge<?> requireEdge(Object value) {
        if (value instanceof GraphEdge<?> edge) return edge;
        throw new InvalidTypeException("edge must be a GraphEdge", value);
    }

    public V tail() { return tail; }

    public V head() { return head; }

    public boolean contains(Object vertex) {
        return tail.equals(vertex) || head.equals(vertex);
    }

    /** The endpoint opposite {@code vertex}. */
    public V otherEnd(Object vertex) {
        if (tail.equals(vertex)) return head;
        if (head.equals(vertex)) return tail;
        throw new NotFoundException("vertex " + vertex + " is not on edge " + this, vertex);
    }

    public GraphEdge<V> reverse() {
        return new GraphEdge<>(head, tail);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof GraphEdge<?> other && tail.equals(other.tail) && head.equals(other.head);
    }

    @Override
    public int hashCode() {
        return tail.hashCode() ^ head.hashCode();
    }

    @Override
    public String toString() {
        return "(" + tail + ", " + head + ")";
    }
}
