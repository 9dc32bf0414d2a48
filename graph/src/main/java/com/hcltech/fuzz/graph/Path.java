package com.hcltech.fuzz.graph;

import java.util.List;

/** Vertices from start to end, in order, with the summed edge weights. */
public record Path<V>(List<V> vertices, double distance) {
    public Path {
        vertices = List.copyOf(vertices);
        if (vertices.isEmpty()) throw new IllegalArgumentException("a path has at least one vertex");
    }

    public V start() { return vertices.get(0); }

    public V end() { return vertices.get(vertices.size() - 1); }

    public int edgeCount() { return vertices.size() - 1; }
}
