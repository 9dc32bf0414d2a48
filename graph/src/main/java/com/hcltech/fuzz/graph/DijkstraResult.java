package com.hcltech.fuzz.graph;

import com.hcltech.fuzz.common.exceptions.NotFoundException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Single-source shortest paths. {@code distances} holds every vertex of the graph (infinite when
 * unreachable); {@code predecessors} holds only reached vertices other than the start.
 */
public record DijkstraResult<V>(V start, Map<V, Double> distances, Map<V, V> predecessors) {
    public DijkstraResult {
        distances = Collections.unmodifiableMap(new LinkedHashMap<>(distances));
        predecessors = Collections.unmodifiableMap(new LinkedHashMap<>(predecessors));
    }

    public double distance(V vertex) {
        Double d = distances.get(vertex);
        if (d == null) throw new NotFoundException("vertex not in graph: " + vertex, vertex);
        return d;
    }

    public Optional<V> predecessor(V vertex) {
        return Optional.ofNullable(predecessors.get(vertex));
    }

    public boolean isReachable(V vertex) {
        return distance(vertex) != Double.POSITIVE_INFINITY;
    }

    /** Empty when {@code end} cannot be reached; the walk is never trusted to signal that. */
    public Optional<Path<V>> pathTo(V end) {
        if (!isReachable(end)) return Optional.empty();
        List<V> reversed = new ArrayList<>();
        V current = end;
        reversed.add(current);
        while (!current.equals(start)) {
            current = predecessors.get(current);
            if (current == null)
                throw new IllegalStateException("broken predecessor chain from " + end + " to " + start);
            reversed.add(current);
        }
        Collections.reverse(reversed);
        return Optional.of(new Path<>(reversed, distance(end)));
    }
}
