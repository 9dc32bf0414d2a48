package com.hcltech.fuzz.graph;

import com.hcltech.fuzz.common.exceptions.NotFoundException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** All-pairs shortest distances, keyed by ordered (from, to) vertex pairs. */
public final class DistanceMatrix<V> {
    private final List<V> order;
    private final Map<V, Integer> index;
    private final double[][] dist;

    DistanceMatrix(List<V> order, double[][] dist) {
        this.order = List.copyOf(order);
        this.index = new LinkedHashMap<>();
        for (int i = 0; i < this.order.size(); i++) index.put(this.order.get(i), i);
        this.dist = dist;
    }

    public List<V> vertices() {
        return order;
    }

    public double distance(V from, V to) {
        return dist[indexOf(from)][indexOf(to)];
    }

    /** Nested copy: {@code asMap().get(from).get(to)}. */
    public Map<V, Map<V, Double>> asMap() {
        Map<V, Map<V, Double>> result = new LinkedHashMap<>();
        for (int i = 0; i < order.size(); i++) {
            Map<V, Double> row = new LinkedHashMap<>();
            for (int j = 0; j < order.size(); j++) row.put(order.get(j), dist[i][j]);
            result.put(order.get(i), row);
        }
        return result;
    }

    @Override
    public String toString() {
        return asMap().toString();
    }

    private int indexOf(V vertex) {
        Integer i = index.get(vertex);
        if (i == null) throw new NotFoundException("vertex not in graph: " + vertex, vertex);
        return i;
    }
}
