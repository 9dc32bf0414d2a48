package com.hcltech.fuzz.graph;

import com.hcltech.fuzz.common.exceptions.DuplicateEdgeException;
import com.hcltech.fuzz.common.exceptions.InvalidTypeException;
import com.hcltech.fuzz.common.exceptions.NotFoundException;
import com.hcltech.fuzz.common.exceptions.UnsupportedGraphException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Storage-independent graph behaviour: edge queries, adjacency and the weighted algorithms.
 * <p>
 * Edges are always stored directed. An undirected graph is an overlay applied when querying:
 * {@link #edges(Object, Object)} matches both orientations, and everything else (weight,
 * adjacency, neighbours, removal) goes through it.
 * <p>
 * Subclasses own the storage and define {@link #weight(Object, Object)}. Not thread-safe: the
 * algorithms assume the vertex and edge sets do not change while they run.
 */
public abstract class AbstractGraph<V> {
    private static final Logger log = LoggerFactory.getLogger(AbstractGraph.class);

    private final boolean directed;
    protected final GraphAlgorithmConfig config;

    protected AbstractGraph(boolean directed, GraphAlgorithmConfig config) {
        this.directed = directed;
        this.config = config;
    }

    public final boolean isDirected() {
        return directed;
    }

    public GraphAlgorithmConfig config() {
        return config;
    }

    // --- storage ---

    /** Unmodifiable snapshot of the vertex set. */
    public abstract Set<V> vertices();

    public abstract boolean containsVertex(Object vertex);

    /** Every stored edge, as stored (no undirected overlay). */
    protected abstract Set<GraphEdge<V>> storedEdges();

    protected abstract void removeStoredEdge(GraphEdge<V> edge);

    protected abstract void removeStoredVertex(V vertex);

    /** Weight of travelling from tail to head; 0 when they are equal, infinite when not adjacent. */
    public abstract double weight(V tail, V head);

    /** Whether every vertex and edge of this graph is in {@code other}. */
    public abstract boolean isSubgraph(AbstractGraph<V> other);

    // --- vertices and edges ---

    /** Removes the vertex and every edge touching it. */
    public void removeVertex(V vertex) {
        requireVertex(vertex);
        for (GraphEdge<V> edge : List.copyOf(storedEdges())) {
            if (edge.contains(vertex)) removeStoredEdge(edge);
        }
        removeStoredVertex(vertex);
    }

    /**
     * Removes every edge from tail to head (either orientation when undirected). Nothing happens
     * when there is none; callers that need the edge to exist should check {@link #adjacent} first.
     */
    public void removeEdge(V tail, V head) {
        for (GraphEdge<V> edge : edges(tail, head)) removeStoredEdge(edge);
    }

    public void disconnect(V tail, V head) {
        removeEdge(tail, head);
    }

    public Set<GraphEdge<V>> edges() {
        return edges(null, null);
    }

    /**
     * Edges filtered by tail and/or head; a null filter matches anything. In an undirected graph
     * an edge also matches with its endpoints swapped.
     */
    public Set<GraphEdge<V>> edges(V tail, V head) {
        if (tail != null) requireVertex(tail);
        if (head != null) requireVertex(head);
        return matchingEdges(tail, head);
    }

    /** {@link #edges()} sorted by ascending weight; equal weights keep storage order. */
    public List<GraphEdge<V>> edgesByWeight() {
        return edgesByWeight(null, null);
    }

    public List<GraphEdge<V>> edgesByWeight(V tail, V head) {
        List<GraphEdge<V>> sorted = new ArrayList<>(edges(tail, head));
        sorted.sort(Comparator.comparingDouble(e -> weight(e.tail(), e.head())));
        return sorted;
    }

    // --- connectivity ---

    /** Directly connected by an edge. A vertex is never adjacent to itself. */
    public boolean adjacent(V tail, V head) {
        if (tail != null && tail.equals(head)) return false;
        requireVertex(tail);
        requireVertex(head);
        return !matchingEdges(tail, head).isEmpty();
    }

    public Set<V> neighbors(V vertex) {
        Set<V> result = new LinkedHashSet<>();
        for (GraphEdge<V> edge : edges(vertex, null)) result.add(edge.otherEnd(vertex));
        return result;
    }

    /**
     * Whether head is reachable from tail by a path of at least one edge (breadth first). False
     * when tail equals head.
     */
    public boolean connected(V tail, V head) {
        if (tail != null && tail.equals(head)) return false;
        requireVertex(tail);
        requireVertex(head);
        Set<V> seen = new HashSet<>();
        Deque<V> frontier = new ArrayDeque<>(neighbors(tail));
        seen.addAll(frontier);
        while (!frontier.isEmpty()) {
            V v = frontier.poll();
            if (v.equals(head)) return true;
            for (V n : neighbors(v)) {
                if (seen.add(n)) frontier.add(n);
            }
        }
        return false;
    }

    // --- shortest paths ---

    /**
     * Dijkstra from {@code start}. Selection scans the unvisited vertices each round, so it is
     * O(V^2); ties go to the first vertex in iteration order. Weights must be non-negative.
     */
    public DijkstraResult<V> dijkstra(V start) {
        requireVertex(start);
        warnIfLarge("dijkstra");
        Map<V, Double> dist = new LinkedHashMap<>();
        Map<V, V> prev = new LinkedHashMap<>();
        Set<V> unvisited = new LinkedHashSet<>(vertices());
        for (V v : unvisited) dist.put(v, Double.POSITIVE_INFINITY);
        dist.put(start, 0.0);

        while (!unvisited.isEmpty()) {
            V u = null;
            for (V v : unvisited) {
                if (u == null || dist.get(v) < dist.get(u)) u = v;
            }
            if (dist.get(u) == Double.POSITIVE_INFINITY) break; // the rest is unreachable
            unvisited.remove(u);
            for (V n : neighbors(u)) {
                double alt = dist.get(u) + weight(u, n);
                if (alt < dist.get(n)) {
                    dist.put(n, alt);
                    prev.put(n, u);
                }
            }
        }
        return new DijkstraResult<>(start, dist, prev);
    }

    /** Empty when {@code end} is unreachable from {@code start}. */
    public Optional<Path<V>> shortestPath(V start, V end) {
        requireVertex(end);
        return dijkstra(start).pathTo(end);
    }

    /** All-pairs shortest distances, O(V^3). The diagonal is always 0. */
    public DistanceMatrix<V> floydWarshall() {
        warnIfLarge("floydWarshall");
        List<V> order = new ArrayList<>(vertices());
        int n = order.size();
        double[][] d = new double[n][n];
        for (int i = 0; i < n; i++)
            for (int j = 0; j < n; j++)
                d[i][j] = i == j ? 0.0 : weight(order.get(i), order.get(j));
        for (int k = 0; k < n; k++)
            for (int i = 0; i < n; i++)
                for (int j = 0; j < n; j++)
                    if (d[i][k] + d[k][j] < d[i][j]) d[i][j] = d[i][k] + d[k][j];
        return new DistanceMatrix<>(order, d);
    }

    // --- subgraphs ---

    /**
     * Kruskal's algorithm. Stops once the tree has |V|-1 edges or the candidates run out, so a
     * disconnected graph yields a spanning forest. The tree is a crisp {@link Graph}: it keeps
     * the topology, and {@link WeightedGraph} overrides this to keep edge weights too.
     */
    public Graph<V> minimumSpanningTree() {
        requireUndirectedForSpanningTree();
        Graph<V> tree = new Graph<>(vertices(), List.of(), false, config);
        return growSpanningTree(tree, tree::addEdge);
    }

    /** Adds the lightest cycle-free edges to {@code tree}, which must start with no edges. */
    protected <G extends Graph<V>> G growSpanningTree(G tree, Consumer<GraphEdge<V>> addEdge) {
        requireUndirectedForSpanningTree();
        int target = Math.max(0, tree.vertices().size() - 1);
        for (GraphEdge<V> edge : edgesByWeight()) {
            if (tree.edges().size() >= target) break;
            if (!tree.connected(edge.tail(), edge.head())) addEdge.accept(edge);
        }
        log.debug("Spanning tree over {} vertices has {} edges", tree.vertices().size(), tree.edges().size());
        return tree;
    }

    private void requireUndirectedForSpanningTree() {
        if (directed)
            throw new UnsupportedGraphException("Kruskal's algorithm is for undirected graphs only", this);
    }

    /**
     * The crisp subgraph of strong edges: those whose own weight equals the shortest distance
     * between their endpoints.
     */
    public Graph<V> shortestPathSubgraph() {
        DistanceMatrix<V> paths = floydWarshall();
        Graph<V> result = new Graph<>(vertices(), List.of(), directed, config);
        for (GraphEdge<V> edge : storedEdges()) {
            if (!(weight(edge.tail(), edge.head()) > paths.distance(edge.tail(), edge.head())))
                result.addEdge(edge);
        }
        log.debug("Shortest path subgraph keeps {} of {} edges", result.edges().size(), storedEdges().size());
        return result;
    }

    public boolean isSupergraph(AbstractGraph<V> other) {
        requireSameKind(other);
        return other.isSubgraph(this);
    }

    public boolean isStrictSubgraph(AbstractGraph<V> other) {
        return isSubgraph(other) && !equals(other);
    }

    public boolean isStrictSupergraph(AbstractGraph<V> other) {
        return isSupergraph(other) && !equals(other);
    }

    // --- helpers for subclasses ---

    /** Edges matching the filters under the overlay, without checking the filters are vertices. */
    protected Set<GraphEdge<V>> matchingEdges(Object tail, Object head) {
        Set<GraphEdge<V>> result = new LinkedHashSet<>();
        for (GraphEdge<V> edge : storedEdges()) {
            if ((tail == null || edge.tail().equals(tail)) && (head == null || edge.head().equals(head)))
                result.add(edge);
        }
        if (!directed) {
            for (GraphEdge<V> edge : storedEdges()) {
                if ((tail == null || edge.head().equals(tail)) && (head == null || edge.tail().equals(head)))
                    result.add(edge);
            }
        }
        return result;
    }

    /** Checks performed before storing a new edge. */
    protected void checkNewEdge(GraphEdge<V> edge) {
        if (edge == null) throw new InvalidTypeException("edge must be a GraphEdge", null);
        if (!containsVertex(edge.tail()) || !containsVertex(edge.head()))
            throw new NotFoundException("tail and head must be in vertex set: " + edge, edge);
        if (storedEdges().contains(edge))
            throw new DuplicateEdgeException("edge already exists: " + edge, edge);
    }

    protected void requireVertex(Object vertex) {
        if (!containsVertex(vertex)) throw new NotFoundException("vertex not in graph: " + vertex, vertex);
    }

    /** Binary operations are only defined between graphs of the same kind (crisp or fuzzy). */
    protected abstract boolean isSameKind(AbstractGraph<?> other);

    protected void requireSameKind(AbstractGraph<?> other) {
        if (other == null || !isSameKind(other))
            throw new InvalidTypeException("binary operation only permitted between graphs of the same kind", other);
    }

    private void warnIfLarge(String algorithm) {
        int n = vertices().size();
        if (n > config.largeGraphWarnVertices())
            log.warn("{} running over {} vertices (warning threshold {})", algorithm, n, config.largeGraphWarnVertices());
    }
}
