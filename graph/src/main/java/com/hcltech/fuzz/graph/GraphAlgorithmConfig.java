package com.hcltech.fuzz.graph;

import com.hcltech.fuzz.common.IEnvGetter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Settings shared by graph instances.
 *
 * @param largeGraphWarnVertices above this many vertices, Dijkstra and Floyd-Warshall log a warning
 */
public record GraphAlgorithmConfig(int largeGraphWarnVertices) {
    private static final Logger log = LoggerFactory.getLogger(GraphAlgorithmConfig.class);

    public static final String LARGE_GRAPH_WARN_VERTICES = "FUZZ_LARGE_GRAPH_WARN_VERTICES";
    public static final int DEFAULT_LARGE_GRAPH_WARN_VERTICES = 1000;

    public GraphAlgorithmConfig {
        if (largeGraphWarnVertices < 0)
            throw new IllegalArgumentException("largeGraphWarnVertices must be >= 0 but was " + largeGraphWarnVertices);
    }

    /** Strict: an unparsable or negative value fails with the variable's name in the message. */
    public static GraphAlgorithmConfig fromEnv(IEnvGetter env) {
        int warn = IEnvGetter.getIntOr(env, LARGE_GRAPH_WARN_VERTICES, DEFAULT_LARGE_GRAPH_WARN_VERTICES);
        if (warn < 0)
            throw new IllegalStateException("Invalid value for environment variable: " + LARGE_GRAPH_WARN_VERTICES + " = " + warn);
        return new GraphAlgorithmConfig(warn);
    }

    /** Lenient: a bad value is logged and the built-in default used instead. */
    public static GraphAlgorithmConfig fromEnvOrDefault(IEnvGetter env) {
        try {
            return fromEnv(env);
        } catch (IllegalStateException e) {
            log.warn("Ignoring {}, using {}: {}", LARGE_GRAPH_WARN_VERTICES, DEFAULT_LARGE_GRAPH_WARN_VERTICES, e.getMessage());
            return new GraphAlgorithmConfig(DEFAULT_LARGE_GRAPH_WARN_VERTICES);
        }
    }

    /** Read once from the process environment. */
    public static GraphAlgorithmConfig defaults() {
        return Holder.DEFAULTS;
    }

    private static final class Holder {
        static final GraphAlgorithmConfig DEFAULTS = fromEnvOrDefault(IEnvGetter.env);
    }
}
