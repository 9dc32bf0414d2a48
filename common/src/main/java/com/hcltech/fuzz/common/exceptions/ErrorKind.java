package com.hcltech.fuzz.common.exceptions;

public enum ErrorKind {
    /** Wrong kind of value where a specific one (edge, hashable vertex, index, graph) is required. */
    TYPE,
    NOT_FOUND,
    DUPLICATE,
    /** Self loop. */
    INVALID_EDGE,
    UNSUPPORTED,
    /** Membership degree or cut threshold outside [0, 1]. */
    RANGE
}
