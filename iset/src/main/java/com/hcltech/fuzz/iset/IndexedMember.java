package com.hcltech.fuzz.iset;

import com.hcltech.fuzz.common.Hashing;

import java.util.Objects;

/**
 * A member with mutable properties but one immutable property, the index, which alone defines
 * equality and hash. This lets an otherwise mutable object live in a hash-based collection and be
 * addressed by its index.
 *
 * @param <K> the index type; must have value-based {@code equals}/{@code hashCode}
 */
public abstract class IndexedMember<K> {
    private final K index;

    protected IndexedMember(K index) {
        this.index = Hashing.requireValueHashable(index, "index");
    }

    public final K index() {
        return index;
    }

    /**
     * An independent copy: same index, own mutable state. {@link IndexedSet} stores copies so that
     * the caller's instance can change without affecting the stored one.
     */
    public abstract IndexedMember<K> copy();

    @Override
    public final boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof IndexedMember<?> other && Objects.equals(index, other.index);
    }

    @Override
    public final int hashCode() {
        return index.hashCode();
    }
}
