package com.hcltech.fuzz.iset;

import com.hcltech.fuzz.common.exceptions.InvalidTypeException;
import com.hcltech.fuzz.common.exceptions.NotFoundException;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Set-like storage of {@link IndexedMember}s with dict-like access by index.
 * <ul>
 *   <li>at most one member per index; {@link #add} replaces an existing one (last write wins)</li>
 *   <li>members are stored as {@link IndexedMember#copy() copies}, so the stored state is owned
 *       by the set and may be mutated in place through {@link #get}</li>
 *   <li>lookups accept either an index or a member (whose index is then used); an argument that
 *       is itself a stored index is always taken as the index</li>
 * </ul>
 * Iteration follows insertion order. Not thread-safe.
 *
 * @param <K> index type
 * @param <M> member type
 */
public final class IndexedSet<K, M extends IndexedMember<K>> implements Iterable<M> {
    private final Map<K, M> members = new LinkedHashMap<>();

    public IndexedSet() {}

    public IndexedSet(Iterable<? extends M> items) {
        addAll(items);
    }

    /** Stores a copy of {@code item}, replacing any member with the same index. */
    public void add(M item) {
        if (item == null) throw new InvalidTypeException("item to add must be an indexed member", null);
        members.put(item.index(), ownCopy(item));
    }

    public void addAll(Iterable<? extends M> items) {
        for (M item : items) add(item);
    }

    /**
     * Assigns {@code item} under {@code key}. Normally members are added with {@link #add} and
     * modified by reference; this exists for symmetry with map-style access.
     */
    public void set(K key, M item) {
        if (item == null || !item.index().equals(key))
            throw new InvalidTypeException("key does not match item index", key);
        members.put(key, ownCopy(item));
    }

    /** The stored member for an index or for a member's index. */
    public M get(Object keyOrItem) {
        M found = members.get(keyOf(keyOrItem));
        if (found == null) throw new NotFoundException("No member with index " + keyOf(keyOrItem), keyOrItem);
        return found;
    }

    public boolean contains(Object keyOrItem) {
        return keyOrItem != null && members.containsKey(keyOf(keyOrItem));
    }

    /** Removes and returns the member for an index or for a member's index. */
    public M remove(Object keyOrItem) {
        Object key = keyOf(keyOrItem);
        if (key == null || !members.containsKey(key))
            throw new NotFoundException("No member with index " + key, keyOrItem);
        return members.remove(key);
    }

    /** Live, unmodifiable view of the indices. */
    public Set<K> keys() {
        return Collections.unmodifiableSet(members.keySet());
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    public Stream<M> stream() {
        return members.values().stream();
    }

    /** Iterates the stored members. {@code remove()} is not supported. */
    @Override
    public Iterator<M> iterator() {
        return Collections.unmodifiableCollection(members.values()).iterator();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof IndexedSet<?, ?> other && members.keySet().equals(other.members.keySet());
    }

    @Override
    public int hashCode() {
        return members.keySet().hashCode();
    }

    @Override
    public String toString() {
        return members.values().toString();
    }

    /** A stored key is used as is, even when the key type is itself an {@link IndexedMember}. */
    private Object keyOf(Object keyOrItem) {
        if (keyOrItem instanceof IndexedMember<?> member && !members.containsKey(keyOrItem)) return member.index();
        return keyOrItem;
    }

    @SuppressWarnings("unchecked")
    private M ownCopy(M item) {
        IndexedMember<K> copy = item.copy();
        if (copy == null || copy.getClass() != item.getClass() || !copy.index().equals(item.index()))
            throw new InvalidTypeException(item.getClass().getName() + ".copy() must return the same type with the same index", item);
        return (M) copy;
    }
}
