package com.hcltech.fuzz.fset;

import com.hcltech.fuzz.iset.IndexedSet;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.DoublePredicate;
import java.util.stream.Stream;

/**
 * A fuzzy set: each wrapped object carries a membership degree. Backed by an {@link IndexedSet}
 * keyed by the wrapped object, so degrees can be changed in place via {@link #element}.
 * <p>
 * Objects not in the set have degree 0.
 */
public final class FuzzySet<T> implements Iterable<FuzzyElement<T>> {
    private final IndexedSet<T, FuzzyElement<T>> elements = new IndexedSet<>();

    public FuzzySet() {}

    public FuzzySet(Iterable<FuzzyElement<T>> elements) {
        this.elements.addAll(elements);
    }

    /** Adds a copy of {@code element}; an element for the same object is replaced. */
    public void add(FuzzyElement<T> element) {
        elements.add(element);
    }

    public void add(T obj, double mu) {
        elements.add(new FuzzyElement<>(obj, mu));
    }

    public FuzzyElement<T> remove(T obj) {
        return elements.remove(obj);
    }

    /** The stored element; mutations to it change this set. */
    public FuzzyElement<T> element(T obj) {
        return elements.get(obj);
    }

    public boolean contains(Object obj) {
        return elements.contains(obj);
    }

    public double mu(Object obj) {
        return elements.contains(obj) ? elements.get(obj).mu() : 0.0;
    }

    /** The wrapped objects, regardless of degree. */
    public Set<T> objects() {
        return new LinkedHashSet<>(elements.keys());
    }

    /** Objects with degree &ge; {@code threshold}. */
    public Set<T> alpha(double threshold) {
        FuzzyElement.requireDegree(threshold, "alpha");
        return select(mu -> mu >= threshold);
    }

    /** Objects with degree &gt; {@code threshold}. */
    public Set<T> strongAlpha(double threshold) {
        FuzzyElement.requireDegree(threshold, "alpha");
        return select(mu -> mu > threshold);
    }

    public Set<T> support() {
        return select(mu -> mu > 0.0);
    }

    public Set<T> kernel() {
        return select(mu -> mu == 1.0);
    }

    /** The largest degree, 0 for an empty set. */
    public double height() {
        double h = 0.0;
        for (FuzzyElement<T> e : elements) h = Math.max(h, e.mu());
        return h;
    }

    /**
     * Rescales every degree so the largest becomes 1. A set of height 0 (empty, or all zero) is
     * left unchanged.
     */
    public void normalize() {
        double h = height();
        if (h <= 0.0 || h == 1.0) return;
        for (FuzzyElement<T> e : elements) e.setMu(Math.min(1.0, e.mu() / h));
    }

    /** Fuzzy inclusion: every degree here is at most the other set's degree for the same object. */
    public boolean isSubsetOf(FuzzySet<T> other) {
        for (FuzzyElement<T> e : elements) {
            if (e.mu() > other.mu(e.obj())) return false;
        }
        return true;
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public Stream<FuzzyElement<T>> stream() {
        return elements.stream();
    }

    @Override
    public Iterator<FuzzyElement<T>> iterator() {
        return elements.iterator();
    }

    /** Equal when both hold the same objects with the same degrees. */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FuzzySet<?> other) || other.size() != size()) return false;
        for (FuzzyElement<T> e : elements) {
            if (!other.contains(e.obj()) || other.mu(e.obj()) != e.mu()) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return elements.toString();
    }

    private Set<T> select(DoublePredicate keep) {
        Set<T> result = new LinkedHashSet<>();
        for (FuzzyElement<T> e : elements) {
            if (keep.test(e.mu())) result.add(e.obj());
        }
        return result;
    }
}
