package com.hcltech.fuzz.fset;

import com.hcltech.fuzz.common.exceptions.MembershipRangeException;
import com.hcltech.fuzz.iset.IndexedMember;

/**
 * An object paired with its degree of membership in [0, 1]. The wrapped object is the index, so
 * two elements are equal when they wrap equal objects, whatever their degrees.
 */
public final class FuzzyElement<T> extends IndexedMember<T> {
    /** Degree of an object added without one. */
    public static final double FULL_MEMBERSHIP = 1.0;

    private double mu;

    public FuzzyElement(T obj, double mu) {
        super(obj);
        this.mu = requireDegree(mu, "membership degree");
    }

    public static <T> FuzzyElement<T> of(T obj) {
        return new FuzzyElement<>(obj, FULL_MEMBERSHIP);
    }

    public T obj() {
        return index();
    }

    public double mu() {
        return mu;
    }

    public void setMu(double mu) {
        this.mu = requireDegree(mu, "membership degree");
    }

    @Override
    public FuzzyElement<T> copy() {
        return new FuzzyElement<>(index(), mu);
    }

    @Override
    public String toString() {
        return index() + "/" + mu;
    }

    /** NaN fails too. */
    public static double requireDegree(double value, String role) {
        if (!(value >= 0.0 && value <= 1.0))
            throw new MembershipRangeException(role + " must be in [0, 1] but was " + value, value);
        return value;
    }
}
