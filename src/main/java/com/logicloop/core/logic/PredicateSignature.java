package com.logicloop.core.logic;

import java.util.Objects;

/**
 * Predicate name plus arity, rendered as "Name/arity".
 */
public final class PredicateSignature {

    private final String name;
    private final int    arity;

    public PredicateSignature(String name, int arity) {
        this.name  = name;
        this.arity = arity;
    }

    public String getName() { return name; }
    public int    getArity() { return arity; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PredicateSignature)) return false;
        PredicateSignature other = (PredicateSignature) o;
        return arity == other.arity && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, arity);
    }

    @Override
    public String toString() {
        return name + "/" + arity;
    }
}
