package com.geico.poc.kqlcompiler.model;

/**
 * Row predicate of a {@code where}. Closed set of variants, dispatched through
 * {@link ConditionVisitor}.
 */
public abstract class Condition {

    Condition() {
    }

    public abstract <R> R accept(ConditionVisitor<R> visitor);
}
