package com.geico.poc.kqlcompiler.model;

/**
 * Value computed by {@code extend} or compared against in a predicate.
 * Closed set: {@link ColumnReference}, {@link Literal}, {@link SqlFragment}.
 */
public abstract class ExpressionValue {

    ExpressionValue() {
    }

    public abstract <R> R accept(ExpressionVisitor<R> visitor);
}
