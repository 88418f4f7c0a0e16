package com.geico.poc.kqlcompiler.model;

import java.util.Objects;

/**
 * {@code field == value}. A {@link Literal#NULL} value is a null test.
 */
public class EqualityCondition extends Condition {

    private final String field;
    private final ExpressionValue value;

    public EqualityCondition(String field, ExpressionValue value) {
        this.field = Objects.requireNonNull(field, "field");
        this.value = value == null ? Literal.NULL : value;
    }

    public String getField() {
        return field;
    }

    public ExpressionValue getValue() {
        return value;
    }

    public boolean isNullTest() {
        return value instanceof Literal && ((Literal) value).isNull();
    }

    @Override
    public <R> R accept(ConditionVisitor<R> visitor) {
        return visitor.visitEquality(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof EqualityCondition)) return false;
        EqualityCondition other = (EqualityCondition) o;
        return field.equals(other.field) && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, value);
    }

    @Override
    public String toString() {
        return field + " == " + value;
    }
}
