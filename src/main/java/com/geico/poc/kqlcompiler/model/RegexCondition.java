package com.geico.poc.kqlcompiler.model;

import java.util.Objects;

/**
 * {@code field matches regex "pattern"}, always case-sensitive.
 */
public class RegexCondition extends Condition {

    private final String field;
    private final String pattern;

    public RegexCondition(String field, String pattern) {
        this.field = Objects.requireNonNull(field, "field");
        this.pattern = Objects.requireNonNull(pattern, "pattern");
    }

    public String getField() {
        return field;
    }

    public String getPattern() {
        return pattern;
    }

    @Override
    public <R> R accept(ConditionVisitor<R> visitor) {
        return visitor.visitRegex(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof RegexCondition)) return false;
        RegexCondition other = (RegexCondition) o;
        return field.equals(other.field) && pattern.equals(other.pattern);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, pattern);
    }

    @Override
    public String toString() {
        return field + " matches regex \"" + pattern + "\"";
    }
}
