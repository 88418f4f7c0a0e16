package com.geico.poc.kqlcompiler.model;

import java.util.Objects;

/**
 * Substring predicate: contains, startswith or endswith, optionally case-sensitive
 * and optionally negated ({@code !contains} and friends).
 */
public class StringCondition extends Condition {

    public enum Operator {
        CONTAINS("contains"),
        STARTS_WITH("startswith"),
        ENDS_WITH("endswith");

        private final String kqlName;

        Operator(String kqlName) {
            this.kqlName = kqlName;
        }

        public String getKqlName() {
            return kqlName;
        }
    }

    private final String field;
    private final Operator operator;
    private final String value;
    private final boolean caseSensitive;
    private final boolean negated;

    public StringCondition(String field, Operator operator, String value, boolean caseSensitive, boolean negated) {
        this.field = Objects.requireNonNull(field, "field");
        this.operator = Objects.requireNonNull(operator, "operator");
        this.value = Objects.requireNonNull(value, "value");
        this.caseSensitive = caseSensitive;
        this.negated = negated;
    }

    public StringCondition(String field, Operator operator, String value, boolean caseSensitive) {
        this(field, operator, value, caseSensitive, false);
    }

    public String getField() {
        return field;
    }

    public Operator getOperator() {
        return operator;
    }

    public String getValue() {
        return value;
    }

    public boolean isCaseSensitive() {
        return caseSensitive;
    }

    public boolean isNegated() {
        return negated;
    }

    @Override
    public <R> R accept(ConditionVisitor<R> visitor) {
        return visitor.visitStringOperation(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof StringCondition)) return false;
        StringCondition other = (StringCondition) o;
        return field.equals(other.field) && operator == other.operator && value.equals(other.value)
                && caseSensitive == other.caseSensitive && negated == other.negated;
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, operator, value, caseSensitive, negated);
    }

    @Override
    public String toString() {
        return field + " " + (negated ? "!" : "") + operator.getKqlName() + (caseSensitive ? "_cs" : "")
                + " \"" + value + "\"";
    }
}
