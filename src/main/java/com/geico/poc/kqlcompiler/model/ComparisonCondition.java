package com.geico.poc.kqlcompiler.model;

import java.util.Objects;

/**
 * Ordering or inequality predicate, {@code field <op> value}.
 */
public class ComparisonCondition extends Condition {

    public enum Operator {
        GREATER_THAN(">"),
        LESS_THAN("<"),
        GREATER_EQUAL(">="),
        LESS_EQUAL("<="),
        NOT_EQUALS("!=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }

    private final String field;
    private final Operator operator;
    private final ExpressionValue value;

    public ComparisonCondition(String field, Operator operator, ExpressionValue value) {
        this.field = Objects.requireNonNull(field, "field");
        this.operator = Objects.requireNonNull(operator, "operator");
        this.value = Objects.requireNonNull(value, "value");
    }

    public String getField() {
        return field;
    }

    public Operator getOperator() {
        return operator;
    }

    public ExpressionValue getValue() {
        return value;
    }

    @Override
    public <R> R accept(ConditionVisitor<R> visitor) {
        return visitor.visitComparison(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ComparisonCondition)) return false;
        ComparisonCondition other = (ComparisonCondition) o;
        return field.equals(other.field) && operator == other.operator && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, operator, value);
    }

    @Override
    public String toString() {
        return field + " " + operator.getSymbol() + " " + value;
    }
}
