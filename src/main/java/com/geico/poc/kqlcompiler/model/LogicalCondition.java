package com.geico.poc.kqlcompiler.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Conjunction or disjunction of nested conditions.
 */
public class LogicalCondition extends Condition {

    public enum Operator {
        AND, OR
    }

    private final Operator operator;
    private final List<Condition> conditions;

    public LogicalCondition(Operator operator, List<Condition> conditions) {
        this.operator = Objects.requireNonNull(operator, "operator");
        if (conditions == null || conditions.isEmpty()) {
            throw new IllegalArgumentException("Logical " + operator + " needs at least one condition");
        }
        this.conditions = Collections.unmodifiableList(new ArrayList<>(conditions));
    }

    public Operator getOperator() {
        return operator;
    }

    public List<Condition> getConditions() {
        return conditions;
    }

    @Override
    public <R> R accept(ConditionVisitor<R> visitor) {
        return visitor.visitLogical(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof LogicalCondition)) return false;
        LogicalCondition other = (LogicalCondition) o;
        return operator == other.operator && conditions.equals(other.conditions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, conditions);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Condition condition : conditions) {
            if (sb.length() > 0) {
                sb.append(' ').append(operator.name().toLowerCase()).append(' ');
            }
            sb.append('(').append(condition).append(')');
        }
        return sb.toString();
    }
}
