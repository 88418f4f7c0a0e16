package com.geico.poc.kqlcompiler.model;

import java.util.Objects;

/**
 * KQL {@code where}: keeps the rows matching one condition tree.
 */
public class FilterOperation extends Operation {

    private final Condition condition;

    public FilterOperation(Condition condition) {
        this.condition = Objects.requireNonNull(condition, "condition");
    }

    public Condition getCondition() {
        return condition;
    }

    @Override
    public String getName() {
        return "where";
    }

    @Override
    public <R, C> R accept(OperationVisitor<R, C> visitor, C context) {
        return visitor.visitFilter(this, context);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FilterOperation && condition.equals(((FilterOperation) o).condition);
    }

    @Override
    public int hashCode() {
        return condition.hashCode();
    }

    @Override
    public String toString() {
        return "where " + condition;
    }
}
