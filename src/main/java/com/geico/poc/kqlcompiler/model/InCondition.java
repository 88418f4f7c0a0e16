package com.geico.poc.kqlcompiler.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Set membership, {@code field in (v1, v2, ...)}. Values are kept exactly as the
 * query supplied them; no case folding happens anywhere in the compiler.
 */
public class InCondition extends Condition {

    private final String field;
    private final List<Literal> values;
    private final boolean caseSensitive;
    private final boolean negated;

    public InCondition(String field, List<Literal> values, boolean caseSensitive, boolean negated) {
        this.field = Objects.requireNonNull(field, "field");
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
        this.caseSensitive = caseSensitive;
        this.negated = negated;
    }

    public InCondition(String field, List<Literal> values, boolean caseSensitive) {
        this(field, values, caseSensitive, false);
    }

    public String getField() {
        return field;
    }

    public List<Literal> getValues() {
        return values;
    }

    public boolean isCaseSensitive() {
        return caseSensitive;
    }

    public boolean isNegated() {
        return negated;
    }

    @Override
    public <R> R accept(ConditionVisitor<R> visitor) {
        return visitor.visitIn(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof InCondition)) return false;
        InCondition other = (InCondition) o;
        return field.equals(other.field) && values.equals(other.values)
                && caseSensitive == other.caseSensitive && negated == other.negated;
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, values, caseSensitive, negated);
    }

    @Override
    public String toString() {
        return field + (negated ? " !in" : " in") + (caseSensitive ? "" : "~") + " " + values;
    }
}
