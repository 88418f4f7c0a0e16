package com.geico.poc.kqlcompiler.model;

import java.util.Objects;

/**
 * One aggregate of a {@code summarize}: {@code alias = function(field)}.
 * The field is null only for {@code count()}.
 */
public class Aggregation {

    private final String alias;
    private final AggregationFunction function;
    private final String field;

    public Aggregation(String alias, AggregationFunction function, String field) {
        this.alias = Objects.requireNonNull(alias, "alias");
        this.function = Objects.requireNonNull(function, "function");
        this.field = field;
    }

    public String getAlias() {
        return alias;
    }

    public AggregationFunction getFunction() {
        return function;
    }

    public String getField() {
        return field;
    }

    public boolean hasField() {
        return field != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Aggregation)) return false;
        Aggregation other = (Aggregation) o;
        return alias.equals(other.alias) && function == other.function && Objects.equals(field, other.field);
    }

    @Override
    public int hashCode() {
        return Objects.hash(alias, function, field);
    }

    @Override
    public String toString() {
        return String.format("%s = %s(%s)", alias, function.getKqlName(), field == null ? "" : field);
    }
}
