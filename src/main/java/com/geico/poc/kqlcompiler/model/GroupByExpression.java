package com.geico.poc.kqlcompiler.model;

import java.util.Objects;

/**
 * Date-bucketing group key, {@code alias = date_trunc(unit, field)}.
 */
public class GroupByExpression extends GroupByItem {

    public static final String DATE_TRUNC = "date_trunc";

    private final String unit;
    private final String field;
    private final String alias;

    public GroupByExpression(String unit, String field, String alias) {
        this.unit = Objects.requireNonNull(unit, "unit");
        this.field = Objects.requireNonNull(field, "field");
        this.alias = Objects.requireNonNull(alias, "alias");
    }

    public String getUnit() {
        return unit;
    }

    public String getField() {
        return field;
    }

    @Override
    public String getAlias() {
        return alias;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GroupByExpression)) return false;
        GroupByExpression other = (GroupByExpression) o;
        return unit.equals(other.unit) && field.equals(other.field) && alias.equals(other.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(unit, field, alias);
    }

    @Override
    public String toString() {
        return String.format("%s = %s('%s', %s)", alias, DATE_TRUNC, unit, field);
    }
}
