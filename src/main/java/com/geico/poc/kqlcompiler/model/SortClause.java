package com.geico.poc.kqlcompiler.model;

import java.util.Objects;

/**
 * One key of a {@code sort by} clause. Direction and nulls ordering are optional;
 * null means the KQL query did not specify them.
 */
public class SortClause {

    public enum Direction {
        ASC, DESC
    }

    public enum NullsOrder {
        FIRST, LAST
    }

    private final String field;
    private final Direction direction;
    private final NullsOrder nulls;

    public SortClause(String field, Direction direction, NullsOrder nulls) {
        this.field = Objects.requireNonNull(field, "field");
        this.direction = direction;
        this.nulls = nulls;
    }

    public SortClause(String field, Direction direction) {
        this(field, direction, null);
    }

    public String getField() {
        return field;
    }

    public Direction getDirection() {
        return direction;
    }

    public NullsOrder getNulls() {
        return nulls;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SortClause)) return false;
        SortClause other = (SortClause) o;
        return field.equals(other.field) && direction == other.direction && nulls == other.nulls;
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, direction, nulls);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(field);
        if (direction != null) {
            sb.append(' ').append(direction.name().toLowerCase());
        }
        if (nulls != null) {
            sb.append(" nulls ").append(nulls.name().toLowerCase());
        }
        return sb.toString();
    }
}
