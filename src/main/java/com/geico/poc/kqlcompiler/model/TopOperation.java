package com.geico.poc.kqlcompiler.model;

import java.util.Objects;

/**
 * KQL {@code top N by field}.
 *
 * {@code withOthers} asks for the rows outside the top N to be folded into one extra
 * row. Plain SQL cannot express that, so the flag is carried here and reported as a
 * warning by the transpiler.
 */
public class TopOperation extends Operation {

    private final long count;
    private final String field;
    private final SortClause.Direction direction;
    private final SortClause.NullsOrder nulls;
    private final boolean withOthers;

    public TopOperation(long count, String field, SortClause.Direction direction,
                        SortClause.NullsOrder nulls, boolean withOthers) {
        if (count < 0) {
            throw new IllegalArgumentException("Row cap must be non-negative, got: " + count);
        }
        this.count = count;
        this.field = Objects.requireNonNull(field, "field");
        this.direction = direction == null ? SortClause.Direction.DESC : direction;
        this.nulls = nulls;
        this.withOthers = withOthers;
    }

    public TopOperation(long count, String field, SortClause.Direction direction, boolean withOthers) {
        this(count, field, direction, null, withOthers);
    }

    public long getCount() {
        return count;
    }

    public String getField() {
        return field;
    }

    public SortClause.Direction getDirection() {
        return direction;
    }

    public SortClause.NullsOrder getNulls() {
        return nulls;
    }

    public boolean isWithOthers() {
        return withOthers;
    }

    @Override
    public String getName() {
        return "top";
    }

    @Override
    public <R, C> R accept(OperationVisitor<R, C> visitor, C context) {
        return visitor.visitTop(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof TopOperation)) return false;
        TopOperation other = (TopOperation) o;
        return count == other.count && field.equals(other.field) && direction == other.direction
                && nulls == other.nulls && withOthers == other.withOthers;
    }

    @Override
    public int hashCode() {
        return Objects.hash(count, field, direction, nulls, withOthers);
    }

    @Override
    public String toString() {
        return "top " + count + " by " + field + " " + direction.name().toLowerCase()
                + (withOthers ? " withothers" : "");
    }
}
