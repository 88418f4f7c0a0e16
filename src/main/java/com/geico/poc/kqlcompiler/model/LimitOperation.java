package com.geico.poc.kqlcompiler.model;

/**
 * KQL {@code take} / {@code limit}: caps the number of rows, with no implied ordering.
 */
public class LimitOperation extends Operation {

    private final long count;

    public LimitOperation(long count) {
        if (count < 0) {
            throw new IllegalArgumentException("Row cap must be non-negative, got: " + count);
        }
        this.count = count;
    }

    public long getCount() {
        return count;
    }

    @Override
    public String getName() {
        return "take";
    }

    @Override
    public <R, C> R accept(OperationVisitor<R, C> visitor, C context) {
        return visitor.visitLimit(this, context);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LimitOperation && count == ((LimitOperation) o).count;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(count);
    }

    @Override
    public String toString() {
        return "take " + count;
    }
}
