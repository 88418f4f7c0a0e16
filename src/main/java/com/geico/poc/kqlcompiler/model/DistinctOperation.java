package com.geico.poc.kqlcompiler.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * KQL {@code distinct}. Without columns it applies to whatever is currently selected.
 */
public class DistinctOperation extends Operation {

    private final List<String> columns;

    public DistinctOperation(List<String> columns) {
        this.columns = columns == null ? null : Collections.unmodifiableList(new ArrayList<>(columns));
    }

    public List<String> getColumns() {
        return columns;
    }

    public boolean hasColumns() {
        return columns != null && !columns.isEmpty();
    }

    @Override
    public String getName() {
        return "distinct";
    }

    @Override
    public <R, C> R accept(OperationVisitor<R, C> visitor, C context) {
        return visitor.visitDistinct(this, context);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DistinctOperation && Objects.equals(columns, ((DistinctOperation) o).columns);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(columns);
    }

    @Override
    public String toString() {
        return columns == null ? "distinct" : "distinct " + String.join(", ", columns);
    }
}
