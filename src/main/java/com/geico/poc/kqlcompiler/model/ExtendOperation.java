package com.geico.poc.kqlcompiler.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * KQL {@code extend}: adds computed columns, keeping every column already visible.
 */
public class ExtendOperation extends Operation {

    private final List<ExtendedColumn> columns;

    public ExtendOperation(List<ExtendedColumn> columns) {
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
    }

    public List<ExtendedColumn> getColumns() {
        return columns;
    }

    @Override
    public String getName() {
        return "extend";
    }

    @Override
    public <R, C> R accept(OperationVisitor<R, C> visitor, C context) {
        return visitor.visitExtend(this, context);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ExtendOperation && columns.equals(((ExtendOperation) o).columns);
    }

    @Override
    public int hashCode() {
        return columns.hashCode();
    }

    @Override
    public String toString() {
        return "extend " + columns;
    }
}
