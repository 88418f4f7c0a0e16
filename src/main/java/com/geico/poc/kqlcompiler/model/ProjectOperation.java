package com.geico.poc.kqlcompiler.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * KQL {@code project}: the output becomes exactly these fields, in this order.
 * A field may be a column, a dotted nested-field path, or an alias defined earlier.
 */
public class ProjectOperation extends Operation {

    private final List<String> fields;

    public ProjectOperation(List<String> fields) {
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    }

    public List<String> getFields() {
        return fields;
    }

    @Override
    public String getName() {
        return "project";
    }

    @Override
    public <R, C> R accept(OperationVisitor<R, C> visitor, C context) {
        return visitor.visitProject(this, context);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ProjectOperation && fields.equals(((ProjectOperation) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "project " + String.join(", ", fields);
    }
}
