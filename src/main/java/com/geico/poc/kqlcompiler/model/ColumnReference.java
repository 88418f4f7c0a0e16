package com.geico.poc.kqlcompiler.model;

import java.util.Objects;

/**
 * Reference to a column, an alias, or a dotted nested-field path.
 */
public class ColumnReference extends ExpressionValue {

    private final String name;

    public ColumnReference(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String getName() {
        return name;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitColumn(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ColumnReference && name.equals(((ColumnReference) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
