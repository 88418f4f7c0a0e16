package com.geico.poc.kqlcompiler.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * KQL {@code sort by} / {@code order by}.
 */
public class SortOperation extends Operation {

    private final List<SortClause> clauses;

    public SortOperation(List<SortClause> clauses) {
        this.clauses = Collections.unmodifiableList(new ArrayList<>(clauses));
    }

    public List<SortClause> getClauses() {
        return clauses;
    }

    @Override
    public String getName() {
        return "sort";
    }

    @Override
    public <R, C> R accept(OperationVisitor<R, C> visitor, C context) {
        return visitor.visitSort(this, context);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SortOperation && clauses.equals(((SortOperation) o).clauses);
    }

    @Override
    public int hashCode() {
        return clauses.hashCode();
    }

    @Override
    public String toString() {
        return "sort by " + clauses;
    }
}
