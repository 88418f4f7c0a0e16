package com.geico.poc.kqlcompiler.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * KQL {@code search}: free-text match of a term over a column list.
 * A null column list means the configured default searchable columns.
 */
public class SearchOperation extends Operation {

    private final String term;
    private final List<String> columns;

    public SearchOperation(String term, List<String> columns) {
        this.term = Objects.requireNonNull(term, "term");
        this.columns = columns == null ? null : Collections.unmodifiableList(new ArrayList<>(columns));
    }

    public String getTerm() {
        return term;
    }

    public List<String> getColumns() {
        return columns;
    }

    public boolean hasColumns() {
        return columns != null && !columns.isEmpty();
    }

    @Override
    public String getName() {
        return "search";
    }

    @Override
    public <R, C> R accept(OperationVisitor<R, C> visitor, C context) {
        return visitor.visitSearch(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof SearchOperation)) return false;
        SearchOperation other = (SearchOperation) o;
        return term.equals(other.term) && Objects.equals(columns, other.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(term, columns);
    }

    @Override
    public String toString() {
        return columns == null ? "search \"" + term + "\"" : "search in " + columns + " \"" + term + "\"";
    }
}
