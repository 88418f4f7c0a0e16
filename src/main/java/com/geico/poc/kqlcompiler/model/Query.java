package com.geico.poc.kqlcompiler.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Canonical KQL query: one source table and the tabular operators applied to it, in order.
 *
 * Instances are immutable. A Query is built once per incoming query string and
 * discarded after SQL has been produced for it.
 */
public class Query {

    private final String source;
    private final List<Operation> operations;

    public Query(String source, List<Operation> operations) {
        this.source = Objects.requireNonNull(source, "source");
        this.operations = Collections.unmodifiableList(new ArrayList<>(operations));
    }

    public String getSource() {
        return source;
    }

    public List<Operation> getOperations() {
        return operations;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Query)) return false;
        Query other = (Query) o;
        return source.equals(other.source) && operations.equals(other.operations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, operations);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(source);
        for (Operation operation : operations) {
            sb.append(" | ").append(operation);
        }
        return sb.toString();
    }
}
