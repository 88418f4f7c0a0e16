package com.geico.poc.kqlcompiler.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * KQL {@code summarize}. Afterwards only the group keys and aggregate aliases are visible.
 */
public class SummarizeOperation extends Operation {

    private final List<Aggregation> aggregations;
    private final List<GroupByItem> groupBy;

    public SummarizeOperation(List<Aggregation> aggregations, List<GroupByItem> groupBy) {
        this.aggregations = Collections.unmodifiableList(new ArrayList<>(aggregations));
        this.groupBy = Collections.unmodifiableList(new ArrayList<>(groupBy));
    }

    public List<Aggregation> getAggregations() {
        return aggregations;
    }

    public List<GroupByItem> getGroupBy() {
        return groupBy;
    }

    @Override
    public String getName() {
        return "summarize";
    }

    @Override
    public <R, C> R accept(OperationVisitor<R, C> visitor, C context) {
        return visitor.visitSummarize(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof SummarizeOperation)) return false;
        SummarizeOperation other = (SummarizeOperation) o;
        return aggregations.equals(other.aggregations) && groupBy.equals(other.groupBy);
    }

    @Override
    public int hashCode() {
        return 31 * aggregations.hashCode() + groupBy.hashCode();
    }

    @Override
    public String toString() {
        return "summarize " + aggregations + " by " + groupBy;
    }
}
