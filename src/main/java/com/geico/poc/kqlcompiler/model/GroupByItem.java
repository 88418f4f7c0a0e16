package com.geico.poc.kqlcompiler.model;

/**
 * One {@code by} item of a {@code summarize}. Either a {@link GroupByField} or a
 * {@link GroupByExpression}; no other subclasses exist.
 */
public abstract class GroupByItem {

    GroupByItem() {
    }

    /**
     * Name under which the group key is visible after the summarize.
     */
    public abstract String getAlias();
}
