package com.geico.poc.kqlcompiler.model;

import java.util.Objects;

/**
 * Group key that is a plain column, dotted path or earlier alias, optionally renamed
 * ({@code by alias = field}).
 */
public class GroupByField extends GroupByItem {

    private final String field;
    private final String alias;

    public GroupByField(String field, String alias) {
        this.field = Objects.requireNonNull(field, "field");
        this.alias = alias == null ? field : alias;
    }

    public GroupByField(String field) {
        this(field, null);
    }

    public String getField() {
        return field;
    }

    @Override
    public String getAlias() {
        return alias;
    }

    public boolean isRenamed() {
        return !alias.equals(field);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof GroupByField)) return false;
        GroupByField other = (GroupByField) o;
        return field.equals(other.field) && alias.equals(other.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, alias);
    }

    @Override
    public String toString() {
        return isRenamed() ? alias + " = " + field : field;
    }
}
