package com.geico.poc.kqlcompiler.model;

import java.util.Objects;

/**
 * Computed column added by {@code extend}: {@code alias = expression}.
 */
public class ExtendedColumn {

    private final String alias;
    private final ExpressionValue expression;

    public ExtendedColumn(String alias, ExpressionValue expression) {
        this.alias = Objects.requireNonNull(alias, "alias");
        this.expression = Objects.requireNonNull(expression, "expression");
    }

    public String getAlias() {
        return alias;
    }

    public ExpressionValue getExpression() {
        return expression;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ExtendedColumn)) return false;
        ExtendedColumn other = (ExtendedColumn) o;
        return alias.equals(other.alias) && expression.equals(other.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(alias, expression);
    }

    @Override
    public String toString() {
        return alias + " = " + expression;
    }
}
