package com.geico.poc.kqlcompiler.model;

import java.util.Objects;

/**
 * SQL text rendered while normalizing a function call or arithmetic expression,
 * e.g. {@code CONCAT("username", '@', "domain")}. The transpiler emits it verbatim.
 */
public class SqlFragment extends ExpressionValue {

    private final String sql;

    public SqlFragment(String sql) {
        this.sql = Objects.requireNonNull(sql, "sql");
    }

    public String getSql() {
        return sql;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitFragment(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SqlFragment && sql.equals(((SqlFragment) o).sql);
    }

    @Override
    public int hashCode() {
        return sql.hashCode();
    }

    @Override
    public String toString() {
        return sql;
    }
}
