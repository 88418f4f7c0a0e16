package com.geico.poc.kqlcompiler.transpiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Clause fragments of the single SELECT being generated.
 *
 * Mutable; one instance lives for exactly one compilation.
 */
class SelectStatement {

    static final String WILDCARD = "*";

    private final String source;
    private boolean distinct;
    private List<String> selectList = new ArrayList<>(Collections.singletonList(WILDCARD));
    private final List<String> where = new ArrayList<>();
    private List<String> groupBy = new ArrayList<>();
    private final List<String> having = new ArrayList<>();
    private List<String> orderBy = new ArrayList<>();
    private Long limit;

    SelectStatement(String source) {
        this.source = source;
    }

    void setDistinct() {
        this.distinct = true;
    }

    void appendSelect(String item) {
        selectList.add(item);
    }

    void replaceSelect(List<String> items) {
        this.selectList = new ArrayList<>(items);
    }

    void addWhere(String predicate) {
        where.add(predicate);
    }

    void replaceGroupBy(List<String> items) {
        this.groupBy = new ArrayList<>(items);
    }

    void addHaving(String predicate) {
        having.add(predicate);
    }

    void replaceOrderBy(List<String> items) {
        this.orderBy = new ArrayList<>(items);
    }

    /**
     * Caps only ever tighten: a later, larger cap cannot bring back rows.
     */
    void capRows(long count) {
        limit = limit == null ? count : Math.min(limit, count);
    }

    String toSql() {
        StringBuilder sql = new StringBuilder("SELECT ");
        if (distinct) {
            sql.append("DISTINCT ");
        }
        sql.append(String.join(", ", selectList));
        sql.append(" FROM ").append(source);
        if (!where.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", where));
        }
        if (!groupBy.isEmpty()) {
            sql.append(" GROUP BY ").append(String.join(", ", groupBy));
        }
        if (!having.isEmpty()) {
            sql.append(" HAVING ").append(String.join(" AND ", having));
        }
        if (!orderBy.isEmpty()) {
            sql.append(" ORDER BY ").append(String.join(", ", orderBy));
        }
        if (limit != null) {
            sql.append(" LIMIT ").append(limit);
        }
        return sql.append(';').toString();
    }
}
