package com.geico.poc.kqlcompiler.model;

public interface ExpressionVisitor<R> {

    R visitColumn(ColumnReference column);

    R visitLiteral(Literal literal);

    R visitFragment(SqlFragment fragment);
}
