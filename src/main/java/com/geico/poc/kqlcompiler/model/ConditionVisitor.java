package com.geico.poc.kqlcompiler.model;

public interface ConditionVisitor<R> {

    R visitEquality(EqualityCondition condition);

    R visitComparison(ComparisonCondition condition);

    R visitStringOperation(StringCondition condition);

    R visitLogical(LogicalCondition condition);

    R visitIn(InCondition condition);

    R visitRegex(RegexCondition condition);
}
