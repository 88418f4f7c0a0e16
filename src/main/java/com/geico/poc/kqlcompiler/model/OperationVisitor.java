package com.geico.poc.kqlcompiler.model;

/**
 * Visitor over the closed set of {@link Operation} variants.
 *
 * @param <R> result type
 * @param <C> type of the value threaded through the visit
 */
public interface OperationVisitor<R, C> {

    R visitFilter(FilterOperation operation, C context);

    R visitProject(ProjectOperation operation, C context);

    R visitLimit(LimitOperation operation, C context);

    R visitSummarize(SummarizeOperation operation, C context);

    R visitSort(SortOperation operation, C context);

    R visitSearch(SearchOperation operation, C context);

    R visitExtend(ExtendOperation operation, C context);

    R visitDistinct(DistinctOperation operation, C context);

    R visitTop(TopOperation operation, C context);
}
