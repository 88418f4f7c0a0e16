package com.geico.poc.kqlcompiler.model;

/**
 * One tabular operator of a KQL pipeline.
 *
 * The set of operators is closed: subclasses live in this package only, and every
 * consumer dispatches through {@link OperationVisitor}, so adding an operator fails
 * to compile until each visitor handles it.
 */
public abstract class Operation {

    Operation() {
    }

    /**
     * KQL name of the operator, used in diagnostics.
     */
    public abstract String getName();

    public abstract <R, C> R accept(OperationVisitor<R, C> visitor, C context);
}
