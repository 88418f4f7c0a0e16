package com.geico.poc.kqlcompiler.model;

import java.util.Locale;

/**
 * Aggregate functions accepted by {@code summarize}.
 */
public enum AggregationFunction {
    COUNT("count"),
    DCOUNT("dcount"),
    SUM("sum"),
    AVG("avg"),
    MIN("min"),
    MAX("max");

    private final String kqlName;

    AggregationFunction(String kqlName) {
        this.kqlName = kqlName;
    }

    public String getKqlName() {
        return kqlName;
    }

    /**
     * Look up a function by its KQL name, ignoring case. Returns null when the name is not an aggregate.
     */
    public static AggregationFunction fromKqlName(String name) {
        if (name == null) {
            return null;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        for (AggregationFunction function : values()) {
            if (function.kqlName.equals(lower)) {
                return function;
            }
        }
        return null;
    }
}
