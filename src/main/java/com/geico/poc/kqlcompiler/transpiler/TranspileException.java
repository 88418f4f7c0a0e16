package com.geico.poc.kqlcompiler.transpiler;

/**
 * Exception thrown when a query cannot be rendered as SQL
 */
public class TranspileException extends RuntimeException {

    public TranspileException(String message) {
        super(message);
    }

    public TranspileException(String message, Throwable cause) {
        super(message, cause);
    }
}
