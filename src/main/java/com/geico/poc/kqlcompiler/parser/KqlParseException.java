package com.geico.poc.kqlcompiler.parser;

/**
 * The external parser rejected a query, or its output could not be read.
 *
 * Carries the parser's error tag and the human-readable detail meant for the user.
 */
public class KqlParseException extends Exception {

    private final String tag;
    private final String detail;

    public KqlParseException(String tag, String detail) {
        super(detail == null ? tag : tag + ": " + detail);
        this.tag = tag;
        this.detail = detail;
    }

    public KqlParseException(String tag, String detail, Throwable cause) {
        super(detail == null ? tag : tag + ": " + detail, cause);
        this.tag = tag;
        this.detail = detail;
    }

    public String getTag() {
        return tag;
    }

    public String getDetail() {
        return detail;
    }
}
