package com.geico.poc.kqlcompiler.dto;

import java.util.ArrayList;
import java.util.List;

public class CompileResponse {
    private String sql;
    private List<String> warnings = new ArrayList<>();
    private List<String> skippedOperators = new ArrayList<>();
    private String error;
    private String errorDetail;

    public CompileResponse() {
    }

    public CompileResponse(String sql, List<String> warnings, List<String> skippedOperators) {
        this.sql = sql;
        this.warnings = new ArrayList<>(warnings);
        this.skippedOperators = new ArrayList<>(skippedOperators);
    }

    public static CompileResponse error(String message) {
        return error(message, null);
    }

    /**
     * @param message short error tag
     * @param detail  text meant for the person who wrote the query
     */
    public static CompileResponse error(String message, String detail) {
        CompileResponse response = new CompileResponse();
        response.error = message;
        response.errorDetail = detail;
        return response;
    }

    public boolean isSuccess() {
        return error == null;
    }

    // Getters and setters
    public String getSql() {
        return sql;
    }

    public void setSql(String sql) {
        this.sql = sql;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public void setWarnings(List<String> warnings) {
        this.warnings = warnings;
    }

    public List<String> getSkippedOperators() {
        return skippedOperators;
    }

    public void setSkippedOperators(List<String> skippedOperators) {
        this.skippedOperators = skippedOperators;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public String getErrorDetail() {
        return errorDetail;
    }

    public void setErrorDetail(String errorDetail) {
        this.errorDetail = errorDetail;
    }
}
