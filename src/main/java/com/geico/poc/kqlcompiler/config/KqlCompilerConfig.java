package com.geico.poc.kqlcompiler.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Configuration for the KQL compiler
 */
@Configuration
@ConfigurationProperties(prefix = "kql-compiler")
public class KqlCompilerConfig {

    /**
     * Semi-structured column on the events table holding vendor-specific fields.
     * Dotted field names are read from it with the ->> text accessor.
     */
    private String sideColumn = "parsed_fields";

    /**
     * Columns searched by a search operator that names no columns.
     */
    private List<String> defaultSearchColumns = new ArrayList<>(Arrays.asList(
            "message_short",
            "message_full",
            "user_id",
            "hostname",
            "process_name",
            "parsed_fields.CommandLine"));

    /**
     * Substrings that mark a nested field as numeric when it is aggregated.
     * Name-based only; there is no schema lookup behind it.
     */
    private List<String> numericFieldHints = new ArrayList<>(Arrays.asList("size", "count", "score"));

    /**
     * Log every generated statement at INFO instead of DEBUG.
     */
    private boolean logGeneratedSql = false;

    private ParserConfig parser = new ParserConfig();

    public String getSideColumn() {
        return sideColumn;
    }

    public void setSideColumn(String sideColumn) {
        if (sideColumn == null || sideColumn.trim().isEmpty()) {
            throw new IllegalArgumentException("sideColumn must not be blank");
        }
        this.sideColumn = sideColumn.trim();
    }

    public List<String> getDefaultSearchColumns() {
        return defaultSearchColumns;
    }

    public void setDefaultSearchColumns(List<String> defaultSearchColumns) {
        this.defaultSearchColumns = defaultSearchColumns;
    }

    public List<String> getNumericFieldHints() {
        return numericFieldHints;
    }

    public void setNumericFieldHints(List<String> numericFieldHints) {
        this.numericFieldHints = numericFieldHints;
    }

    public boolean isLogGeneratedSql() {
        return logGeneratedSql;
    }

    public void setLogGeneratedSql(boolean logGeneratedSql) {
        this.logGeneratedSql = logGeneratedSql;
    }

    public ParserConfig getParser() {
        return parser;
    }

    public void setParser(ParserConfig parser) {
        this.parser = parser;
    }

    /**
     * External KQL parser, run as a child process per query.
     */
    public static class ParserConfig {
        /**
         * Command line of the parser executable. It reads one query on stdin and prints
         * the tree (or an error payload) as JSON on stdout. Unset means /translate is disabled.
         */
        private List<String> command = new ArrayList<>();
        private long timeoutMs = 5000;

        public List<String> getCommand() {
            return command;
        }

        public void setCommand(List<String> command) {
            this.command = command;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }
}
