package com.geico.poc.kqlcompiler.transpiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Generated SQL plus the non-fatal warnings raised while producing it.
 */
public class TranspiledQuery {

    private final String sql;
    private final List<String> warnings;

    public TranspiledQuery(String sql, List<String> warnings) {
        this.sql = Objects.requireNonNull(sql, "sql");
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    public String getSql() {
        return sql;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    @Override
    public String toString() {
        return warnings.isEmpty() ? sql : sql + " " + warnings;
    }
}
