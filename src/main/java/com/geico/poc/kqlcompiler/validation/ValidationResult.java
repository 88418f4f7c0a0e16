package com.geico.poc.kqlcompiler.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Diagnostics collected while compiling one query.
 *
 * Errors are operators the normalizer had to drop; warnings are accepted features
 * that the generated SQL cannot fully honour. Neither stops compilation.
 */
public class ValidationResult {
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    public void addError(String error) {
        errors.add(error);
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    public void addWarnings(List<String> more) {
        warnings.addAll(more);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public String getErrorMessage() {
        if (!hasErrors()) {
            return null;
        }

        StringBuilder sb = new StringBuilder();
        sb.append("Skipped operators:\n");
        for (String error : errors) {
            sb.append("  ❌ ").append(error).append("\n");
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();

        if (hasErrors()) {
            sb.append("Errors: ").append(errors).append("\n");
        }

        if (hasWarnings()) {
            sb.append("Warnings: ").append(warnings);
        }

        if (!hasErrors() && !hasWarnings()) {
            sb.append("Clean");
        }

        return sb.toString();
    }
}
