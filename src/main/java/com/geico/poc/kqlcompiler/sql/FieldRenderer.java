package com.geico.poc.kqlcompiler.sql;

import com.geico.poc.kqlcompiler.config.KqlCompilerConfig;
import com.geico.poc.kqlcompiler.model.Literal;
import org.apache.calcite.sql.SqlDialect;
import org.apache.calcite.sql.dialect.PostgresqlSqlDialect;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders field names and literals as SQL text for the events table.
 *
 * Bare names become double-quoted identifiers. A name containing a dot is a nested
 * field inside the side column and is read with the text accessor keyed by its last
 * segment, e.g. {@code parsed_fields.LogonType -> parsed_fields->>'LogonType'}.
 *
 * Stateless once constructed; one instance is shared by the normalizer and the transpiler.
 */
@Component
public class FieldRenderer {

    /**
     * Where a field is being written. Nested fields render differently per position.
     */
    public enum Usage {
        SELECT,
        PREDICATE,
        GROUP_BY,
        ORDER_BY,
        AGGREGATE_ARGUMENT
    }

    private static final SqlDialect DIALECT = PostgresqlSqlDialect.DEFAULT;

    private final String sideColumn;
    private final List<String> numericFieldHints;

    @Autowired
    public FieldRenderer(KqlCompilerConfig config) {
        this.sideColumn = config.getSideColumn();
        List<String> hints = new ArrayList<>();
        if (config.getNumericFieldHints() != null) {
            for (String hint : config.getNumericFieldHints()) {
                hints.add(hint.toLowerCase(Locale.ROOT));
            }
        }
        this.numericFieldHints = hints;
    }

    public FieldRenderer() {
        this(new KqlCompilerConfig());
    }

    public String getSideColumn() {
        return sideColumn;
    }

    public static boolean isNestedPath(String field) {
        return field.indexOf('.') >= 0;
    }

    public static String lastSegment(String field) {
        return field.substring(field.lastIndexOf('.') + 1);
    }

    public String quoteIdentifier(String name) {
        return DIALECT.quoteIdentifier(name);
    }

    /**
     * Text accessor into the side column for a dotted path.
     */
    public String accessor(String field) {
        return sideColumn + "->>" + quoteString(lastSegment(field));
    }

    public String render(String field, Usage usage) {
        if (!isNestedPath(field)) {
            return quoteIdentifier(field);
        }
        String accessor = accessor(field);
        switch (usage) {
            case SELECT:
                return accessor + " AS " + quoteIdentifier(field);
            case AGGREGATE_ARGUMENT:
                return looksNumeric(field) ? numericCast(accessor) : accessor;
            default:
                return accessor;
        }
    }

    /**
     * Name-based guess that a nested field holds numbers, so aggregates over it need a cast.
     */
    public boolean looksNumeric(String field) {
        String segment = lastSegment(field).toLowerCase(Locale.ROOT);
        for (String hint : numericFieldHints) {
            if (segment.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    public String numericCast(String sql) {
        return "(" + sql + ")::numeric";
    }

    public static String quoteString(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    public String renderLiteral(Literal literal) {
        switch (literal.getType()) {
            case STRING:
                return quoteString(literal.asString());
            case INTEGER:
            case BOOLEAN:
                return String.valueOf(literal.getValue());
            case REAL:
                return BigDecimal.valueOf((Double) literal.getValue()).toPlainString();
            case NULL:
            default:
                return "NULL";
        }
    }

    /**
     * Literal compared against a nested field. The accessor yields text, so every
     * non-null value is written as a string.
     */
    public String renderLiteralAsText(Literal literal) {
        if (literal.isNull() || literal.isString()) {
            return renderLiteral(literal);
        }
        if (literal.getType() == Literal.Type.REAL) {
            return quoteString(BigDecimal.valueOf((Double) literal.getValue()).toPlainString());
        }
        return quoteString(String.valueOf(literal.getValue()));
    }

    /**
     * Escape LIKE wildcards so a search term matches literally.
     */
    public static String escapeLikePattern(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            if (c == '\\' || c == '%' || c == '_') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
