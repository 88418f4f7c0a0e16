package com.geico.poc.kqlcompiler.transpiler;

import com.geico.poc.kqlcompiler.model.ColumnReference;
import com.geico.poc.kqlcompiler.model.ComparisonCondition;
import com.geico.poc.kqlcompiler.model.Condition;
import com.geico.poc.kqlcompiler.model.ConditionVisitor;
import com.geico.poc.kqlcompiler.model.EqualityCondition;
import com.geico.poc.kqlcompiler.model.ExpressionValue;
import com.geico.poc.kqlcompiler.model.ExpressionVisitor;
import com.geico.poc.kqlcompiler.model.InCondition;
import com.geico.poc.kqlcompiler.model.Literal;
import com.geico.poc.kqlcompiler.model.LogicalCondition;
import com.geico.poc.kqlcompiler.model.RegexCondition;
import com.geico.poc.kqlcompiler.model.SqlFragment;
import com.geico.poc.kqlcompiler.model.StringCondition;
import com.geico.poc.kqlcompiler.sql.FieldRenderer;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders conditions and value expressions against one compilation context.
 *
 * Aliases known to the context are replaced by the SQL that defines them, since a
 * predicate cannot refer to a select-list alias of the same statement.
 */
class ConditionRenderer implements ConditionVisitor<String>, ExpressionVisitor<String> {

    private final FieldRenderer fields;
    private final CompilationContext context;
    private final List<String> warnings;

    ConditionRenderer(FieldRenderer fields, CompilationContext context, List<String> warnings) {
        this.fields = fields;
        this.context = context;
        this.warnings = warnings;
    }

    String render(Condition condition) {
        return condition.accept(this);
    }

    String render(ExpressionValue value) {
        return value.accept(this);
    }

    String field(String name) {
        String alias = context.aliasSql(name);
        return alias != null ? alias : fields.render(name, FieldRenderer.Usage.PREDICATE);
    }

    /**
     * True when {@code name} reads from the side column, whose accessor yields text.
     */
    private boolean isNested(String name) {
        return !context.isAlias(name) && FieldRenderer.isNestedPath(name);
    }

    private String literalFor(String field, Literal literal) {
        return isNested(field) ? fields.renderLiteralAsText(literal) : fields.renderLiteral(literal);
    }

    // ========================================
    // Conditions
    // ========================================

    @Override
    public String visitEquality(EqualityCondition condition) {
        String field = field(condition.getField());
        if (condition.isNullTest()) {
            return field + " IS NULL";
        }
        ExpressionValue value = condition.getValue();
        if (value instanceof Literal) {
            return field + " = " + literalFor(condition.getField(), (Literal) value);
        }
        return field + " = " + render(value);
    }

    @Override
    public String visitComparison(ComparisonCondition condition) {
        String field = field(condition.getField());
        ExpressionValue value = condition.getValue();
        String symbol = condition.getOperator().getSymbol();

        if (value instanceof Literal) {
            Literal literal = (Literal) value;
            if (literal.isNull()) {
                if (condition.getOperator() == ComparisonCondition.Operator.NOT_EQUALS) {
                    return field + " IS NOT NULL";
                }
                throw new TranspileException("Cannot compare " + condition.getField() + " " + symbol + " null");
            }
            if (literal.isNumeric() && isNested(condition.getField())) {
                return fields.numericCast(field) + " " + symbol + " " + fields.renderLiteral(literal);
            }
            return field + " " + symbol + " " + fields.renderLiteral(literal);
        }
        return field + " " + symbol + " " + render(value);
    }

    @Override
    public String visitStringOperation(StringCondition condition) {
        String escaped = FieldRenderer.escapeLikePattern(condition.getValue());
        String pattern;
        switch (condition.getOperator()) {
            case CONTAINS:
                pattern = "%" + escaped + "%";
                break;
            case STARTS_WITH:
                pattern = escaped + "%";
                break;
            case ENDS_WITH:
                pattern = "%" + escaped;
                break;
            default:
                throw new TranspileException("Unsupported string operator: " + condition.getOperator());
        }
        String operator = condition.isCaseSensitive() ? "LIKE" : "ILIKE";
        if (condition.isNegated()) {
            operator = "NOT " + operator;
        }
        return field(condition.getField()) + " " + operator + " " + FieldRenderer.quoteString(pattern);
    }

    @Override
    public String visitLogical(LogicalCondition condition) {
        List<String> parts = new ArrayList<>();
        for (Condition operand : condition.getConditions()) {
            String sql = render(operand);
            parts.add(operand instanceof LogicalCondition ? "(" + sql + ")" : sql);
        }
        return String.join(" " + condition.getOperator().name() + " ", parts);
    }

    @Override
    public String visitIn(InCondition condition) {
        List<String> values = new ArrayList<>();
        boolean anyString = false;
        for (Literal literal : condition.getValues()) {
            values.add(literalFor(condition.getField(), literal));
            anyString |= literal.isString();
        }
        if (!condition.isCaseSensitive() && anyString) {
            warnings.add("Case-insensitive 'in' on " + condition.getField()
                    + " compares values exactly as written: " + condition.getValues());
        }
        return field(condition.getField()) + (condition.isNegated() ? " NOT IN (" : " IN (")
                + String.join(", ", values) + ")";
    }

    @Override
    public String visitRegex(RegexCondition condition) {
        return field(condition.getField()) + " ~ " + FieldRenderer.quoteString(condition.getPattern());
    }

    // ========================================
    // Values
    // ========================================

    @Override
    public String visitColumn(ColumnReference column) {
        return field(column.getName());
    }

    @Override
    public String visitLiteral(Literal literal) {
        return fields.renderLiteral(literal);
    }

    @Override
    public String visitFragment(SqlFragment fragment) {
        return fragment.getSql();
    }
}
