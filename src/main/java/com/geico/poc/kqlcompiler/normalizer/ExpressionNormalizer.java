package com.geico.poc.kqlcompiler.normalizer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geico.poc.kqlcompiler.model.ColumnReference;
import com.geico.poc.kqlcompiler.model.ComparisonCondition;
import com.geico.poc.kqlcompiler.model.Condition;
import com.geico.poc.kqlcompiler.model.EqualityCondition;
import com.geico.poc.kqlcompiler.model.ExpressionValue;
import com.geico.poc.kqlcompiler.model.InCondition;
import com.geico.poc.kqlcompiler.model.Literal;
import com.geico.poc.kqlcompiler.model.LogicalCondition;
import com.geico.poc.kqlcompiler.model.RegexCondition;
import com.geico.poc.kqlcompiler.model.SqlFragment;
import com.geico.poc.kqlcompiler.model.StringCondition;
import com.geico.poc.kqlcompiler.sql.FieldRenderer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Converts expression nodes of the external tree: literals, column and path references,
 * function calls, arithmetic and predicates.
 *
 * Every shape mismatch raises {@link NormalizationException}; the caller decides how much
 * of the pipeline that costs.
 */
class ExpressionNormalizer {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Pattern FUNCTION_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern DATETIME_PART = Pattern.compile("[A-Za-z_]+");

    private static final Map<String, String> ARITHMETIC = new HashMap<>();

    private static final Map<String, StringOperator> STRING_OPERATORS = new HashMap<>();

    private static final class StringOperator {
        final StringCondition.Operator operator;
        final boolean caseSensitive;
        final boolean negated;

        StringOperator(StringCondition.Operator operator, boolean caseSensitive, boolean negated) {
            this.operator = operator;
            this.caseSensitive = caseSensitive;
            this.negated = negated;
        }
    }

    static {
        ARITHMETIC.put("Add", "+");
        ARITHMETIC.put("Sub", "-");
        ARITHMETIC.put("Mul", "*");
        ARITHMETIC.put("Div", "/");
        ARITHMETIC.put("Mod", "%");

        stringOperator("Contains", StringCondition.Operator.CONTAINS);
        stringOperator("StartsWith", StringCondition.Operator.STARTS_WITH);
        stringOperator("EndsWith", StringCondition.Operator.ENDS_WITH);
        // word-boundary matching is approximated as substring matching
        stringOperator("Has", StringCondition.Operator.CONTAINS);
        stringOperator("HasPrefix", StringCondition.Operator.STARTS_WITH);
        stringOperator("HasSuffix", StringCondition.Operator.ENDS_WITH);
    }

    private static void stringOperator(String name, StringCondition.Operator operator) {
        STRING_OPERATORS.put(name, new StringOperator(operator, false, false));
        STRING_OPERATORS.put(name + "Cs", new StringOperator(operator, true, false));
        STRING_OPERATORS.put("Not" + name, new StringOperator(operator, false, true));
        STRING_OPERATORS.put("Not" + name + "Cs", new StringOperator(operator, true, true));
    }

    private final FieldRenderer fieldRenderer;

    ExpressionNormalizer(FieldRenderer fieldRenderer) {
        this.fieldRenderer = fieldRenderer;
    }

    // ========================================
    // Node helpers
    // ========================================

    static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    /**
     * Identifier text from any of the shapes the parser uses for names:
     * {@code "x"}, {@code {"value": "x"}} or {@code {"name": {"value": "x"}}}.
     */
    static String identifier(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.has("value")) {
            return identifier(node.get("value"));
        }
        if (node.has("name")) {
            return identifier(node.get("name"));
        }
        return null;
    }

    /**
     * Name of a single-key tagged node, or of a bare string tag.
     */
    static String tag(JsonNode node) {
        if (isAbsent(node)) {
            return "null";
        }
        if (node.isTextual()) {
            return node.asText();
        }
        Iterator<String> names = node.fieldNames();
        return names.hasNext() ? names.next() : "empty";
    }

    static List<JsonNode> elements(JsonNode node, String what) {
        if (isAbsent(node)) {
            return Collections.emptyList();
        }
        if (!node.isArray()) {
            throw new NormalizationException(what + " must be a list, got: " + node.getNodeType());
        }
        List<JsonNode> result = new ArrayList<>();
        node.forEach(result::add);
        return result;
    }

    // ========================================
    // Literals
    // ========================================

    /**
     * Resolve the payload of a {@code Literal} node to a typed literal.
     */
    Literal literal(JsonNode payload) {
        if (isAbsent(payload) || !payload.isObject()) {
            throw new NormalizationException("Malformed literal: " + payload);
        }
        if (payload.has("String")) {
            return Literal.of(requireText(payload.get("String"), "String"));
        }
        if (payload.has("Long")) {
            JsonNode value = payload.get("Long");
            if (!value.canConvertToLong() || !value.isIntegralNumber()) {
                throw new NormalizationException("Long literal is not an integer: " + value);
            }
            return Literal.of(value.asLong());
        }
        if (payload.has("Number")) {
            JsonNode value = payload.get("Number");
            if (value.isIntegralNumber() && value.canConvertToLong()) {
                return Literal.of(value.asLong());
            }
            return real(value);
        }
        if (payload.has("Real")) {
            return real(payload.get("Real"));
        }
        if (payload.has("Bool")) {
            JsonNode value = payload.get("Bool");
            if (!value.isBoolean()) {
                throw new NormalizationException("Bool literal is not a boolean: " + value);
            }
            return Literal.of(value.asBoolean());
        }
        if (payload.has("Datetime")) {
            return Literal.of(requireText(payload.get("Datetime"), "Datetime"));
        }
        if (payload.has("Timespan")) {
            return Literal.of(requireText(payload.get("Timespan"), "Timespan"));
        }
        if (payload.has("Dynamic")) {
            JsonNode value = payload.get("Dynamic");
            if (isAbsent(value)) {
                return Literal.NULL;
            }
            try {
                return Literal.of(MAPPER.writeValueAsString(value));
            } catch (JsonProcessingException e) {
                throw new NormalizationException("Cannot serialize dynamic literal: " + e.getOriginalMessage());
            }
        }
        if (payload.has("Null")) {
            return Literal.NULL;
        }
        throw new NormalizationException("Unknown literal type: " + tag(payload));
    }

    private Literal real(JsonNode value) {
        if (!value.isNumber() || !Double.isFinite(value.asDouble())) {
            throw new NormalizationException("Real literal is not a finite number: " + value);
        }
        return Literal.of(value.asDouble());
    }

    private static String requireText(JsonNode value, String type) {
        if (isAbsent(value) || !value.isTextual()) {
            throw new NormalizationException(type + " literal is not text: " + value);
        }
        return value.asText();
    }

    /**
     * Non-negative integer literal, used for row caps.
     */
    long rowCount(JsonNode expression, String operator) {
        if (isAbsent(expression) || !expression.has("Literal")) {
            throw new NormalizationException(operator + " count must be an integer literal, got: " + tag(expression));
        }
        Literal literal = literal(expression.get("Literal"));
        if (literal.getType() != Literal.Type.INTEGER) {
            throw new NormalizationException(operator + " count must be an integer literal, got: " + literal);
        }
        long count = (Long) literal.getValue();
        if (count < 0) {
            throw new NormalizationException(operator + " count must be non-negative, got: " + count);
        }
        return count;
    }

    String stringLiteral(JsonNode expression, String what) {
        if (!isAbsent(expression) && expression.has("Literal")) {
            Literal literal = literal(expression.get("Literal"));
            if (literal.isString()) {
                return literal.asString();
            }
        }
        throw new NormalizationException(what + " must be a string literal, got: " + tag(expression));
    }

    // ========================================
    // Columns and paths
    // ========================================

    boolean isFieldReference(JsonNode expression) {
        return !isAbsent(expression) && (expression.has("Column") || expression.has("Path"));
    }

    /**
     * Dotted field name of a column or path expression.
     */
    String fieldPath(JsonNode expression) {
        if (!isAbsent(expression) && expression.has("Column")) {
            String name = identifier(expression.get("Column"));
            if (name == null || name.isEmpty()) {
                throw new NormalizationException("Column without a name: " + expression);
            }
            return name;
        }
        if (!isAbsent(expression) && expression.has("Path")) {
            JsonNode path = expression.get("Path");
            StringBuilder sb = new StringBuilder(fieldPath(path.path("expression")));
            for (JsonNode accessor : elements(path.path("accessors"), "Path accessors")) {
                sb.append('.').append(accessorSegment(accessor));
            }
            return sb.toString();
        }
        throw new NormalizationException("Expected a column or path, got: " + tag(expression));
    }

    private String accessorSegment(JsonNode accessor) {
        if (accessor.has("Member")) {
            String name = identifier(accessor.get("Member"));
            if (name == null) {
                throw new NormalizationException("Path member without a name: " + accessor);
            }
            return name;
        }
        if (accessor.has("Index")) {
            JsonNode index = accessor.get("Index");
            JsonNode indexExpr = index.has("index") ? index.get("index") : index;
            if (indexExpr.has("Literal")) {
                Literal literal = literal(indexExpr.get("Literal"));
                if (literal.isString() || literal.getType() == Literal.Type.INTEGER) {
                    return String.valueOf(literal.getValue());
                }
            }
            throw new NormalizationException("Path index must be a string or integer literal, got: " + tag(indexExpr));
        }
        throw new NormalizationException("Unknown path accessor: " + tag(accessor));
    }

    // ========================================
    // Value expressions
    // ========================================

    /**
     * Right-hand side of a comparison or the body of an extended column.
     */
    ExpressionValue expressionValue(JsonNode expression) {
        if (isFieldReference(expression)) {
            return new ColumnReference(fieldPath(expression));
        }
        if (!isAbsent(expression) && expression.has("Literal")) {
            return literal(expression.get("Literal"));
        }
        if (!isAbsent(expression) && (expression.has("FunctionCall") || expression.has("BinaryExpression"))) {
            return new SqlFragment(sql(expression));
        }
        throw new NormalizationException("Unsupported expression: " + tag(expression));
    }

    /**
     * SQL text of an expression used inside a function call or arithmetic.
     */
    String sql(JsonNode expression) {
        if (isFieldReference(expression)) {
            return fieldRenderer.render(fieldPath(expression), FieldRenderer.Usage.PREDICATE);
        }
        if (isAbsent(expression)) {
            throw new NormalizationException("Missing expression");
        }
        if (expression.has("Literal")) {
            return fieldRenderer.renderLiteral(literal(expression.get("Literal")));
        }
        if (expression.has("FunctionCall")) {
            return functionCall(expression.get("FunctionCall"));
        }
        if (expression.has("BinaryExpression")) {
            JsonNode binary = expression.get("BinaryExpression");
            String op = tag(binary.path("op"));
            String symbol = ARITHMETIC.get(op);
            if (symbol == null) {
                throw new NormalizationException("Operator " + op + " is not valid inside a value expression");
            }
            return "(" + sql(binary.path("left")) + " " + symbol + " " + sql(binary.path("right")) + ")";
        }
        throw new NormalizationException("Unsupported expression: " + tag(expression));
    }

    static String functionName(JsonNode call) {
        String name = identifier(call.path("name"));
        if (name == null || !FUNCTION_NAME.matcher(name).matches()) {
            throw new NormalizationException("Invalid function name: " + call.path("name"));
        }
        return name;
    }

    private String functionCall(JsonNode call) {
        String name = functionName(call);
        String kqlName = name.toLowerCase(Locale.ROOT);
        String sqlName = FunctionMapping.toSql(name);
        List<JsonNode> args = elements(call.path("args"), name + " arguments");

        switch (kqlName) {
            case "gethour":
                requireArity(name, args, 1);
                return "EXTRACT(HOUR FROM " + sql(args.get(0)) + ")";
            case "datetime_part": {
                requireArity(name, args, 2);
                String part = stringLiteral(args.get(0), "datetime_part part");
                if (!DATETIME_PART.matcher(part).matches()) {
                    throw new NormalizationException("Invalid datetime_part part: " + part);
                }
                return "EXTRACT(" + part.toUpperCase(Locale.ROOT) + " FROM " + sql(args.get(1)) + ")";
            }
            case "ago":
                requireArity(name, args, 1);
                return "NOW() - INTERVAL " + FieldRenderer.quoteString(Timespans.toInterval(timespan(args.get(0))));
            case "now":
                requireArity(name, args, 0);
                return "NOW()";
            case "dcount":
                requireArity(name, args, 1);
                return "COUNT(DISTINCT " + sql(args.get(0)) + ")";
            case "count":
                return args.isEmpty() ? "COUNT(*)" : sqlName + "(" + joinSql(args) + ")";
            case "bin":
                requireArity(name, args, 2);
                return "DATE_TRUNC(" + FieldRenderer.quoteString(Timespans.toTruncUnit(timespan(args.get(1))))
                        + ", " + sql(args.get(0)) + ")";
            default:
                return sqlName + "(" + joinSql(args) + ")";
        }
    }

    /**
     * Text of a timespan argument. Accepts a Timespan literal or a string shaped like one.
     */
    String timespan(JsonNode expression) {
        if (!isAbsent(expression) && expression.has("Literal")) {
            JsonNode payload = expression.get("Literal");
            if (payload.has("Timespan") && payload.get("Timespan").isTextual()) {
                return payload.get("Timespan").asText();
            }
            if (payload.has("String") && Timespans.isTimespan(payload.get("String").asText())) {
                return payload.get("String").asText();
            }
        }
        throw new NormalizationException("Expected a timespan literal, got: " + expression);
    }

    private String joinSql(List<JsonNode> args) {
        List<String> parts = new ArrayList<>(args.size());
        for (JsonNode arg : args) {
            parts.add(sql(arg));
        }
        return String.join(", ", parts);
    }

    private static void requireArity(String name, List<JsonNode> args, int expected) {
        if (args.size() != expected) {
            throw new NormalizationException(name + "() expects " + expected + " argument(s), got " + args.size());
        }
    }

    // ========================================
    // Predicates
    // ========================================

    Condition condition(JsonNode expression) {
        if (isAbsent(expression) || !expression.has("BinaryExpression")) {
            throw new NormalizationException("Expression is not a predicate: " + tag(expression));
        }
        JsonNode binary = expression.get("BinaryExpression");
        String op = tag(binary.path("op"));
        JsonNode left = binary.path("left");
        JsonNode right = binary.path("right");

        if ("And".equals(op) || "Or".equals(op)) {
            List<Condition> operands = new ArrayList<>(2);
            operands.add(condition(left));
            operands.add(condition(right));
            return new LogicalCondition("And".equals(op) ? LogicalCondition.Operator.AND : LogicalCondition.Operator.OR,
                    operands);
        }

        String field = fieldPath(left);

        switch (op) {
            case "In":
            case "InCs":
            case "NotIn":
            case "NotInCs":
                return new InCondition(field, arrayLiteral(right, op), op.endsWith("Cs"), op.startsWith("Not"));
            case "MatchesRegex":
                return new RegexCondition(field, stringLiteral(right, "Regex pattern"));
            case "Equal":
                return new EqualityCondition(field, expressionValue(right));
            case "NotEqual":
                return comparison(field, ComparisonCondition.Operator.NOT_EQUALS, right);
            case "GreaterThan":
                return comparison(field, ComparisonCondition.Operator.GREATER_THAN, right);
            case "LessThan":
                return comparison(field, ComparisonCondition.Operator.LESS_THAN, right);
            case "GreaterThanOrEqual":
                return comparison(field, ComparisonCondition.Operator.GREATER_EQUAL, right);
            case "LessThanOrEqual":
                return comparison(field, ComparisonCondition.Operator.LESS_EQUAL, right);
            default:
                StringOperator stringOp = STRING_OPERATORS.get(op);
                if (stringOp == null) {
                    throw new NormalizationException("Unsupported binary operator: " + op);
                }
                return new StringCondition(field, stringOp.operator, stringLiteral(right, op + " value"),
                        stringOp.caseSensitive, stringOp.negated);
        }
    }

    private Condition comparison(String field, ComparisonCondition.Operator operator, JsonNode right) {
        ExpressionValue value = expressionValue(right);
        if (value instanceof Literal) {
            Literal literal = (Literal) value;
            boolean nullTest = literal.isNull() && operator == ComparisonCondition.Operator.NOT_EQUALS;
            if (!nullTest && !literal.isString() && !literal.isNumeric()) {
                throw new NormalizationException("Invalid value for " + operator.getSymbol() + ": " + literal);
            }
        }
        return new ComparisonCondition(field, operator, value);
    }

    private List<Literal> arrayLiteral(JsonNode right, String op) {
        if (isAbsent(right) || !right.has("ArrayLiteral")) {
            throw new NormalizationException(op + " expects a literal list on the right, got: " + tag(right));
        }
        JsonNode array = right.get("ArrayLiteral");
        JsonNode items;
        if (array.isArray()) {
            items = array;
        } else if (array.has("Array")) {
            items = array.get("Array");
        } else {
            items = array.path("expressions");
        }

        List<Literal> values = new ArrayList<>();
        for (JsonNode item : elements(items, op + " values")) {
            if (item.has("Literal")) {
                values.add(literal(item.get("Literal")));
            } else if (item.isObject() && !item.has("Column") && !item.has("Path")
                    && !item.has("FunctionCall") && !item.has("BinaryExpression")) {
                values.add(literal(item));
            } else {
                throw new NormalizationException(op + " list may only contain literals, got: " + tag(item));
            }
        }
        if (values.isEmpty()) {
            throw new NormalizationException(op + " list is empty");
        }
        return values;
    }
}
