package com.geico.poc.kqlcompiler.normalizer;

import com.fasterxml.jackson.databind.JsonNode;
import com.geico.poc.kqlcompiler.model.Aggregation;
import com.geico.poc.kqlcompiler.model.AggregationFunction;
import com.geico.poc.kqlcompiler.model.ColumnReference;
import com.geico.poc.kqlcompiler.model.DistinctOperation;
import com.geico.poc.kqlcompiler.model.ExtendOperation;
import com.geico.poc.kqlcompiler.model.ExtendedColumn;
import com.geico.poc.kqlcompiler.model.FilterOperation;
import com.geico.poc.kqlcompiler.model.GroupByExpression;
import com.geico.poc.kqlcompiler.model.GroupByField;
import com.geico.poc.kqlcompiler.model.GroupByItem;
import com.geico.poc.kqlcompiler.model.LimitOperation;
import com.geico.poc.kqlcompiler.model.Literal;
import com.geico.poc.kqlcompiler.model.Operation;
import com.geico.poc.kqlcompiler.model.ProjectOperation;
import com.geico.poc.kqlcompiler.model.Query;
import com.geico.poc.kqlcompiler.model.SearchOperation;
import com.geico.poc.kqlcompiler.model.SortClause;
import com.geico.poc.kqlcompiler.model.SortOperation;
import com.geico.poc.kqlcompiler.model.SummarizeOperation;
import com.geico.poc.kqlcompiler.model.TopOperation;
import com.geico.poc.kqlcompiler.sql.FieldRenderer;
import com.geico.poc.kqlcompiler.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static com.geico.poc.kqlcompiler.normalizer.ExpressionNormalizer.elements;
import static com.geico.poc.kqlcompiler.normalizer.ExpressionNormalizer.identifier;
import static com.geico.poc.kqlcompiler.normalizer.ExpressionNormalizer.isAbsent;
import static com.geico.poc.kqlcompiler.normalizer.ExpressionNormalizer.tag;

/**
 * Turns the JSON tree produced by the external KQL parser into a {@link Query}.
 *
 * The whole compilation fails (empty result) only when the root is unrecognizable:
 * no statement list, a first statement that is not a tabular pipeline, or a pipeline
 * without a source name or operator list. A malformed operator is logged, reported
 * and dropped; the remaining operators still apply.
 *
 * Stateless and safe to share between threads.
 */
@Component
public class AstNormalizer {

    private static final Logger log = LoggerFactory.getLogger(AstNormalizer.class);

    private static final int LOG_SNIPPET = 500;

    private final ExpressionNormalizer expressions;

    @Autowired
    public AstNormalizer(FieldRenderer fieldRenderer) {
        this.expressions = new ExpressionNormalizer(fieldRenderer);
    }

    public AstNormalizer() {
        this(new FieldRenderer());
    }

    public Optional<Query> normalize(JsonNode root) {
        return normalize(root, new ValidationResult());
    }

    /**
     * Normalize {@code root}, recording every skipped operator as an error in {@code report}.
     */
    public Optional<Query> normalize(JsonNode root, ValidationResult report) {
        JsonNode statements = isAbsent(root) ? null : root.get("statements");
        if (statements == null || !statements.isArray() || statements.size() == 0) {
            log.error("❌ Invalid parse tree (no statements): {}", snippet(root));
            return Optional.empty();
        }

        JsonNode first = statements.get(0);
        JsonNode pipeline = first == null ? null : first.get("TabularExpression");
        if (isAbsent(pipeline)) {
            log.error("❌ Expected TabularExpression in first statement, got: {}", snippet(first));
            return Optional.empty();
        }

        String source = identifier(pipeline.path("source").path("name"));
        JsonNode operators = pipeline.get("operations");
        if (source == null || source.isEmpty() || operators == null || !operators.isArray()) {
            log.error("❌ Invalid TabularExpression (missing source or operations): {}", snippet(pipeline));
            return Optional.empty();
        }

        List<Operation> operations = new ArrayList<>();
        int position = 0;
        for (JsonNode operator : operators) {
            position++;
            String name = tag(operator);
            try {
                operations.addAll(operator(name, operator.get(name)));
            } catch (NormalizationException | IllegalArgumentException e) {
                log.warn("⚠️  Skipping operator #{} ({}): {} - {}", position, name, e.getMessage(), snippet(operator));
                report.addError(name + " (#" + position + "): " + e.getMessage());
            }
        }

        log.debug("Normalized query on {} with {} operation(s)", source, operations.size());
        return Optional.of(new Query(source, operations));
    }

    private List<Operation> operator(String name, JsonNode payload) {
        if (isAbsent(payload)) {
            throw new NormalizationException("Operator has no payload");
        }
        switch (name) {
            case "Where":
                return single(where(payload));
            case "Project":
                return project(payload);
            case "Limit":
            case "Take":
                return single(new LimitOperation(expressions.rowCount(payload.path("count"), name)));
            case "Summarize":
                return single(summarize(payload));
            case "SortBy":
            case "Sort":
                return single(sort(payload));
            case "Search":
                return single(search(payload));
            case "Extend":
                return single(extend(payload));
            case "Distinct":
                return single(distinct(payload));
            case "Top":
                return single(top(payload));
            default:
                throw new NormalizationException("Unsupported tabular operator");
        }
    }

    private static List<Operation> single(Operation operation) {
        return Collections.singletonList(operation);
    }

    private Operation where(JsonNode payload) {
        JsonNode predicate = payload.has("predicate") ? payload.get("predicate") : payload;
        return new FilterOperation(expressions.condition(predicate));
    }

    /**
     * Plain columns are projected by name. A renamed or computed column is first introduced
     * with an extend and then projected under its alias.
     */
    private List<Operation> project(JsonNode payload) {
        List<String> fields = new ArrayList<>();
        List<ExtendedColumn> computed = new ArrayList<>();
        for (JsonNode column : elements(payload.path("columns"), "Project columns")) {
            JsonNode expression = column.path("expression");
            String alias = alias(column);
            if (expressions.isFieldReference(expression)) {
                String path = expressions.fieldPath(expression);
                if (alias == null || alias.equals(path)) {
                    fields.add(path);
                } else {
                    computed.add(new ExtendedColumn(alias, new ColumnReference(path)));
                    fields.add(alias);
                }
            } else {
                if (alias == null) {
                    throw new NormalizationException("Computed project column needs a name: " + tag(expression));
                }
                computed.add(new ExtendedColumn(alias, expressions.expressionValue(expression)));
                fields.add(alias);
            }
        }
        if (fields.isEmpty()) {
            throw new NormalizationException("Project has no columns");
        }

        List<Operation> result = new ArrayList<>(2);
        if (!computed.isEmpty()) {
            result.add(new ExtendOperation(computed));
        }
        result.add(new ProjectOperation(fields));
        return result;
    }

    private SummarizeOperation summarize(JsonNode payload) {
        List<Aggregation> aggregations = new ArrayList<>();
        for (JsonNode named : elements(payload.path("aggregations"), "Summarize aggregations")) {
            aggregations.add(aggregation(named));
        }

        List<GroupByItem> groupBy = new ArrayList<>();
        for (JsonNode named : elements(payload.path("by_clauses"), "Summarize by clauses")) {
            groupBy.add(groupByItem(named));
        }

        if (aggregations.isEmpty() && groupBy.isEmpty()) {
            throw new NormalizationException("Summarize has neither aggregations nor group keys");
        }
        return new SummarizeOperation(aggregations, groupBy);
    }

    private Aggregation aggregation(JsonNode named) {
        JsonNode expression = named.path("expression");
        if (!expression.has("FunctionCall")) {
            throw new NormalizationException("Expected a function call in summarize, got: " + tag(expression));
        }
        JsonNode call = expression.get("FunctionCall");
        String name = ExpressionNormalizer.functionName(call);
        AggregationFunction function = AggregationFunction.fromKqlName(name);
        if (function == null) {
            throw new NormalizationException("Unsupported aggregation function: " + name);
        }

        List<JsonNode> args = elements(call.path("args"), name + " arguments");
        String field = args.isEmpty() ? null : expressions.fieldPath(args.get(0));
        if (field == null && function != AggregationFunction.COUNT) {
            throw new NormalizationException(name + "() requires a field argument");
        }

        String alias = alias(named);
        if (alias == null) {
            alias = field == null
                    ? function.getKqlName() + "_"
                    : function.getKqlName() + "_" + field.replace('.', '_');
        }
        return new Aggregation(alias, function, field);
    }

    private GroupByItem groupByItem(JsonNode named) {
        JsonNode expression = named.path("expression");
        String alias = alias(named);

        if (expressions.isFieldReference(expression)) {
            return new GroupByField(expressions.fieldPath(expression), alias);
        }

        if (expression.has("FunctionCall")) {
            JsonNode call = expression.get("FunctionCall");
            String name = ExpressionNormalizer.functionName(call).toLowerCase(Locale.ROOT);
            List<JsonNode> args = elements(call.path("args"), name + " arguments");

            if (GroupByExpression.DATE_TRUNC.equals(name) && args.size() == 2) {
                String unit = expressions.stringLiteral(args.get(0), "date_trunc unit");
                String field = expressions.fieldPath(args.get(1));
                if (alias == null) {
                    throw new NormalizationException("date_trunc group key needs a name");
                }
                return new GroupByExpression(unit, field, alias);
            }
            if ("bin".equals(name) && args.size() == 2) {
                String field = expressions.fieldPath(args.get(0));
                String unit = Timespans.toTruncUnit(expressions.timespan(args.get(1)));
                return new GroupByExpression(unit, field, alias == null ? field : alias);
            }
        }
        throw new NormalizationException("Unsupported group-by expression: " + snippet(expression));
    }

    private SortOperation sort(JsonNode payload) {
        List<SortClause> clauses = new ArrayList<>();
        for (JsonNode clause : elements(payload.path("clauses"), "Sort clauses")) {
            clauses.add(new SortClause(
                    expressions.fieldPath(clause.path("expression")),
                    direction(clause.path("sort_order")),
                    nullsOrder(clause.path("nulls_order"))));
        }
        if (clauses.isEmpty()) {
            throw new NormalizationException("Sort has no clauses");
        }
        return new SortOperation(clauses);
    }

    private SearchOperation search(JsonNode payload) {
        String term = expressions.stringLiteral(payload.path("search_term"), "Search term");
        JsonNode columnsNode = payload.path("columns");
        if (isAbsent(columnsNode)) {
            return new SearchOperation(term, null);
        }
        List<String> columns = new ArrayList<>();
        for (JsonNode column : elements(columnsNode, "Search columns")) {
            columns.add(expressions.fieldPath(column));
        }
        return new SearchOperation(term, columns.isEmpty() ? null : columns);
    }

    private ExtendOperation extend(JsonNode payload) {
        List<ExtendedColumn> columns = new ArrayList<>();
        for (JsonNode named : elements(payload.path("columns"), "Extend columns")) {
            String alias = alias(named);
            if (alias == null) {
                throw new NormalizationException("Extended column needs a name");
            }
            columns.add(new ExtendedColumn(alias, expressions.expressionValue(named.path("expression"))));
        }
        if (columns.isEmpty()) {
            throw new NormalizationException("Extend has no columns");
        }
        return new ExtendOperation(columns);
    }

    private DistinctOperation distinct(JsonNode payload) {
        JsonNode columnsNode = payload.isArray() ? payload : payload.path("columns");
        List<String> columns = new ArrayList<>();
        for (JsonNode column : elements(columnsNode, "Distinct columns")) {
            JsonNode expression = column.has("expression") ? column.get("expression") : column;
            columns.add(expressions.fieldPath(expression));
        }
        return new DistinctOperation(columns.isEmpty() ? null : columns);
    }

    private TopOperation top(JsonNode payload) {
        long count = expressions.rowCount(payload.path("count"), "Top");

        JsonNode by = payload.path("by_expression");
        String alias = alias(by);
        String field = alias != null ? alias : expressions.fieldPath(by.path("expression"));

        boolean withOthers = false;
        JsonNode others = payload.path("with_others");
        if (!isAbsent(others)) {
            if (others.isBoolean()) {
                withOthers = others.asBoolean();
            } else if (others.has("Literal")) {
                Literal literal = expressions.literal(others.get("Literal"));
                withOthers = literal.getType() == Literal.Type.BOOLEAN && (Boolean) literal.getValue();
            }
        }

        return new TopOperation(count, field, direction(payload.path("sort_order")),
                nullsOrder(payload.path("nulls_order")), withOthers);
    }

    // ========================================
    // Helpers
    // ========================================

    private static String alias(JsonNode named) {
        return isAbsent(named) ? null : identifier(named.get("alias"));
    }

    private static SortClause.Direction direction(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        String value = node.asText().toLowerCase(Locale.ROOT);
        switch (value) {
            case "asc":
                return SortClause.Direction.ASC;
            case "desc":
                return SortClause.Direction.DESC;
            default:
                throw new NormalizationException("Unknown sort order: " + node);
        }
    }

    private static SortClause.NullsOrder nullsOrder(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        String value = node.asText().toLowerCase(Locale.ROOT);
        switch (value) {
            case "first":
                return SortClause.NullsOrder.FIRST;
            case "last":
                return SortClause.NullsOrder.LAST;
            default:
                throw new NormalizationException("Unknown nulls order: " + node);
        }
    }

    private static String snippet(JsonNode node) {
        String text = String.valueOf(node);
        return text.length() > LOG_SNIPPET ? text.substring(0, LOG_SNIPPET) + "..." : text;
    }
}
