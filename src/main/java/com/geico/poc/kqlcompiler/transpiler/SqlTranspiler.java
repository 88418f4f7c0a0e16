package com.geico.poc.kqlcompiler.transpiler;

import com.geico.poc.kqlcompiler.config.KqlCompilerConfig;
import com.geico.poc.kqlcompiler.model.Aggregation;
import com.geico.poc.kqlcompiler.model.DistinctOperation;
import com.geico.poc.kqlcompiler.model.ExtendOperation;
import com.geico.poc.kqlcompiler.model.ExtendedColumn;
import com.geico.poc.kqlcompiler.model.FilterOperation;
import com.geico.poc.kqlcompiler.model.GroupByExpression;
import com.geico.poc.kqlcompiler.model.GroupByField;
import com.geico.poc.kqlcompiler.model.GroupByItem;
import com.geico.poc.kqlcompiler.model.LimitOperation;
import com.geico.poc.kqlcompiler.model.Operation;
import com.geico.poc.kqlcompiler.model.OperationVisitor;
import com.geico.poc.kqlcompiler.model.ProjectOperation;
import com.geico.poc.kqlcompiler.model.Query;
import com.geico.poc.kqlcompiler.model.SearchOperation;
import com.geico.poc.kqlcompiler.model.SortClause;
import com.geico.poc.kqlcompiler.model.SortOperation;
import com.geico.poc.kqlcompiler.model.SummarizeOperation;
import com.geico.poc.kqlcompiler.model.TopOperation;
import com.geico.poc.kqlcompiler.sql.FieldRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a {@link Query} as one PostgreSQL SELECT statement.
 *
 * Operators are applied left to right. Each one receives the {@link CompilationContext}
 * left by its predecessor and returns the context for its successor; the clause
 * fragments accumulate in a statement owned by that single call. The transpiler itself
 * keeps no per-query state, so one instance serves concurrent compilations.
 */
@Component
public class SqlTranspiler {

    private static final Logger log = LoggerFactory.getLogger(SqlTranspiler.class);

    private final FieldRenderer fields;
    private final KqlCompilerConfig config;

    @Autowired
    public SqlTranspiler(FieldRenderer fields, KqlCompilerConfig config) {
        this.fields = fields;
        this.config = config;
    }

    public SqlTranspiler(KqlCompilerConfig config) {
        this(new FieldRenderer(config), config);
    }

    public SqlTranspiler() {
        this(new KqlCompilerConfig());
    }

    public String toSql(Query query) {
        return transpile(query).getSql();
    }

    /**
     * Render {@code query}. Never modifies it.
     *
     * @throws TranspileException if an operation cannot be expressed as SQL
     */
    public TranspiledQuery transpile(Query query) {
        String source = query.getSource();
        if (source.trim().isEmpty()) {
            throw new TranspileException("Query has no source table");
        }

        Pass pass = new Pass(new SelectStatement(fields.quoteIdentifier(source)));
        CompilationContext context = CompilationContext.initial();
        for (Operation operation : query.getOperations()) {
            context = operation.accept(pass, context);
            log.trace("After {}: {}", operation.getName(), context);
        }

        String sql = pass.statement.toSql();
        if (config.isLogGeneratedSql()) {
            log.info("📝 Generated SQL: {}", sql);
        } else {
            log.debug("Generated SQL: {}", sql);
        }
        for (String warning : pass.warnings) {
            log.warn("⚠️  {}", warning);
        }
        return new TranspiledQuery(sql, pass.warnings);
    }

    /**
     * One compilation: the statement under construction and the warnings raised so far.
     */
    private final class Pass implements OperationVisitor<CompilationContext, CompilationContext> {

        private final SelectStatement statement;
        private final List<String> warnings = new ArrayList<>();

        Pass(SelectStatement statement) {
            this.statement = statement;
        }

        private ConditionRenderer renderer(CompilationContext context) {
            return new ConditionRenderer(fields, context, warnings);
        }

        private void addPredicate(String predicate, CompilationContext context) {
            if (context.isGrouped()) {
                statement.addHaving(predicate);
            } else {
                statement.addWhere(predicate);
            }
        }

        @Override
        public CompilationContext visitFilter(FilterOperation operation, CompilationContext context) {
            addPredicate("(" + renderer(context).render(operation.getCondition()) + ")", context);
            return context;
        }

        @Override
        public CompilationContext visitSearch(SearchOperation operation, CompilationContext context) {
            String term = operation.getTerm();
            if (term.trim().isEmpty()) {
                return context;
            }
            List<String> columns;
            if (operation.hasColumns()) {
                columns = operation.getColumns();
            } else if (context.isGrouped()) {
                // source columns are gone; match the summarize outputs instead
                columns = new ArrayList<>(context.getVisibleColumns());
            } else {
                columns = config.getDefaultSearchColumns();
            }
            if (columns == null || columns.isEmpty()) {
                throw new TranspileException("Search has no columns to match and none are configured");
            }

            String pattern = FieldRenderer.quoteString("%" + FieldRenderer.escapeLikePattern(term) + "%");
            ConditionRenderer renderer = renderer(context);
            List<String> matches = new ArrayList<>();
            for (String column : columns) {
                if (context.isGrouped()) {
                    if (!context.isVisible(column)) {
                        throw new TranspileException("Search column " + column + " is not an output of summarize");
                    }
                    matches.add("(" + renderer.field(column) + ")::text ILIKE " + pattern);
                } else {
                    matches.add(renderer.field(column) + " ILIKE " + pattern);
                }
            }
            addPredicate("(" + String.join(" OR ", matches) + ")", context);
            return context;
        }

        @Override
        public CompilationContext visitExtend(ExtendOperation operation, CompilationContext context) {
            Map<String, String> computed = new LinkedHashMap<>();
            CompilationContext current = context;
            for (ExtendedColumn column : operation.getColumns()) {
                // later columns of the same extend may refer to earlier ones
                String sql = renderer(current).render(column.getExpression());
                statement.appendSelect(sql + " AS " + fields.quoteIdentifier(column.getAlias()));
                computed.put(column.getAlias(), sql);
                current = context.withExtended(computed);
            }
            return current;
        }

        @Override
        public CompilationContext visitSummarize(SummarizeOperation operation, CompilationContext context) {
            ConditionRenderer renderer = renderer(context);
            List<String> select = new ArrayList<>();
            List<String> groupBy = new ArrayList<>();
            Map<String, String> outputs = new LinkedHashMap<>();

            for (GroupByItem item : operation.getGroupBy()) {
                String sql = groupKey(item, context, renderer);
                String alias = item.getAlias();
                boolean plainColumn = item instanceof GroupByField
                        && !((GroupByField) item).isRenamed()
                        && !context.isAlias(alias)
                        && !FieldRenderer.isNestedPath(alias);
                select.add(plainColumn ? sql : sql + " AS " + fields.quoteIdentifier(alias));
                groupBy.add(sql);
                outputs.put(alias, sql);
            }

            for (Aggregation aggregation : operation.getAggregations()) {
                String sql = aggregate(aggregation, context);
                select.add(sql + " AS " + fields.quoteIdentifier(aggregation.getAlias()));
                outputs.put(aggregation.getAlias(), sql);
            }

            if (select.isEmpty()) {
                throw new TranspileException("Summarize has neither aggregations nor group keys");
            }
            statement.replaceSelect(select);
            statement.replaceGroupBy(groupBy);
            return context.withSummarized(outputs);
        }

        private String groupKey(GroupByItem item, CompilationContext context, ConditionRenderer renderer) {
            if (item instanceof GroupByField) {
                return renderer.field(((GroupByField) item).getField());
            }
            if (item instanceof GroupByExpression) {
                GroupByExpression expression = (GroupByExpression) item;
                return "DATE_TRUNC(" + FieldRenderer.quoteString(expression.getUnit()) + ", "
                        + renderer.field(expression.getField()) + ")";
            }
            throw new TranspileException("Unsupported group-by item: " + item.getClass().getSimpleName());
        }

        private String aggregate(Aggregation aggregation, CompilationContext context) {
            String field = null;
            if (aggregation.hasField()) {
                String name = aggregation.getField();
                field = context.isAlias(name)
                        ? context.aliasSql(name)
                        : fields.render(name, FieldRenderer.Usage.AGGREGATE_ARGUMENT);
            }

            switch (aggregation.getFunction()) {
                case COUNT:
                    return field == null ? "COUNT(*)" : "COUNT(" + field + ")";
                case DCOUNT:
                    return "COUNT(DISTINCT " + requireField(aggregation, field) + ")";
                case SUM:
                case AVG:
                case MIN:
                case MAX:
                    return aggregation.getFunction().name() + "(" + requireField(aggregation, field) + ")";
                default:
                    throw new TranspileException("Unsupported aggregation function: " + aggregation.getFunction());
            }
        }

        private String requireField(Aggregation aggregation, String field) {
            if (field == null) {
                throw new TranspileException(aggregation.getFunction().getKqlName() + "() requires a field: "
                        + aggregation.getAlias());
            }
            return field;
        }

        @Override
        public CompilationContext visitDistinct(DistinctOperation operation, CompilationContext context) {
            statement.setDistinct();
            if (!operation.hasColumns()) {
                return context;
            }
            statement.replaceSelect(selectItems(operation.getColumns(), context));
            return context.withProjected(operation.getColumns());
        }

        @Override
        public CompilationContext visitProject(ProjectOperation operation, CompilationContext context) {
            statement.replaceSelect(selectItems(operation.getFields(), context));
            return context.withProjected(operation.getFields());
        }

        /**
         * True when {@code name} already names an output column at this point of the pipeline.
         */
        private boolean isVisibleName(String name, CompilationContext context) {
            return context.isAlias(name) || (!context.isAllColumnsVisible() && context.isVisible(name));
        }

        private List<String> selectItems(List<String> names, CompilationContext context) {
            List<String> items = new ArrayList<>(names.size());
            for (String name : names) {
                // a projected nested path has no column of its own once the select list is replaced
                boolean reference = isVisibleName(name, context)
                        && (context.isAlias(name) || !FieldRenderer.isNestedPath(name));
                items.add(reference
                        ? fields.quoteIdentifier(name)
                        : fields.render(name, FieldRenderer.Usage.SELECT));
            }
            return items;
        }

        @Override
        public CompilationContext visitSort(SortOperation operation, CompilationContext context) {
            List<String> orderBy = new ArrayList<>();
            for (SortClause clause : operation.getClauses()) {
                orderBy.add(orderKey(clause.getField(), clause.getDirection(), clause.getNulls(), context));
            }
            statement.replaceOrderBy(orderBy);
            return context;
        }

        @Override
        public CompilationContext visitTop(TopOperation operation, CompilationContext context) {
            List<String> orderBy = new ArrayList<>(1);
            orderBy.add(orderKey(operation.getField(), operation.getDirection(), operation.getNulls(), context));
            statement.replaceOrderBy(orderBy);
            statement.capRows(operation.getCount());
            if (operation.isWithOthers()) {
                warnings.add("top " + operation.getCount() + " by " + operation.getField()
                        + " with others: the others row is not produced");
            }
            return context;
        }

        private String orderKey(String field, SortClause.Direction direction, SortClause.NullsOrder nulls,
                                CompilationContext context) {
            StringBuilder sb = new StringBuilder(isVisibleName(field, context)
                    ? fields.quoteIdentifier(field)
                    : fields.render(field, FieldRenderer.Usage.ORDER_BY));
            if (direction != null) {
                sb.append(' ').append(direction.name());
            }
            if (nulls != null) {
                sb.append(" NULLS ").append(nulls.name());
            }
            return sb.toString();
        }

        @Override
        public CompilationContext visitLimit(LimitOperation operation, CompilationContext context) {
            statement.capRows(operation.getCount());
            return context;
        }
    }
}
