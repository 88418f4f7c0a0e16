package com.geico.poc.kqlcompiler.transpiler;

import com.geico.poc.kqlcompiler.config.KqlCompilerConfig;
import com.geico.poc.kqlcompiler.model.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SQL generation from the query model
 */
public class SqlTranspilerTest {

    private final SqlTranspiler transpiler = new SqlTranspiler();

    private static Query query(Operation... operations) {
        return new Query("events", Arrays.asList(operations));
    }

    private static FilterOperation where(Condition condition) {
        return new FilterOperation(condition);
    }

    private static Condition eq(String field, Object value) {
        return new EqualityCondition(field, literal(value));
    }

    private static Literal literal(Object value) {
        if (value == null) return Literal.NULL;
        if (value instanceof String) return Literal.of((String) value);
        if (value instanceof Boolean) return Literal.of((Boolean) value);
        if (value instanceof Double) return Literal.of((Double) value);
        return Literal.of(((Number) value).longValue());
    }

    private String sql(Operation... operations) {
        return transpiler.toSql(query(operations));
    }

    private String whereSql(Condition condition) {
        String sql = sql(where(condition));
        String prefix = "SELECT * FROM \"events\" WHERE (";
        assertTrue(sql.startsWith(prefix) && sql.endsWith(");"), sql);
        return sql.substring(prefix.length(), sql.length() - 2);
    }

    // ========================================
    // Reference scenarios
    // ========================================

    @Test
    @DisplayName("Plain take")
    public void testPlainCap() {
        assertEquals("SELECT * FROM \"events\" LIMIT 10;", sql(new LimitOperation(10)));
    }

    @Test
    @DisplayName("Filter, project and take")
    public void testFilterProjectCap() {
        assertEquals("SELECT \"timestamp\", \"user_id\", \"ip_address\" FROM \"events\""
                        + " WHERE (\"event_type_id\" = '4624') LIMIT 5;",
                sql(where(eq("event_type_id", "4624")),
                        new ProjectOperation(Arrays.asList("timestamp", "user_id", "ip_address")),
                        new LimitOperation(5)));
    }

    @Test
    @DisplayName("Filter, summarize, sort and take")
    public void testAggregateSortCap() {
        assertEquals("SELECT \"user_id\", COUNT(*) AS \"attempts\" FROM \"events\""
                        + " WHERE (\"event_type_id\" = '4625') GROUP BY \"user_id\""
                        + " ORDER BY \"attempts\" DESC LIMIT 10;",
                sql(where(eq("event_type_id", "4625")),
                        new SummarizeOperation(
                                Collections.singletonList(new Aggregation("attempts", AggregationFunction.COUNT, null)),
                                Collections.<GroupByItem>singletonList(new GroupByField("user_id"))),
                        new SortOperation(Collections.singletonList(
                                new SortClause("attempts", SortClause.Direction.DESC))),
                        new LimitOperation(10)));
    }

    @Test
    @DisplayName("Nested path filter and projection")
    public void testNestedPath() {
        assertEquals("SELECT \"timestamp\", \"user_id\","
                        + " parsed_fields->>'WorkstationName' AS \"parsed_fields.WorkstationName\""
                        + " FROM \"events\" WHERE (parsed_fields->>'LogonType' = '2');",
                sql(where(eq("parsed_fields.LogonType", 2L)),
                        new ProjectOperation(Arrays.asList("timestamp", "user_id", "parsed_fields.WorkstationName"))));
    }

    @Test
    @DisplayName("Set membership keeps literals verbatim and warns on case-insensitive match")
    public void testSetMembership() {
        TranspiledQuery result = transpiler.transpile(query(where(
                new InCondition("severity", Arrays.asList(Literal.of("A"), Literal.of("B")), false))));
        assertEquals("SELECT * FROM \"events\" WHERE (\"severity\" IN ('A', 'B'));", result.getSql());
        assertEquals(1, result.getWarnings().size());

        TranspiledQuery exact = transpiler.transpile(query(where(
                new InCondition("severity", Arrays.asList(Literal.of("High"), Literal.of("critical")), true))));
        assertTrue(exact.getSql().contains("\"severity\" IN ('High', 'critical')"));
        assertFalse(exact.hasWarnings());
    }

    @Test
    @DisplayName("Top with others still renders and only warns")
    public void testTopWithOthers() {
        TranspiledQuery result = transpiler.transpile(query(
                new TopOperation(3, "error_count", SortClause.Direction.DESC, true)));
        assertEquals("SELECT * FROM \"events\" ORDER BY \"error_count\" DESC LIMIT 3;", result.getSql());
        assertEquals(1, result.getWarnings().size());
        assertTrue(result.getWarnings().get(0).contains("others"));

        assertFalse(transpiler.transpile(query(
                new TopOperation(3, "error_count", SortClause.Direction.DESC, false))).hasWarnings());
    }

    // ========================================
    // Predicates
    // ========================================

    @Test
    @DisplayName("Equality with null renders IS NULL")
    public void testIsNull() {
        assertEquals("\"user_id\" IS NULL", whereSql(eq("user_id", null)));
    }

    @Test
    @DisplayName("Literal types in equality")
    public void testEqualityLiterals() {
        assertEquals("\"success\" = true", whereSql(eq("success", true)));
        assertEquals("\"severity_level\" = 3", whereSql(eq("severity_level", 3L)));
        assertEquals("\"name\" = 'O''Brien'", whereSql(eq("name", "O'Brien")));
    }

    @Test
    @DisplayName("Comparisons, including nested numeric casts and functions")
    public void testComparisons() {
        assertEquals("\"severity_level\" >= 3", whereSql(new ComparisonCondition(
                "severity_level", ComparisonCondition.Operator.GREATER_EQUAL, Literal.of(3L))));
        assertEquals("(parsed_fields->>'LogonType')::numeric > 2", whereSql(new ComparisonCondition(
                "parsed_fields.LogonType", ComparisonCondition.Operator.GREATER_THAN, Literal.of(2L))));
        assertEquals("\"timestamp\" > NOW() - INTERVAL '7 days'", whereSql(new ComparisonCondition(
                "timestamp", ComparisonCondition.Operator.GREATER_THAN, new SqlFragment("NOW() - INTERVAL '7 days'"))));
        assertEquals("\"a\" != \"b\"", whereSql(new ComparisonCondition(
                "a", ComparisonCondition.Operator.NOT_EQUALS, new ColumnReference("b"))));
        assertEquals("\"a\" IS NOT NULL", whereSql(new ComparisonCondition(
                "a", ComparisonCondition.Operator.NOT_EQUALS, Literal.NULL)));
    }

    @Test
    @DisplayName("Ordering comparison with null is rejected")
    public void testComparisonWithNull() {
        assertThrows(TranspileException.class, () -> sql(where(new ComparisonCondition(
                "a", ComparisonCondition.Operator.LESS_THAN, Literal.NULL))));
    }

    @Test
    @DisplayName("String predicates use ILIKE or LIKE with escaped patterns")
    public void testStringPredicates() {
        assertEquals("\"hostname\" ILIKE '%web%'", whereSql(
                new StringCondition("hostname", StringCondition.Operator.CONTAINS, "web", false)));
        assertEquals("\"hostname\" LIKE 'DC%'", whereSql(
                new StringCondition("hostname", StringCondition.Operator.STARTS_WITH, "DC", true)));
        assertEquals("parsed_fields->>'CommandLine' ILIKE '%.exe'", whereSql(
                new StringCondition("parsed_fields.CommandLine", StringCondition.Operator.ENDS_WITH, ".exe", false)));
        assertEquals("\"hostname\" NOT ILIKE '%test%'", whereSql(
                new StringCondition("hostname", StringCondition.Operator.CONTAINS, "test", false, true)));
        assertEquals("\"msg\" ILIKE '%100\\%\\_done''s%'", whereSql(
                new StringCondition("msg", StringCondition.Operator.CONTAINS, "100%_done's", false)));
    }

    @Test
    @DisplayName("Logical conditions keep nesting")
    public void testLogical() {
        Condition condition = new LogicalCondition(LogicalCondition.Operator.AND, Arrays.asList(
                eq("a", 1L),
                new LogicalCondition(LogicalCondition.Operator.OR, Arrays.asList(eq("b", 2L), eq("c", 3L)))));
        assertEquals("\"a\" = 1 AND (\"b\" = 2 OR \"c\" = 3)", whereSql(condition));
    }

    @Test
    @DisplayName("Regex and negated membership")
    public void testRegexAndNotIn() {
        assertEquals("\"details\" ~ 'user=([^\\s]+)'", whereSql(new RegexCondition("details", "user=([^\\s]+)")));
        assertEquals("\"status\" NOT IN (1, 2)", whereSql(new InCondition("status",
                Arrays.asList(Literal.of(1L), Literal.of(2L)), true, true)));
        assertEquals("parsed_fields->>'LogonType' IN ('2', '10')", whereSql(new InCondition("parsed_fields.LogonType",
                Arrays.asList(Literal.of(2L), Literal.of(10L)), true)));
    }

    @Test
    @DisplayName("Successive filters are conjoined")
    public void testMultipleFilters() {
        assertEquals("SELECT * FROM \"events\" WHERE (\"a\" = 1) AND (\"b\" = 2);",
                sql(where(eq("a", 1L)), where(eq("b", 2L))));
    }

    // ========================================
    // Search
    // ========================================

    @Test
    @DisplayName("Search without columns uses the configured defaults")
    public void testSearchDefaults() {
        assertEquals("SELECT * FROM \"events\" WHERE (\"message_short\" ILIKE '%critical error%'"
                        + " OR \"message_full\" ILIKE '%critical error%'"
                        + " OR \"user_id\" ILIKE '%critical error%'"
                        + " OR \"hostname\" ILIKE '%critical error%'"
                        + " OR \"process_name\" ILIKE '%critical error%'"
                        + " OR parsed_fields->>'CommandLine' ILIKE '%critical error%');",
                sql(new SearchOperation("critical error", null)));
    }

    @Test
    @DisplayName("Search with explicit columns and configured defaults")
    public void testSearchColumns() {
        assertEquals("SELECT * FROM \"events\" WHERE (\"hostname\" ILIKE '%x%');",
                sql(new SearchOperation("x", Collections.singletonList("hostname"))));

        KqlCompilerConfig config = new KqlCompilerConfig();
        config.setDefaultSearchColumns(Arrays.asList("a", "b"));
        assertEquals("SELECT * FROM \"events\" WHERE (\"a\" ILIKE '%y%' OR \"b\" ILIKE '%y%');",
                new SqlTranspiler(config).toSql(query(new SearchOperation("y", null))));
    }

    @Test
    @DisplayName("Blank search term adds nothing")
    public void testBlankSearch() {
        assertEquals("SELECT * FROM \"events\";", sql(new SearchOperation("  ", null)));
    }

    // ========================================
    // Extend and column visibility
    // ========================================

    private static ExtendOperation extendHour() {
        return new ExtendOperation(Collections.singletonList(
                new ExtendedColumn("hour", new SqlFragment("EXTRACT(HOUR FROM \"timestamp\")"))));
    }

    @Test
    @DisplayName("Extend keeps the wildcard")
    public void testExtendKeepsWildcard() {
        assertEquals("SELECT *, EXTRACT(HOUR FROM \"timestamp\") AS \"hour\" FROM \"events\";", sql(extendHour()));
    }

    @Test
    @DisplayName("Extended column refers to an earlier one by inlining it")
    public void testExtendChain() {
        ExtendOperation extend = new ExtendOperation(Arrays.asList(
                new ExtendedColumn("host", new ColumnReference("hostname")),
                new ExtendedColumn("host2", new ColumnReference("host"))));
        assertEquals("SELECT *, \"hostname\" AS \"host\", \"hostname\" AS \"host2\" FROM \"events\";", sql(extend));
    }

    @Test
    @DisplayName("Sort, project and top use extended names as bare aliases")
    public void testAliasVisibility() {
        assertEquals("SELECT *, EXTRACT(HOUR FROM \"timestamp\") AS \"hour\" FROM \"events\" ORDER BY \"hour\" ASC;",
                sql(extendHour(), new SortOperation(Collections.singletonList(
                        new SortClause("hour", SortClause.Direction.ASC)))));
        assertEquals("SELECT \"hour\", \"user_id\" FROM \"events\";",
                sql(extendHour(), new ProjectOperation(Arrays.asList("hour", "user_id"))));
        assertEquals("SELECT *, EXTRACT(HOUR FROM \"timestamp\") AS \"hour\" FROM \"events\" ORDER BY \"hour\" DESC LIMIT 1;",
                sql(extendHour(), new TopOperation(1, "hour", SortClause.Direction.DESC, false)));
    }

    @Test
    @DisplayName("Sort and distinct after project refer to projected nested paths by output name")
    public void testSortAfterProjectedPath() {
        ProjectOperation project = new ProjectOperation(Collections.singletonList("parsed_fields.LogonType"));
        assertEquals("SELECT parsed_fields->>'LogonType' AS \"parsed_fields.LogonType\" FROM \"events\""
                        + " ORDER BY \"parsed_fields.LogonType\" ASC;",
                sql(project, new SortOperation(Collections.singletonList(
                        new SortClause("parsed_fields.LogonType", SortClause.Direction.ASC)))));
        assertEquals("SELECT parsed_fields->>'LogonType' AS \"parsed_fields.LogonType\" FROM \"events\""
                        + " ORDER BY \"parsed_fields.LogonType\" DESC LIMIT 3;",
                sql(project, new TopOperation(3, "parsed_fields.LogonType", SortClause.Direction.DESC, false)));
        assertEquals("SELECT DISTINCT parsed_fields->>'LogonType' AS \"parsed_fields.LogonType\" FROM \"events\";",
                sql(project, new DistinctOperation(Collections.singletonList("parsed_fields.LogonType"))));
    }

    @Test
    @DisplayName("Sort on a column not yet projected is rendered from the source")
    public void testSortBeforeProject() {
        assertEquals("SELECT * FROM \"events\" ORDER BY parsed_fields->>'LogonType' ASC;",
                sql(new SortOperation(Collections.singletonList(
                        new SortClause("parsed_fields.LogonType", SortClause.Direction.ASC)))));
    }

    @Test
    @DisplayName("Filter on an extended column inlines its expression")
    public void testFilterOnExtended() {
        assertEquals("SELECT *, EXTRACT(HOUR FROM \"timestamp\") AS \"hour\" FROM \"events\""
                        + " WHERE (EXTRACT(HOUR FROM \"timestamp\") > 20);",
                sql(extendHour(), where(new ComparisonCondition("hour",
                        ComparisonCondition.Operator.GREATER_THAN, Literal.of(20L)))));
    }

    // ========================================
    // Summarize
    // ========================================

    @Test
    @DisplayName("Aggregates over nested fields and distinct counts")
    public void testAggregates() {
        assertEquals("SELECT \"hostname\", COUNT(DISTINCT \"user_id\") AS \"users\","
                        + " AVG((parsed_fields->>'FileSize')::numeric) AS \"avg_size\","
                        + " MAX(\"timestamp\") AS \"last_seen\" FROM \"events\" GROUP BY \"hostname\";",
                sql(new SummarizeOperation(Arrays.asList(
                        new Aggregation("users", AggregationFunction.DCOUNT, "user_id"),
                        new Aggregation("avg_size", AggregationFunction.AVG, "parsed_fields.FileSize"),
                        new Aggregation("last_seen", AggregationFunction.MAX, "timestamp")),
                        Collections.<GroupByItem>singletonList(new GroupByField("hostname")))));
    }

    @Test
    @DisplayName("Bucketed and nested group keys")
    public void testGroupKeys() {
        assertEquals("SELECT DATE_TRUNC('hour', \"timestamp\") AS \"hour\","
                        + " parsed_fields->>'LogonType' AS \"parsed_fields.LogonType\","
                        + " \"user_id\" AS \"who\", COUNT(*) AS \"n\" FROM \"events\""
                        + " GROUP BY DATE_TRUNC('hour', \"timestamp\"), parsed_fields->>'LogonType', \"user_id\";",
                sql(new SummarizeOperation(
                        Collections.singletonList(new Aggregation("n", AggregationFunction.COUNT, null)),
                        Arrays.<GroupByItem>asList(
                                new GroupByExpression("hour", "timestamp", "hour"),
                                new GroupByField("parsed_fields.LogonType"),
                                new GroupByField("user_id", "who")))));
    }

    @Test
    @DisplayName("Group-by on an extended column groups by its expression")
    public void testGroupByExtended() {
        assertEquals("SELECT EXTRACT(HOUR FROM \"timestamp\") AS \"hour\", COUNT(*) AS \"n\" FROM \"events\""
                        + " GROUP BY EXTRACT(HOUR FROM \"timestamp\");",
                sql(extendHour(), new SummarizeOperation(
                        Collections.singletonList(new Aggregation("n", AggregationFunction.COUNT, null)),
                        Collections.<GroupByItem>singletonList(new GroupByField("hour")))));
    }

    @Test
    @DisplayName("Filter after summarize becomes HAVING")
    public void testHaving() {
        assertEquals("SELECT \"user_id\", COUNT(*) AS \"attempts\" FROM \"events\""
                        + " WHERE (\"success\" = false) GROUP BY \"user_id\" HAVING (COUNT(*) > 5)"
                        + " ORDER BY \"attempts\" DESC;",
                sql(where(eq("success", false)),
                        new SummarizeOperation(
                                Collections.singletonList(new Aggregation("attempts", AggregationFunction.COUNT, null)),
                                Collections.<GroupByItem>singletonList(new GroupByField("user_id"))),
                        where(new ComparisonCondition("attempts", ComparisonCondition.Operator.GREATER_THAN,
                                Literal.of(5L))),
                        new SortOperation(Collections.singletonList(
                                new SortClause("attempts", SortClause.Direction.DESC)))));
    }

    private static SummarizeOperation attemptsByUser() {
        return new SummarizeOperation(
                Collections.singletonList(new Aggregation("attempts", AggregationFunction.COUNT, null)),
                Collections.<GroupByItem>singletonList(new GroupByField("user_id")));
    }

    @Test
    @DisplayName("Search after summarize matches the summarize outputs as text")
    public void testSearchAfterSummarize() {
        assertEquals("SELECT \"user_id\", COUNT(*) AS \"attempts\" FROM \"events\" GROUP BY \"user_id\""
                        + " HAVING ((\"user_id\")::text ILIKE '%bob%' OR (COUNT(*))::text ILIKE '%bob%');",
                sql(attemptsByUser(), new SearchOperation("bob", null)));
        assertEquals("SELECT \"user_id\", COUNT(*) AS \"attempts\" FROM \"events\" GROUP BY \"user_id\""
                        + " HAVING ((\"user_id\")::text ILIKE '%bob%');",
                sql(attemptsByUser(), new SearchOperation("bob", Collections.singletonList("user_id"))));
    }

    @Test
    @DisplayName("Search after summarize cannot name a dropped source column")
    public void testSearchDroppedColumnAfterSummarize() {
        assertThrows(TranspileException.class, () -> sql(attemptsByUser(),
                new SearchOperation("bob", Collections.singletonList("hostname"))));
    }

    @Test
    @DisplayName("Extend after summarize inlines a referenced aggregate")
    public void testExtendAfterSummarize() {
        assertEquals("SELECT \"user_id\", COUNT(*) AS \"attempts\", COUNT(*) AS \"same\" FROM \"events\""
                        + " GROUP BY \"user_id\";",
                sql(attemptsByUser(), new ExtendOperation(Collections.singletonList(
                        new ExtendedColumn("same", new ColumnReference("attempts"))))));
    }

    @Test
    @DisplayName("Aggregates other than count need a field")
    public void testAggregateWithoutField() {
        assertThrows(TranspileException.class, () -> sql(new SummarizeOperation(
                Collections.singletonList(new Aggregation("s", AggregationFunction.SUM, null)),
                Collections.<GroupByItem>emptyList())));
    }

    // ========================================
    // Distinct, sort, limit
    // ========================================

    @Test
    @DisplayName("Distinct with and without columns")
    public void testDistinct() {
        assertEquals("SELECT DISTINCT \"user_id\", \"hostname\" FROM \"events\";",
                sql(new DistinctOperation(Arrays.asList("user_id", "hostname"))));
        assertEquals("SELECT DISTINCT * FROM \"events\";", sql(new DistinctOperation(null)));
    }

    @Test
    @DisplayName("Sort keys carry direction and nulls ordering; a later sort replaces an earlier one")
    public void testSort() {
        assertEquals("SELECT * FROM \"events\" ORDER BY \"user_id\" ASC NULLS LAST, parsed_fields->>'LogonType' DESC;",
                sql(new SortOperation(Collections.singletonList(new SortClause("timestamp", null))),
                        new SortOperation(Arrays.asList(
                                new SortClause("user_id", SortClause.Direction.ASC, SortClause.NullsOrder.LAST),
                                new SortClause("parsed_fields.LogonType", SortClause.Direction.DESC)))));
    }

    @Test
    @DisplayName("A second cap keeps the smaller one; zero is allowed")
    public void testLimits() {
        assertEquals("SELECT * FROM \"events\" LIMIT 5;", sql(new LimitOperation(5), new LimitOperation(50)));
        assertEquals("SELECT * FROM \"events\" LIMIT 5;", sql(new LimitOperation(50), new LimitOperation(5)));
        assertEquals("SELECT * FROM \"events\" LIMIT 0;", sql(new LimitOperation(0)));
    }

    @Test
    @DisplayName("No operations selects everything")
    public void testEmptyPipeline() {
        assertEquals("SELECT * FROM \"events\";", sql());
    }

    @Test
    @DisplayName("Blank source is rejected")
    public void testBlankSource() {
        assertThrows(TranspileException.class,
                () -> transpiler.toSql(new Query(" ", Collections.<Operation>emptyList())));
    }

    // ========================================
    // Purity and concurrency
    // ========================================

    private static Query sampleAggregate() {
        return query(where(eq("event_type_id", "4625")),
                new SummarizeOperation(
                        Collections.singletonList(new Aggregation("attempts", AggregationFunction.COUNT, null)),
                        Collections.<GroupByItem>singletonList(new GroupByField("user_id"))),
                new SortOperation(Collections.singletonList(new SortClause("attempts", SortClause.Direction.DESC))),
                new LimitOperation(10));
    }

    private static Query sampleExtend() {
        return query(extendHour(), new ProjectOperation(Arrays.asList("hour", "parsed_fields.Image")));
    }

    @Test
    @DisplayName("Transpiling twice gives the same SQL and leaves the query unchanged")
    public void testIdempotent() {
        Query query = sampleAggregate();
        String before = query.toString();
        String first = transpiler.toSql(query);
        String second = transpiler.toSql(query);
        assertEquals(first, second);
        assertEquals(before, query.toString());
        assertEquals(sampleAggregate(), query);
    }

    @Test
    @DisplayName("Concurrent compilations do not see each other's columns")
    public void testConcurrentCompilation() throws Exception {
        String expectedAggregate = transpiler.toSql(sampleAggregate());
        String expectedExtend = transpiler.toSql(sampleExtend());

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < 400; i++) {
                final boolean aggregate = i % 2 == 0;
                results.add(pool.submit(() -> aggregate
                        ? expectedAggregate.equals(transpiler.toSql(sampleAggregate()))
                        : expectedExtend.equals(transpiler.toSql(sampleExtend()))));
            }
            for (Future<Boolean> result : results) {
                assertTrue(result.get(10, TimeUnit.SECONDS), "Concurrent compilation produced different SQL");
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
