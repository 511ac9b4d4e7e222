package org.saiql.engine.transpiler;

import org.saiql.engine.CompileWarning;
import org.saiql.engine.ErrorCode;
import org.saiql.engine.QueryFirewall;
import org.saiql.engine.SampleSchema;
import org.saiql.engine.WarningCode;
import org.saiql.engine.lang.QueryParser;
import org.saiql.engine.lang.Surface;
import org.saiql.engine.plan.ColumnReference;
import org.saiql.engine.plan.ComparisonExpression;
import org.saiql.engine.plan.ComparisonExpression.ComparisonOperator;
import org.saiql.engine.plan.FilterNode;
import org.saiql.engine.plan.JoinNode;
import org.saiql.engine.plan.JoinNode.JoinType;
import org.saiql.engine.plan.Literal;
import org.saiql.engine.plan.PlanBuilder;
import org.saiql.engine.plan.PlanNode;
import org.saiql.engine.plan.ProjectNode;
import org.saiql.engine.plan.ResultColumn;
import org.saiql.engine.plan.SinkNode;
import org.saiql.engine.store.Column;
import org.saiql.engine.store.InMemorySchemaCatalog;
import org.saiql.engine.store.Table;
import org.saiql.engine.types.CanonicalType;
import org.saiql.engine.types.TypeKind;
import org.saiql.engine.types.TypeRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link SQLGenerator}: statement text, parameter binding and
 * dialect differences.
 */
@DisplayName("SQL Generator Tests")
class SQLGeneratorTest {

    private static final PlanBuilder BUILDER = new PlanBuilder(SampleSchema.catalog(), QueryFirewall.allowAll());

    private static PlanNode symbolic(String query) {
        return BUILDER.build(QueryParser.parse(query, Surface.SYMBOLIC), query);
    }

    private static PlanNode sql(String query) {
        return BUILDER.build(QueryParser.parse(query, Surface.SQL_SUBSET), query);
    }

    private static GeneratedSql generate(SQLDialect dialect, PlanNode plan) {
        return new SQLGenerator(dialect).generate(plan);
    }

    private static SQLGenerator withOverride(SQLDialect dialect, FeatureId feature) {
        return new SQLGenerator(dialect, TypeRegistry.standard(), Set.of(feature), false);
    }

    private static SQLGenerator deferring(SQLDialect dialect) {
        return new SQLGenerator(dialect, TypeRegistry.standard(), Set.of(), true);
    }

    private static List<Object> values(GeneratedSql generated) {
        return generated.parameters().stream().map(BoundParameter::value).toList();
    }

    private static boolean hasWarning(GeneratedSql generated, WarningCode code) {
        return generated.warnings().stream().anyMatch(w -> w.code() == code);
    }

    private static final String CANONICAL = "*5[users]::name,email|status='active'>>oQ";

    // ==================== Reads per dialect ====================

    @Nested
    @DisplayName("Canonical query on every dialect")
    class Dialects {

        @Test
        @DisplayName("PostgreSQL numbers its placeholders")
        void testPostgres() {
            // GIVEN: The canonical query
            PlanNode plan = symbolic(CANONICAL);

            // WHEN: We generate PostgreSQL
            GeneratedSql generated = generate(PostgreSQLDialect.INSTANCE, plan);

            // THEN: The literal is bound, never inlined
            assertEquals("SELECT \"users\".\"name\", \"users\".\"email\" FROM \"users\" "
                    + "WHERE \"users\".\"status\" = $1 LIMIT 5", generated.sql());
            assertEquals(List.of(new BoundParameter(1, "active", CanonicalType.varchar(20))),
                    generated.parameters());
            assertEquals(List.of("name", "email"), generated.resultColumns().stream().map(ResultColumn::name).toList());
            assertTrue(generated.warnings().isEmpty(), generated.warnings().toString());
            assertFalse(generated.requiresOverride());
        }

        @Test
        @DisplayName("MySQL quotes with backticks")
        void testMySql() {
            GeneratedSql generated = generate(MySQLDialect.INSTANCE, symbolic(CANONICAL));
            assertEquals("SELECT `users`.`name`, `users`.`email` FROM `users` WHERE `users`.`status` = ? LIMIT 5",
                    generated.sql());
        }

        @Test
        @DisplayName("SQLite and DuckDB use positional markers")
        void testSqliteAndDuckDb() {
            String expected = "SELECT \"users\".\"name\", \"users\".\"email\" FROM \"users\" "
                    + "WHERE \"users\".\"status\" = ? LIMIT 5";
            assertEquals(expected, generate(SQLiteDialect.INSTANCE, symbolic(CANONICAL)).sql());
            assertEquals(expected, generate(DuckDBDialect.INSTANCE, symbolic(CANONICAL)).sql());
        }

        @Test
        @DisplayName("SQL Server limits with TOP")
        void testSqlServer() {
            GeneratedSql generated = generate(SQLServerDialect.INSTANCE, symbolic(CANONICAL));
            assertEquals("SELECT TOP 5 [users].[name], [users].[email] FROM [users] WHERE [users].[status] = ?",
                    generated.sql());
        }

        @Test
        @DisplayName("Oracle uses FETCH FIRST and reports its empty-string semantics")
        void testOracle() {
            GeneratedSql generated = generate(OracleDialect.INSTANCE, symbolic(CANONICAL));
            assertEquals("SELECT \"users\".\"name\", \"users\".\"email\" FROM \"users\" "
                    + "WHERE \"users\".\"status\" = :1 FETCH FIRST 5 ROWS ONLY", generated.sql());
            assertTrue(hasWarning(generated, WarningCode.LOSSY_MAPPING));
            assertTrue(generated.warnings().get(0).message().contains("Oracle stores empty strings as NULL"));
        }

        @Test
        @DisplayName("HANA keeps the ANSI defaults")
        void testHana() {
            assertEquals("SELECT \"users\".\"name\", \"users\".\"email\" FROM \"users\" "
                    + "WHERE \"users\".\"status\" = ? LIMIT 5", generate(HanaDialect.INSTANCE, symbolic(CANONICAL)).sql());
        }

        @Test
        @DisplayName("Same plan, same text")
        void testDeterministic() {
            PlanNode plan = symbolic("*=J[users+orders]::users.name,orders.total|orders.total>100>>oQ");
            assertEquals(generate(PostgreSQLDialect.INSTANCE, plan), generate(PostgreSQLDialect.INSTANCE, plan));
        }

        @Test
        @DisplayName("Every dialect is registered")
        void testLookup() {
            for (org.saiql.engine.DialectId id : org.saiql.engine.DialectId.values()) {
                assertEquals(id, SQLDialects.forId(id).id());
            }
        }
    }

    // ==================== Parameters ====================

    @Nested
    @DisplayName("Parameter binding")
    class Parameters {

        @Test
        @DisplayName("Placeholders are numbered in text order")
        void testParameterOrder() {
            // GIVEN: A disjunction under a conjunction
            PlanNode plan = symbolic("*[users]::name|(status='a' or status='b') and age>30>>oQ");

            // WHEN: We generate PostgreSQL
            GeneratedSql generated = generate(PostgreSQLDialect.INSTANCE, plan);

            // THEN: Nested OR is parenthesized and indexes follow the text
            assertEquals("SELECT \"users\".\"name\" FROM \"users\" WHERE "
                    + "(\"users\".\"status\" = $1 OR \"users\".\"status\" = $2) AND \"users\".\"age\" > $3",
                    generated.sql());
            assertEquals(List.of("a", "b", 30L), values(generated));
            assertEquals(List.of(1, 2, 3), generated.parameters().stream().map(BoundParameter::index).toList());
        }

        @Test
        @DisplayName("Quote characters in values cannot escape the literal")
        void testInjectionSafety() {
            // GIVEN: A value that would break out of an inlined string
            String hostile = "x' OR '1'='1";
            PlanNode plan = symbolic("*[users]::name|name=\"" + hostile + "\">>oQ");

            // WHEN: We generate for every dialect
            for (org.saiql.engine.DialectId id : org.saiql.engine.DialectId.values()) {
                GeneratedSql generated = generate(SQLDialects.forId(id), plan);

                // THEN: The text only has a placeholder and the value travels intact
                assertFalse(generated.sql().contains("OR"), generated.sql());
                assertFalse(generated.sql().contains("'"), generated.sql());
                assertEquals(List.of(hostile), values(generated));
            }
        }

        @Test
        @DisplayName("Identifiers with quote characters are escaped by doubling")
        void testIdentifierQuoting() {
            assertEquals("\"we\"\"ird\"", PostgreSQLDialect.INSTANCE.quoteIdentifier("we\"ird"));
            assertEquals("`we``ird`", MySQLDialect.INSTANCE.quoteIdentifier("we`ird"));
            assertEquals("[we]]ird]", SQLServerDialect.INSTANCE.quoteIdentifier("we]ird"));
        }

        @Test
        @DisplayName("IN lists and NULL tests")
        void testInAndNull() {
            GeneratedSql in = generate(PostgreSQLDialect.INSTANCE,
                    symbolic("*[users]::name|age not in (30, 41) and email is null>>oQ"));
            assertEquals("SELECT \"users\".\"name\" FROM \"users\" WHERE "
                    + "\"users\".\"age\" NOT IN ($1, $2) AND \"users\".\"email\" IS NULL", in.sql());
            assertEquals(List.of(30L, 41L), values(in));
        }
    }

    // ==================== Functions and predicates ====================

    @Nested
    @DisplayName("Functions and predicates")
    class Predicates {

        @Test
        @DisplayName("ILIKE is native on PostgreSQL and DuckDB, lowered elsewhere")
        void testIlike() {
            PlanNode plan = symbolic("*[users]::name|name ilike 'a%'>>oQ");
            assertTrue(generate(PostgreSQLDialect.INSTANCE, plan).sql().endsWith("WHERE \"users\".\"name\" ILIKE $1"));
            assertTrue(generate(DuckDBDialect.INSTANCE, plan).sql().endsWith("WHERE \"users\".\"name\" ILIKE ?"));
            assertTrue(generate(SQLiteDialect.INSTANCE, plan).sql()
                    .endsWith("WHERE LOWER(\"users\".\"name\") LIKE LOWER(?)"));
        }

        @Test
        @DisplayName("Scalar functions take dialect spellings")
        void testFunctions() {
            PlanNode plan = symbolic("*[users]::name|length(name)>3>>oQ");
            assertTrue(generate(PostgreSQLDialect.INSTANCE, plan).sql().contains("LENGTH(\"users\".\"name\") > $1"));
            assertTrue(generate(MySQLDialect.INSTANCE, plan).sql().contains("CHAR_LENGTH(`users`.`name`) > ?"));
            assertTrue(generate(SQLServerDialect.INSTANCE, plan).sql().contains("LEN([users].[name]) > ?"));
        }

        @Test
        @DisplayName("A boolean column as a condition is compared to 1 where booleans are bits")
        void testBooleanCondition() {
            PlanNode plan = symbolic("*[users]::name|active>>oQ");
            assertTrue(generate(PostgreSQLDialect.INSTANCE, plan).sql().endsWith("WHERE \"users\".\"active\""));
            assertTrue(generate(SQLServerDialect.INSTANCE, plan).sql().endsWith("WHERE [users].[active] = 1"));
        }

        @Test
        @DisplayName("RANDOM orders by the dialect's random function")
        void testRandom() {
            PlanNode plan = symbolic("*RANDOM[users]::name>>oQ");
            assertEquals("SELECT `users`.`name` FROM `users` ORDER BY RAND() ASC LIMIT 1",
                    generate(MySQLDialect.INSTANCE, plan).sql());
            assertEquals("SELECT TOP 1 [users].[name] FROM [users] ORDER BY NEWID() ASC",
                    generate(SQLServerDialect.INSTANCE, plan).sql());
            assertTrue(generate(PostgreSQLDialect.INSTANCE, plan).sql().contains("ORDER BY RANDOM() ASC"));
        }
    }

    // ==================== Limits ====================

    @Nested
    @DisplayName("Row limits")
    class Limits {

        @Test
        @DisplayName("ORDER BY with LIMIT and OFFSET")
        void testOrderedPage() {
            PlanNode plan = sql("SELECT name FROM users ORDER BY name DESC LIMIT 10 OFFSET 5");

            assertEquals("SELECT \"users\".\"name\" FROM \"users\" ORDER BY \"users\".\"name\" DESC LIMIT 10 OFFSET 5",
                    generate(PostgreSQLDialect.INSTANCE, plan).sql());
            assertEquals("SELECT [users].[name] FROM [users] ORDER BY [users].[name] DESC "
                    + "OFFSET 5 ROWS FETCH NEXT 10 ROWS ONLY", generate(SQLServerDialect.INSTANCE, plan).sql());
            assertEquals("SELECT \"users\".\"name\" FROM \"users\" ORDER BY \"users\".\"name\" DESC "
                    + "OFFSET 5 ROWS FETCH FIRST 10 ROWS ONLY", generate(OracleDialect.INSTANCE, plan).sql());
        }

        @Test
        @DisplayName("SQL Server needs an ORDER BY before OFFSET")
        void testSqlServerUnorderedOffset() {
            GeneratedSql generated = generate(SQLServerDialect.INSTANCE,
                    sql("SELECT name FROM users LIMIT 10 OFFSET 5"));
            assertEquals("SELECT [users].[name] FROM [users] ORDER BY (SELECT NULL) OFFSET 5 ROWS FETCH NEXT 10 ROWS ONLY",
                    generated.sql());
        }

        @Test
        @DisplayName("Offset without a limit")
        void testOffsetOnly() {
            assertEquals(" LIMIT 18446744073709551615 OFFSET 5", MySQLDialect.INSTANCE.limitClause(null, 5, false));
            assertEquals(" LIMIT -1 OFFSET 5", SQLiteDialect.INSTANCE.limitClause(null, 5, false));
            assertEquals(" OFFSET 5", PostgreSQLDialect.INSTANCE.limitClause(null, 5, false));
            assertEquals("", PostgreSQLDialect.INSTANCE.limitClause(null, 0, true));
        }
    }

    // ==================== Joins and aggregates ====================

    @Nested
    @DisplayName("Joins and aggregates")
    class JoinsAndAggregates {

        @Test
        @DisplayName("Inner join on the foreign key")
        void testInnerJoin() {
            GeneratedSql generated = generate(PostgreSQLDialect.INSTANCE,
                    symbolic("*=J[users+orders]::users.name,orders.total>>oQ"));
            assertTrue(generated.sql().contains(
                    "FROM \"users\" INNER JOIN \"orders\" ON \"users\".\"id\" = \"orders\".\"user_id\""),
                    generated.sql());
        }

        @Test
        @DisplayName("A filter above an outer join stays in WHERE")
        void testFilterAboveOuterJoin() {
            GeneratedSql generated = generate(PostgreSQLDialect.INSTANCE,
                    symbolic("*=L[users+orders]::users.name|orders.status='completed'>>oQ"));
            assertTrue(generated.sql().endsWith(
                    "FROM \"users\" LEFT OUTER JOIN \"orders\" ON \"users\".\"id\" = \"orders\".\"user_id\" "
                            + "WHERE \"orders\".\"status\" = $1"), generated.sql());
        }

        @Test
        @DisplayName("COUNT over a filter; SQL Server counts with COUNT_BIG")
        void testCount() {
            GeneratedSql generated = generate(SQLServerDialect.INSTANCE,
                    symbolic("*COUNT[orders]::*|status='completed'>>oQ"));
            assertEquals("SELECT COUNT_BIG(*) AS [count] FROM [orders] WHERE [orders].[status] = ?", generated.sql());
            assertEquals(List.of("completed"), values(generated));
            assertEquals(List.of(new ResultColumn("count", CanonicalType.of(TypeKind.INTEGER64).notNull())),
                    generated.resultColumns());
        }

        @Test
        @DisplayName("Grouped SUM lists the group key first")
        void testGroupedSum() {
            GeneratedSql generated = generate(PostgreSQLDialect.INSTANCE,
                    symbolic("*SUM[orders]::total>>GROUP(user_id)>>oQ"));
            assertEquals("SELECT \"orders\".\"user_id\", SUM(\"orders\".\"total\") AS \"sum_total\" FROM \"orders\" "
                    + "GROUP BY \"orders\".\"user_id\"", generated.sql());
        }

        @Test
        @DisplayName("Aggregate select list renders in the written order")
        void testAggregateListOrder() {
            // GIVEN: A call written before its grouping column
            PlanNode plan = sql("SELECT COUNT(*) AS n, status FROM orders GROUP BY status");

            // WHEN: We generate PostgreSQL
            GeneratedSql generated = generate(PostgreSQLDialect.INSTANCE, plan);

            // THEN: Columns and result metadata keep that order
            assertEquals("SELECT COUNT(*) AS \"n\", \"orders\".\"status\" FROM \"orders\" "
                    + "GROUP BY \"orders\".\"status\"", generated.sql());
            assertEquals(List.of("n", "status"), generated.resultColumns().stream().map(ResultColumn::name).toList());
        }

        @Test
        @DisplayName("Other dialects keep plain COUNT")
        void testCountElsewhere() {
            GeneratedSql generated = generate(MySQLDialect.INSTANCE, symbolic("*COUNT[orders]::*>>oQ"));
            assertEquals("SELECT COUNT(*) AS `count` FROM `orders`", generated.sql());
        }

        @Test
        @DisplayName("A filter under a FULL OUTER JOIN input stays inside that input")
        void testFilteredFullJoinInput() {
            // GIVEN: A full join whose left input is filtered
            SinkNode sink = (SinkNode) symbolic("*=F[users+orders](users.id=orders.user_id)::users.name,orders.total>>oQ");
            ProjectNode project = (ProjectNode) sink.source();
            JoinNode join = (JoinNode) project.source();
            CanonicalType age = CanonicalType.of(TypeKind.INTEGER32);
            FilterNode adults = new FilterNode(join.left(), new ComparisonExpression(
                    new ColumnReference("users", "age", age), ComparisonOperator.GREATER_THAN, new Literal(30L, age)));
            PlanNode plan = new SinkNode(new ProjectNode(
                    new JoinNode(adults, join.right(), join.condition(), JoinType.FULL_OUTER),
                    project.projections(), project.distinct()), sink.format());

            // WHEN: We generate PostgreSQL
            GeneratedSql generated = generate(PostgreSQLDialect.INSTANCE, plan);

            // THEN: The filter is applied in a derived table, not in ON or WHERE
            String sql = generated.sql();
            assertTrue(sql.contains("FROM (SELECT \"id\", \"name\", \"email\", \"status\", \"age\", \"active\" "
                    + "FROM \"users\" WHERE \"users\".\"age\" > $1) AS \"users\" FULL OUTER JOIN \"orders\" "
                    + "ON \"users\".\"id\" = \"orders\".\"user_id\""), sql);
            assertFalse(sql.contains(" WHERE \"users\".\"age\" > $1 AND"), sql);
            assertTrue(sql.endsWith("\"orders\".\"user_id\""), sql);
            assertEquals(List.of(30L), values(generated));
        }
    }

    // ==================== JSON output ====================

    @Nested
    @DisplayName("JSON sink")
    class Json {

        @Test
        @DisplayName("PostgreSQL aggregates rows into one JSON array")
        void testPostgresJson() {
            GeneratedSql generated = generate(PostgreSQLDialect.INSTANCE, symbolic("*[users]::name,email>>oJ"));

            assertEquals("SELECT json_agg(json_build_object('name', \"q\".\"name\", 'email', \"q\".\"email\")) "
                    + "AS \"result\" FROM (SELECT \"users\".\"name\", \"users\".\"email\" FROM \"users\") AS \"q\"",
                    generated.sql());
            assertEquals(List.of(new ResultColumn("result", CanonicalType.of(TypeKind.JSON))),
                    generated.resultColumns());
        }

        @Test
        @DisplayName("DuckDB uses json_group_array")
        void testDuckDbJson() {
            String sql = generate(DuckDBDialect.INSTANCE, symbolic("*[users]::name>>oJ")).sql();
            assertTrue(sql.startsWith("SELECT json_group_array(json_object('name', \"q\".\"name\")) AS \"result\""), sql);
        }

        @Test
        @DisplayName("No JSON support: exception, override or deferral")
        void testJsonUnsupported() {
            PlanNode plan = symbolic("*[users]::name>>oJ");

            // Default: fail with the feature named
            CodegenException e = assertThrows(CodegenException.class,
                    () -> generate(SQLServerDialect.INSTANCE, plan));
            assertEquals(FeatureId.JSON_OUTPUT, e.feature());
            assertEquals(ErrorCode.UNSUPPORTED_FEATURE, e.errorCode());

            // Override: plain rows with a warning
            GeneratedSql overridden = withOverride(SQLServerDialect.INSTANCE, FeatureId.JSON_OUTPUT).generate(plan);
            assertEquals("SELECT [users].[name] FROM [users]", overridden.sql());
            assertTrue(hasWarning(overridden, WarningCode.OVERRIDE_USED));
            assertFalse(overridden.requiresOverride());

            // Deferral: same text, flagged
            GeneratedSql deferred = deferring(HanaDialect.INSTANCE).generate(plan);
            assertTrue(deferred.requiresOverride());
            assertTrue(hasWarning(deferred, WarningCode.UNSUPPORTED_FEATURE));
        }
    }

    // ==================== Unsupported features ====================

    @Nested
    @DisplayName("Unsupported features")
    class Unsupported {

        private final PlanNode fullJoin =
                symbolic("*=F[users+orders](users.id=orders.user_id)::users.name,orders.total>>oQ");

        @Test
        @DisplayName("FULL OUTER JOIN is native where available")
        void testFullJoinNative() {
            assertTrue(generate(PostgreSQLDialect.INSTANCE, fullJoin).sql().contains("FULL OUTER JOIN"));
        }

        @Test
        @DisplayName("MySQL FULL OUTER JOIN needs an override")
        void testFullJoinOnMySql() {
            CodegenException e = assertThrows(CodegenException.class, () -> generate(MySQLDialect.INSTANCE, fullJoin));
            assertEquals(FeatureId.FULL_OUTER_JOIN, e.feature());
            assertTrue(e.getMessage().contains("FULL_OUTER_JOIN"), e.getMessage());

            GeneratedSql overridden = withOverride(MySQLDialect.INSTANCE, FeatureId.FULL_OUTER_JOIN).generate(fullJoin);
            assertTrue(overridden.sql().contains("LEFT OUTER JOIN"), overridden.sql());
            CompileWarning warning = overridden.warnings().get(0);
            assertEquals(WarningCode.OVERRIDE_USED, warning.code());
            assertTrue(warning.message().contains("rows found only on the right are dropped"));
        }

        @Test
        @DisplayName("Columns the target has no type for")
        void testUnmappedType() {
            // GIVEN: A TIME column, which Oracle cannot hold
            Table events = new Table("events", List.of(
                    Column.nullable("name", CanonicalType.varchar(40)),
                    Column.nullable("starts", CanonicalType.of(TypeKind.TIME))));
            PlanBuilder builder = new PlanBuilder(InMemorySchemaCatalog.of(events), QueryFirewall.allowAll());
            String query = "*[events]::starts>>oQ";
            PlanNode plan = builder.build(QueryParser.parse(query, Surface.SYMBOLIC), query);

            // THEN: Refused by default, text fallback with an override
            CodegenException e = assertThrows(CodegenException.class, () -> generate(OracleDialect.INSTANCE, plan));
            assertEquals(FeatureId.UNMAPPED_TYPE, e.feature());
            GeneratedSql overridden = withOverride(OracleDialect.INSTANCE, FeatureId.UNMAPPED_TYPE).generate(plan);
            assertTrue(hasWarning(overridden, WarningCode.OVERRIDE_USED));
            assertEquals("SELECT \"events\".\"starts\" FROM \"events\"", overridden.sql());

            // PostgreSQL has TIME
            assertTrue(generate(PostgreSQLDialect.INSTANCE, plan).warnings().isEmpty());
        }

        @Test
        @DisplayName("Lossy result columns are reported")
        void testLossyColumn() {
            GeneratedSql generated = generate(SQLiteDialect.INSTANCE, symbolic("*[orders]::total>>oQ"));
            assertTrue(hasWarning(generated, WarningCode.LOSSY_MAPPING));
            assertTrue(generated.warnings().get(0).message().contains("orders.total as REAL"),
                    generated.warnings().toString());
        }
    }

    // ==================== Mutations ====================

    @Nested
    @DisplayName("Data modification")
    class Mutations {

        @Test
        @DisplayName("Multi-row INSERT binds every value")
        void testInsert() {
            GeneratedSql generated = generate(PostgreSQLDialect.INSTANCE,
                    sql("INSERT INTO users (id, name) VALUES (5, 'Eve'), (6, 'Frank')"));
            assertEquals("INSERT INTO \"users\" (\"id\", \"name\") VALUES ($1, $2), ($3, $4)", generated.sql());
            assertEquals(List.of(5L, "Eve", 6L, "Frank"), values(generated));
            assertTrue(generated.resultColumns().isEmpty());
        }

        @Test
        @DisplayName("UPDATE numbers SET values before the WHERE clause")
        void testUpdate() {
            GeneratedSql generated = generate(OracleDialect.INSTANCE,
                    sql("UPDATE orders SET total = 12.50 WHERE id = 10"));
            assertEquals("UPDATE \"orders\" SET \"total\" = :1 WHERE \"id\" = :2", generated.sql());
            assertEquals(List.of(new BigDecimal("12.50"), 10L), values(generated));
        }

        @Test
        @DisplayName("DELETE with and without a condition")
        void testDelete() {
            assertEquals("DELETE FROM `orders` WHERE `status` IN (?, ?)",
                    generate(MySQLDialect.INSTANCE, sql("DELETE FROM orders WHERE status IN ('cancelled', 'void')"))
                            .sql());
            assertEquals("DELETE FROM [audit_log]", generate(SQLServerDialect.INSTANCE, sql("DELETE FROM audit_log")).sql());
        }
    }

    @Test
    @DisplayName("Generator requires a dialect")
    void testNullDialect() {
        assertThrows(NullPointerException.class, () -> new SQLGenerator(null));
    }
}
