package org.saiql.engine;

import org.saiql.engine.lang.LexException;
import org.saiql.engine.lang.Surface;
import org.saiql.engine.lang.SyntaxException;
import org.saiql.engine.lang.ast.SinkFormat;
import org.saiql.engine.optimizer.IndexMetadata;
import org.saiql.engine.optimizer.OptimizationLevel;
import org.saiql.engine.plan.ResultColumn;
import org.saiql.engine.transpiler.CodegenException;
import org.saiql.engine.transpiler.FeatureId;
import org.saiql.engine.types.CanonicalType;
import org.saiql.engine.types.TypeKind;
import org.saiql.engine.types.TypeRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link QueryCompiler}: the whole pipeline from query text to a
 * compiled statement.
 */
@DisplayName("Query Compiler Tests")
class QueryCompilerTest {

    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.EPOCH, ZoneOffset.UTC);

    private final QueryCompiler compiler = new QueryCompiler(TypeRegistry.standard(), QueryFirewall.allowAll());

    private CompiledQuery compile(String query, Surface surface, DialectId target, CompileOptions options) {
        return compiler.compile(query, surface, target, SampleSchema.catalog(), IndexMetadata.unavailable(), options);
    }

    private CompiledQuery compile(String query, DialectId target) {
        return compile(query, Surface.SYMBOLIC, target, CompileOptions.defaults());
    }

    // ==================== Successful compilation ====================

    @Nested
    @DisplayName("Compiled statements")
    class Compiled {

        @Test
        @DisplayName("COUNT with a filter binds a single parameter")
        void testCount() {
            // GIVEN: A count of completed orders
            String query = "*COUNT[orders]::*|status='completed'>>oQ";

            // WHEN: We compile for PostgreSQL
            CompiledQuery compiled = compile(query, DialectId.POSTGRESQL);

            // THEN: One placeholder, one value, ready to run
            assertEquals("SELECT COUNT(*) AS \"count\" FROM \"orders\" WHERE \"orders\".\"status\" = $1",
                    compiled.sqlText());
            assertEquals(List.of("completed"), compiled.parameterValues());
            assertEquals(CompileStatus.READY, compiled.status());
            assertTrue(compiled.isReadyToExecute());
            assertEquals(SinkFormat.ROWS, compiled.sinkFormat());
            assertEquals(DialectId.POSTGRESQL, compiled.dialect());
            assertEquals(List.of(new ResultColumn("count", CanonicalType.of(TypeKind.INTEGER64).notNull())),
                    compiled.resultColumns());
        }

        @Test
        @DisplayName("Compiling twice gives identical results")
        void testDeterministic() {
            String query = "*=J[users+orders]::users.name,orders.total|orders.status='completed' and users.age>20>>oQ";
            CompileOptions options = CompileOptions.builder().clock(FIXED_CLOCK).build();
            assertEquals(compile(query, Surface.SYMBOLIC, DialectId.DUCKDB, options),
                    compile(query, Surface.SYMBOLIC, DialectId.DUCKDB, options));
        }

        @Test
        @DisplayName("Both surfaces compile to the same statement")
        void testSurfacesAgree() {
            CompiledQuery symbolic = compile("*[users]::name|age>30>>oQ", DialectId.DUCKDB);
            CompiledQuery sql = compile("SELECT name FROM users WHERE age > 30", Surface.SQL_SUBSET,
                    DialectId.DUCKDB, CompileOptions.defaults());

            assertEquals(symbolic.sqlText(), sql.sqlText());
            assertEquals(symbolic.parameters(), sql.parameters());
        }

        @Test
        @DisplayName("Explain records join order and access paths")
        void testExplain() {
            CompiledQuery compiled = compile("*=J[users+orders]::users.name,orders.total>>oQ", DialectId.SQLITE);

            ExplainInfo explain = compiled.explain();
            assertEquals(2, explain.joinOrder().size());
            assertTrue(explain.joinOrder().containsAll(List.of("users", "orders")));
            assertEquals("full scan", explain.accessPaths().get("users"));
            assertTrue(explain.iterations() >= 1);
            assertTrue(explain.describe().get(0).startsWith("join order: "));
        }

        @Test
        @DisplayName("Data modification has no sink format or result columns")
        void testMutation() {
            CompiledQuery compiled = compile("DELETE FROM orders WHERE id = 14", Surface.SQL_SUBSET,
                    DialectId.MYSQL, CompileOptions.defaults());

            assertEquals("DELETE FROM `orders` WHERE `id` = ?", compiled.sqlText());
            assertEquals(List.of(14L), compiled.parameterValues());
            assertNull(compiled.sinkFormat());
            assertTrue(compiled.resultColumns().isEmpty());
            assertEquals(ExplainInfo.empty(), compiled.explain());
        }

        @Test
        @DisplayName("Lossy result columns come back as warnings, not failures")
        void testLossyWarning() {
            CompiledQuery compiled = compile("*[orders]::id,total>>oQ", DialectId.SQLITE);
            assertTrue(compiled.isReadyToExecute());
            assertTrue(compiled.hasWarning(WarningCode.LOSSY_MAPPING));
        }

        @Test
        @DisplayName("A cancelled optimization still compiles")
        void testCancelledOptimizer() {
            CancellationToken token = CancellationToken.none();
            token.cancel();
            CompileOptions options = CompileOptions.builder().cancellationToken(token).build();

            CompiledQuery compiled = compile("*[users]::name>>oQ", Surface.SYMBOLIC, DialectId.DUCKDB, options);

            assertTrue(compiled.hasWarning(WarningCode.OPTIMIZER_TIMEOUT));
            assertEquals("SELECT \"users\".\"name\" FROM \"users\"", compiled.sqlText());
        }
    }

    // ==================== Optimization levels ====================

    @Nested
    @DisplayName("Optimization levels, cost and timing")
    class Levels {

        private static final String JOIN = "*=J[users+orders]::orders.total>>oQ";

        private CompiledQuery compileAt(OptimizationLevel level) {
            return compile(JOIN, Surface.SYMBOLIC, DialectId.DUCKDB,
                    CompileOptions.builder().optimizationLevel(level).build());
        }

        @Test
        @DisplayName("STANDARD is the default level")
        void testDefaultLevel() {
            assertEquals(OptimizationLevel.STANDARD, CompileOptions.defaults().optimizationLevel());
            assertEquals(compileAt(OptimizationLevel.STANDARD).sqlText(), compile(JOIN, DialectId.DUCKDB).sqlText());
        }

        @Test
        @DisplayName("NONE skips the optimizer and joins whole tables")
        void testNone() {
            // WHEN: We compile a join without optimization
            CompiledQuery compiled = compileAt(OptimizationLevel.NONE);

            // THEN: No rule ran and the scans were not narrowed
            assertEquals("SELECT \"orders\".\"total\" "
                    + "FROM \"users\" INNER JOIN \"orders\" ON \"users\".\"id\" = \"orders\".\"user_id\"",
                    compiled.sqlText());
            assertEquals(0, compiled.explain().iterations());
            assertTrue(compiled.explain().rulesApplied().isEmpty());
            assertEquals("full scan", compiled.explain().accessPaths().get("orders"));
        }

        @Test
        @DisplayName("Pruned join inputs read only the columns the query needs")
        void testPrunedJoinInputs() {
            // WHEN: We compile the same join at the default level
            CompiledQuery compiled = compileAt(OptimizationLevel.STANDARD);

            // THEN: Each side is a derived table of its kept columns
            String sql = compiled.sqlText();
            assertTrue(sql.contains("(SELECT \"id\" FROM \"users\") AS \"users\""), sql);
            assertTrue(sql.contains("(SELECT \"user_id\", \"total\" FROM \"orders\") AS \"orders\""), sql);
            assertTrue(compiled.explain().rulesApplied().contains("ProjectionPruningRule"));
        }

        @Test
        @DisplayName("BASIC prunes but leaves access paths uncosted")
        void testBasic() {
            CompiledQuery compiled = compileAt(OptimizationLevel.BASIC);

            assertEquals(List.of("ProjectionPruningRule"), compiled.explain().rulesApplied());
            assertTrue(compiled.sqlText().contains("(SELECT \"id\" FROM \"users\") AS \"users\""),
                    compiled.sqlText());
        }

        @Test
        @DisplayName("AGGRESSIVE compiles like STANDARD")
        void testAggressive() {
            assertEquals(compileAt(OptimizationLevel.STANDARD).sqlText(),
                    compileAt(OptimizationLevel.AGGRESSIVE).sqlText());
        }

        @Test
        @DisplayName("Explain carries the plan's estimated cost")
        void testEstimatedCost() {
            // GIVEN: A single scan of a table with the default 1000 rows
            CompiledQuery compiled = compile("*[users]::name>>oQ", DialectId.DUCKDB);

            // THEN: The estimate is one full scan
            assertEquals(10.0, compiled.explain().estimatedCost(), 1e-9);
            assertTrue(compiled.explain().describe().contains("estimated cost: 10.00"));
        }

        @Test
        @DisplayName("Compile time is read from the options' clock")
        void testCompileTime() {
            CompileOptions fixed = CompileOptions.builder().clock(FIXED_CLOCK).build();

            assertEquals(Duration.ZERO, compile("*[users]>>oQ", Surface.SYMBOLIC, DialectId.DUCKDB, fixed).compileTime());
            assertFalse(compile("*[users]>>oQ", DialectId.DUCKDB).compileTime().isNegative());
        }
    }

    // ==================== Unsupported features ====================

    @Nested
    @DisplayName("Unsupported features")
    class Overrides {

        private static final String FULL_JOIN =
                "*=F[users+orders](users.id=orders.user_id)::users.name,orders.total>>oQ";

        @Test
        @DisplayName("Default: compilation fails with the feature named")
        void testFailure() {
            CodegenException e = assertThrows(CodegenException.class, () -> compile(FULL_JOIN, DialectId.MYSQL));
            assertEquals(FeatureId.FULL_OUTER_JOIN, e.feature());
            assertEquals(ErrorCode.Stage.CODEGEN, e.errorCode().stage());
        }

        @Test
        @DisplayName("Deferred: REQUIRES_OVERRIDE with a warning")
        void testDeferred() {
            CompileOptions options = CompileOptions.builder().deferUnsupported(true).build();

            CompiledQuery compiled = compile(FULL_JOIN, Surface.SYMBOLIC, DialectId.MYSQL, options);

            assertEquals(CompileStatus.REQUIRES_OVERRIDE, compiled.status());
            assertFalse(compiled.isReadyToExecute());
            assertTrue(compiled.hasWarning(WarningCode.UNSUPPORTED_FEATURE));
        }

        @Test
        @DisplayName("Allowed override: READY with the fallback recorded")
        void testOverride() {
            CompileOptions options = CompileOptions.builder().allowOverride(FeatureId.FULL_OUTER_JOIN).build();

            CompiledQuery compiled = compile(FULL_JOIN, Surface.SYMBOLIC, DialectId.MYSQL, options);

            assertEquals(CompileStatus.READY, compiled.status());
            assertTrue(compiled.hasWarning(WarningCode.OVERRIDE_USED));
            assertTrue(compiled.sqlText().contains("LEFT OUTER JOIN"), compiled.sqlText());
        }
    }

    // ==================== Failures ====================

    @Nested
    @DisplayName("Failures carry the stage that raised them")
    class Failures {

        @Test
        @DisplayName("Lexer")
        void testLexFailure() {
            LexException e = assertThrows(LexException.class, () -> compile("*[users]#>>oQ", DialectId.DUCKDB));
            assertEquals(ErrorCode.Stage.LEXER, e.errorCode().stage());
        }

        @Test
        @DisplayName("Parser")
        void testSyntaxFailure() {
            SyntaxException e = assertThrows(SyntaxException.class, () -> compile("*[users]", DialectId.DUCKDB));
            assertEquals(ErrorCode.SYNTAX_ERROR, e.errorCode());
        }

        @Test
        @DisplayName("Validator")
        void testValidatorFailure() {
            QueryCompileException e = assertThrows(QueryCompileException.class,
                    () -> compile("*[customers]>>oQ", DialectId.DUCKDB));
            assertEquals(ErrorCode.UNKNOWN_TABLE, e.errorCode());
            assertEquals(ErrorCode.Stage.VALIDATOR, e.errorCode().stage());
        }

        @Test
        @DisplayName("Firewall sees the normalized text and can block it")
        void testFirewall() {
            // GIVEN: A firewall that records what it inspects and blocks orders
            List<String> seen = new ArrayList<>();
            QueryFirewall firewall = query -> {
                seen.add(query);
                return query.contains("orders") ? FirewallVerdict.block("orders are private") : FirewallVerdict.allow();
            };
            QueryCompiler guarded = new QueryCompiler(TypeRegistry.standard(), firewall);

            // WHEN: A spaced-out query is compiled
            QueryCompileException e = assertThrows(QueryCompileException.class,
                    () -> guarded.compile("*[ orders ]  >>oQ", Surface.SYMBOLIC, DialectId.DUCKDB,
                            SampleSchema.catalog(), IndexMetadata.unavailable(), CompileOptions.defaults()));

            // THEN: It is rejected and the firewall saw the normalized form
            assertEquals(ErrorCode.FIREWALL_REJECTED, e.errorCode());
            assertEquals(List.of("* [ orders ] >> oQ"), seen);
        }

        @Test
        @DisplayName("Collaborators and arguments are required")
        void testNullArguments() {
            assertThrows(NullPointerException.class, () -> new QueryCompiler(null, QueryFirewall.allowAll()));
            assertThrows(NullPointerException.class, () -> new QueryCompiler(TypeRegistry.standard(), null));
            assertThrows(NullPointerException.class, () -> compiler.compile("*[users]>>oQ", Surface.SYMBOLIC,
                    DialectId.DUCKDB, null, IndexMetadata.unavailable(), CompileOptions.defaults()));
            assertThrows(NullPointerException.class, () -> compiler.compile(null, Surface.SYMBOLIC,
                    DialectId.DUCKDB, SampleSchema.catalog(), IndexMetadata.unavailable(), CompileOptions.defaults()));
        }
    }
}
