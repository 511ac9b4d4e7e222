package org.saiql.migration;

import org.saiql.engine.DialectId;
import org.saiql.engine.ErrorCode;
import org.saiql.engine.WarningCode;
import org.saiql.engine.transpiler.FeatureId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link SchemaMigrationPlanner} and the DDL it renders.
 */
@DisplayName("Schema Migration Planner Tests")
class SchemaMigrationPlannerTest {

    private final SchemaMigrationPlanner planner = new SchemaMigrationPlanner();

    private static SourceTable accounts(SourceColumn... extra) {
        List<SourceColumn> columns = new ArrayList<>(List.of(
                new SourceColumn("id", "bigint", false),
                new SourceColumn("name", "character varying(80)", true),
                new SourceColumn("balance", "numeric(50,10)", true),
                new SourceColumn("created", "timestamp(3) with time zone", true)));
        columns.addAll(List.of(extra));
        return new SourceTable("accounts", columns, List.of("id"));
    }

    // ==================== Mapping ====================

    @Nested
    @DisplayName("Column mapping")
    class Mapping {

        @Test
        @DisplayName("PostgreSQL to DuckDB with one lossy column")
        void testPostgresToDuckDb() {
            // WHEN: We plan the accounts table for DuckDB
            MigrationPlan plan = planner.plan(DialectId.POSTGRESQL, List.of(accounts()), DialectId.DUCKDB,
                    MigrationOptions.defaults());

            // THEN: DDL uses DuckDB types and the clamped decimal is reported
            assertEquals(List.of("CREATE TABLE \"accounts\" (\"id\" BIGINT NOT NULL, \"name\" VARCHAR, "
                    + "\"balance\" DECIMAL(38,10), \"created\" TIMESTAMP WITH TIME ZONE, PRIMARY KEY (\"id\"))"),
                    plan.ddl());
            assertEquals(1, plan.warnings().size());
            assertEquals(WarningCode.LOSSY_MAPPING, plan.warnings().get(0).code());
            assertEquals("accounts.balance numeric(50,10) as DECIMAL(38,10): "
                            + "precision/scale reduced from DECIMAL(50,10) to DECIMAL(38,10)",
                    plan.warnings().get(0).message());
            assertEquals(1, plan.table("ACCOUNTS").orElseThrow().lossyColumns());
        }

        @Test
        @DisplayName("MySQL special types land on their PostgreSQL equivalents")
        void testMySqlToPostgres() {
            SourceTable flags = new SourceTable("flags", List.of(
                    new SourceColumn("enabled", "tinyint(1)", false),
                    new SourceColumn("counter", "bigint unsigned", true),
                    new SourceColumn("seen", "datetime(3)", true)), List.of());

            MigrationPlan plan = planner.plan(DialectId.MYSQL, List.of(flags), DialectId.POSTGRESQL,
                    MigrationOptions.defaults());

            assertEquals("CREATE TABLE \"flags\" (\"enabled\" BOOLEAN NOT NULL, \"counter\" NUMERIC(20,0), "
                    + "\"seen\" TIMESTAMP(3))", plan.ddl().get(0));
            assertTrue(plan.warnings().isEmpty(), plan.warnings().toString());
        }

        @Test
        @DisplayName("Target quoting and IF NOT EXISTS")
        void testSqlServerDdl() {
            MigrationPlan plan = planner.plan(DialectId.POSTGRESQL, List.of(accounts()), DialectId.SQLSERVER,
                    MigrationOptions.defaults().withIfNotExists(true));

            String ddl = plan.ddl().get(0);
            assertTrue(ddl.startsWith("CREATE TABLE IF NOT EXISTS [accounts] ([id] BIGINT NOT NULL, "
                    + "[name] NVARCHAR(80), [balance] DECIMAL(38,10), [created] DATETIMEOFFSET(3)"), ddl);
            assertTrue(ddl.endsWith("PRIMARY KEY ([id]))"), ddl);
        }

        @Test
        @DisplayName("Summary lists tables, columns and warnings")
        void testSummary() {
            MigrationPlan plan = planner.plan(DialectId.POSTGRESQL, List.of(accounts()), DialectId.DUCKDB,
                    MigrationOptions.defaults());

            List<String> summary = plan.summary();
            assertEquals("PostgreSQL -> DuckDB: 1 tables, 1 warnings", summary.get(0));
            assertEquals("accounts (4 columns, 1 lossy)", summary.get(1));
            assertEquals("  id: bigint -> BIGINT", summary.get(2));
            assertTrue(summary.get(4).startsWith("  balance: numeric(50,10) -> DECIMAL(38,10) (lossy: "));
        }
    }

    // ==================== Unmapped types ====================

    @Nested
    @DisplayName("Types the target cannot hold")
    class Unmapped {

        @Test
        @DisplayName("Planning stops unless the override is allowed")
        void testUnmappedColumn() {
            SourceTable table = accounts(new SourceColumn("opens", "time", true));

            MigrationException e = assertThrows(MigrationException.class,
                    () -> planner.plan(DialectId.POSTGRESQL, List.of(table), DialectId.ORACLE,
                            MigrationOptions.defaults()));
            assertEquals(ErrorCode.MIGRATION_ERROR, e.errorCode());
            assertTrue(e.getMessage().contains("accounts.opens"), e.getMessage());
        }

        @Test
        @DisplayName("The override creates the column as text")
        void testOverride() {
            SourceTable table = accounts(new SourceColumn("opens", "time", true));

            MigrationPlan plan = planner.plan(DialectId.POSTGRESQL, List.of(table), DialectId.ORACLE,
                    MigrationOptions.defaults().withOverride(FeatureId.UNMAPPED_TYPE));

            ColumnMigration opens = plan.table("accounts").orElseThrow().columns().get(4);
            assertTrue(opens.overridden());
            assertEquals("CLOB", opens.targetType());
            assertEquals("opens: time -> CLOB (override)", opens.describe());
            assertTrue(plan.hasWarning(WarningCode.OVERRIDE_USED));
            assertTrue(plan.ddl().get(0).contains("\"opens\" CLOB"));
        }

        @Test
        @DisplayName("Unknown source types are reported the same way")
        void testUnknownSourceType() {
            SourceTable shapes = new SourceTable("shapes", List.of(
                    new SourceColumn("outline", "geometry", true)), List.of());

            assertThrows(MigrationException.class, () -> planner.plan(DialectId.POSTGRESQL, List.of(shapes),
                    DialectId.DUCKDB, MigrationOptions.defaults()));

            MigrationPlan plan = planner.plan(DialectId.POSTGRESQL, List.of(shapes), DialectId.DUCKDB,
                    MigrationOptions.defaults().withOverride(FeatureId.UNMAPPED_TYPE));
            assertEquals("CREATE TABLE \"shapes\" (\"outline\" VARCHAR)", plan.ddl().get(0));
        }
    }

    @Test
    @DisplayName("A table needs at least one column")
    void testEmptyTable() {
        assertThrows(IllegalArgumentException.class, () -> new SourceTable("empty", List.of(), List.of()));
    }
}
