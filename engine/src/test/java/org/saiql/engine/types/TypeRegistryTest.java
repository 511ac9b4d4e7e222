package org.saiql.engine.types;

import org.saiql.engine.DialectId;
import org.saiql.engine.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link TypeRegistry}: reading backend signatures, rendering
 * canonical types per dialect, and lossiness.
 */
@DisplayName("Type Registry Tests")
class TypeRegistryTest {

    private final TypeRegistry registry = TypeRegistry.standard();

    // ==================== Parsing ====================

    @Nested
    @DisplayName("Reading backend signatures")
    class Parsing {

        @Test
        @DisplayName("PostgreSQL parameters and multi-word names")
        void testPostgresSignatures() {
            assertEquals(CanonicalType.varchar(40), registry.parse(DialectId.POSTGRESQL, "character varying(40)"));
            assertEquals(CanonicalType.decimal(20, 4), registry.parse(DialectId.POSTGRESQL, "numeric(20,4)"));
            assertEquals(CanonicalType.timestampTz(3),
                    registry.parse(DialectId.POSTGRESQL, "timestamp(3) with time zone"));
            assertEquals(CanonicalType.decimal(19, 2), registry.parse(DialectId.POSTGRESQL, "money"));
            assertEquals(CanonicalType.of(TypeKind.INTEGER32), registry.parse(DialectId.POSTGRESQL, "INT4"));
        }

        @Test
        @DisplayName("MySQL special cases")
        void testMySqlSignatures() {
            assertEquals(CanonicalType.of(TypeKind.BOOLEAN), registry.parse(DialectId.MYSQL, "tinyint(1)"));
            assertEquals(CanonicalType.of(TypeKind.INTEGER16), registry.parse(DialectId.MYSQL, "tinyint(4)"));
            assertEquals(CanonicalType.decimal(20, 0), registry.parse(DialectId.MYSQL, "bigint unsigned"));
            assertEquals(CanonicalType.of(TypeKind.TIMESTAMP_TZ), registry.parse(DialectId.MYSQL, "timestamp"));
            assertEquals(CanonicalType.varchar(255), registry.parse(DialectId.MYSQL, "VARCHAR(255)"));
        }

        @Test
        @DisplayName("SQLite affinity names collapse to few kinds")
        void testSqliteSignatures() {
            assertEquals(CanonicalType.of(TypeKind.TEXT), registry.parse(DialectId.SQLITE, "varchar(255)"));
            assertEquals(CanonicalType.of(TypeKind.INTEGER64), registry.parse(DialectId.SQLITE, "int"));
        }

        @Test
        @DisplayName("Unknown type names the dialect and the signature")
        void testUnknownType() {
            TypeMappingException e = assertThrows(TypeMappingException.class,
                    () -> registry.parse(DialectId.POSTGRESQL, "geometry"));
            assertEquals(ErrorCode.UNSUPPORTED_TYPE, e.errorCode());
            assertEquals(DialectId.POSTGRESQL, e.dialect());
            assertEquals("geometry", e.type());

            assertThrows(TypeMappingException.class, () -> registry.parse(DialectId.SQLITE, "uuid"));
        }
    }

    // ==================== Rendering ====================

    @Nested
    @DisplayName("Rendering canonical types")
    class Rendering {

        @Test
        @DisplayName("PostgreSQL keeps parameters")
        void testPostgresTargets() {
            assertEquals("NUMERIC(12,2)", registry.toTarget(CanonicalType.decimal(12, 2), DialectId.POSTGRESQL)
                    .targetSignature());
            assertEquals("NUMERIC", registry.toTarget(CanonicalType.of(TypeKind.DECIMAL), DialectId.POSTGRESQL)
                    .targetSignature());
            assertEquals("TIMESTAMP(3) WITH TIME ZONE",
                    registry.toTarget(CanonicalType.timestampTz(3), DialectId.POSTGRESQL).targetSignature());
        }

        @Test
        @DisplayName("DuckDB clamps decimals to 38 digits and reports the loss")
        void testDuckDbDecimalClamp() {
            // GIVEN: A wide PostgreSQL numeric
            TypeMapping mapping = registry.mapType(DialectId.POSTGRESQL, "numeric(50,10)", DialectId.DUCKDB);

            // THEN: Precision is clamped and the mapping is lossy
            assertEquals("DECIMAL(38,10)", mapping.targetSignature());
            assertTrue(mapping.lossy());
            assertEquals("precision/scale reduced from DECIMAL(50,10) to DECIMAL(38,10)", mapping.reason());
            assertEquals(DialectId.POSTGRESQL, mapping.sourceDialect());
        }

        @Test
        @DisplayName("DuckDB writes VARCHAR for every character type")
        void testDuckDbCharacters() {
            TypeMapping mapping = registry.toTarget(CanonicalType.varchar(100), DialectId.DUCKDB);
            assertEquals("VARCHAR", mapping.targetSignature());
            assertFalse(mapping.lossy());
            assertEquals("BIGINT", registry.toTarget(CanonicalType.of(TypeKind.INTEGER64), DialectId.DUCKDB)
                    .targetSignature());
        }

        @Test
        @DisplayName("SQLite stores decimals as REAL, which is lossy")
        void testSqliteTargets() {
            TypeMapping decimal = registry.toTarget(CanonicalType.decimal(12, 2), DialectId.SQLITE);
            assertEquals("REAL", decimal.targetSignature());
            assertEquals("exact DECIMAL(12,2) becomes approximate FLOAT64", decimal.reason());

            TypeMapping bool = registry.toTarget(CanonicalType.of(TypeKind.BOOLEAN), DialectId.SQLITE);
            assertEquals("INTEGER", bool.targetSignature());
            assertFalse(bool.lossy());
            assertFalse(registry.toTarget(CanonicalType.timestamp(6), DialectId.SQLITE).lossy());
            assertFalse(registry.toTarget(CanonicalType.varchar(10), DialectId.SQLITE).lossy());
        }

        @Test
        @DisplayName("MySQL drops time zone offsets and overflows long varchar")
        void testMySqlTargets() {
            TypeMapping tz = registry.toTarget(CanonicalType.timestampTz(6), DialectId.MYSQL);
            assertEquals("TIMESTAMP(6)", tz.targetSignature());
            assertEquals("time zone offset dropped", tz.reason());

            TypeMapping wide = registry.toTarget(CanonicalType.varchar(20000), DialectId.MYSQL);
            assertEquals("LONGTEXT", wide.targetSignature());
            assertFalse(wide.lossy());
            assertEquals("TINYINT(1)", registry.toTarget(CanonicalType.of(TypeKind.BOOLEAN), DialectId.MYSQL)
                    .targetSignature());
        }

        @Test
        @DisplayName("SQL Server switches to NVARCHAR(MAX) past 4000 characters")
        void testSqlServerTargets() {
            assertEquals("NVARCHAR(100)", registry.toTarget(CanonicalType.varchar(100), DialectId.SQLSERVER)
                    .targetSignature());
            TypeMapping wide = registry.toTarget(CanonicalType.varchar(5000), DialectId.SQLSERVER);
            assertEquals("NVARCHAR(MAX)", wide.targetSignature());
            assertFalse(wide.lossy());
        }

        @Test
        @DisplayName("Oracle notes empty-string semantics and has no TIME")
        void testOracleTargets() {
            TypeMapping varchar = registry.toTarget(CanonicalType.varchar(100), DialectId.ORACLE);
            assertEquals("VARCHAR2(100)", varchar.targetSignature());
            assertTrue(varchar.lossy());
            assertEquals("Oracle stores empty strings as NULL", varchar.reason());

            assertEquals("NUMBER(19)", registry.toTarget(CanonicalType.of(TypeKind.INTEGER64), DialectId.ORACLE)
                    .targetSignature());

            TypeMappingException e = assertThrows(TypeMappingException.class,
                    () -> registry.toTarget(CanonicalType.of(TypeKind.TIME), DialectId.ORACLE));
            assertEquals(DialectId.ORACLE, e.dialect());
            assertFalse(registry.isRepresentable(CanonicalType.of(TypeKind.TIME), DialectId.ORACLE));
            assertFalse(registry.isRepresentable(CanonicalType.of(TypeKind.JSON), DialectId.ORACLE));
        }

        @Test
        @DisplayName("HANA has no JSON type")
        void testHanaJson() {
            assertFalse(registry.isRepresentable(CanonicalType.of(TypeKind.JSON), DialectId.HANA));
            assertThrows(TypeMappingException.class,
                    () -> registry.toTarget(CanonicalType.of(TypeKind.JSON), DialectId.HANA));
        }

        @Test
        @DisplayName("Every dialect renders the common column types")
        void testCommonTypesEverywhere() {
            List<CanonicalType> common = List.of(
                    CanonicalType.of(TypeKind.BOOLEAN),
                    CanonicalType.of(TypeKind.INTEGER32),
                    CanonicalType.of(TypeKind.INTEGER64),
                    CanonicalType.decimal(10, 2),
                    CanonicalType.varchar(50),
                    CanonicalType.of(TypeKind.TEXT),
                    CanonicalType.of(TypeKind.DATE),
                    CanonicalType.timestamp(3));
            for (DialectId dialect : DialectId.values()) {
                for (CanonicalType type : common) {
                    TypeMapping mapping = assertDoesNotThrow(() -> registry.toTarget(type, dialect),
                            type + " on " + dialect);
                    assertNotNull(mapping.targetSignature());
                    assertTrue(registry.isRepresentable(type, dialect));
                }
            }
        }
    }

    // ==================== Lossiness ====================

    @Nested
    @DisplayName("Lossiness between canonical types")
    class Conversions {

        @Test
        @DisplayName("Explicit target signature narrowing an integer")
        void testExplicitTarget() {
            TypeMapping mapping = registry.mapType(DialectId.POSTGRESQL, "bigint", DialectId.MYSQL, "int");
            assertEquals("int", mapping.targetSignature());
            assertTrue(mapping.lossy());
            assertEquals("INTEGER64 narrowed to INTEGER32, large values overflow", mapping.reason());
        }

        @Test
        @DisplayName("Same-kind mappings between dialects")
        void testCrossDialect() {
            TypeMapping mapping = registry.mapType(DialectId.MYSQL, "datetime(3)", DialectId.POSTGRESQL);
            assertEquals("TIMESTAMP(3)", mapping.targetSignature());
            assertFalse(mapping.lossy());
            assertEquals(CanonicalType.timestamp(3), mapping.canonical());
        }

        @Test
        @DisplayName("Length, widening and fractional seconds")
        void testConversionRules() {
            Lossiness shorter = registry.conversion(CanonicalType.varchar(100), CanonicalType.varchar(50));
            assertEquals("length reduced from VARCHAR(100) to VARCHAR(50), longer values are truncated",
                    shorter.reason());

            assertEquals(Lossiness.NONE, registry.conversion(CanonicalType.of(TypeKind.INTEGER32),
                    CanonicalType.of(TypeKind.INTEGER64)));
            assertEquals(Lossiness.NONE, registry.conversion(CanonicalType.of(TypeKind.DATE),
                    CanonicalType.timestamp(0)));
            assertEquals("fractional seconds reduced from 6 to 3 digits",
                    registry.conversion(CanonicalType.timestamp(6), CanonicalType.timestamp(3)).reason());
        }

        @Test
        @DisplayName("Reasons of combined losses are joined in order")
        void testCombinedReasons() {
            Lossiness combined = registry.conversion(CanonicalType.timestampTz(6), CanonicalType.timestamp(3));
            assertEquals("time zone offset dropped; fractional seconds reduced from 6 to 3 digits", combined.reason());
        }
    }
}
