package org.saiql.engine.types;

import org.saiql.engine.DialectId;
import org.saiql.engine.types.DialectTypeSystem.TargetRule;

import java.util.EnumMap;
import java.util.Map;

import static org.saiql.engine.types.TypeKind.*;

/**
 * Built-in type vocabularies for every {@link DialectId}.
 */
public final class DialectTypeSystems {

    private static final String ORACLE_EMPTY_STRING = "Oracle stores empty strings as NULL";

    private DialectTypeSystems() {
    }

    public static Map<DialectId, DialectTypeSystem> standard() {
        Map<DialectId, DialectTypeSystem> systems = new EnumMap<>(DialectId.class);
        systems.put(DialectId.POSTGRESQL, postgres());
        systems.put(DialectId.MYSQL, mysql());
        systems.put(DialectId.SQLITE, sqlite());
        systems.put(DialectId.DUCKDB, duckdb());
        systems.put(DialectId.SQLSERVER, sqlServer());
        systems.put(DialectId.ORACLE, oracle());
        systems.put(DialectId.HANA, hana());
        return systems;
    }

    public static DialectTypeSystem postgres() {
        return DialectTypeSystem.builder(DialectId.POSTGRESQL)
                .read(BOOLEAN, "boolean", "bool")
                .read(INTEGER16, "smallint", "int2", "smallserial")
                .read(INTEGER32, "integer", "int", "int4", "serial")
                .read(INTEGER64, "bigint", "int8", "bigserial")
                .read(FLOAT32, "real", "float4")
                .read(FLOAT64, "double precision", "float8", "float")
                .read(DECIMAL, "numeric", "decimal")
                .readFixed("money", DECIMAL, 19, 2)
                .read(CHAR, "char", "character", "bpchar")
                .read(VARCHAR, "varchar", "character varying")
                .read(TEXT, "text", "citext", "name")
                .read(BINARY, "bytea")
                .read(DATE, "date")
                .read(TIME, "time", "time without time zone")
                .read(TIMESTAMP, "timestamp", "timestamp without time zone")
                .read(TIMESTAMP_TZ, "timestamptz", "timestamp with time zone")
                .read(UUID, "uuid")
                .read(JSON, "json", "jsonb")
                .write(BOOLEAN, "BOOLEAN")
                .write(INTEGER16, "SMALLINT")
                .write(INTEGER32, "INTEGER")
                .write(INTEGER64, "BIGINT")
                .write(FLOAT32, "REAL")
                .write(FLOAT64, "DOUBLE PRECISION")
                .write(DECIMAL, TargetRule.parameterized("NUMERIC", DECIMAL, 1000).withUnboundedName("NUMERIC"))
                .write(CHAR, TargetRule.parameterized("CHAR", CHAR, 10485760))
                .write(VARCHAR, TargetRule.parameterized("VARCHAR", VARCHAR, 10485760))
                .write(TEXT, "TEXT")
                .write(BINARY, TargetRule.plain("BYTEA", BINARY))
                .write(DATE, "DATE")
                .write(TIME, TargetRule.parameterized("TIME", TIME, 6))
                .write(TIMESTAMP, TargetRule.parameterized("TIMESTAMP", TIMESTAMP, 6))
                .write(TIMESTAMP_TZ, TargetRule.parameterized("TIMESTAMP WITH TIME ZONE", TIMESTAMP_TZ, 6))
                .write(UUID, "UUID")
                .write(JSON, "JSONB")
                .build();
    }

    public static DialectTypeSystem mysql() {
        TargetRule longText = TargetRule.plain("LONGTEXT", TEXT);
        TargetRule longBlob = TargetRule.plain("LONGBLOB", BINARY);
        return DialectTypeSystem.builder(DialectId.MYSQL)
                .readExact("tinyint(1)", BOOLEAN)
                .readExact("bit(1)", BOOLEAN)
                .read(BOOLEAN, "boolean", "bool")
                .read(INTEGER16, "tinyint", "smallint", "year")
                .read(INTEGER32, "mediumint", "int", "integer")
                .read(INTEGER64, "bigint", "int unsigned", "integer unsigned")
                .readFixed("bigint unsigned", DECIMAL, 20, 0)
                .read(FLOAT32, "float")
                .read(FLOAT64, "double", "double precision", "real")
                .read(DECIMAL, "decimal", "numeric", "dec")
                .read(CHAR, "char")
                .read(VARCHAR, "varchar")
                .read(TEXT, "tinytext", "text", "mediumtext", "longtext", "enum", "set")
                .read(BINARY, "binary", "varbinary", "tinyblob", "blob", "mediumblob", "longblob")
                .read(DATE, "date")
                .read(TIME, "time")
                .read(TIMESTAMP, "datetime")
                .read(TIMESTAMP_TZ, "timestamp")
                .read(JSON, "json")
                .write(BOOLEAN, TargetRule.plain("TINYINT(1)", BOOLEAN))
                .write(INTEGER16, "SMALLINT")
                .write(INTEGER32, "INT")
                .write(INTEGER64, "BIGINT")
                .write(FLOAT32, "FLOAT")
                .write(FLOAT64, "DOUBLE")
                .write(DECIMAL, TargetRule.parameterized("DECIMAL", DECIMAL, 65).withMaxScale(30))
                .write(CHAR, TargetRule.parameterized("CHAR", CHAR, 255)
                        .withOverflow(TargetRule.parameterized("VARCHAR", VARCHAR, 16383).withOverflow(longText)))
                .write(VARCHAR, TargetRule.parameterized("VARCHAR", VARCHAR, 16383).withOverflow(longText))
                .write(TEXT, longText)
                .write(BINARY, TargetRule.parameterized("VARBINARY", BINARY, 65535).withOverflow(longBlob))
                .write(DATE, "DATE")
                .write(TIME, TargetRule.parameterized("TIME", TIME, 6))
                .write(TIMESTAMP, TargetRule.parameterized("DATETIME", TIMESTAMP, 6))
                // TIMESTAMP is normalized to UTC and keeps no offset
                .write(TIMESTAMP_TZ, TargetRule.parameterized("TIMESTAMP", TIMESTAMP, 6))
                .write(UUID, TargetRule.plain("CHAR(36)", UUID))
                .write(JSON, "JSON")
                .build();
    }

    public static DialectTypeSystem sqlite() {
        return DialectTypeSystem.builder(DialectId.SQLITE)
                .read(BOOLEAN, "boolean", "bool")
                .read(INTEGER64, "integer", "int", "bigint", "smallint", "tinyint", "mediumint")
                .read(FLOAT64, "real", "double", "double precision", "float")
                .read(DECIMAL, "numeric", "decimal")
                .read(TEXT, "text", "varchar", "char", "character", "clob", "nvarchar", "nchar")
                .read(BINARY, "blob")
                .read(DATE, "date")
                .read(TIMESTAMP, "datetime", "timestamp")
                .write(BOOLEAN, TargetRule.plain("INTEGER", INTEGER64))
                .write(INTEGER16, TargetRule.plain("INTEGER", INTEGER64))
                .write(INTEGER32, TargetRule.plain("INTEGER", INTEGER64))
                .write(INTEGER64, "INTEGER")
                .write(FLOAT32, TargetRule.plain("REAL", FLOAT64))
                .write(FLOAT64, TargetRule.plain("REAL", FLOAT64))
                .write(DECIMAL, TargetRule.plain("REAL", FLOAT64))
                .write(CHAR, TargetRule.plain("TEXT", TEXT))
                .write(VARCHAR, TargetRule.plain("TEXT", TEXT))
                .write(TEXT, "TEXT")
                .write(BINARY, TargetRule.plain("BLOB", BINARY))
                .write(DATE, TargetRule.plain("TEXT", TEXT))
                .write(TIME, TargetRule.plain("TEXT", TEXT))
                .write(TIMESTAMP, TargetRule.plain("TEXT", TEXT))
                .write(TIMESTAMP_TZ, TargetRule.plain("TEXT", TEXT))
                .write(UUID, TargetRule.plain("TEXT", TEXT))
                .write(JSON, TargetRule.plain("TEXT", TEXT))
                .build();
    }

    public static DialectTypeSystem duckdb() {
        return DialectTypeSystem.builder(DialectId.DUCKDB)
                .read(BOOLEAN, "boolean", "bool")
                .read(INTEGER16, "tinyint", "smallint", "int2")
                .read(INTEGER32, "integer", "int", "int4")
                .read(INTEGER64, "bigint", "int8")
                .readFixed("hugeint", DECIMAL, 38, 0)
                .read(FLOAT32, "real", "float", "float4")
                .read(FLOAT64, "double", "float8")
                .read(DECIMAL, "decimal", "numeric")
                .read(TEXT, "varchar", "text", "string", "char", "bpchar")
                .read(BINARY, "blob", "bytea")
                .read(DATE, "date")
                .read(TIME, "time")
                .readFixed("timestamp", TIMESTAMP, 6, null)
                .readFixed("datetime", TIMESTAMP, 6, null)
                .readFixed("timestamp with time zone", TIMESTAMP_TZ, 6, null)
                .readFixed("timestamptz", TIMESTAMP_TZ, 6, null)
                .read(UUID, "uuid")
                .read(JSON, "json")
                .write(BOOLEAN, "BOOLEAN")
                .write(INTEGER16, "SMALLINT")
                .write(INTEGER32, "INTEGER")
                .write(INTEGER64, "BIGINT")
                .write(FLOAT32, "REAL")
                .write(FLOAT64, "DOUBLE")
                .write(DECIMAL, TargetRule.parameterized("DECIMAL", DECIMAL, 38))
                .write(CHAR, TargetRule.plain("VARCHAR", TEXT))
                .write(VARCHAR, TargetRule.plain("VARCHAR", TEXT))
                .write(TEXT, TargetRule.plain("VARCHAR", TEXT))
                .write(BINARY, TargetRule.plain("BLOB", BINARY))
                .write(DATE, "DATE")
                .write(TIME, TargetRule.plain("TIME", TIME).withFixedPrecision(6))
                .write(TIMESTAMP, TargetRule.plain("TIMESTAMP", TIMESTAMP).withFixedPrecision(6))
                .write(TIMESTAMP_TZ, TargetRule.plain("TIMESTAMP WITH TIME ZONE", TIMESTAMP_TZ).withFixedPrecision(6))
                .write(UUID, "UUID")
                .write(JSON, "JSON")
                .build();
    }

    public static DialectTypeSystem sqlServer() {
        TargetRule nvarcharMax = TargetRule.plain("NVARCHAR(MAX)", TEXT);
        TargetRule varbinaryMax = TargetRule.plain("VARBINARY(MAX)", BINARY);
        return DialectTypeSystem.builder(DialectId.SQLSERVER)
                .read(BOOLEAN, "bit")
                .read(INTEGER16, "tinyint", "smallint")
                .read(INTEGER32, "int", "integer")
                .read(INTEGER64, "bigint")
                .read(FLOAT32, "real")
                .read(FLOAT64, "float", "double precision")
                .read(DECIMAL, "decimal", "numeric")
                .readFixed("money", DECIMAL, 19, 4)
                .readFixed("smallmoney", DECIMAL, 10, 4)
                .read(CHAR, "char", "nchar")
                .read(VARCHAR, "varchar", "nvarchar")
                .read(TEXT, "text", "ntext", "xml")
                .read(BINARY, "binary", "varbinary", "image")
                .read(DATE, "date")
                .read(TIME, "time")
                .readFixed("datetime", TIMESTAMP, 3, null)
                .readFixed("smalldatetime", TIMESTAMP, 0, null)
                .read(TIMESTAMP, "datetime2")
                .read(TIMESTAMP_TZ, "datetimeoffset")
                .read(UUID, "uniqueidentifier")
                .write(BOOLEAN, TargetRule.plain("BIT", BOOLEAN))
                .write(INTEGER16, "SMALLINT")
                .write(INTEGER32, "INT")
                .write(INTEGER64, "BIGINT")
                .write(FLOAT32, "REAL")
                .write(FLOAT64, "FLOAT")
                .write(DECIMAL, TargetRule.parameterized("DECIMAL", DECIMAL, 38))
                .write(CHAR, TargetRule.parameterized("NCHAR", CHAR, 4000).withOverflow(nvarcharMax))
                .write(VARCHAR, TargetRule.parameterized("NVARCHAR", VARCHAR, 4000).withOverflow(nvarcharMax))
                .write(TEXT, nvarcharMax)
                .write(BINARY, TargetRule.parameterized("VARBINARY", BINARY, 8000).withOverflow(varbinaryMax))
                .write(DATE, "DATE")
                .write(TIME, TargetRule.parameterized("TIME", TIME, 7))
                .write(TIMESTAMP, TargetRule.parameterized("DATETIME2", TIMESTAMP, 7))
                .write(TIMESTAMP_TZ, TargetRule.parameterized("DATETIMEOFFSET", TIMESTAMP_TZ, 7))
                .write(UUID, TargetRule.plain("UNIQUEIDENTIFIER", UUID))
                .write(JSON, TargetRule.plain("NVARCHAR(MAX)", TEXT))
                .build();
    }

    public static DialectTypeSystem oracle() {
        TargetRule clob = TargetRule.plain("CLOB", TEXT).withNote(ORACLE_EMPTY_STRING);
        TargetRule blob = TargetRule.plain("BLOB", BINARY);
        return DialectTypeSystem.builder(DialectId.ORACLE)
                .read(DECIMAL, "number", "numeric", "decimal")
                .readFixed("integer", DECIMAL, 38, 0)
                .readFixed("int", DECIMAL, 38, 0)
                .readFixed("smallint", DECIMAL, 38, 0)
                .read(FLOAT32, "binary_float")
                .read(FLOAT64, "binary_double", "float")
                .read(CHAR, "char", "nchar")
                .read(VARCHAR, "varchar2", "nvarchar2", "varchar")
                .read(TEXT, "clob", "nclob", "long")
                .read(BINARY, "raw", "blob")
                // DATE carries a time of day down to the second
                .readFixed("date", TIMESTAMP, 0, null)
                .read(TIMESTAMP, "timestamp")
                .read(TIMESTAMP_TZ, "timestamp with time zone", "timestamp with local time zone")
                .read(JSON, "json")
                .write(BOOLEAN, TargetRule.plain("NUMBER(1)", BOOLEAN))
                .write(INTEGER16, TargetRule.plain("NUMBER(5)", INTEGER16))
                .write(INTEGER32, TargetRule.plain("NUMBER(10)", INTEGER32))
                .write(INTEGER64, TargetRule.plain("NUMBER(19)", INTEGER64))
                .write(FLOAT32, "BINARY_FLOAT")
                .write(FLOAT64, "BINARY_DOUBLE")
                .write(DECIMAL, TargetRule.parameterized("NUMBER", DECIMAL, 38).withUnboundedName("NUMBER"))
                .write(CHAR, TargetRule.parameterized("CHAR", CHAR, 2000).withOverflow(clob)
                        .withNote(ORACLE_EMPTY_STRING))
                .write(VARCHAR, TargetRule.parameterized("VARCHAR2", VARCHAR, 4000).withOverflow(clob)
                        .withNote(ORACLE_EMPTY_STRING))
                .write(TEXT, clob)
                .write(BINARY, TargetRule.parameterized("RAW", BINARY, 2000).withOverflow(blob))
                .write(DATE, "DATE")
                .write(TIMESTAMP, TargetRule.parameterized("TIMESTAMP", TIMESTAMP, 9))
                .write(TIMESTAMP_TZ, TargetRule.parameterized("TIMESTAMP WITH TIME ZONE", TIMESTAMP_TZ, 9))
                .write(UUID, TargetRule.plain("RAW(16)", UUID))
                .build();
    }

    public static DialectTypeSystem hana() {
        TargetRule nclob = TargetRule.plain("NCLOB", TEXT);
        TargetRule blob = TargetRule.plain("BLOB", BINARY);
        return DialectTypeSystem.builder(DialectId.HANA)
                .read(BOOLEAN, "boolean")
                .read(INTEGER16, "tinyint", "smallint")
                .read(INTEGER32, "integer", "int")
                .read(INTEGER64, "bigint")
                .readFixed("smalldecimal", DECIMAL, 16, 0)
                .read(DECIMAL, "decimal")
                .read(FLOAT32, "real")
                .read(FLOAT64, "double", "float")
                .read(CHAR, "char", "nchar")
                .read(VARCHAR, "varchar", "nvarchar", "alphanum", "shorttext")
                .read(TEXT, "clob", "nclob", "text")
                .read(BINARY, "varbinary", "blob")
                .read(DATE, "date")
                .readFixed("time", TIME, 0, null)
                .readFixed("seconddate", TIMESTAMP, 0, null)
                .readFixed("timestamp", TIMESTAMP, 7, null)
                .write(BOOLEAN, "BOOLEAN")
                .write(INTEGER16, "SMALLINT")
                .write(INTEGER32, "INTEGER")
                .write(INTEGER64, "BIGINT")
                .write(FLOAT32, "REAL")
                .write(FLOAT64, "DOUBLE")
                .write(DECIMAL, TargetRule.parameterized("DECIMAL", DECIMAL, 38))
                .write(CHAR, TargetRule.parameterized("NCHAR", CHAR, 2000).withOverflow(nclob))
                .write(VARCHAR, TargetRule.parameterized("NVARCHAR", VARCHAR, 5000).withOverflow(nclob))
                .write(TEXT, nclob)
                .write(BINARY, TargetRule.parameterized("VARBINARY", BINARY, 5000).withOverflow(blob))
                .write(DATE, "DATE")
                .write(TIME, TargetRule.plain("TIME", TIME).withFixedPrecision(0))
                .write(TIMESTAMP, TargetRule.plain("TIMESTAMP", TIMESTAMP).withFixedPrecision(7))
                // HANA TIMESTAMP keeps no offset
                .write(TIMESTAMP_TZ, TargetRule.plain("TIMESTAMP", TIMESTAMP).withFixedPrecision(7))
                .write(UUID, TargetRule.plain("NVARCHAR(36)", UUID))
                .build();
    }
}
