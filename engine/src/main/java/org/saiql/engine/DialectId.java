package org.saiql.engine;

import java.util.Locale;

/**
 * Backend database kinds the compiler and the type registry know about.
 */
public enum DialectId {
    POSTGRESQL("PostgreSQL"),
    MYSQL("MySQL"),
    SQLITE("SQLite"),
    DUCKDB("DuckDB"),
    SQLSERVER("SQL Server"),
    ORACLE("Oracle"),
    HANA("SAP HANA");

    private final String displayName;

    DialectId(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Resolves a dialect from a user-facing name such as {@code postgres} or
     * {@code mssql}.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static DialectId fromName(String name) {
        String key = name.trim().toLowerCase(Locale.ROOT);
        return switch (key) {
            case "postgresql", "postgres", "pg" -> POSTGRESQL;
            case "mysql", "mariadb" -> MYSQL;
            case "sqlite" -> SQLITE;
            case "duckdb" -> DUCKDB;
            case "sqlserver", "mssql" -> SQLSERVER;
            case "oracle" -> ORACLE;
            case "hana", "saphana" -> HANA;
            default -> throw new IllegalArgumentException("Unknown dialect: " + name);
        };
    }
}
