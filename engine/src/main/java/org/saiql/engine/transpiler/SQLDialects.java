package org.saiql.engine.transpiler;

import org.saiql.engine.DialectId;

/**
 * Looks up the built-in dialect for a backend.
 */
public final class SQLDialects {

    private SQLDialects() {
    }

    public static SQLDialect forId(DialectId id) {
        return switch (id) {
            case POSTGRESQL -> PostgreSQLDialect.INSTANCE;
            case MYSQL -> MySQLDialect.INSTANCE;
            case SQLITE -> SQLiteDialect.INSTANCE;
            case DUCKDB -> DuckDBDialect.INSTANCE;
            case SQLSERVER -> SQLServerDialect.INSTANCE;
            case ORACLE -> OracleDialect.INSTANCE;
            case HANA -> HanaDialect.INSTANCE;
        };
    }
}
