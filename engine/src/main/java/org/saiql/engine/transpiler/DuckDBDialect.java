package org.saiql.engine.transpiler;

import org.saiql.engine.DialectId;
import org.saiql.engine.transpiler.json.DuckDbJsonDialect;
import org.saiql.engine.transpiler.json.JsonSqlDialect;

/**
 * SQL dialect implementation for DuckDB.
 * DuckDB uses double quotes for identifiers and supports ILIKE.
 */
public final class DuckDBDialect implements SQLDialect {

    public static final DuckDBDialect INSTANCE = new DuckDBDialect();

    private DuckDBDialect() {
        // Singleton
    }

    @Override
    public DialectId id() {
        return DialectId.DUCKDB;
    }

    @Override
    public String caseInsensitiveLike(String value, String pattern) {
        return value + " ILIKE " + pattern;
    }

    @Override
    public JsonSqlDialect getJsonDialect() {
        return DuckDbJsonDialect.INSTANCE;
    }
}
