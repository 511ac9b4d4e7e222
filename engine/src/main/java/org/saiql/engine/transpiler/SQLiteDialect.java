package org.saiql.engine.transpiler;

import org.saiql.engine.DialectId;
import org.saiql.engine.transpiler.json.DuckDbJsonDialect;
import org.saiql.engine.transpiler.json.JsonSqlDialect;

/**
 * SQL dialect implementation for SQLite.
 * SQLite needs a LIMIT before OFFSET; {@code LIMIT -1} means no limit.
 */
public final class SQLiteDialect implements SQLDialect {

    public static final SQLiteDialect INSTANCE = new SQLiteDialect();

    private SQLiteDialect() {
        // Singleton
    }

    @Override
    public DialectId id() {
        return DialectId.SQLITE;
    }

    @Override
    public String limitClause(Long limit, long offset, boolean ordered) {
        if (limit == null && offset > 0) {
            return " LIMIT -1 OFFSET " + offset;
        }
        return SQLDialect.super.limitClause(limit, offset, ordered);
    }

    @Override
    public JsonSqlDialect getJsonDialect() {
        // The JSON1 functions share DuckDB's names
        return DuckDbJsonDialect.INSTANCE;
    }
}
