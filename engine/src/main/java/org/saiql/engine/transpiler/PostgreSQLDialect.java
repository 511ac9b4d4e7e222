package org.saiql.engine.transpiler;

import org.saiql.engine.DialectId;
import org.saiql.engine.transpiler.json.JsonSqlDialect;
import org.saiql.engine.transpiler.json.PostgresJsonDialect;

/**
 * PostgreSQL uses numbered placeholders ({@code $1}) and has a native ILIKE.
 */
public final class PostgreSQLDialect implements SQLDialect {

    public static final PostgreSQLDialect INSTANCE = new PostgreSQLDialect();

    private PostgreSQLDialect() {
        // Singleton
    }

    @Override
    public DialectId id() {
        return DialectId.POSTGRESQL;
    }

    @Override
    public String placeholder(int index) {
        return "$" + index;
    }

    @Override
    public String caseInsensitiveLike(String value, String pattern) {
        return value + " ILIKE " + pattern;
    }

    @Override
    public JsonSqlDialect getJsonDialect() {
        return PostgresJsonDialect.INSTANCE;
    }
}
