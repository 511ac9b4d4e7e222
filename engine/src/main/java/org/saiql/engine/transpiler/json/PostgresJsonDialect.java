package org.saiql.engine.transpiler.json;

/**
 * PostgreSQL JSON functions: json_build_object and json_agg.
 */
public final class PostgresJsonDialect implements JsonSqlDialect {

    public static final PostgresJsonDialect INSTANCE = new PostgresJsonDialect();

    private PostgresJsonDialect() {
    }

    @Override
    public String jsonObjectFunction() {
        return "json_build_object";
    }

    @Override
    public String jsonArrayAggFunction() {
        return "json_agg";
    }
}
