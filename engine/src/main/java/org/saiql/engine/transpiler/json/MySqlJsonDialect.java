package org.saiql.engine.transpiler.json;

/**
 * MySQL JSON functions: JSON_OBJECT and JSON_ARRAYAGG.
 */
public final class MySqlJsonDialect implements JsonSqlDialect {

    public static final MySqlJsonDialect INSTANCE = new MySqlJsonDialect();

    private MySqlJsonDialect() {
    }

    @Override
    public String jsonObjectFunction() {
        return "JSON_OBJECT";
    }

    @Override
    public String jsonArrayAggFunction() {
        return "JSON_ARRAYAGG";
    }
}
