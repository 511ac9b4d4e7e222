package org.saiql.engine.transpiler.json;

import java.util.List;

/**
 * Oracle spells object members {@code 'key' VALUE expr}.
 */
public final class OracleJsonDialect implements JsonSqlDialect {

    public static final OracleJsonDialect INSTANCE = new OracleJsonDialect();

    private OracleJsonDialect() {
    }

    @Override
    public String jsonObjectFunction() {
        return "JSON_OBJECT";
    }

    @Override
    public String jsonArrayAggFunction() {
        return "JSON_ARRAYAGG";
    }

    @Override
    public String jsonObject(List<String> keys, List<String> values) {
        return jsonObjectFunction() + "(" + JsonSqlDialect.keyValuePairs(keys, values, " VALUE ", this::quotedKey) + ")";
    }
}
