package org.saiql.engine.transpiler.json;

import java.util.List;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Dialect interface for JSON result generation.
 *
 * Different databases have different JSON construction functions:
 * - DuckDB, SQLite: json_object(), json_group_array()
 * - PostgreSQL: json_build_object(), json_agg()
 * - MySQL: JSON_OBJECT(), JSON_ARRAYAGG()
 */
public interface JsonSqlDialect {

    /**
     * Function name for constructing a JSON object from key-value pairs.
     * Example: json_object('name', expr, 'age', expr2)
     */
    String jsonObjectFunction();

    /**
     * Function name for aggregating values into a JSON array.
     * Example: json_group_array(expr)
     */
    String jsonArrayAggFunction();

    /**
     * Generates a JSON object construction expression.
     *
     * @param keys   object keys, in output order
     * @param values value expressions (already formatted), one per key
     */
    default String jsonObject(List<String> keys, List<String> values) {
        StringBuilder sb = new StringBuilder(jsonObjectFunction()).append("(");
        for (int i = 0; i < keys.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(quotedKey(keys.get(i))).append(", ").append(values.get(i));
        }
        return sb.append(")").toString();
    }

    /**
     * Generates a JSON array aggregation expression.
     */
    default String jsonArrayAgg(String innerExpression) {
        return jsonArrayAggFunction() + "(" + innerExpression + ")";
    }

    /**
     * Quotes an output column name for use as a JSON key.
     */
    default String quotedKey(String key) {
        return "'" + key.replace("'", "''") + "'";
    }

    /**
     * Joins key/value pairs for dialects that spell them {@code key VALUE expr}.
     */
    static String keyValuePairs(List<String> keys, List<String> values, String separator,
                                UnaryOperator<String> quote) {
        return IntStream.range(0, keys.size())
                .mapToObj(i -> quote.apply(keys.get(i)) + separator + values.get(i))
                .collect(Collectors.joining(", "));
    }
}
