package org.saiql.engine.transpiler;

import org.saiql.engine.DialectId;
import org.saiql.engine.lang.ast.AggregateFunction;
import org.saiql.engine.plan.SqlFunctionCall.ScalarFunction;
import org.saiql.engine.transpiler.json.JsonSqlDialect;

import java.util.List;

/**
 * Interface defining SQL dialect-specific behavior.
 * Implementations handle differences between database engines.
 */
public interface SQLDialect {

    DialectId id();

    /**
     * @return The dialect name (e.g., "DuckDB", "SQLite")
     */
    default String name() {
        return id().displayName();
    }

    /**
     * Quote an identifier (table name, column name, alias).
     * Embedded quote characters are doubled.
     *
     * @param identifier The identifier to quote
     * @return The quoted identifier
     */
    default String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    /**
     * Placeholder for the n-th bound parameter (1-based).
     */
    default String placeholder(int index) {
        return "?";
    }

    /**
     * Table reference with an alias, both already quoted.
     */
    default String aliasTable(String table, String alias) {
        return table + " AS " + alias;
    }

    /**
     * Text placed right after {@code SELECT [DISTINCT]}, for dialects that
     * limit rows there.
     */
    default String selectPrefix(Long limit, long offset) {
        return "";
    }

    /**
     * Row limit clause appended to the statement, with a leading space, or
     * an empty string.
     *
     * @param limit   rows to return, or null for all
     * @param offset  rows to skip
     * @param ordered whether the statement has an ORDER BY
     */
    default String limitClause(Long limit, long offset, boolean ordered) {
        StringBuilder sb = new StringBuilder();
        if (limit != null) {
            sb.append(" LIMIT ").append(limit);
        }
        if (offset > 0) {
            sb.append(" OFFSET ").append(offset);
        }
        return sb.toString();
    }

    /**
     * Renders a scalar function call over already rendered arguments.
     */
    default String function(ScalarFunction function, List<String> arguments) {
        return function.name() + "(" + String.join(", ", arguments) + ")";
    }

    /**
     * Renders an aggregate call over an already rendered argument, or
     * {@code *} for a row count.
     */
    default String aggregate(AggregateFunction function, String argument) {
        return function.name() + "(" + argument + ")";
    }

    /**
     * Case-insensitive LIKE; ILIKE where the backend has it.
     */
    default String caseInsensitiveLike(String value, String pattern) {
        return "LOWER(" + value + ") LIKE LOWER(" + pattern + ")";
    }

    /**
     * A boolean column or value used as a whole condition.
     */
    default String booleanCondition(String expression) {
        return expression;
    }

    /**
     * Get the JSON dialect for database-side JSON output.
     *
     * @return The JSON dialect, or null if not supported
     */
    default JsonSqlDialect getJsonDialect() {
        return null;
    }

    default boolean supports(FeatureId feature) {
        return switch (feature) {
            case JSON_OUTPUT -> getJsonDialect() != null;
            case UNMAPPED_TYPE -> false;
            default -> true;
        };
    }
}
