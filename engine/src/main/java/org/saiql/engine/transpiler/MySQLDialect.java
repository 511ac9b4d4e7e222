package org.saiql.engine.transpiler;

import org.saiql.engine.DialectId;
import org.saiql.engine.plan.SqlFunctionCall.ScalarFunction;
import org.saiql.engine.transpiler.json.JsonSqlDialect;
import org.saiql.engine.transpiler.json.MySqlJsonDialect;

import java.util.List;

/**
 * MySQL quotes identifiers with backticks and has no FULL OUTER JOIN.
 */
public final class MySQLDialect implements SQLDialect {

    public static final MySQLDialect INSTANCE = new MySQLDialect();

    /** Largest LIMIT MySQL accepts; it stands for "no limit". */
    private static final String NO_LIMIT = "18446744073709551615";

    private MySQLDialect() {
        // Singleton
    }

    @Override
    public DialectId id() {
        return DialectId.MYSQL;
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return "`" + identifier.replace("`", "``") + "`";
    }

    @Override
    public String limitClause(Long limit, long offset, boolean ordered) {
        if (limit == null && offset > 0) {
            return " LIMIT " + NO_LIMIT + " OFFSET " + offset;
        }
        return SQLDialect.super.limitClause(limit, offset, ordered);
    }

    @Override
    public String function(ScalarFunction function, List<String> arguments) {
        if (function == ScalarFunction.RANDOM) {
            return "RAND()";
        }
        if (function == ScalarFunction.LENGTH) {
            return "CHAR_LENGTH(" + arguments.get(0) + ")";
        }
        return SQLDialect.super.function(function, arguments);
    }

    @Override
    public JsonSqlDialect getJsonDialect() {
        return MySqlJsonDialect.INSTANCE;
    }

    @Override
    public boolean supports(FeatureId feature) {
        return feature != FeatureId.FULL_OUTER_JOIN && SQLDialect.super.supports(feature);
    }
}
