package org.saiql.engine.transpiler;

import org.saiql.engine.DialectId;
import org.saiql.engine.plan.SqlFunctionCall.ScalarFunction;
import org.saiql.engine.transpiler.json.JsonSqlDialect;
import org.saiql.engine.transpiler.json.OracleJsonDialect;

import java.util.List;

/**
 * Oracle: {@code :n} placeholders, no AS before table aliases, and
 * {@code FETCH FIRST} row limits.
 */
public final class OracleDialect implements SQLDialect {

    public static final OracleDialect INSTANCE = new OracleDialect();

    private OracleDialect() {
        // Singleton
    }

    @Override
    public DialectId id() {
        return DialectId.ORACLE;
    }

    @Override
    public String placeholder(int index) {
        return ":" + index;
    }

    @Override
    public String aliasTable(String table, String alias) {
        return table + " " + alias;
    }

    @Override
    public String limitClause(Long limit, long offset, boolean ordered) {
        StringBuilder sb = new StringBuilder();
        if (offset > 0) {
            sb.append(" OFFSET ").append(offset).append(" ROWS");
        }
        if (limit != null) {
            sb.append(" FETCH FIRST ").append(limit).append(" ROWS ONLY");
        }
        return sb.toString();
    }

    @Override
    public String function(ScalarFunction function, List<String> arguments) {
        if (function == ScalarFunction.RANDOM) {
            return "DBMS_RANDOM.VALUE";
        }
        return SQLDialect.super.function(function, arguments);
    }

    @Override
    public String booleanCondition(String expression) {
        return expression + " = 1";
    }

    @Override
    public JsonSqlDialect getJsonDialect() {
        return OracleJsonDialect.INSTANCE;
    }
}
