package org.saiql.engine.transpiler;

import org.saiql.engine.DialectId;
import org.saiql.engine.lang.ast.AggregateFunction;
import org.saiql.engine.plan.SqlFunctionCall.ScalarFunction;

import java.util.List;

/**
 * SQL Server: bracket quoting, {@code TOP n} or {@code OFFSET ... FETCH},
 * BIT booleans and no database-side JSON arrays.
 */
public final class SQLServerDialect implements SQLDialect {

    public static final SQLServerDialect INSTANCE = new SQLServerDialect();

    private SQLServerDialect() {
        // Singleton
    }

    @Override
    public DialectId id() {
        return DialectId.SQLSERVER;
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return "[" + identifier.replace("]", "]]") + "]";
    }

    @Override
    public String selectPrefix(Long limit, long offset) {
        return limit != null && offset == 0 ? "TOP " + limit + " " : "";
    }

    @Override
    public String limitClause(Long limit, long offset, boolean ordered) {
        if (offset == 0) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        if (!ordered) {
            // OFFSET is only valid after an ORDER BY
            sb.append(" ORDER BY (SELECT NULL)");
        }
        sb.append(" OFFSET ").append(offset).append(" ROWS");
        if (limit != null) {
            sb.append(" FETCH NEXT ").append(limit).append(" ROWS ONLY");
        }
        return sb.toString();
    }

    @Override
    public String function(ScalarFunction function, List<String> arguments) {
        return switch (function) {
            case RANDOM -> "NEWID()";
            case LENGTH -> "LEN(" + arguments.get(0) + ")";
            default -> SQLDialect.super.function(function, arguments);
        };
    }

    @Override
    public String aggregate(AggregateFunction function, String argument) {
        // COUNT is a 32-bit INT here
        return function == AggregateFunction.COUNT
                ? "COUNT_BIG(" + argument + ")"
                : SQLDialect.super.aggregate(function, argument);
    }

    @Override
    public String booleanCondition(String expression) {
        return expression + " = 1";
    }
}
