package org.saiql.engine.transpiler;

import org.saiql.engine.DialectId;
import org.saiql.engine.plan.SqlFunctionCall.ScalarFunction;

import java.util.List;

/**
 * SAP HANA: LIMIT/OFFSET like PostgreSQL, RAND() for random ordering, no
 * JSON array aggregation.
 */
public final class HanaDialect implements SQLDialect {

    public static final HanaDialect INSTANCE = new HanaDialect();

    private HanaDialect() {
        // Singleton
    }

    @Override
    public DialectId id() {
        return DialectId.HANA;
    }

    @Override
    public String function(ScalarFunction function, List<String> arguments) {
        if (function == ScalarFunction.RANDOM) {
            return "RAND()";
        }
        return SQLDialect.super.function(function, arguments);
    }
}
