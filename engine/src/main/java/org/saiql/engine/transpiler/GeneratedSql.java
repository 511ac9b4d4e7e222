package org.saiql.engine.transpiler;

import org.saiql.engine.CompileWarning;
import org.saiql.engine.plan.ResultColumn;

import java.util.List;
import java.util.Objects;

/**
 * Output of the code generator.
 *
 * @param sql              statement text with placeholders
 * @param parameters       bound values in placeholder order
 * @param resultColumns    result columns of a read, empty for a mutation
 * @param warnings         lossy mappings, overrides and deferred features
 * @param requiresOverride whether a deferred unsupported feature was hit
 */
public record GeneratedSql(String sql, List<BoundParameter> parameters, List<ResultColumn> resultColumns,
                           List<CompileWarning> warnings, boolean requiresOverride) {

    public GeneratedSql {
        Objects.requireNonNull(sql, "SQL cannot be null");
        parameters = List.copyOf(parameters);
        resultColumns = List.copyOf(resultColumns);
        warnings = List.copyOf(warnings);
    }
}
