package org.saiql.engine;

import org.saiql.engine.lang.ast.SinkFormat;
import org.saiql.engine.plan.ResultColumn;
import org.saiql.engine.transpiler.BoundParameter;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * A compiled statement ready to be prepared on the target backend.
 *
 * @param dialect       target backend
 * @param sqlText       statement with placeholders
 * @param parameters    values to bind, in placeholder order
 * @param warnings      optimizer and code generation diagnostics
 * @param explain       optimizer decisions
 * @param status        whether the statement may run as is
 * @param sinkFormat    requested output shape; null for data modification
 * @param resultColumns columns of the result set; empty for data modification
 * @param compileTime   time from lexing to generated SQL, read from the options' clock
 */
public record CompiledQuery(DialectId dialect, String sqlText, List<BoundParameter> parameters,
                            List<CompileWarning> warnings, ExplainInfo explain, CompileStatus status,
                            SinkFormat sinkFormat, List<ResultColumn> resultColumns, Duration compileTime) {

    public CompiledQuery {
        Objects.requireNonNull(dialect, "Dialect cannot be null");
        Objects.requireNonNull(sqlText, "SQL text cannot be null");
        Objects.requireNonNull(explain, "Explain cannot be null");
        Objects.requireNonNull(status, "Status cannot be null");
        Objects.requireNonNull(compileTime, "Compile time cannot be null");
        parameters = List.copyOf(parameters);
        warnings = List.copyOf(warnings);
        resultColumns = List.copyOf(resultColumns);
    }

    public boolean isReadyToExecute() {
        return status == CompileStatus.READY;
    }

    public boolean hasWarning(WarningCode code) {
        return warnings.stream().anyMatch(w -> w.code() == code);
    }

    /**
     * Bound values in placeholder order.
     */
    public List<Object> parameterValues() {
        return parameters.stream().map(BoundParameter::value).toList();
    }
}
