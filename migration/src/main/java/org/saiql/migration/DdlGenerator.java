package org.saiql.migration;

import org.saiql.engine.DialectId;
import org.saiql.engine.transpiler.SQLDialect;
import org.saiql.engine.transpiler.SQLDialects;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders CREATE TABLE statements in the target dialect.
 */
public final class DdlGenerator {

    private final SQLDialect dialect;

    public DdlGenerator(DialectId target) {
        this.dialect = SQLDialects.forId(Objects.requireNonNull(target, "Target dialect cannot be null"));
    }

    public String createTable(String table, List<ColumnMigration> columns, List<String> primaryKey,
                              boolean ifNotExists) {
        List<String> definitions = new ArrayList<>();
        for (ColumnMigration column : columns) {
            String definition = dialect.quoteIdentifier(column.name()) + " " + column.targetType();
            if (!column.source().nullable()) {
                definition += " NOT NULL";
            }
            definitions.add(definition);
        }
        if (!primaryKey.isEmpty()) {
            definitions.add(primaryKey.stream()
                    .map(dialect::quoteIdentifier)
                    .collect(Collectors.joining(", ", "PRIMARY KEY (", ")")));
        }
        return "CREATE TABLE " + (ifNotExists ? "IF NOT EXISTS " : "") + dialect.quoteIdentifier(table)
                + " (" + String.join(", ", definitions) + ")";
    }
}
