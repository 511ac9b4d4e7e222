package org.saiql.migration;

import org.saiql.engine.CompileWarning;
import org.saiql.engine.DialectId;
import org.saiql.engine.WarningCode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything needed to recreate a schema on another backend.
 */
public record MigrationPlan(DialectId source, DialectId target, List<TableMigration> tables,
                            List<CompileWarning> warnings) {

    public MigrationPlan {
        Objects.requireNonNull(source, "Source dialect cannot be null");
        Objects.requireNonNull(target, "Target dialect cannot be null");
        tables = List.copyOf(tables);
        warnings = List.copyOf(warnings);
    }

    public Optional<TableMigration> table(String name) {
        return tables.stream().filter(t -> t.name().equalsIgnoreCase(name)).findFirst();
    }

    /**
     * DDL statements in table order.
     */
    public List<String> ddl() {
        return tables.stream().map(TableMigration::ddl).toList();
    }

    public boolean hasWarning(WarningCode code) {
        return warnings.stream().anyMatch(w -> w.code() == code);
    }

    /**
     * Human-readable report, one line per table, column and warning.
     */
    public List<String> summary() {
        List<String> lines = new ArrayList<>();
        lines.add(source.displayName() + " -> " + target.displayName() + ": " + tables.size() + " tables, "
                + warnings.size() + " warnings");
        for (TableMigration table : tables) {
            lines.add(table.name() + " (" + table.columns().size() + " columns, "
                    + table.lossyColumns() + " lossy)");
            table.columns().forEach(c -> lines.add("  " + c.describe()));
        }
        warnings.forEach(w -> lines.add(w.toString()));
        return lines;
    }
}
