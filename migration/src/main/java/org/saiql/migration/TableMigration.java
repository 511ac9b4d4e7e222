package org.saiql.migration;

import java.util.List;
import java.util.Objects;

/**
 * @param name       The table name
 * @param columns    Column mappings in declaration order
 * @param primaryKey Primary key columns
 * @param ddl        CREATE TABLE statement for the target
 */
public record TableMigration(String name, List<ColumnMigration> columns, List<String> primaryKey, String ddl) {

    public TableMigration {
        Objects.requireNonNull(name, "Table name cannot be null");
        Objects.requireNonNull(ddl, "DDL cannot be null");
        columns = List.copyOf(columns);
        primaryKey = List.copyOf(primaryKey);
    }

    public long lossyColumns() {
        return columns.stream().filter(ColumnMigration::lossy).count();
    }
}
