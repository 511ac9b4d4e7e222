package org.saiql.engine.plan;

import org.saiql.engine.store.Column;
import org.saiql.engine.store.Table;

import java.util.List;
import java.util.Objects;

/**
 * Reads a table.
 *
 * @param table      catalog table
 * @param alias      alias the rest of the plan refers to
 * @param columns    columns read, in table order; pruned by the optimizer
 * @param accessPath chosen access path
 */
public record ScanNode(Table table, String alias, List<Column> columns, AccessPath accessPath) implements RelationNode {

    public ScanNode {
        Objects.requireNonNull(table, "Table cannot be null");
        Objects.requireNonNull(alias, "Alias cannot be null");
        Objects.requireNonNull(accessPath, "Access path cannot be null");
        columns = List.copyOf(columns);
    }

    /**
     * Scan of every column with the uncosted access path.
     */
    public static ScanNode of(Table table, String alias) {
        return new ScanNode(table, alias, table.columns(), AccessPath.uncosted());
    }

    public ScanNode withColumns(List<Column> value) {
        return new ScanNode(table, alias, value, accessPath);
    }

    public ScanNode withAccessPath(AccessPath value) {
        return new ScanNode(table, alias, columns, value);
    }

    @Override
    public <T> T accept(RelationNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
