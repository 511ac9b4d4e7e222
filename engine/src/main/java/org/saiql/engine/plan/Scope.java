package org.saiql.engine.plan;

import org.saiql.engine.ErrorCode;
import org.saiql.engine.lang.ast.ColumnRef;
import org.saiql.engine.store.Column;
import org.saiql.engine.store.Table;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Tables visible to a query, in FROM order, keyed by alias.
 */
final class Scope {

    record Entry(String alias, Table table) {
        ColumnReference reference(Column column) {
            return new ColumnReference(alias, column.name(), column.type());
        }
    }

    private final List<Entry> entries = new ArrayList<>();

    void add(String alias, Table table) {
        if (findEntry(alias).isPresent()) {
            throw new SemanticException(ErrorCode.DUPLICATE_ALIAS,
                    "Table alias '" + alias + "' is used more than once; alias one of the references");
        }
        entries.add(new Entry(alias, table));
    }

    List<Entry> entries() {
        return List.copyOf(entries);
    }

    Entry first() {
        return entries.get(0);
    }

    private Optional<Entry> findEntry(String alias) {
        return entries.stream().filter(e -> e.alias().equalsIgnoreCase(alias)).findFirst();
    }

    Entry entry(String qualifier) {
        return findEntry(qualifier).orElseThrow(() -> new SemanticException(ErrorCode.UNKNOWN_TABLE,
                "Unknown table or alias '" + qualifier + "'"));
    }

    /**
     * Binds a column reference, qualified or not.
     */
    ColumnReference resolve(ColumnRef ref) {
        if (ref.isWildcard()) {
            throw new SemanticException(ErrorCode.UNKNOWN_COLUMN, "'" + ref + "' is not a single column");
        }
        if (ref.qualifier() != null) {
            Entry entry = entry(ref.qualifier());
            Column column = entry.table().findColumn(ref.name())
                    .orElseThrow(() -> new SemanticException(ErrorCode.UNKNOWN_COLUMN,
                            "Unknown column '" + ref.name() + "' in table " + entry.table().name()));
            return entry.reference(column);
        }

        List<ColumnReference> matches = new ArrayList<>();
        for (Entry entry : entries) {
            entry.table().findColumn(ref.name()).ifPresent(c -> matches.add(entry.reference(c)));
        }
        if (matches.isEmpty()) {
            String tables = entries.stream().map(e -> e.table().name()).collect(Collectors.joining(", "));
            throw new SemanticException(ErrorCode.UNKNOWN_COLUMN,
                    "Unknown column '" + ref.name() + "' in " + tables);
        }
        if (matches.size() > 1) {
            String owners = matches.stream().map(ColumnReference::tableAlias).collect(Collectors.joining(", "));
            throw new SemanticException(ErrorCode.AMBIGUOUS_COLUMN,
                    "Column '" + ref.name() + "' is ambiguous; it exists in " + owners);
        }
        return matches.get(0);
    }

    /**
     * Expands {@code *} or {@code alias.*} into columns in FROM and table order.
     */
    List<ColumnReference> expand(ColumnRef wildcard) {
        List<Entry> sources = wildcard.qualifier() == null ? entries : List.of(entry(wildcard.qualifier()));
        List<ColumnReference> result = new ArrayList<>();
        for (Entry entry : sources) {
            for (Column column : entry.table().columns()) {
                result.add(entry.reference(column));
            }
        }
        return result;
    }
}
