package org.saiql.engine.store;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable in-memory {@link SchemaCatalog}.
 */
public final class InMemorySchemaCatalog implements SchemaCatalog {

    private final Map<String, Table> tables;

    private InMemorySchemaCatalog(Map<String, Table> tables) {
        this.tables = Collections.unmodifiableMap(tables);
    }

    public static InMemorySchemaCatalog of(Table... tables) {
        return of(List.of(tables));
    }

    public static InMemorySchemaCatalog of(Collection<Table> tables) {
        Map<String, Table> byName = new LinkedHashMap<>();
        for (Table table : tables) {
            Table previous = byName.put(key(table.name()), table);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate table '" + table.name() + "'");
            }
        }
        return new InMemorySchemaCatalog(byName);
    }

    @Override
    public Optional<Table> findTable(String name) {
        return Optional.ofNullable(tables.get(key(name)));
    }

    @Override
    public Collection<Table> tables() {
        return tables.values();
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
