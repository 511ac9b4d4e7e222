package org.saiql.migration;

import org.saiql.engine.DialectId;
import org.saiql.engine.store.Column;
import org.saiql.engine.store.ForeignKey;
import org.saiql.engine.store.InMemorySchemaCatalog;
import org.saiql.engine.store.SchemaCatalog;
import org.saiql.engine.store.Table;
import org.saiql.engine.types.CanonicalType;
import org.saiql.engine.types.TypeKind;
import org.saiql.engine.types.TypeMappingException;
import org.saiql.engine.types.TypeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Reads table definitions through JDBC {@link DatabaseMetaData}.
 *
 * <p>Drivers report type parameters either inside {@code TYPE_NAME} or in
 * {@code COLUMN_SIZE}/{@code DECIMAL_DIGITS}; both are folded into one
 * signature the {@link TypeRegistry} can parse.
 */
public final class JdbcSchemaReader {

    private static final Logger log = LoggerFactory.getLogger(JdbcSchemaReader.class);

    private static final Set<String> TABLE_TYPES = Set.of("TABLE", "BASE TABLE");

    private final DialectId dialect;
    private final TypeRegistry typeRegistry;
    private final String schemaPattern;

    /**
     * @param schemaPattern schema to read, or null for every schema the driver reports
     */
    public JdbcSchemaReader(DialectId dialect, TypeRegistry typeRegistry, String schemaPattern) {
        this.dialect = Objects.requireNonNull(dialect, "Dialect cannot be null");
        this.typeRegistry = Objects.requireNonNull(typeRegistry, "Type registry cannot be null");
        this.schemaPattern = schemaPattern;
    }

    public JdbcSchemaReader(DialectId dialect) {
        this(dialect, TypeRegistry.standard(), null);
    }

    public DialectId dialect() {
        return dialect;
    }

    /**
     * Reads every user table, sorted by name.
     *
     * @throws MigrationException when the driver fails
     */
    public List<SourceTable> readTables(Connection connection) {
        try {
            DatabaseMetaData metaData = connection.getMetaData();
            TreeMap<String, String> names = new TreeMap<>();
            try (ResultSet tables = metaData.getTables(null, schemaPattern, "%", null)) {
                while (tables.next()) {
                    String name = tables.getString("TABLE_NAME");
                    String type = tables.getString("TABLE_TYPE");
                    if (type != null && TABLE_TYPES.contains(type.toUpperCase(Locale.ROOT))
                            && !name.toLowerCase(Locale.ROOT).startsWith("sqlite_")) {
                        names.put(name, tables.getString("TABLE_SCHEM"));
                    }
                }
            }
            List<SourceTable> result = new ArrayList<>();
            for (var entry : names.entrySet()) {
                result.add(readTable(metaData, entry.getValue(), entry.getKey()));
            }
            log.info("Read {} tables from {}", result.size(), dialect.displayName());
            return result;
        } catch (SQLException e) {
            throw new MigrationException("Failed to read " + dialect.displayName() + " schema: " + e.getMessage(), e);
        }
    }

    private SourceTable readTable(DatabaseMetaData metaData, String schema, String table) throws SQLException {
        List<SourceColumn> columns = new ArrayList<>();
        try (ResultSet rs = metaData.getColumns(null, schema, table, "%")) {
            TreeMap<Integer, SourceColumn> ordered = new TreeMap<>();
            while (rs.next()) {
                String typeName = rs.getString("TYPE_NAME");
                int size = rs.getInt("COLUMN_SIZE");
                boolean sizeKnown = !rs.wasNull();
                int digits = rs.getInt("DECIMAL_DIGITS");
                boolean digitsKnown = !rs.wasNull();
                boolean nullable = rs.getInt("NULLABLE") != DatabaseMetaData.columnNoNulls;
                String signature = signature(typeName, sizeKnown ? size : null, digitsKnown ? digits : null);
                ordered.put(rs.getInt("ORDINAL_POSITION"), new SourceColumn(rs.getString("COLUMN_NAME"), signature, nullable));
            }
            columns.addAll(ordered.values());
        }

        TreeMap<Short, String> keyColumns = new TreeMap<>();
        try (ResultSet rs = metaData.getPrimaryKeys(null, schema, table)) {
            while (rs.next()) {
                keyColumns.put(rs.getShort("KEY_SEQ"), rs.getString("COLUMN_NAME"));
            }
        }

        List<ForeignKey> foreignKeys = new ArrayList<>();
        try (ResultSet rs = metaData.getImportedKeys(null, schema, table)) {
            List<String> from = new ArrayList<>();
            List<String> to = new ArrayList<>();
            String referenced = null;
            while (rs.next()) {
                if (rs.getShort("KEY_SEQ") == 1 && !from.isEmpty()) {
                    foreignKeys.add(new ForeignKey(from, referenced, to));
                    from = new ArrayList<>();
                    to = new ArrayList<>();
                }
                referenced = rs.getString("PKTABLE_NAME");
                from.add(rs.getString("FKCOLUMN_NAME"));
                to.add(rs.getString("PKCOLUMN_NAME"));
            }
            if (!from.isEmpty()) {
                foreignKeys.add(new ForeignKey(from, referenced, to));
            }
        }
        log.debug("Read table {}: {} columns, key {}", table, columns.size(), keyColumns.values());
        return new SourceTable(table, columns, new ArrayList<>(keyColumns.values()), foreignKeys);
    }

    /**
     * Folds driver-reported size and scale into the type name when the type
     * takes them and the name does not already carry them.
     */
    String signature(String typeName, Integer size, Integer digits) {
        if (typeName.contains("(") || size == null || size <= 0) {
            return typeName;
        }
        TypeKind kind;
        try {
            kind = typeRegistry.parse(dialect, typeName).kind();
        } catch (TypeMappingException e) {
            // Left to the migration planner to report
            return typeName;
        }
        return switch (kind.params()) {
            case LENGTH -> typeName + "(" + size + ")";
            case PRECISION_SCALE -> typeName + "(" + size + "," + (digits == null ? 0 : digits) + ")";
            default -> typeName;
        };
    }

    /**
     * Snapshots the tables as a compiler catalog.
     *
     * @throws TypeMappingException when a column type has no canonical form
     */
    public SchemaCatalog toCatalog(List<SourceTable> tables) {
        List<Table> converted = new ArrayList<>();
        for (SourceTable source : tables) {
            List<Column> columns = new ArrayList<>();
            for (SourceColumn column : source.columns()) {
                CanonicalType type = typeRegistry.parse(dialect, column.typeSignature()).withNullable(column.nullable());
                columns.add(new Column(column.name(), type));
            }
            converted.add(new Table(source.name(), columns, source.primaryKey(), source.foreignKeys()));
        }
        return InMemorySchemaCatalog.of(converted);
    }

    public SchemaCatalog readCatalog(Connection connection) {
        return toCatalog(readTables(connection));
    }
}
