package org.saiql.migration;

import org.saiql.engine.CompileWarning;
import org.saiql.engine.DialectId;
import org.saiql.engine.WarningCode;
import org.saiql.engine.transpiler.FeatureId;
import org.saiql.engine.types.CanonicalType;
import org.saiql.engine.types.TypeKind;
import org.saiql.engine.types.TypeMapping;
import org.saiql.engine.types.TypeMappingException;
import org.saiql.engine.types.TypeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Plans moving table definitions from one backend to another.
 *
 * <p>Every column goes through {@link TypeRegistry#mapType}. Lossy mappings
 * become warnings; a type the target cannot hold stops planning unless the
 * caller overrides {@link FeatureId#UNMAPPED_TYPE}, in which case the column
 * is created as the target's text type.
 */
public final class SchemaMigrationPlanner {

    private static final Logger log = LoggerFactory.getLogger(SchemaMigrationPlanner.class);

    private final TypeRegistry typeRegistry;

    public SchemaMigrationPlanner(TypeRegistry typeRegistry) {
        this.typeRegistry = Objects.requireNonNull(typeRegistry, "Type registry cannot be null");
    }

    public SchemaMigrationPlanner() {
        this(TypeRegistry.standard());
    }

    /**
     * @throws MigrationException when a column type cannot be mapped and no override applies
     */
    public MigrationPlan plan(DialectId source, List<SourceTable> tables, DialectId target,
                              MigrationOptions options) {
        Objects.requireNonNull(source, "Source dialect cannot be null");
        Objects.requireNonNull(target, "Target dialect cannot be null");
        Objects.requireNonNull(options, "Migration options cannot be null");

        DdlGenerator ddl = new DdlGenerator(target);
        List<TableMigration> migrations = new ArrayList<>();
        List<CompileWarning> warnings = new ArrayList<>();
        for (SourceTable table : tables) {
            List<ColumnMigration> columns = new ArrayList<>();
            for (SourceColumn column : table.columns()) {
                columns.add(column(source, table, column, target, options, warnings));
            }
            migrations.add(new TableMigration(table.name(), columns, table.primaryKey(),
                    ddl.createTable(table.name(), columns, table.primaryKey(), options.ifNotExists())));
        }
        log.info("Planned migration of {} tables from {} to {} with {} warnings",
                migrations.size(), source.displayName(), target.displayName(), warnings.size());
        return new MigrationPlan(source, target, migrations, warnings);
    }

    private ColumnMigration column(DialectId source, SourceTable table, SourceColumn column, DialectId target,
                                   MigrationOptions options, List<CompileWarning> warnings) {
        String label = table.name() + "." + column.name();
        try {
            TypeMapping mapping = typeRegistry.mapType(source, column.typeSignature(), target);
            if (mapping.lossy()) {
                warnings.add(new CompileWarning(WarningCode.LOSSY_MAPPING,
                        label + " " + mapping.sourceSignature() + " as " + mapping.targetSignature()
                                + ": " + mapping.reason()));
            }
            return new ColumnMigration(column, mapping, mapping.targetSignature(), false);
        } catch (TypeMappingException e) {
            if (!options.allows(FeatureId.UNMAPPED_TYPE)) {
                throw new MigrationException("Cannot migrate " + label + ": " + e.getMessage(), e);
            }
            String fallback = typeRegistry.toTarget(CanonicalType.of(TypeKind.TEXT), target).targetSignature();
            log.warn("Column {} of type {} falls back to {}", label, column.typeSignature(), fallback);
            warnings.add(new CompileWarning(WarningCode.OVERRIDE_USED,
                    label + " " + column.typeSignature() + " created as " + fallback + ": " + e.getMessage()));
            return new ColumnMigration(column, null, fallback, true);
        }
    }
}
