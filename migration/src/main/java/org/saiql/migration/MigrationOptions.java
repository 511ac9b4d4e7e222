package org.saiql.migration;

import org.saiql.engine.transpiler.FeatureId;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Caller choices for one migration plan.
 *
 * @param allowOverrides features the caller accepts a fallback for
 * @param ifNotExists    whether DDL skips tables that already exist
 */
public record MigrationOptions(Set<FeatureId> allowOverrides, boolean ifNotExists) {

    public MigrationOptions {
        allowOverrides = Set.copyOf(allowOverrides);
    }

    public static MigrationOptions defaults() {
        return new MigrationOptions(Set.of(), false);
    }

    public MigrationOptions withOverride(FeatureId feature) {
        Set<FeatureId> features = allowOverrides.isEmpty() ? EnumSet.noneOf(FeatureId.class) : EnumSet.copyOf(allowOverrides);
        features.add(Objects.requireNonNull(feature, "Feature cannot be null"));
        return new MigrationOptions(features, ifNotExists);
    }

    public MigrationOptions withIfNotExists(boolean value) {
        return new MigrationOptions(allowOverrides, value);
    }

    public boolean allows(FeatureId feature) {
        return allowOverrides.contains(feature);
    }
}
