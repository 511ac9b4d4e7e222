package org.saiql.engine.store;

import java.util.Collection;
import java.util.Optional;

/**
 * Read-only schema snapshot the validator resolves tables and columns against.
 *
 * <p>Implementations must return the same answers for the duration of a
 * compilation.
 */
public interface SchemaCatalog {

    /**
     * Looks a table up by name. Matching is case-insensitive.
     */
    Optional<Table> findTable(String name);

    Collection<Table> tables();
}
