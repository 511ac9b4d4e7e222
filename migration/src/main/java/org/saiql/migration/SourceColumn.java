package org.saiql.migration;

import java.util.Objects;

/**
 * A column as the source database declares it.
 *
 * @param name          The column name
 * @param typeSignature The backend type signature, e.g. {@code numeric(12,2)}
 * @param nullable      Whether the column accepts NULL
 */
public record SourceColumn(String name, String typeSignature, boolean nullable) {

    public SourceColumn {
        Objects.requireNonNull(name, "Column name cannot be null");
        Objects.requireNonNull(typeSignature, "Type signature cannot be null");
    }

    @Override
    public String toString() {
        return name + " " + typeSignature + (nullable ? "" : " NOT NULL");
    }
}
