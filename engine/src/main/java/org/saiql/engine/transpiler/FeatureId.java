package org.saiql.engine.transpiler;

/**
 * Constructs a backend may lack. Callers name them in
 * {@code CompileOptions.allowOverrides} to accept the documented fallback.
 */
public enum FeatureId {
    /** FULL OUTER JOIN; the fallback renders a LEFT OUTER JOIN. */
    FULL_OUTER_JOIN,
    /** RIGHT OUTER JOIN; backends without it get a LEFT OUTER JOIN with swapped inputs. */
    RIGHT_OUTER_JOIN,
    /** Database-side JSON array output; the fallback returns plain rows. */
    JSON_OUTPUT,
    /** A column type the target has no type for; the fallback uses text. */
    UNMAPPED_TYPE
}
