package org.saiql.engine;

/**
 * Non-fatal diagnostics attached to a compiled query or migration plan.
 */
public enum WarningCode {
    /** A value type is mapped onto a target type that cannot hold every value. */
    LOSSY_MAPPING,
    /** An unsupported feature was generated with a fallback because the caller allowed it. */
    OVERRIDE_USED,
    /** A feature the target cannot express; the result needs an override before it runs. */
    UNSUPPORTED_FEATURE,
    /** The optimizer ran out of time, iterations or was cancelled. */
    OPTIMIZER_TIMEOUT,
    /** An optimizer rule threw and was disabled for the rest of the run. */
    OPTIMIZER_RULE_FAILED
}
