package org.saiql.engine;

/**
 * Whether a compiled statement may be run as is.
 */
public enum CompileStatus {
    /** Nothing stands in the way of execution. */
    READY,
    /** An unsupported feature was deferred; the caller must override it or give up. */
    REQUIRES_OVERRIDE
}
