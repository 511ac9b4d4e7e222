package org.saiql.engine.transpiler;

import org.saiql.engine.ErrorCode;
import org.saiql.engine.QueryCompileException;

import java.util.Objects;

/**
 * Raised when the target dialect cannot express part of a plan and the
 * caller did not allow a fallback.
 */
public class CodegenException extends QueryCompileException {

    private final FeatureId feature;

    public CodegenException(FeatureId feature, String message) {
        super(ErrorCode.UNSUPPORTED_FEATURE, message);
        this.feature = Objects.requireNonNull(feature, "Feature cannot be null");
    }

    public FeatureId feature() {
        return feature;
    }
}
