package org.saiql.engine;

import java.util.Objects;

public record CompileWarning(WarningCode code, String message) {

    public CompileWarning {
        Objects.requireNonNull(code, "Warning code cannot be null");
        Objects.requireNonNull(message, "Warning message cannot be null");
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
