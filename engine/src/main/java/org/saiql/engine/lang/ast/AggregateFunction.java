package org.saiql.engine.lang.ast;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum AggregateFunction {
    COUNT, SUM, AVG, MIN, MAX;

    public static Optional<AggregateFunction> fromName(String name) {
        String upper = name.toUpperCase(Locale.ROOT);
        return Arrays.stream(values()).filter(f -> f.name().equals(upper)).findFirst();
    }
}
