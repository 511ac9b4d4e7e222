package org.saiql.engine.optimizer;

import org.saiql.engine.CancellationToken;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Limits on one optimizer run. Checked between rule applications, never
 * inside one.
 *
 * @param deadline      wall time allowed
 * @param maxIterations passes over the rule list allowed
 * @param cancellation  caller's cancellation token
 * @param clock         time source
 */
public record OptimizerBudget(Duration deadline, int maxIterations, CancellationToken cancellation, Clock clock) {

    /** System property overriding the default deadline, in milliseconds. */
    public static final String DEADLINE_PROPERTY = "saiql.optimizer.deadline.ms";

    public static final Duration DEFAULT_DEADLINE = Duration.ofMillis(500);
    public static final int DEFAULT_MAX_ITERATIONS = 10;

    public OptimizerBudget {
        Objects.requireNonNull(deadline, "Deadline cannot be null");
        Objects.requireNonNull(cancellation, "Cancellation token cannot be null");
        Objects.requireNonNull(clock, "Clock cannot be null");
        if (deadline.isNegative()) {
            throw new IllegalArgumentException("Deadline cannot be negative: " + deadline);
        }
        if (maxIterations < 1) {
            throw new IllegalArgumentException("At least one iteration is required, got " + maxIterations);
        }
    }

    public static OptimizerBudget defaults() {
        return new OptimizerBudget(defaultDeadline(), DEFAULT_MAX_ITERATIONS, CancellationToken.none(),
                Clock.systemUTC());
    }

    /**
     * {@link #DEFAULT_DEADLINE}, unless {@value #DEADLINE_PROPERTY} is set.
     */
    public static Duration defaultDeadline() {
        String value = System.getProperty(DEADLINE_PROPERTY);
        if (value == null || value.isBlank()) {
            return DEFAULT_DEADLINE;
        }
        try {
            return Duration.ofMillis(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + DEADLINE_PROPERTY + ": " + value, e);
        }
    }
}
