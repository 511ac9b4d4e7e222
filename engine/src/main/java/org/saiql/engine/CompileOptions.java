package org.saiql.engine;

import org.saiql.engine.optimizer.OptimizationLevel;
import org.saiql.engine.optimizer.OptimizerBudget;
import org.saiql.engine.transpiler.FeatureId;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Caller choices for one compilation. Immutable; build with {@link #builder()}.
 */
public final class CompileOptions {

    private static final CompileOptions DEFAULTS = builder().build();

    private final Set<FeatureId> allowOverrides;
    private final Duration deadline;
    private final int maxIterations;
    private final CancellationToken cancellationToken;
    private final Clock clock;
    private final boolean deferUnsupported;
    private final OptimizationLevel optimizationLevel;

    private CompileOptions(Builder builder) {
        this.allowOverrides = Set.copyOf(builder.allowOverrides);
        this.deadline = builder.deadline;
        this.maxIterations = builder.maxIterations;
        this.cancellationToken = builder.cancellationToken;
        this.clock = builder.clock;
        this.deferUnsupported = builder.deferUnsupported;
        this.optimizationLevel = builder.optimizationLevel;
    }

    public static CompileOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Features the caller accepts a degraded rendering for.
     */
    public Set<FeatureId> allowOverrides() {
        return allowOverrides;
    }

    /**
     * Optimizer deadline; null means {@link OptimizerBudget#defaultDeadline()}.
     */
    public Duration deadline() {
        return deadline;
    }

    public int maxIterations() {
        return maxIterations;
    }

    public CancellationToken cancellationToken() {
        return cancellationToken;
    }

    public Clock clock() {
        return clock;
    }

    /**
     * Whether an unsupported feature yields a REQUIRES_OVERRIDE result instead
     * of an exception.
     */
    public boolean deferUnsupported() {
        return deferUnsupported;
    }

    /**
     * Rule set the optimizer runs; {@link OptimizationLevel#STANDARD} unless set.
     */
    public OptimizationLevel optimizationLevel() {
        return optimizationLevel;
    }

    public OptimizerBudget budget() {
        Duration effective = deadline != null ? deadline : OptimizerBudget.defaultDeadline();
        return new OptimizerBudget(effective, maxIterations, cancellationToken, clock);
    }

    public static final class Builder {
        private final Set<FeatureId> allowOverrides = EnumSet.noneOf(FeatureId.class);
        private Duration deadline;
        private int maxIterations = OptimizerBudget.DEFAULT_MAX_ITERATIONS;
        private CancellationToken cancellationToken = CancellationToken.none();
        private Clock clock = Clock.systemUTC();
        private boolean deferUnsupported;
        private OptimizationLevel optimizationLevel = OptimizationLevel.STANDARD;

        private Builder() {
        }

        public Builder allowOverride(FeatureId feature) {
            allowOverrides.add(Objects.requireNonNull(feature, "Feature cannot be null"));
            return this;
        }

        public Builder allowOverrides(Set<FeatureId> features) {
            features.forEach(this::allowOverride);
            return this;
        }

        public Builder deadline(Duration deadline) {
            this.deadline = Objects.requireNonNull(deadline, "Deadline cannot be null");
            return this;
        }

        public Builder maxIterations(int maxIterations) {
            if (maxIterations < 1) {
                throw new IllegalArgumentException("At least one iteration is required, got " + maxIterations);
            }
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder cancellationToken(CancellationToken cancellationToken) {
            this.cancellationToken = Objects.requireNonNull(cancellationToken, "Cancellation token cannot be null");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
            return this;
        }

        public Builder deferUnsupported(boolean deferUnsupported) {
            this.deferUnsupported = deferUnsupported;
            return this;
        }

        public Builder optimizationLevel(OptimizationLevel optimizationLevel) {
            this.optimizationLevel = Objects.requireNonNull(optimizationLevel, "Optimization level cannot be null");
            return this;
        }

        public CompileOptions build() {
            return new CompileOptions(this);
        }
    }
}
