package io.github.eutro.ilcore.passes.transforms;

/**
 * Immutable settings for running block transforms. Instances should typically be created
 * with {@link #builder()}.
 */
public final class TransformSettings {
    /**
     * The name of the environment variable which, when set, turns on {@link #isCheckInvariants()} by default.
     */
    public static final String CHECK_INVARIANTS_ENV = "ILCORE_CHECK_INVARIANTS";

    /**
     * The default settings.
     */
    public static final TransformSettings DEFAULT = builder().build();

    private final boolean nullCoalescing;
    private final boolean checkInvariants;
    private final int maxIterations;
    private final int stepLimit;
    private final boolean recordSteps;

    private TransformSettings(Builder builder) {
        nullCoalescing = builder.nullCoalescing;
        checkInvariants = builder.checkInvariants;
        maxIterations = builder.maxIterations;
        stepLimit = builder.stepLimit;
        recordSteps = builder.recordSteps;
    }

    /**
     * Get whether null-coalescing operators should be recognized.
     *
     * @return Whether null-coalescing operators are recognized.
     */
    public boolean isNullCoalescing() {
        return nullCoalescing;
    }

    /**
     * Get whether block invariants are checked after every transform.
     *
     * @return Whether invariants are checked.
     */
    public boolean isCheckInvariants() {
        return checkInvariants;
    }

    /**
     * Get the maximum number of times the transforms are run on a single block
     * before giving up on reaching a fixed point.
     *
     * @return The iteration bound.
     */
    public int getMaxIterations() {
        return maxIterations;
    }

    /**
     * Get the number of steps after which transforming stops, with a {@link StepLimitReachedException}.
     *
     * @return The step limit.
     */
    public int getStepLimit() {
        return stepLimit;
    }

    /**
     * Get whether steps are recorded by the {@link Stepper}, for later inspection.
     *
     * @return Whether steps are recorded.
     */
    public boolean isRecordSteps() {
        return recordSteps;
    }

    /**
     * Start a builder initialized with these settings.
     *
     * @return The new builder.
     */
    public Builder toBuilder() {
        return new Builder()
                .setNullCoalescing(nullCoalescing)
                .setCheckInvariants(checkInvariants)
                .setMaxIterations(maxIterations)
                .setStepLimit(stepLimit)
                .setRecordSteps(recordSteps);
    }

    @Override
    public String toString() {
        return "TransformSettings{" +
                "nullCoalescing=" + nullCoalescing +
                ", checkInvariants=" + checkInvariants +
                ", maxIterations=" + maxIterations +
                ", stepLimit=" + stepLimit +
                ", recordSteps=" + recordSteps +
                '}';
    }

    /**
     * Start a {@link Builder} with the default settings.
     *
     * @return The new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * A builder for {@link TransformSettings}.
     */
    public static class Builder {
        private boolean nullCoalescing = true;
        private boolean checkInvariants = System.getenv(CHECK_INVARIANTS_ENV) != null;
        private int maxIterations = 100;
        private int stepLimit = Integer.MAX_VALUE;
        private boolean recordSteps = false;

        /**
         * Set whether null-coalescing operators should be recognized. Enabled by default.
         *
         * @param nullCoalescing Whether to recognize them.
         * @return This builder, for convenience.
         */
        public Builder setNullCoalescing(boolean nullCoalescing) {
            this.nullCoalescing = nullCoalescing;
            return this;
        }

        /**
         * Set whether block invariants should be checked after every transform.
         * By default, only if the {@value CHECK_INVARIANTS_ENV} environment variable is set.
         *
         * @param checkInvariants Whether to check invariants.
         * @return This builder, for convenience.
         */
        public Builder setCheckInvariants(boolean checkInvariants) {
            this.checkInvariants = checkInvariants;
            return this;
        }

        /**
         * Set the maximum number of fixed-point iterations per block. 100 by default.
         *
         * @param maxIterations The bound, at least 1.
         * @return This builder, for convenience.
         */
        public Builder setMaxIterations(int maxIterations) {
            if (maxIterations < 1) throw new IllegalArgumentException("maxIterations must be positive, got " + maxIterations);
            this.maxIterations = maxIterations;
            return this;
        }

        /**
         * Set the number of steps after which transforming stops. Unlimited by default.
         *
         * @param stepLimit The step limit, not negative.
         * @return This builder, for convenience.
         */
        public Builder setStepLimit(int stepLimit) {
            if (stepLimit < 0) throw new IllegalArgumentException("stepLimit must not be negative, got " + stepLimit);
            this.stepLimit = stepLimit;
            return this;
        }

        /**
         * Set whether steps should be recorded. Disabled by default.
         *
         * @param recordSteps Whether to record steps.
         * @return This builder, for convenience.
         */
        public Builder setRecordSteps(boolean recordSteps) {
            this.recordSteps = recordSteps;
            return this;
        }

        /**
         * Build the settings.
         *
         * @return The settings.
         */
        public TransformSettings build() {
            return new TransformSettings(this);
        }
    }
}
