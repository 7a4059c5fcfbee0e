package io.dynamis.bsdf.core;

import io.dynamis.bsdf.api.BsdfConstants;
import io.dynamis.bsdf.api.SampleSet;

/**
 * Options of a single BSDF volume build.
 *
 * IMMUTABLE: created through {@link #builder()}; every field has a default, so
 * {@code BsdfBuildConfig.builder().build()} is a valid configuration.
 *
 *   samplingStepDegrees  1.0      angular step of the output grid, 0 < step <= 90
 *   incidences           null     explicit IncidenceSet; null resolves it from the measurements
 *   parallelism          1        worker threads for per-cell reconstruction; 1 = caller thread
 *   quadratureTolerance  0.1      absolute tolerance per integration axis
 */
public final class BsdfBuildConfig {

    private final double samplingStepDegrees;
    private final SampleSet incidences;
    private final int parallelism;
    private final double quadratureTolerance;

    private BsdfBuildConfig(Builder builder) {
        this.samplingStepDegrees = builder.samplingStepDegrees;
        this.incidences = builder.incidences;
        this.parallelism = builder.parallelism;
        this.quadratureTolerance = builder.quadratureTolerance;
    }

    public static BsdfBuildConfig defaults() {
        return builder().build();
    }

    public double samplingStepDegrees() { return samplingStepDegrees; }

    /** Explicit incidence set, or null when it is resolved from the measurements. */
    public SampleSet incidences() { return incidences; }

    public int parallelism() { return parallelism; }

    public double quadratureTolerance() { return quadratureTolerance; }

    @Override
    public String toString() {
        return "BsdfBuildConfig{step=" + samplingStepDegrees + "deg"
            + ", incidences=" + (incidences == null ? "resolved" : incidences.size())
            + ", parallelism=" + parallelism
            + ", tolerance=" + quadratureTolerance + "}";
    }

    // -- Builder --------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private double samplingStepDegrees = BsdfConstants.DEFAULT_SAMPLING_STEP_DEGREES;
        private SampleSet incidences;
        private int parallelism = 1;
        private double quadratureTolerance = BsdfConstants.DEFAULT_QUADRATURE_TOLERANCE;

        private Builder() {}

        /**
         * @throws IllegalArgumentException unless 0 < step <= MAX_SAMPLING_STEP_DEGREES
         */
        public Builder samplingStepDegrees(double step) {
            if (!(step > 0.0) || step > BsdfConstants.MAX_SAMPLING_STEP_DEGREES) {
                throw new IllegalArgumentException(
                    "sampling step must satisfy 0 < step <= "
                        + BsdfConstants.MAX_SAMPLING_STEP_DEGREES + "; actual = " + step);
            }
            this.samplingStepDegrees = step;
            return this;
        }

        /**
         * Supplies the IncidenceSet instead of resolving it from the measurements.
         * Pass null to restore resolution.
         *
         * @throws IllegalArgumentException if the set is empty
         */
        public Builder incidences(SampleSet incidences) {
            if (incidences != null && incidences.isEmpty()) {
                throw new IllegalArgumentException("incidence set must not be empty");
            }
            this.incidences = incidences;
            return this;
        }

        /**
         * @throws IllegalArgumentException if parallelism is below 1
         */
        public Builder parallelism(int parallelism) {
            if (parallelism < 1) {
                throw new IllegalArgumentException(
                    "parallelism must be >= 1; actual = " + parallelism);
            }
            this.parallelism = parallelism;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the tolerance is not positive
         */
        public Builder quadratureTolerance(double tolerance) {
            if (!(tolerance > 0.0) || Double.isInfinite(tolerance)) {
                throw new IllegalArgumentException(
                    "quadrature tolerance must be positive and finite; actual = " + tolerance);
            }
            this.quadratureTolerance = tolerance;
            return this;
        }

        public BsdfBuildConfig build() {
            return new BsdfBuildConfig(this);
        }
    }
}
