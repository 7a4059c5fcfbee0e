package io.dynamis.bsdf.test;

import io.dynamis.bsdf.api.BsdfConstants;
import io.dynamis.bsdf.api.SampleSet;
import io.dynamis.bsdf.core.BsdfBuildConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class BsdfBuildConfigTest {

    @Test
    void defaults() {
        BsdfBuildConfig config = BsdfBuildConfig.defaults();
        assertThat(config.samplingStepDegrees()).isEqualTo(BsdfConstants.DEFAULT_SAMPLING_STEP_DEGREES);
        assertThat(config.incidences()).isNull();
        assertThat(config.parallelism()).isEqualTo(1);
        assertThat(config.quadratureTolerance()).isEqualTo(BsdfConstants.DEFAULT_QUADRATURE_TOLERANCE);
    }

    @Test
    void builderCarriesValues() {
        SampleSet incidences = SampleSet.inOrder(0.5, 0.0);
        BsdfBuildConfig config = BsdfBuildConfig.builder()
            .samplingStepDegrees(0.5)
            .incidences(incidences)
            .parallelism(8)
            .quadratureTolerance(1e-3)
            .build();
        assertThat(config.samplingStepDegrees()).isEqualTo(0.5);
        assertThat(config.incidences()).isEqualTo(incidences);
        assertThat(config.parallelism()).isEqualTo(8);
        assertThat(config.quadratureTolerance()).isEqualTo(1e-3);
    }

    @Test
    void rejectsInvalidSamplingStep() {
        BsdfBuildConfig.Builder builder = BsdfBuildConfig.builder();
        assertThatThrownBy(() -> builder.samplingStepDegrees(0.0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.samplingStepDegrees(-1.0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.samplingStepDegrees(90.5))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.samplingStepDegrees(Double.NaN))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(builder.samplingStepDegrees(90.0).build().samplingStepDegrees()).isEqualTo(90.0);
    }

    @Test
    void rejectsInvalidOptions() {
        BsdfBuildConfig.Builder builder = BsdfBuildConfig.builder();
        assertThatThrownBy(() -> builder.parallelism(0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.quadratureTolerance(0.0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.quadratureTolerance(Double.POSITIVE_INFINITY))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.incidences(SampleSet.inOrder()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
