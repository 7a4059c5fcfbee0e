package io.dynamis.bsdf.test;

import io.dynamis.bsdf.api.Branch;
import io.dynamis.bsdf.simulation.PiecewiseLinearProfile;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class PiecewiseLinearProfileTest {

    private static final PiecewiseLinearProfile TENT = new PiecewiseLinearProfile(
        Branch.REFLECTIVE, new double[] { -1.0, 0.0, 2.0 }, new double[] { 0.0, 1.0, 0.0 });

    @Test
    void returnsSampleValuesAtNodes() {
        assertThat(TENT.valueAt(-1.0)).isEqualTo(0.0);
        assertThat(TENT.valueAt(0.0)).isEqualTo(1.0);
        assertThat(TENT.valueAt(2.0)).isEqualTo(0.0);
    }

    @Test
    void interpolatesLinearlyBetweenNodes() {
        assertThat(TENT.valueAt(-0.5)).isCloseTo(0.5, within(1e-12));
        assertThat(TENT.valueAt(1.0)).isCloseTo(0.5, within(1e-12));
    }

    @Test
    void extrapolatesWithFirstSegmentSlopeBelowRange() {
        // first segment slope = +1
        assertThat(TENT.valueAt(-3.0)).isCloseTo(-2.0, within(1e-12));
    }

    @Test
    void extrapolatesWithLastSegmentSlopeAboveRange() {
        // last segment slope = -0.5
        assertThat(TENT.valueAt(4.0)).isCloseTo(-1.0, within(1e-12));
    }

    @Test
    void reportsSampledRange() {
        assertThat(TENT.minTheta()).isEqualTo(-1.0);
        assertThat(TENT.maxTheta()).isEqualTo(2.0);
        assertThat(TENT.branch()).isEqualTo(Branch.REFLECTIVE);
    }

    @Test
    void fromSamplesSortsUnorderedInput() {
        PiecewiseLinearProfile p = PiecewiseLinearProfile.fromSamples(Branch.TRANSMISSIVE,
            new double[] { 2.0, -1.0, 0.0 }, new double[] { 0.0, 0.0, 1.0 });
        assertThat(p.valueAt(-0.5)).isCloseTo(0.5, within(1e-12));
        assertThat(p.sampleCount()).isEqualTo(3);
    }

    @Test
    void fromSamplesAveragesCoincidentAngles() {
        PiecewiseLinearProfile p = PiecewiseLinearProfile.fromSamples(Branch.REFLECTIVE,
            new double[] { 0.0, 1.0, 1.0 }, new double[] { 0.0, 2.0, 4.0 });
        assertThat(p.sampleCount()).isEqualTo(2);
        assertThat(p.valueAt(1.0)).isEqualTo(3.0);
    }

    @Test
    void distinctCountIgnoresRepeats() {
        assertThat(PiecewiseLinearProfile.distinctCount(new double[] { 0.1, 0.1, 0.2 }))
            .isEqualTo(2);
        assertThat(PiecewiseLinearProfile.distinctCount(new double[0])).isZero();
    }

    @Test
    void singleDistinctSampleIsRejected() {
        assertThatThrownBy(() -> PiecewiseLinearProfile.fromSamples(Branch.REFLECTIVE,
            new double[] { 0.5, 0.5 }, new double[] { 1.0, 2.0 }))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nonAscendingAbscissaeAreRejected() {
        assertThatThrownBy(() -> new PiecewiseLinearProfile(Branch.REFLECTIVE,
            new double[] { 0.0, 0.0 }, new double[] { 1.0, 2.0 }))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
