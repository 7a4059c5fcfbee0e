package io.dynamis.bsdf.test;

import io.dynamis.bsdf.api.AngularGrid;
import io.dynamis.bsdf.api.BsdfVolume;
import io.dynamis.bsdf.api.SampleSet;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class BsdfVolumeTest {

    private static final AngularGrid GRID = AngularGrid.fromSamplingStep(45.0);
    private static final SampleSet INCIDENCES = SampleSet.inOrder(0.0, 0.5);
    private static final SampleSet WAVELENGTHS = SampleSet.ascending(450.0, 550.0, 650.0);

    @Test
    void exposesShapeAndValues() {
        double[][][][] brdf = tensor(1.0);
        brdf[1][2][3][1] = 7.0;
        BsdfVolume volume = new BsdfVolume(INCIDENCES, WAVELENGTHS, GRID,
            brdf, scalars(0.3), null, null);

        assertThat(volume.tensorShape()).containsExactly(2, 3, GRID.phiCount(), GRID.thetaCount());
        assertThat(volume.brdf(1, 2, 3, 1)).isEqualTo(7.0);
        assertThat(volume.reflectance(0, 0)).isEqualTo(0.3);
        assertThat(volume.hasTransmission()).isFalse();
        assertThat(volume.btdfCopy()).isNull();
        assertThat(volume.transmittanceCopy()).isNull();
    }

    @Test
    void transmissionAccessorsRequireTransmission() {
        BsdfVolume volume = new BsdfVolume(INCIDENCES, WAVELENGTHS, GRID,
            tensor(1.0), scalars(0.3), null, null);
        assertThatThrownBy(() -> volume.btdf(0, 0, 0, 0)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> volume.transmittance(0, 0)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void carriesTransmission() {
        BsdfVolume volume = new BsdfVolume(INCIDENCES, WAVELENGTHS, GRID,
            tensor(1.0), scalars(0.3), tensor(2.0), scalars(0.4));
        assertThat(volume.hasTransmission()).isTrue();
        assertThat(volume.btdf(1, 1, 1, 1)).isEqualTo(2.0);
        assertThat(volume.transmittance(1, 2)).isEqualTo(0.4);
    }

    @Test
    void inputsAndOutputsAreDeepCopied() {
        double[][][][] brdf = tensor(1.0);
        BsdfVolume volume = new BsdfVolume(INCIDENCES, WAVELENGTHS, GRID,
            brdf, scalars(0.3), null, null);
        brdf[0][0][0][0] = 99.0;
        assertThat(volume.brdf(0, 0, 0, 0)).isEqualTo(1.0);

        double[][][][] copy = volume.brdfCopy();
        copy[0][0][0][0] = 99.0;
        assertThat(volume.brdf(0, 0, 0, 0)).isEqualTo(1.0);

        double[][] r = volume.reflectanceCopy();
        r[0][0] = 99.0;
        assertThat(volume.reflectance(0, 0)).isEqualTo(0.3);
    }

    @Test
    void rejectsHalfPresentTransmission() {
        assertThatThrownBy(() -> new BsdfVolume(INCIDENCES, WAVELENGTHS, GRID,
            tensor(1.0), scalars(0.3), tensor(1.0), null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BsdfVolume(INCIDENCES, WAVELENGTHS, GRID,
            tensor(1.0), scalars(0.3), null, scalars(0.1)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsMisshapenTensors() {
        // theta and phi axes swapped
        double[][][][] swapped = new double[2][3][GRID.thetaCount()][GRID.phiCount()];
        assertThatThrownBy(() -> new BsdfVolume(INCIDENCES, WAVELENGTHS, GRID,
            swapped, scalars(0.3), null, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BsdfVolume(INCIDENCES, WAVELENGTHS, GRID,
            tensor(1.0), new double[3][2], null, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static double[][][][] tensor(double fill) {
        double[][][][] t = new double[2][3][GRID.phiCount()][GRID.thetaCount()];
        for (double[][][] a : t) {
            for (double[][] b : a) {
                for (double[] c : b) {
                    java.util.Arrays.fill(c, fill);
                }
            }
        }
        return t;
    }

    private static double[][] scalars(double fill) {
        double[][] m = new double[2][3];
        for (double[] row : m) {
            java.util.Arrays.fill(row, fill);
        }
        return m;
    }
}
