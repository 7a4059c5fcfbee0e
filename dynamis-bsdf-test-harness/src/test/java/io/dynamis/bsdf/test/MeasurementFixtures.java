package io.dynamis.bsdf.test;

import io.dynamis.bsdf.api.MeasurementPoint;

import java.util.ArrayList;
import java.util.List;

/**
 * Synthetic in-plane scans shared by the reconstruction tests.
 */
final class MeasurementFixtures {

    /** Scan angles -80 .. 80 degrees in 10 degree steps. */
    static final int SCAN_HALF_WIDTH_DEG = 80;
    static final int SCAN_STEP_DEG = 10;

    private MeasurementFixtures() {}

    /** Reflective scan of a Lambertian lobe: value = k cos(theta). */
    static List<MeasurementPoint> lambertianReflective(double incidence, double wavelength,
                                                       double k) {
        List<MeasurementPoint> out = new ArrayList<>();
        for (int deg = -SCAN_HALF_WIDTH_DEG; deg <= SCAN_HALF_WIDTH_DEG; deg += SCAN_STEP_DEG) {
            double theta = Math.toRadians(deg);
            out.add(new MeasurementPoint(incidence, wavelength, theta, k * Math.cos(theta)));
        }
        return out;
    }

    /**
     * Transmissive scan mirroring lambertianReflective through the surface: a sample at
     * deviation f from the opposite normal is recorded at raw angle pi - f (f >= 0) or
     * -(pi + f) (f < 0).
     */
    static List<MeasurementPoint> lambertianTransmissive(double incidence, double wavelength,
                                                         double k) {
        List<MeasurementPoint> out = new ArrayList<>();
        for (int deg = -SCAN_HALF_WIDTH_DEG; deg <= SCAN_HALF_WIDTH_DEG; deg += SCAN_STEP_DEG) {
            double folded = Math.toRadians(deg);
            double raw = folded < 0 ? -(Math.PI + folded) : Math.PI - folded;
            out.add(new MeasurementPoint(incidence, wavelength, raw, k * Math.cos(folded)));
        }
        return out;
    }

    /** Reflective scan with every value exactly zero. */
    static List<MeasurementPoint> zeroReflective(double incidence, double wavelength) {
        return lambertianReflective(incidence, wavelength, 0.0);
    }

    @SafeVarargs
    static List<MeasurementPoint> concat(List<MeasurementPoint>... parts) {
        List<MeasurementPoint> out = new ArrayList<>();
        for (List<MeasurementPoint> part : parts) {
            out.addAll(part);
        }
        return out;
    }
}
