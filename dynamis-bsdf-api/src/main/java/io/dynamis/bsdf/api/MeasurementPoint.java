package io.dynamis.bsdf.api;

/**
 * A single in-plane BSDF sample: value = f(incidence, wavelength, theta).
 *
 * Measurements carry no phi dependency. theta is the signed scan angle of the detector,
 * so a reflective scan covers (-pi/2, pi/2) and transmissive samples lie beyond +/- pi/2.
 *
 * @param incidence  incidence angle in radians
 * @param wavelength wavelength in nanometres
 * @param theta      signed detector angle in radians
 * @param value      BSDF value in 1/sr
 */
public record MeasurementPoint(
    double incidence,
    double wavelength,
    double theta,
    double value
) {

    public MeasurementPoint {
        requireFinite("incidence", incidence);
        requireFinite("wavelength", wavelength);
        requireFinite("theta", theta);
        requireFinite("value", value);
    }

    /** Half space this sample belongs to, derived from theta. */
    public Branch branch() {
        return Branch.classify(theta);
    }

    /** True when this sample was taken at exactly the given incidence and wavelength. */
    public boolean matches(double incidence, double wavelength) {
        return this.incidence == incidence && this.wavelength == wavelength;
    }

    private static void requireFinite(String name, double v) {
        if (!Double.isFinite(v)) {
            throw new IllegalArgumentException(name + " must be finite; actual = " + v);
        }
    }
}
