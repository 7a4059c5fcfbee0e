package io.dynamis.bsdf.export;

/**
 * Intensity diagram of one branch at one (wavelength, incidence) pair, in export layout.
 *
 * values holds the cosine-weighted BSDF flattened theta-major:
 *   values[t * phiCount + p] = bsdf(theta_t, phi_p)
 *
 * Arrays are copied on construction and on access.
 */
public final class ScatteringDiagram {

    private final double integral;
    private final double[] thetaSamples;
    private final double[] phiSamples;
    private final double[] values;

    public ScatteringDiagram(double integral, double[] thetaSamples, double[] phiSamples,
                             double[] values) {
        if (values.length != thetaSamples.length * phiSamples.length) {
            throw new IllegalArgumentException(
                "values length " + values.length + " does not match "
                    + thetaSamples.length + " x " + phiSamples.length);
        }
        this.integral = integral;
        this.thetaSamples = thetaSamples.clone();
        this.phiSamples = phiSamples.clone();
        this.values = values.clone();
    }

    /** Hemispherical reflectance or transmittance. */
    public double integral() { return integral; }

    public double[] thetaSamples() { return thetaSamples.clone(); }

    public double[] phiSamples() { return phiSamples.clone(); }

    public double[] values() { return values.clone(); }

    public int thetaCount() { return thetaSamples.length; }

    public int phiCount() { return phiSamples.length; }

    public double value(int thetaIndex, int phiIndex) {
        return values[thetaIndex * phiSamples.length + phiIndex];
    }
}
