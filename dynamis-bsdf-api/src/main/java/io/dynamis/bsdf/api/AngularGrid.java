package io.dynamis.bsdf.api;

/**
 * Uniform outgoing-direction grid shared by every reconstructed polar map of a build.
 *
 * theta spans [0, pi/2] and phi spans [0, 2pi], both endpoints included.
 * Sample counts follow the resampling convention of the export format:
 *
 *   thetaCount = floor(90 / step + 1)
 *   phiCount   = 2 * floor(180 / step + 1) - 1
 *
 * so a 1 degree step yields 91 x 361 samples and a 0.5 degree step 181 x 721.
 * The same instance is used for the reflective and transmissive branches so that the
 * exported tensors stay aligned.
 */
public final class AngularGrid {

    private final double samplingStepDegrees;
    private final double[] thetaSamples;
    private final double[] phiSamples;

    private AngularGrid(double samplingStepDegrees, double[] thetaSamples, double[] phiSamples) {
        this.samplingStepDegrees = samplingStepDegrees;
        this.thetaSamples = thetaSamples;
        this.phiSamples = phiSamples;
    }

    /**
     * Builds the grid for a sampling step in degrees.
     *
     * @param stepDegrees angular step; must satisfy 0 < step <= 90
     * @throws IllegalArgumentException if the step is out of range or not finite
     */
    public static AngularGrid fromSamplingStep(double stepDegrees) {
        if (!(stepDegrees > 0.0) || stepDegrees > BsdfConstants.MAX_SAMPLING_STEP_DEGREES) {
            throw new IllegalArgumentException(
                "sampling step must satisfy 0 < step <= "
                    + BsdfConstants.MAX_SAMPLING_STEP_DEGREES + "; actual = " + stepDegrees);
        }
        int thetaCount = (int) (90.0 / stepDegrees + 1.0);
        int phiCount = 2 * (int) (180.0 / stepDegrees + 1.0) - 1;
        return new AngularGrid(stepDegrees,
            linspace(BsdfConstants.THETA_RANGE, thetaCount),
            linspace(BsdfConstants.PHI_RANGE, phiCount));
    }

    public double samplingStepDegrees() { return samplingStepDegrees; }

    public int thetaCount() { return thetaSamples.length; }

    public int phiCount() { return phiSamples.length; }

    public double theta(int index) { return thetaSamples[index]; }

    public double phi(int index) { return phiSamples[index]; }

    /** Defensive copy of the theta samples, radians. */
    public double[] thetaSamples() { return thetaSamples.clone(); }

    /** Defensive copy of the phi samples, radians. */
    public double[] phiSamples() { return phiSamples.clone(); }

    @Override
    public String toString() {
        return "AngularGrid{step=" + samplingStepDegrees + "deg, theta=" + thetaSamples.length
            + ", phi=" + phiSamples.length + "}";
    }

    private static double[] linspace(double end, int count) {
        double[] out = new double[count];
        double step = end / (count - 1);
        for (int i = 0; i < count; i++) {
            out[i] = i * step;
        }
        // last sample pinned to the bound, independent of rounding in i * step
        out[count - 1] = end;
        return out;
    }
}
