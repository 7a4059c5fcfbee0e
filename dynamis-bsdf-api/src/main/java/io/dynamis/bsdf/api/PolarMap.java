package io.dynamis.bsdf.api;

/**
 * Dense reconstructed BSDF over an AngularGrid for one (incidence, wavelength, branch).
 *
 * Values are stored [theta][phi] in 1/sr. The map does not copy the array it is given:
 * it is a transient, build-owned buffer that is flattened into a BsdfVolume afterwards.
 */
public final class PolarMap {

    private final Branch branch;
    private final double incidence;
    private final double wavelength;
    private final double[][] values;

    public PolarMap(Branch branch, double incidence, double wavelength, double[][] values) {
        if (branch == null) {
            throw new NullPointerException("branch must not be null");
        }
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("values must contain at least one theta row");
        }
        int phiCount = values[0].length;
        for (int t = 1; t < values.length; t++) {
            if (values[t].length != phiCount) {
                throw new IllegalArgumentException(
                    "ragged polar map: row " + t + " has " + values[t].length
                        + " phi samples, expected " + phiCount);
            }
        }
        this.branch = branch;
        this.incidence = incidence;
        this.wavelength = wavelength;
        this.values = values;
    }

    public Branch branch() { return branch; }

    public double incidence() { return incidence; }

    public double wavelength() { return wavelength; }

    public int thetaCount() { return values.length; }

    public int phiCount() { return values[0].length; }

    public double value(int thetaIndex, int phiIndex) {
        return values[thetaIndex][phiIndex];
    }

    /** Direct view of the backing [theta][phi] array. Callers must not mutate it. */
    public double[][] values() { return values; }

    @Override
    public String toString() {
        return "PolarMap{" + branch + ", incidence=" + incidence + ", wavelength=" + wavelength
            + ", " + values.length + "x" + values[0].length + "}";
    }
}
