package io.dynamis.bsdf.api;

/**
 * Immutable reconstructed BSDF, ready for the export boundary.
 *
 * TENSOR LAYOUT:
 *   brdf[incidence][wavelength][phi][theta]   1/sr
 *   btdf[incidence][wavelength][phi][theta]   1/sr, incidence axis reversed (see below)
 *   reflectance[incidence][wavelength]        [0..1]
 *   transmittance[incidence][wavelength]      [0..1], not reversed
 *
 * btdf and transmittance are present iff the measurement set contained any transmissive
 * point. The btdf incidence axis runs from the last incidence sample to the first; this is
 * the layout the export format expects and is reproduced here unchanged.
 *
 * All arrays are deep-copied on construction. Bulk getters return deep copies.
 */
public final class BsdfVolume {

    private final SampleSet incidenceSamples;
    private final SampleSet wavelengthSamples;
    private final AngularGrid grid;
    private final double[][][][] brdf;
    private final double[][][][] btdf;
    private final double[][] reflectance;
    private final double[][] transmittance;

    /**
     * @param btdf          null for reflective-only materials; must then pair with a null
     *                      transmittance
     * @throws IllegalArgumentException if any tensor disagrees with the sample counts
     */
    public BsdfVolume(SampleSet incidenceSamples,
                      SampleSet wavelengthSamples,
                      AngularGrid grid,
                      double[][][][] brdf,
                      double[][] reflectance,
                      double[][][][] btdf,
                      double[][] transmittance) {
        if (incidenceSamples == null || wavelengthSamples == null || grid == null) {
            throw new NullPointerException("sample sets and grid must not be null");
        }
        if ((btdf == null) != (transmittance == null)) {
            throw new IllegalArgumentException(
                "btdf and transmittance must be both present or both absent");
        }
        int ni = incidenceSamples.size();
        int nw = wavelengthSamples.size();
        requireShape("brdf", brdf, ni, nw, grid.phiCount(), grid.thetaCount());
        requireShape("reflectance", reflectance, ni, nw);
        if (btdf != null) {
            requireShape("btdf", btdf, ni, nw, grid.phiCount(), grid.thetaCount());
            requireShape("transmittance", transmittance, ni, nw);
        }
        this.incidenceSamples = incidenceSamples;
        this.wavelengthSamples = wavelengthSamples;
        this.grid = grid;
        this.brdf = deepCopy(brdf);
        this.reflectance = deepCopy(reflectance);
        this.btdf = btdf == null ? null : deepCopy(btdf);
        this.transmittance = transmittance == null ? null : deepCopy(transmittance);
    }

    public SampleSet incidenceSamples() { return incidenceSamples; }

    public SampleSet wavelengthSamples() { return wavelengthSamples; }

    public AngularGrid grid() { return grid; }

    /** True when the volume carries btdf and transmittance. */
    public boolean hasTransmission() { return btdf != null; }

    /** {incidence, wavelength, phi, theta} counts of the brdf (and btdf) tensor. */
    public int[] tensorShape() {
        return new int[] {
            incidenceSamples.size(), wavelengthSamples.size(), grid.phiCount(), grid.thetaCount()
        };
    }

    public double brdf(int incidence, int wavelength, int phi, int theta) {
        return brdf[incidence][wavelength][phi][theta];
    }

    public double reflectance(int incidence, int wavelength) {
        return reflectance[incidence][wavelength];
    }

    /**
     * @throws IllegalStateException if the volume has no transmission
     */
    public double btdf(int incidence, int wavelength, int phi, int theta) {
        requireTransmission();
        return btdf[incidence][wavelength][phi][theta];
    }

    /**
     * @throws IllegalStateException if the volume has no transmission
     */
    public double transmittance(int incidence, int wavelength) {
        requireTransmission();
        return transmittance[incidence][wavelength];
    }

    public double[][][][] brdfCopy() { return deepCopy(brdf); }

    public double[][] reflectanceCopy() { return deepCopy(reflectance); }

    /** Deep copy of the btdf tensor, or null when absent. */
    public double[][][][] btdfCopy() { return btdf == null ? null : deepCopy(btdf); }

    /** Deep copy of the transmittance matrix, or null when absent. */
    public double[][] transmittanceCopy() {
        return transmittance == null ? null : deepCopy(transmittance);
    }

    @Override
    public String toString() {
        return "BsdfVolume{incidences=" + incidenceSamples.size()
            + ", wavelengths=" + wavelengthSamples.size()
            + ", grid=" + grid
            + ", transmission=" + hasTransmission() + "}";
    }

    private void requireTransmission() {
        if (btdf == null) {
            throw new IllegalStateException("volume has no transmissive data");
        }
    }

    private static void requireShape(String name, double[][][][] t,
                                     int ni, int nw, int np, int nt) {
        if (t == null || t.length != ni) {
            throw shapeError(name);
        }
        for (double[][][] perIncidence : t) {
            if (perIncidence.length != nw) {
                throw shapeError(name);
            }
            for (double[][] perWavelength : perIncidence) {
                if (perWavelength.length != np) {
                    throw shapeError(name);
                }
                for (double[] perPhi : perWavelength) {
                    if (perPhi.length != nt) {
                        throw shapeError(name);
                    }
                }
            }
        }
    }

    private static void requireShape(String name, double[][] m, int ni, int nw) {
        if (m == null || m.length != ni) {
            throw shapeError(name);
        }
        for (double[] row : m) {
            if (row.length != nw) {
                throw shapeError(name);
            }
        }
    }

    private static IllegalArgumentException shapeError(String name) {
        return new IllegalArgumentException(name + " shape does not match the sample counts");
    }

    private static double[][][][] deepCopy(double[][][][] src) {
        double[][][][] out = new double[src.length][][][];
        for (int i = 0; i < src.length; i++) {
            out[i] = new double[src[i].length][][];
            for (int w = 0; w < src[i].length; w++) {
                out[i][w] = deepCopy(src[i][w]);
            }
        }
        return out;
    }

    private static double[][] deepCopy(double[][] src) {
        double[][] out = new double[src.length][];
        for (int i = 0; i < src.length; i++) {
            out[i] = src[i].clone();
        }
        return out;
    }
}
