package io.dynamis.bsdf.export;

import io.dynamis.bsdf.api.AngularGrid;
import io.dynamis.bsdf.api.BsdfVolume;

import java.util.ArrayList;
import java.util.List;

/**
 * Packages a BsdfVolume into the wavelength -> incidence -> branch layout consumed by the
 * light-transport simulator.
 *
 * Transmission diagrams carry theta samples offset by pi/2 (measured from the surface normal
 * on the incidence side) and read the btdf tensor at the same incidence index as the
 * reflection; the volume's btdf incidence axis is already reversed for this format.
 *
 * Serialization of the layout is left to the caller.
 */
public final class SpectralBsdfPackager {

    /** Description used when none is supplied. */
    public static final String DEFAULT_DESCRIPTION = "Dynamis reconstructed spectral BSDF";

    private SpectralBsdfPackager() {}

    public static SpectralBsdfLayout pack(BsdfVolume volume) {
        return pack(volume, DEFAULT_DESCRIPTION);
    }

    public static SpectralBsdfLayout pack(BsdfVolume volume, String description) {
        if (volume == null) {
            throw new NullPointerException("volume must not be null");
        }
        AngularGrid grid = volume.grid();
        double[] theta = grid.thetaSamples();
        double[] phi = grid.phiSamples();
        double[] transmissionTheta = new double[theta.length];
        for (int t = 0; t < theta.length; t++) {
            transmissionTheta[t] = theta[t] + Math.PI / 2.0;
        }

        double[] incidences = volume.incidenceSamples().toArray();
        double[] wavelengths = volume.wavelengthSamples().toArray();
        List<SpectralBsdfLayout.IncidenceEntry> entries =
            new ArrayList<>(incidences.length * wavelengths.length);
        for (int w = 0; w < wavelengths.length; w++) {
            for (int i = 0; i < incidences.length; i++) {
                ScatteringDiagram reflection = new ScatteringDiagram(
                    volume.reflectance(i, w), theta, phi, flatten(volume, i, w, false));
                ScatteringDiagram transmission = null;
                if (volume.hasTransmission()) {
                    transmission = new ScatteringDiagram(
                        volume.transmittance(i, w), transmissionTheta, phi,
                        flatten(volume, i, w, true));
                }
                entries.add(new SpectralBsdfLayout.IncidenceEntry(
                    w, i, wavelengths[w], incidences[i], reflection, transmission));
            }
        }
        return new SpectralBsdfLayout(
            description == null ? DEFAULT_DESCRIPTION : description,
            incidences, wavelengths, entries);
    }

    private static double[] flatten(BsdfVolume volume, int incidence, int wavelength,
                                    boolean transmissive) {
        int nt = volume.grid().thetaCount();
        int np = volume.grid().phiCount();
        double[] out = new double[nt * np];
        for (int t = 0; t < nt; t++) {
            for (int p = 0; p < np; p++) {
                out[t * np + p] = transmissive
                    ? volume.btdf(incidence, wavelength, p, t)
                    : volume.brdf(incidence, wavelength, p, t);
            }
        }
        return out;
    }
}
