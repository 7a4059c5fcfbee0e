package io.dynamis.bsdf.export;

import java.util.List;

/**
 * Hierarchical export structure of a spectral BSDF: wavelength -> incidence -> branch.
 *
 * entries are ordered wavelength-major: all incidences of the first wavelength, then all
 * incidences of the second, and so on.
 */
public final class SpectralBsdfLayout {

    /** One (wavelength, incidence) pair. transmission is null for reflective-only data. */
    public record IncidenceEntry(
        int wavelengthIndex,
        int incidenceIndex,
        double wavelength,
        double incidence,
        ScatteringDiagram reflection,
        ScatteringDiagram transmission
    ) {

        public boolean hasTransmission() {
            return transmission != null;
        }
    }

    private final String description;
    private final double[] incidenceSamples;
    private final double[] wavelengthSamples;
    private final List<IncidenceEntry> entries;

    SpectralBsdfLayout(String description,
                       double[] incidenceSamples,
                       double[] wavelengthSamples,
                       List<IncidenceEntry> entries) {
        this.description = description;
        this.incidenceSamples = incidenceSamples.clone();
        this.wavelengthSamples = wavelengthSamples.clone();
        this.entries = List.copyOf(entries);
    }

    public String description() { return description; }

    /** Incidence samples, radians. */
    public double[] incidenceSamples() { return incidenceSamples.clone(); }

    /** Wavelength samples, nanometres. */
    public double[] wavelengthSamples() { return wavelengthSamples.clone(); }

    /** All entries, wavelength-major. Unmodifiable. */
    public List<IncidenceEntry> entries() { return entries; }

    public IncidenceEntry entry(int wavelengthIndex, int incidenceIndex) {
        return entries.get(wavelengthIndex * incidenceSamples.length + incidenceIndex);
    }

    @Override
    public String toString() {
        return "SpectralBsdfLayout{description='" + description + "', wavelengths="
            + wavelengthSamples.length + ", incidences=" + incidenceSamples.length + "}";
    }
}
