package io.dynamis.bsdf.api;

/**
 * Thrown when an (incidence, wavelength, branch) cell has no, or too few, measurement
 * points to fit an angular profile.
 */
public final class InsufficientDataException extends BsdfBuildException {

    private final double incidence;
    private final double wavelength;
    private final Branch branch;

    public InsufficientDataException(double incidence, double wavelength, Branch branch,
                                     String reason) {
        super("Insufficient " + branch + " data at incidence " + incidence
            + " rad, wavelength " + wavelength + " nm: " + reason);
        this.incidence = incidence;
        this.wavelength = wavelength;
        this.branch = branch;
    }

    /** Incidence of the failing cell, radians. */
    public double incidence() { return incidence; }

    /** Wavelength of the failing cell, nanometres. */
    public double wavelength() { return wavelength; }

    public Branch branch() { return branch; }
}
