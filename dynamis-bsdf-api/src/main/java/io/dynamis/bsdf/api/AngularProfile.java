package io.dynamis.bsdf.api;

/**
 * Continuous 1D angular BSDF profile for one (incidence, wavelength, branch) cell.
 *
 * Reflective profiles are parameterised by the signed scan angle. Transmissive profiles are
 * parameterised by the signed deviation from the opposite normal, folded into [-pi/2, pi/2].
 * Implementations must be defined for any finite argument, extrapolating outside the
 * sampled range.
 */
public interface AngularProfile {

    /** Half space the profile describes. */
    Branch branch();

    /**
     * BSDF value at the given profile angle, in 1/sr.
     *
     * @param theta angle in radians; may lie outside the sampled range
     */
    double valueAt(double theta);

    /** Smallest sampled angle. */
    double minTheta();

    /** Largest sampled angle. */
    double maxTheta();
}
