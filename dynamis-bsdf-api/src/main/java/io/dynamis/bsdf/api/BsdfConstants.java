package io.dynamis.bsdf.api;

/**
 * Global constants for the Dynamis BSDF reconstruction engine.
 *
 * These values are shared by every stage of a build: the angular grid, the polar
 * reconstruction and the hemispherical integration. Changing any of them changes the
 * exported tensors, so downstream consumers must be re-validated.
 *
 * All angles are in radians unless the name says otherwise.
 */
public final class BsdfConstants {

    private BsdfConstants() {}

    // -- Angular domain -------------------------------------------------------

    /** Upper bound of the outgoing polar angle theta. Lower bound is 0. */
    public static final double THETA_RANGE = Math.PI / 2.0;

    /** Upper bound of the outgoing azimuth phi. Lower bound is 0. */
    public static final double PHI_RANGE = 2.0 * Math.PI;

    /**
     * Boundary between the reflective and transmissive half spaces of a raw
     * measurement angle. |theta| strictly below this value is reflective.
     */
    public static final double HEMISPHERE_BOUNDARY = Math.PI / 2.0;

    // -- Grid sampling --------------------------------------------------------

    /** Default angular sampling step of the reconstructed grid, in degrees. */
    public static final double DEFAULT_SAMPLING_STEP_DEGREES = 1.0;

    /** Largest accepted sampling step, in degrees. Yields a 2 x 5 theta/phi grid. */
    public static final double MAX_SAMPLING_STEP_DEGREES = 90.0;

    // -- Reconstruction -------------------------------------------------------

    /**
     * Angular distance below which a grid point is treated as the specular point
     * of the revolution blend.
     */
    public static final double SPECULAR_EPSILON = 1e-6;

    /**
     * Distance substituted for a degenerate (specular) angular distance.
     * Keeps the blend weight finite at d == 0.
     */
    public static final double SPECULAR_FALLBACK_DISTANCE = 1.0;

    /** Minimum number of distinct theta samples needed to fit a profile branch. */
    public static final int MIN_PROFILE_SAMPLES = 2;

    // -- Integration ----------------------------------------------------------

    /** Default absolute tolerance of the adaptive quadrature, applied per axis. */
    public static final double DEFAULT_QUADRATURE_TOLERANCE = 0.1;

    /**
     * Maximum bisection depth of the adaptive quadrature on a single axis.
     * 2^8 panels is already finer than a 0.5 degree grid over the theta range.
     */
    public static final int MAX_QUADRATURE_DEPTH = 8;

    /** Physical upper bound of a hemispherical reflectance or transmittance. */
    public static final double MAX_HEMISPHERICAL_INTEGRAL = 1.0;

    // -- Validation -----------------------------------------------------------

    /**
     * Called once at class load. Verifies internal consistency of constants.
     * Throws IllegalStateException if any invariant is violated.
     */
    public static void validate() {
        if (DEFAULT_SAMPLING_STEP_DEGREES <= 0.0
            || DEFAULT_SAMPLING_STEP_DEGREES > MAX_SAMPLING_STEP_DEGREES) {
            throw new IllegalStateException(
                "DEFAULT_SAMPLING_STEP_DEGREES must lie in (0, "
                    + MAX_SAMPLING_STEP_DEGREES + "]; actual = " + DEFAULT_SAMPLING_STEP_DEGREES);
        }
        if (SPECULAR_FALLBACK_DISTANCE <= SPECULAR_EPSILON) {
            throw new IllegalStateException(
                "SPECULAR_FALLBACK_DISTANCE must exceed SPECULAR_EPSILON");
        }
        if (MIN_PROFILE_SAMPLES < 2) {
            throw new IllegalStateException(
                "A piecewise-linear profile needs at least two samples; actual = "
                    + MIN_PROFILE_SAMPLES);
        }
        if (DEFAULT_QUADRATURE_TOLERANCE <= 0.0) {
            throw new IllegalStateException("DEFAULT_QUADRATURE_TOLERANCE must be positive");
        }
    }

    static {
        validate();
    }
}
