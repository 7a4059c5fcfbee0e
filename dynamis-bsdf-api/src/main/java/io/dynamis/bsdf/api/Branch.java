package io.dynamis.bsdf.api;

/**
 * Half space a measurement or reconstructed map belongs to.
 */
public enum Branch {

    /** Scattered back into the incidence hemisphere. Produces the BRDF. */
    REFLECTIVE,

    /** Scattered through the surface. Produces the BTDF. */
    TRANSMISSIVE;

    /**
     * Classifies a raw measurement angle.
     * |theta| below pi/2 is reflective, anything else (including exactly pi/2) is transmissive.
     *
     * @param theta signed measurement angle in radians
     */
    public static Branch classify(double theta) {
        return Math.abs(theta) < BsdfConstants.HEMISPHERE_BOUNDARY ? REFLECTIVE : TRANSMISSIVE;
    }
}
