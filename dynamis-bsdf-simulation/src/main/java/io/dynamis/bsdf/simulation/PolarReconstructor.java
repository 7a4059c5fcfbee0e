package io.dynamis.bsdf.simulation;

import io.dynamis.bsdf.api.AngularGrid;
import io.dynamis.bsdf.api.AngularProfile;
import io.dynamis.bsdf.api.BsdfConstants;
import io.dynamis.bsdf.api.PolarMap;

/**
 * Expands a 1D angular profile into a dense (theta, phi) map under the revolution assumption.
 *
 * The measured lobe is assumed rotationally symmetric about the specular trajectory of the
 * incidence direction. For each outgoing direction (theta, phi) the reconstructor measures the
 * angular distance d to the specular point in the projected polar plane and blends the two
 * in-plane profile values that lie at that distance on either side of the incidence:
 *
 *   d = sqrt((i - theta cos phi)^2 + (theta sin phi)^2)
 *   d < SPECULAR_EPSILON           -> d = SPECULAR_FALLBACK_DISTANCE
 *   w = (i + d - theta cos phi) / (2d)
 *   i + d > thetaMax               -> w = 1 (never blend toward unmeasured angles)
 *   value = w * f(i - d) + (1 - w) * f(i + d)
 *
 * Deterministic and free of NaN for any profile defined on all finite angles.
 */
public final class PolarReconstructor {

    private PolarReconstructor() {}

    /**
     * Reconstructs the full polar map of one cell.
     *
     * @param profile    fitted profile of the branch being reconstructed
     * @param incidence  incidence angle, radians
     * @param wavelength wavelength carried into the map, nanometres
     * @param thetaMax   largest measured reflective angle, radians
     * @param grid       shared output grid
     * @return map of values [theta][phi] in 1/sr
     */
    public static PolarMap reconstruct(AngularProfile profile,
                                       double incidence,
                                       double wavelength,
                                       double thetaMax,
                                       AngularGrid grid) {
        int thetaCount = grid.thetaCount();
        int phiCount = grid.phiCount();
        double[] cosPhi = new double[phiCount];
        double[] sinPhi = new double[phiCount];
        for (int p = 0; p < phiCount; p++) {
            cosPhi[p] = Math.cos(grid.phi(p));
            sinPhi[p] = Math.sin(grid.phi(p));
        }

        double[][] values = new double[thetaCount][phiCount];
        for (int t = 0; t < thetaCount; t++) {
            double theta = grid.theta(t);
            for (int p = 0; p < phiCount; p++) {
                values[t][p] = blend(profile, incidence, thetaMax,
                    theta * cosPhi[p], theta * sinPhi[p]);
            }
        }
        return new PolarMap(profile.branch(), incidence, wavelength, values);
    }

    /**
     * Reconstructed value at a single outgoing direction.
     *
     * @param theta outgoing polar angle, radians
     * @param phi   outgoing azimuth, radians
     */
    public static double valueAt(AngularProfile profile, double incidence, double thetaMax,
                                 double theta, double phi) {
        return blend(profile, incidence, thetaMax, theta * Math.cos(phi), theta * Math.sin(phi));
    }

    /** Angular distance from the specular point, before the epsilon fallback. */
    public static double angularDistance(double incidence, double theta, double phi) {
        double u = incidence - theta * Math.cos(phi);
        double v = theta * Math.sin(phi);
        return Math.sqrt(u * u + v * v);
    }

    private static double blend(AngularProfile profile, double incidence, double thetaMax,
                                double projected, double lateral) {
        double u = incidence - projected;
        double d = Math.sqrt(u * u + lateral * lateral);
        if (d < BsdfConstants.SPECULAR_EPSILON) {
            d = BsdfConstants.SPECULAR_FALLBACK_DISTANCE;
        }
        double w;
        if (incidence + d > thetaMax) {
            w = 1.0;
        } else {
            w = (incidence + d - projected) / (2.0 * d);
        }
        return w * profile.valueAt(incidence - d) + (1.0 - w) * profile.valueAt(incidence + d);
    }
}
